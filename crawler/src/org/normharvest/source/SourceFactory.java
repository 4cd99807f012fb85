package org.normharvest.source;

@FunctionalInterface
public interface SourceFactory {
    SourceAdapter create(SourceContext context);
}
