package org.normharvest.source;

import org.jetbrains.annotations.Nullable;
import org.normharvest.source.conama.ConamaSource;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Source adapters by name.
 */
public class SourceRegistry {
    private final Map<String, SourceFactory> factories = new TreeMap<>();

    public static SourceRegistry builtIn() {
        var registry = new SourceRegistry();
        registry.register(ConamaSource.NAME, ConamaSource::new);
        return registry;
    }

    public SourceRegistry register(String name, SourceFactory factory) {
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Source already registered: " + name);
        }
        return this;
    }

    public @Nullable SourceFactory get(String name) {
        return factories.get(name);
    }

    public Set<String> names() {
        return factories.keySet();
    }
}
