package org.normharvest.extract;

import java.io.IOException;

/**
 * Reads the text off a rendered page image.
 */
@FunctionalInterface
public interface PageRecognizer {
    /**
     * @param png        the page rendered as PNG
     * @param pageNumber 1-based page number, for logging
     * @return the page text as markdown, empty if nothing was recognised
     */
    String recognize(byte[] png, int pageNumber) throws IOException;
}
