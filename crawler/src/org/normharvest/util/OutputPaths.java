package org.normharvest.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * File naming for the output trees.
 * <p>
 * A record lives at {@code base/{year}/{type}/{situation}/{title}_{url stem}.json} with type and situation
 * URL-decoded and title and stem reduced to {@code [A-Za-z0-9_-]}.
 */
public final class OutputPaths {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");
    private static final String EXTENSION = ".json";

    private OutputPaths() {
    }

    /**
     * Transliterates to ASCII, turns whitespace runs into underscores and drops everything else outside
     * {@code [A-Za-z0-9_-]}.
     */
    public static String sanitize(String text) {
        if (text == null) return "";
        String ascii = COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD)).replaceAll("");
        String underscored = WHITESPACE.matcher(ascii.strip()).replaceAll("_");
        return UNSAFE.matcher(underscored).replaceAll("");
    }

    /**
     * The last path segment of a URL without its final extension, e.g. "lei_123" for
     * "https://host/docs/lei_123.pdf".
     */
    public static String stem(String url) {
        if (url == null) return "";
        String trimmed = url;
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        String name = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        // a leading dot is part of the name, not an extension
        return dot > 0 && dot < name.length() - 1 ? name.substring(0, dot) : name;
    }

    /**
     * URL-decodes a type or situation for use as a single directory name. Plus signs are kept as is.
     */
    public static String segment(String value) {
        String decoded;
        try {
            decoded = URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            decoded = value;
        }
        decoded = decoded.replace('/', '-').replace('\\', '-').strip();
        return decoded.isEmpty() || decoded.equals(".") || decoded.equals("..") ? "_" : decoded;
    }

    public static Path directory(Path base, int year, String type, String situation) {
        return base.resolve(String.valueOf(year)).resolve(segment(type)).resolve(segment(situation));
    }

    /**
     * The file for a record. When the absolute path would be longer than {@code maxPathLength}, the file name
     * stem is cut from the end by the overflow and the extension kept.
     *
     * @throws IllegalArgumentException if the directory leaves no room for even a one character stem
     */
    public static Path file(Path directory, String title, String url, int maxPathLength) {
        String stem = sanitize(title) + "_" + sanitize(stem(url));
        Path file = directory.resolve(stem + EXTENSION);
        int overflow = file.toAbsolutePath().toString().length() - maxPathLength;
        if (overflow > 0) {
            int keep = stem.length() - overflow;
            if (keep < 1) {
                throw new IllegalArgumentException("Directory " + directory.toAbsolutePath()
                                                   + " is too long for a maximum path length of " + maxPathLength);
            }
            file = directory.resolve(stem.substring(0, keep) + EXTENSION);
        }
        return file;
    }
}
