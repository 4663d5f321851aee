package com.phillippitts.arithmetic.util;

/** Utility for privacy-safe logging of request payload previews. */
public final class LogSanitizer {

    /** Default preview length for request bodies in log lines. */
    public static final int DEFAULT_PREVIEW_LENGTH = 120;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     * Line breaks are flattened so one payload stays on one log line.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    /** Preview of an arbitrary value using {@link #DEFAULT_PREVIEW_LENGTH}. */
    public static String preview(Object value) {
        return value == null ? "" : truncate(String.valueOf(value), DEFAULT_PREVIEW_LENGTH);
    }
}
