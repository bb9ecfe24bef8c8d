package com.phillippitts.genesis.util;

/** Utility for privacy-safe logging of utterance and reply previews. */
public final class LogSanitizer {

    /** Default preview length for user text in logs. */
    public static final int PREVIEW_CHARS = 50;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short single-line preview of arbitrary values, with line breaks flattened.
     */
    public static String preview(Object value) {
        if (value == null) {
            return "";
        }
        return truncate(String.valueOf(value).replace('\n', ' ').replace('\r', ' '), PREVIEW_CHARS);
    }
}
