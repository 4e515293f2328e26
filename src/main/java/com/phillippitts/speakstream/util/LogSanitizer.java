package com.phillippitts.speakstream.util;

/** Utility for privacy-safe logging of spoken text. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview for log messages: whitespace runs collapse to one space, the result is
     * trimmed, and text longer than {@code max} is cut and marked with "...".
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").strip();
        return flat.length() <= max ? flat : truncate(flat, max) + "...";
    }
}
