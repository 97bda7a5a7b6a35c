package com.phillippitts.voicelink.util;

/** Utility for privacy-safe logging of untrusted client payloads. */
public final class LogSanitizer {
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
     * Single-line preview of a raw frame: control characters become spaces and the result is
     * truncated, with a trailing marker when characters were dropped.
     */
    public static String preview(String s, int max) {
        String flat = s == null ? "" : s.replaceAll("\\p{Cntrl}", " ");
        String cut = truncate(flat, max);
        return cut.length() < flat.length() ? cut + "..." : cut;
    }
}
