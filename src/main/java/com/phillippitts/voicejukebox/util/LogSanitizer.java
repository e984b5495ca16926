package com.phillippitts.voicejukebox.util;

/** Utility for privacy-safe logging of spoken query text and track titles. */
public final class LogSanitizer {

    /** Default preview length for free-text voice queries. */
    public static final int QUERY_PREVIEW_CHARS = 40;

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
     * Single-line, length-bounded preview of a voice query for log messages.
     */
    public static String queryPreview(String query) {
        String flat = query == null ? "" : query.replaceAll("[\\r\\n\\t]+", " ").strip();
        String cut = truncate(flat, QUERY_PREVIEW_CHARS);
        return cut.length() < flat.length() ? cut + "..." : cut;
    }
}
