package com.phillippitts.huevoice.util;

/** Utility for privacy-safe logging of spoken command previews. */
public final class LogSanitizer {

    /** Default preview length for transcripts in INFO logs. */
    public static final int PREVIEW_CHARS = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    public static String preview(String s) {
        return truncate(s, PREVIEW_CHARS);
    }
}
