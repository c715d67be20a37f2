package com.phillippitts.voicerelay.util;

/** Utility for privacy-safe logging of caller and model text. */
public final class LogSanitizer {

    /** Default preview length for transcript and sentence text in logs. */
    public static final int PREVIEW_CHARS = 40;

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
     * Short preview for logs: at most {@link #PREVIEW_CHARS} characters with line breaks flattened.
     */
    public static String preview(String s) {
        return truncate(s, PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
    }
}
