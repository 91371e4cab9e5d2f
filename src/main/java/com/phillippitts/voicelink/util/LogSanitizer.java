package com.phillippitts.voicelink.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {

    /** Default number of characters shown in DEBUG previews of transcript text. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

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
     * Single-line preview suitable for log output: newlines collapsed, truncated with an ellipsis.
     */
    public static String preview(String s) {
        String flat = s == null ? "" : s.replaceAll("\\s+", " ").trim();
        return flat.length() <= DEFAULT_PREVIEW_CHARS ? flat : truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
