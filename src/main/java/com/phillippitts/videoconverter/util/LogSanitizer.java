package com.phillippitts.videoconverter.util;

/** Utility for keeping process output in log lines short and single-line. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Returns at most the last {@code max} characters of {@code s}; returns "" for null.
     * ffmpeg prints the actual error at the end of its output, so the tail is what matters.
     */
    public static String tail(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(s.length() - max);
    }

    /**
     * Collapses line breaks so a multi-line snippet stays on one log line.
     */
    public static String singleLine(String s) {
        if (s == null) {
            return "";
        }
        return s.replace('\r', ' ').replace('\n', ' ').trim();
    }
}
