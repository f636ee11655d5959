package com.phillippitts.heartbeat.util;

/**
 * Makes caller-supplied text (service names, heartbeat messages, request ids) safe to log:
 * a single line, bounded in length.
 */
public final class LogSanitizer {

    static final String ELLIPSIS = "...";

    private LogSanitizer() {}

    /**
     * Replaces line breaks and tabs with spaces and cuts the result at {@code max} characters,
     * marking the cut with "...". Returns "" for null or a non-positive max.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String oneLine = s.replaceAll("[\\r\\n\\t]", " ");
        if (oneLine.length() <= max) {
            return oneLine;
        }
        if (max <= ELLIPSIS.length()) {
            return oneLine.substring(0, max);
        }
        return oneLine.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}
