package com.phillippitts.mcpanalytics.util;

/** Normalization of client-supplied header values before they become tally keys. */
public final class HeaderValues {
    private HeaderValues() {}

    /**
     * Returns the value, or the fallback when the value is null or blank.
     */
    public static String orDefault(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value;
    }

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
}
