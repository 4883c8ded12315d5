package com.budgetaudit.util;

import javax.annotation.Nonnull;

/**
 * Null-safe string helpers for log tags, metric tags and span attributes.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * Returns "unknown" for null or blank input, the value otherwise.
     *
     * @param value The string value (may be null)
     * @return A non-null string
     */
    @Nonnull
    public static String safe(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value;
    }

    /**
     * Returns a safe non-null string with a custom default value.
     *
     * @param value The string value (may be null)
     * @param defaultValue Fallback used when value is null or blank
     * @return A non-null string
     */
    @Nonnull
    public static String safe(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue != null ? defaultValue : "unknown";
        }
        return value;
    }

    /**
     * Cuts a value to at most {@code maxChars} characters for log output.
     */
    @Nonnull
    public static String abbreviate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, Math.max(0, maxChars)) + "...";
    }
}
