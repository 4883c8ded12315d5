package com.budgetaudit.util;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Non-null contract helpers. The returned values are annotated {@code @Nonnull} so callers
 * can pass them on to APIs that reject nulls.
 */
public final class NonNulls {

    private NonNulls() {
        // Utility class
    }

    /**
     * @throws NullPointerException if value is null
     */
    @Nonnull
    public static <T> T nn(T value, String message) {
        return Objects.requireNonNull(value, message);
    }

    /**
     * Ensures that a string is non-null and non-blank.
     *
     * @param value The string value to check (may be null or blank)
     * @param message Error message if value is null or blank
     * @return The non-null, non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    @Nonnull
    public static String requireNonBlank(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }
}
