package com.mlbbai.hero_analysis_engine.util;

import java.util.Collection;
import java.util.Locale;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }

    public static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    /**
     * Lower-cases and trims a value for case-insensitive comparisons. Null becomes "".
     */
    public static String normalizeKey(String value) {
        return trimToEmpty(value).toLowerCase(Locale.ROOT);
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (!hasText(needle)) {
            return true;
        }
        return haystack != null && normalizeKey(haystack).contains(normalizeKey(needle));
    }

    /**
     * Parses an integer query value, returning {@code fallback} for null, blank or non-numeric input.
     */
    public static int parseIntOrDefault(String value, int fallback) {
        if (!hasText(value)) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
