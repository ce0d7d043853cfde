package com.williamcallahan.series_sync_engine.util;

import java.util.Collection;

/**
 * Null and blank checks shared by workers and mappers.
 */
public final class ValidationUtils {

    private ValidationUtils() {
    }

    public static boolean isNullOrBlank(String value) {
        return value == null || value.isBlank();
    }

    public static boolean hasText(String value) {
        return !isNullOrBlank(value);
    }

    public static String nullIfBlank(String value) {
        return isNullOrBlank(value) ? null : value.trim();
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }
}
