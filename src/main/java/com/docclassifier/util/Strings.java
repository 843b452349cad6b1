package com.docclassifier.util;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * String helpers for metric tags, span attributes and persisted error messages.
 */
public final class Strings {

    public static final String UNKNOWN = "unknown";

    private Strings() {
    }

    /**
     * Metric tags and span attributes reject null values.
     */
    @Nonnull
    public static String tagValue(@Nullable String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    /**
     * Cuts a message down to the column width it is stored in.
     */
    @Nullable
    public static String truncate(@Nullable String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
