package com.example.access.common.util;

import java.util.Locale;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public final class StringSanitizer {

    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int MAX_TAG_LENGTH = 50;
    private static final String TAG_UNKNOWN = "unknown";

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Bounded, lower-case metric tag value.
     */
    @NonNull
    public static String forTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
