package com.example.access.authz.abac.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Effect a policy has when it applies to a request.
 */
public enum PolicyEffect {
    ALLOW,
    DENY;

    /**
     * Parse an effect name, case-insensitive ("allow", "Allow", "DENY").
     */
    public static Optional<PolicyEffect> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String verb() {
        return this == ALLOW ? "allows" : "denies";
    }
}
