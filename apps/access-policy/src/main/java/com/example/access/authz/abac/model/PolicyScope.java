package com.example.access.authz.abac.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Where a policy was defined: platform-wide or inside a single organization.
 */
public enum PolicyScope {
    SYSTEM,
    ORGANIZATION;

    public static Optional<PolicyScope> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
