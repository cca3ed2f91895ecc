package com.example.access.authz.abac.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators of the condition language. Codes are the snake_case names
 * stored with policies ("greater_than_or_equals", "not_in", ...).
 */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    CONTAINS_ANY("contains_any"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    MATCHES("matches"),
    IN("in"),
    NOT_IN("not_in"),
    GREATER_THAN("greater_than"),
    GREATER_THAN_OR_EQUALS("greater_than_or_equals"),
    LESS_THAN("less_than"),
    LESS_THAN_OR_EQUALS("less_than_or_equals"),
    BETWEEN("between"),
    NOT_BETWEEN("not_between"),
    EXISTS("exists");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ConditionOperator> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.code.equals(normalized))
                .findFirst();
    }
}
