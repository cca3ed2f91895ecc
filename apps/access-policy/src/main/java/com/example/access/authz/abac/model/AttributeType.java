package com.example.access.authz.abac.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.example.access.authz.abac.model.ConditionOperator.*;

/**
 * Value type of an attribute condition. Decides how the condition value is interpreted
 * and which operators are legal for it.
 */
public enum AttributeType {
    STRING(EnumSet.of(EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH,
            IN, NOT_IN, MATCHES, EXISTS)),
    NUMBER(EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN,
            LESS_THAN_OR_EQUALS, BETWEEN, NOT_BETWEEN, IN, NOT_IN, EXISTS)),
    BOOLEAN(EnumSet.of(EQUALS, EXISTS)),
    ARRAY(EnumSet.of(CONTAINS, NOT_CONTAINS, IN, NOT_IN, CONTAINS_ANY, EXISTS)),
    DATE(EnumSet.of(EQUALS, NOT_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN,
            LESS_THAN_OR_EQUALS, BETWEEN, NOT_BETWEEN, EXISTS));

    private final Set<ConditionOperator> operators;

    AttributeType(Set<ConditionOperator> operators) {
        this.operators = operators;
    }

    public boolean supports(ConditionOperator operator) {
        return operators.contains(operator);
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AttributeType> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
