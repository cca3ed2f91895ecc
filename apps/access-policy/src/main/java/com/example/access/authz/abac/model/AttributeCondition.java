package com.example.access.authz.abac.model;

import java.util.List;
import java.util.Optional;

/**
 * A single attribute predicate: {@code <attribute> <operator> <value>}, where {@code type}
 * tells how {@code value} and the runtime attribute are to be compared.
 *
 * <p>Operator and type are kept as the raw codes received with the policy so that an
 * unknown code can be carried through and evaluated as a failed condition instead of
 * rejecting the whole policy. The value may contain {@code ${subject.x}},
 * {@code ${resource.x}} or {@code ${env.x}} placeholders.
 *
 * @param attribute attribute name, or a dotted path for custom conditions
 * @param operator  operator code, see {@link ConditionOperator}
 * @param value     expected value: scalar, or a list for in/not_in/between/contains_any
 * @param type      type code, see {@link AttributeType}; inferred from the value when null
 */
public record AttributeCondition(
        String attribute,
        String operator,
        Object value,
        String type
) {
    public static AttributeCondition of(String attribute, ConditionOperator operator, Object value, AttributeType type) {
        return new AttributeCondition(attribute, operator.code(), value, type.code());
    }

    public static AttributeCondition string(String attribute, ConditionOperator operator, Object value) {
        return of(attribute, operator, value, AttributeType.STRING);
    }

    public static AttributeCondition number(String attribute, ConditionOperator operator, Object value) {
        return of(attribute, operator, value, AttributeType.NUMBER);
    }

    public static AttributeCondition bool(String attribute, boolean value) {
        return of(attribute, ConditionOperator.EQUALS, value, AttributeType.BOOLEAN);
    }

    public static AttributeCondition array(String attribute, ConditionOperator operator, Object value) {
        return of(attribute, operator, value, AttributeType.ARRAY);
    }

    public Optional<ConditionOperator> operatorCode() {
        return ConditionOperator.fromCode(operator);
    }

    /**
     * Declared type, or the type inferred from the expected value when none was declared.
     * Empty when a type was declared but is unknown.
     */
    public Optional<AttributeType> resolvedType() {
        if (type != null && !type.isBlank()) {
            return AttributeType.fromCode(type);
        }
        if (value instanceof Number) {
            return Optional.of(AttributeType.NUMBER);
        }
        if (value instanceof Boolean) {
            return Optional.of(AttributeType.BOOLEAN);
        }
        if (value instanceof List<?> && operatorCode().filter(ConditionOperator.CONTAINS_ANY::equals).isPresent()) {
            return Optional.of(AttributeType.ARRAY);
        }
        return Optional.of(AttributeType.STRING);
    }

    public String describe() {
        return attribute + " " + operator + " " + value;
    }
}
