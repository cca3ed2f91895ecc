package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.AttributeCondition;
import com.example.access.authz.abac.model.AttributeType;
import com.example.access.authz.abac.model.ConditionOperator;
import com.example.access.authz.abac.model.PolicyConditions;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates attribute conditions and the environmental condition groups of a policy.
 *
 * <p>Conditions are total: an unknown operator or type, an operator the type does not
 * support, a runtime value of the wrong type or an unresolvable placeholder all make the
 * condition false instead of raising an error. A missing runtime value only satisfies
 * {@code exists: false}.
 */
@Slf4j
public final class ConditionEvaluator {

    private final AttributeResolver resolver;
    private final TimeWindowMatcher timeWindowMatcher;
    private final NetworkMatcher networkMatcher;

    public ConditionEvaluator(AttributeResolver resolver,
                              TimeWindowMatcher timeWindowMatcher,
                              NetworkMatcher networkMatcher) {
        this.resolver = resolver;
        this.timeWindowMatcher = timeWindowMatcher;
        this.networkMatcher = networkMatcher;
    }

    public ConditionEvaluator() {
        this(new AttributeResolver(), new TimeWindowMatcher(), new NetworkMatcher());
    }

    public AttributeResolver resolver() {
        return resolver;
    }

    /**
     * Evaluate a custom condition whose attribute is a dotted context path.
     */
    public boolean evaluate(AttributeCondition condition, PolicyEvaluationContext context) {
        Object actual = resolver.resolve(condition.attribute(), context).orElse(null);
        return test(condition, actual, context);
    }

    /**
     * Evaluate a condition against an already resolved runtime value.
     */
    public boolean test(AttributeCondition condition, Object actual, PolicyEvaluationContext context) {
        Optional<ConditionOperator> operator = condition.operatorCode();
        Optional<AttributeType> type = condition.resolvedType();
        if (operator.isEmpty() || type.isEmpty()) {
            log.debug("Unknown operator or type in condition: {} (type={})", condition.describe(), condition.type());
            return false;
        }
        if (!type.get().supports(operator.get())) {
            log.debug("Operator {} not supported for type {}", operator.get().code(), type.get().code());
            return false;
        }

        Optional<Object> expected = resolver.resolvePlaceholders(condition.value(), context);
        if (operator.get() == ConditionOperator.EXISTS) {
            boolean shouldExist = expected.flatMap(AttributeValues::toBoolean).orElse(Boolean.TRUE);
            return (actual != null) == shouldExist;
        }
        if (actual == null || expected.isEmpty()) {
            return false;
        }

        return switch (type.get()) {
            case STRING -> compareString(operator.get(), actual, expected.get());
            case NUMBER -> compareOrdered(operator.get(), actual, expected.get(), AttributeValues::toDecimal, true);
            case BOOLEAN -> compareBoolean(actual, expected.get());
            case ARRAY -> compareArray(operator.get(), actual, expected.get());
            case DATE -> compareOrdered(operator.get(), actual, expected.get(), AttributeValues::toInstant, false);
        };
    }

    /**
     * Descriptions of every condition of the group that does not hold. All conditions are
     * computed even after the first failure.
     */
    public List<String> failedConditions(PolicyConditions conditions, PolicyEvaluationContext context) {
        if (conditions == null || conditions.isEmpty()) {
            return List.of();
        }
        List<String> failed = new ArrayList<>();
        PolicyEvaluationContext.Environment env = context.environment();

        TimeWindow window = conditions.timeWindow();
        if (window != null && !timeWindowMatcher.matches(window, env.timestamp())) {
            failed.add("timeWindow " + describe(window));
        }
        if (!networkMatcher.ipAllowed(conditions.ipAddresses(), env.ipAddress())) {
            failed.add("ipAddress " + env.ipAddress() + " not in " + conditions.ipAddresses());
        }
        if (!networkMatcher.locationAllowed(conditions.locations(), env.location())) {
            failed.add("location " + env.location() + " not in " + conditions.locations());
        }
        for (AttributeCondition condition : conditions.customConditions()) {
            if (!evaluate(condition, context)) {
                failed.add("condition " + condition.describe());
            }
        }
        return failed;
    }

    public boolean conditionsHold(PolicyConditions conditions, PolicyEvaluationContext context) {
        return failedConditions(conditions, context).isEmpty();
    }

    private static boolean compareString(ConditionOperator operator, Object actual, Object expected) {
        if (!(actual instanceof String value)) {
            return false;
        }
        if (operator == ConditionOperator.IN || operator == ConditionOperator.NOT_IN) {
            boolean member = AttributeValues.asList(expected).stream()
                    .map(String::valueOf)
                    .anyMatch(value::equals);
            return operator == ConditionOperator.IN ? member : !member;
        }
        String target = String.valueOf(expected);
        return switch (operator) {
            case EQUALS -> value.equals(target);
            case NOT_EQUALS -> !value.equals(target);
            case CONTAINS -> value.contains(target);
            case NOT_CONTAINS -> !value.contains(target);
            case STARTS_WITH -> value.startsWith(target);
            case ENDS_WITH -> value.endsWith(target);
            case MATCHES -> matchesPattern(value, target);
            default -> false;
        };
    }

    private static boolean matchesPattern(String value, String regex) {
        try {
            return Pattern.compile(regex).matcher(value).find();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regular expression in condition: {}", regex);
            return false;
        }
    }

    /**
     * Numbers and dates. With {@code strictActual} the runtime value must already be a number,
     * otherwise it is converted the same way as the expected value.
     */
    private static <T extends Comparable<T>> boolean compareOrdered(ConditionOperator operator,
                                                                    Object actual,
                                                                    Object expected,
                                                                    Function<Object, Optional<T>> convert,
                                                                    boolean strictActual) {
        if (strictActual && !(actual instanceof Number)) {
            return false;
        }
        Optional<T> value = convert.apply(actual);
        if (value.isEmpty()) {
            return false;
        }

        switch (operator) {
            case BETWEEN, NOT_BETWEEN -> {
                List<Object> bounds = AttributeValues.asList(expected);
                if (bounds.size() != 2) {
                    return false;
                }
                Optional<T> low = convert.apply(bounds.get(0));
                Optional<T> high = convert.apply(bounds.get(1));
                if (low.isEmpty() || high.isEmpty()) {
                    return false;
                }
                boolean inside = value.get().compareTo(low.get()) >= 0 && value.get().compareTo(high.get()) <= 0;
                return operator == ConditionOperator.BETWEEN ? inside : !inside;
            }
            case IN, NOT_IN -> {
                boolean member = AttributeValues.asList(expected).stream()
                        .map(convert)
                        .flatMap(Optional::stream)
                        .anyMatch(candidate -> candidate.compareTo(value.get()) == 0);
                return operator == ConditionOperator.IN ? member : !member;
            }
            default -> {
                Optional<T> target = convert.apply(expected);
                if (target.isEmpty()) {
                    return false;
                }
                int cmp = value.get().compareTo(target.get());
                return switch (operator) {
                    case EQUALS -> cmp == 0;
                    case NOT_EQUALS -> cmp != 0;
                    case GREATER_THAN -> cmp > 0;
                    case GREATER_THAN_OR_EQUALS -> cmp >= 0;
                    case LESS_THAN -> cmp < 0;
                    case LESS_THAN_OR_EQUALS -> cmp <= 0;
                    default -> false;
                };
            }
        }
    }

    private static boolean compareBoolean(Object actual, Object expected) {
        if (!(actual instanceof Boolean value)) {
            return false;
        }
        return AttributeValues.toBoolean(expected).map(value::equals).orElse(false);
    }

    private static boolean compareArray(ConditionOperator operator, Object actual, Object expected) {
        Optional<List<Object>> runtime = AttributeValues.toList(actual);
        if (runtime.isEmpty()) {
            return false;
        }
        List<Object> values = runtime.get();
        return switch (operator) {
            case CONTAINS -> AttributeValues.containsLoosely(values, expected);
            case NOT_CONTAINS -> !AttributeValues.containsLoosely(values, expected);
            case IN -> {
                List<Object> allowed = AttributeValues.asList(expected);
                yield values.stream().allMatch(v -> AttributeValues.containsLoosely(allowed, v));
            }
            case NOT_IN -> {
                List<Object> excluded = AttributeValues.asList(expected);
                yield values.stream().noneMatch(v -> AttributeValues.containsLoosely(excluded, v));
            }
            case CONTAINS_ANY -> AttributeValues.asList(expected).stream()
                    .anyMatch(v -> AttributeValues.containsLoosely(values, v));
            default -> false;
        };
    }

    private static String describe(TimeWindow window) {
        StringBuilder text = new StringBuilder();
        text.append(window.start() != null ? window.start() : "00:00")
                .append('-')
                .append(window.end() != null ? window.end() : "23:59");
        if (window.timezone() != null) {
            text.append(' ').append(window.timezone());
        }
        if (!window.daysOfWeek().isEmpty()) {
            text.append(" days=").append(window.daysOfWeek());
        }
        return text.toString();
    }
}
