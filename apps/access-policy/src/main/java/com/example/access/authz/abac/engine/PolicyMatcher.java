package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.AttributeCondition;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyResources;
import com.example.access.authz.abac.model.PolicySubjects;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a policy targets a request: subject, resource, action, organization and
 * the active flag. Conditions are left to {@link ConditionEvaluator}.
 *
 * <p>Subject and resource sections are disjunctive over their channels. A subject section with
 * no entries matches everyone; a resource section with no entries matches nothing.
 */
public final class PolicyMatcher {

    private static final String ANY_TYPE = "*";
    private static final String SUBJECT_PREFIX = "subject.";
    private static final String RESOURCE_PREFIX = "resource.";

    private final ConditionEvaluator conditionEvaluator;
    private final MatchingOptions options;

    public PolicyMatcher(ConditionEvaluator conditionEvaluator, MatchingOptions options) {
        this.conditionEvaluator = conditionEvaluator;
        this.options = options != null ? options : MatchingOptions.defaults();
    }

    public boolean isCandidate(Policy policy, PolicyEvaluationContext context) {
        return policy.active()
                && organizationMatches(policy, context.organizationId())
                && actionMatches(policy.actions(), context.action())
                && subjectMatches(policy.subjects(), context.subject())
                && resourceMatches(policy.resources(), context);
    }

    public boolean organizationMatches(Policy policy, String organizationId) {
        return policy.isSystemWide() || policy.organizationId().equals(organizationId);
    }

    public boolean actionMatches(List<String> actions, String action) {
        return actions.contains(Policy.ALL_ACTIONS) || (action != null && actions.contains(action));
    }

    public boolean subjectMatches(PolicySubjects subjects, PolicyEvaluationContext.Subject subject) {
        if (subjects.isEmpty()) {
            return true;
        }
        if (subject.id() != null && subjects.users().contains(subject.id())) {
            return true;
        }
        if (intersects(subjects.groups(), subject.groups()) || intersects(subjects.roles(), subject.roles())) {
            return true;
        }
        return !subjects.attributes().isEmpty() && subjectAttributesMatch(subjects.attributes(), subject.attributes());
    }

    public boolean resourceMatches(PolicyResources resources, PolicyEvaluationContext context) {
        if (resources.isEmpty()) {
            return false;
        }
        PolicyEvaluationContext.Resource resource = context.resource();
        if (typeListed(resources.types(), resource.type())) {
            return true;
        }
        if (resource.id() != null && resources.ids().contains(resource.id())) {
            return true;
        }
        if (resources.attributes().isEmpty()) {
            return false;
        }
        if (resources.types().isEmpty() && !options.attributeOnlyPoliciesApplyTo(resource.type())) {
            return false;
        }
        return resources.attributes().stream()
                .allMatch(condition -> resourceConditionHolds(condition, resource, context));
    }

    private boolean resourceConditionHolds(AttributeCondition condition,
                                           PolicyEvaluationContext.Resource resource,
                                           PolicyEvaluationContext context) {
        String name = stripPrefix(condition.attribute(), RESOURCE_PREFIX);
        Object actual = switch (Objects.requireNonNullElse(name, "")) {
            case "type" -> resource.type();
            case "id" -> resource.id();
            default -> AttributeResolver.lookup(resource.attributes(), name).orElse(null);
        };
        return conditionEvaluator.test(condition, actual, context);
    }

    private static boolean subjectAttributesMatch(Map<String, Object> required, Map<String, Object> actual) {
        return required.entrySet().stream().allMatch(entry -> {
            Optional<Object> value = AttributeResolver.lookup(actual, stripPrefix(entry.getKey(), SUBJECT_PREFIX));
            return value.isPresent() && AttributeValues.looselyEquals(value.get(), entry.getValue());
        });
    }

    private static boolean typeListed(List<String> types, String resourceType) {
        return types.stream().anyMatch(t -> t.equals(ANY_TYPE) || t.equals(resourceType));
    }

    private static boolean intersects(Collection<String> configured, Collection<String> actual) {
        return !configured.isEmpty() && actual.stream().anyMatch(configured::contains);
    }

    private static String stripPrefix(String name, String prefix) {
        return name != null && name.startsWith(prefix) ? name.substring(prefix.length()) : name;
    }
}
