package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.Policy;

import java.util.Optional;

/**
 * Structural checks a policy must pass before it is considered for matching. Policies come
 * from an external store, so a broken one is skipped rather than failing the request.
 */
public final class PolicyValidator {

    private PolicyValidator() {}

    /**
     * @return the first problem found, empty for a well-formed policy
     */
    public static Optional<String> problem(Policy policy) {
        if (policy == null) {
            return Optional.of("policy is null");
        }
        if (policy.id() == null || policy.id().isBlank()) {
            return Optional.of("policy '" + policy.displayName() + "' has no id");
        }
        if (policy.effect() == null) {
            return Optional.of("policy " + policy.id() + " has no effect");
        }
        if (policy.actions().isEmpty()) {
            return Optional.of("policy " + policy.id() + " has no actions");
        }
        if (policy.resources().isEmpty()) {
            return Optional.of("policy " + policy.id() + " has no resource constraint");
        }
        return Optional.empty();
    }
}
