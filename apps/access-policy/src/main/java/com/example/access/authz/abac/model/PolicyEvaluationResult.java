package com.example.access.authz.abac.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of evaluating a policy set against one request.
 *
 * @param allowed          final decision
 * @param matchedPolicies  every policy that applied, highest priority first
 * @param deniedPolicies   deny policies that decided the outcome
 * @param reasons          one line per policy that decided the outcome, or the default-deny reason
 * @param warnings         policies that were skipped as malformed or failed to evaluate
 * @param evaluationTimeMs wall-clock evaluation time
 */
public record PolicyEvaluationResult(
        boolean allowed,
        List<Policy> matchedPolicies,
        List<Policy> deniedPolicies,
        List<String> reasons,
        List<String> warnings,
        long evaluationTimeMs
) {
    public static final String NO_MATCHING_POLICY = "no matching policy";

    public PolicyEvaluationResult {
        matchedPolicies = ModelCollections.list(matchedPolicies);
        deniedPolicies = ModelCollections.list(deniedPolicies);
        reasons = ModelCollections.list(reasons);
        warnings = ModelCollections.list(warnings);
    }

    public static PolicyEvaluationResult defaultDeny(List<String> warnings, long evaluationTimeMs) {
        return new PolicyEvaluationResult(false, List.of(), List.of(), List.of(NO_MATCHING_POLICY),
                warnings, evaluationTimeMs);
    }

    public boolean hasExplicitDeny() {
        return !deniedPolicies.isEmpty();
    }

    /**
     * Matched policies with an allow effect.
     */
    public List<Policy> allowPolicies() {
        return matchedPolicies.stream().filter(Policy::isAllow).toList();
    }

    public PolicyEvaluationResult withReason(String reason) {
        List<String> extended = new ArrayList<>(reasons);
        extended.add(reason);
        return new PolicyEvaluationResult(allowed, matchedPolicies, deniedPolicies, extended, warnings,
                evaluationTimeMs);
    }
}
