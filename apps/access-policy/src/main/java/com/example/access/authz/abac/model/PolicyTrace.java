package com.example.access.authz.abac.model;

import java.util.List;

/**
 * Step-by-step explanation of whether a single policy applies to a request, used by the
 * policy tester.
 */
public record PolicyTrace(
        String policyId,
        String problem,
        boolean active,
        boolean organizationMatched,
        boolean subjectMatched,
        boolean resourceMatched,
        boolean actionMatched,
        List<String> failedConditions
) {
    public PolicyTrace {
        failedConditions = ModelCollections.list(failedConditions);
    }

    public static PolicyTrace malformed(String policyId, String problem) {
        return new PolicyTrace(policyId, problem, false, false, false, false, false, List.of());
    }

    public boolean conditionsSatisfied() {
        return failedConditions.isEmpty();
    }

    public boolean applicable() {
        return problem == null && active && organizationMatched && subjectMatched
                && resourceMatched && actionMatched && conditionsSatisfied();
    }
}
