package com.example.access.exception;

import com.example.access.authz.abac.model.PolicyEvaluationResult;

import java.util.List;

/**
 * Signals a denied authorization decision to callers that prefer an error over inspecting
 * the result.
 */
public class AccessDeniedException extends RuntimeException {

    private final transient PolicyEvaluationResult result;

    public AccessDeniedException(String action, String resourceType, PolicyEvaluationResult result) {
        super("Access denied: action '" + action + "' on '" + resourceType + "' ("
                + String.join("; ", result.reasons()) + ")");
        this.result = result;
    }

    public PolicyEvaluationResult getResult() {
        return result;
    }

    public List<String> getReasons() {
        return result.reasons();
    }
}
