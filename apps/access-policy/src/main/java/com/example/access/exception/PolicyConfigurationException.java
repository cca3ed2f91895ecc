package com.example.access.exception;

/**
 * Thrown at startup when configured policy definitions cannot be turned into policies.
 */
public class PolicyConfigurationException extends RuntimeException {

    private final String policyId;

    public PolicyConfigurationException(String policyId, String message) {
        super("Invalid policy definition '" + policyId + "': " + message);
        this.policyId = policyId;
    }

    public PolicyConfigurationException(String policyId, String message, Throwable cause) {
        super("Invalid policy definition '" + policyId + "': " + message, cause);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
