package com.example.access.authz.audit;

import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for authorization decisions and field-level denials.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        List<String> policyIds,
        List<String> reasons,
        List<String> warnings,
        long evaluationTimeMs,

        // Subject
        String userId,
        String organizationId,

        // Resource and action
        String resourceType,
        String resourceId,
        String action,

        // Field access
        String fieldMode,
        List<String> deniedFields,

        // Request environment
        String clientIp,
        String location
) {
    public enum Outcome {
        ALLOW, DENY, FIELD_DENIED
    }

    /**
     * Creates an audit event from an evaluation result.
     */
    public static AuthzAuditEvent decision(PolicyEvaluationContext context,
                                           PolicyEvaluationResult result,
                                           String correlationId) {
        List<Policy> deciding = result.allowed() ? result.allowPolicies() : result.deniedPolicies();
        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                correlationId,
                result.allowed() ? Outcome.ALLOW : Outcome.DENY,
                deciding.stream().map(Policy::id).toList(),
                result.reasons(),
                result.warnings(),
                result.evaluationTimeMs(),
                context.subject().id(),
                context.organizationId(),
                context.resource().type(),
                context.resource().id(),
                context.action(),
                null,
                List.of(),
                context.environment().ipAddress(),
                context.environment().location()
        );
    }

    /**
     * Creates an audit event for fields removed from a response or rejected from a write.
     */
    public static AuthzAuditEvent fieldDenied(PolicyEvaluationContext context,
                                              String fieldMode,
                                              List<String> deniedFields,
                                              String correlationId) {
        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                correlationId,
                Outcome.FIELD_DENIED,
                List.of(),
                List.of(),
                List.of(),
                0L,
                context.subject().id(),
                context.organizationId(),
                context.resource().type(),
                context.resource().id(),
                context.action(),
                fieldMode,
                List.copyOf(deniedFields),
                context.environment().ipAddress(),
                context.environment().location()
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("event_type", outcome == Outcome.FIELD_DENIED ? "authz_field_access" : "authz_decision");
        log.put("event_id", eventId);
        log.put("timestamp", timestamp.toString());
        log.put("correlation_id", nullToEmpty(correlationId));
        log.put("outcome", outcome.name());
        log.put("policy_ids", policyIds);
        log.put("reasons", reasons);
        if (!warnings.isEmpty()) {
            log.put("warnings", warnings);
        }
        log.put("evaluation_time_ms", evaluationTimeMs);
        log.put("user_id", nullToEmpty(userId));
        log.put("organization_id", nullToEmpty(organizationId));
        log.put("resource_type", nullToEmpty(resourceType));
        log.put("resource_id", nullToEmpty(resourceId));
        log.put("action", nullToEmpty(action));
        if (fieldMode != null) {
            log.put("field_mode", fieldMode);
            log.put("denied_fields", deniedFields);
        }
        log.put("client_ip", nullToEmpty(clientIp));
        log.put("location", nullToEmpty(location));
        return log;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
