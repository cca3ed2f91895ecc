package com.example.access.authz.audit;

import com.example.access.authz.abac.model.PolicyEvaluationContext;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import com.example.access.common.util.StringSanitizer;
import com.example.access.config.properties.AccessPolicyProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for publishing authorization audit events in structured JSON format.
 */
@Service
@ConditionalOnProperty(name = "app.access.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    public static final String FIELD_MODE_READ = "read";
    public static final String FIELD_MODE_WRITE = "write";

    private final ObjectMapper objectMapper;
    private final boolean logAllowed;

    public AuthzAuditService(ObjectMapper objectMapper, AccessPolicyProperties properties) {
        this.objectMapper = objectMapper;
        this.logAllowed = properties.audit().logAllowed();
    }

    public void logDecision(
            @NonNull PolicyEvaluationContext context,
            @NonNull PolicyEvaluationResult result,
            @Nullable String correlationId) {

        if (result.allowed() && !logAllowed) {
            return;
        }
        logEvent(AuthzAuditEvent.decision(context, result, correlationId));
    }

    public void logFieldDenial(
            @NonNull PolicyEvaluationContext context,
            @NonNull String fieldMode,
            @NonNull List<String> deniedFields,
            @Nullable String correlationId) {

        if (deniedFields.isEmpty()) {
            return;
        }
        logEvent(AuthzAuditEvent.fieldDenied(context, fieldMode, deniedFields, correlationId));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(@NonNull AuthzAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> AUDIT_LOG.info(json);
            case DENY, FIELD_DENIED -> AUDIT_LOG.warn(json);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - user={}, org={}, resource={}/{}, action={}, policies={}, reasons={}, fields={}",
                event.outcome(),
                StringSanitizer.forLog(event.userId()),
                StringSanitizer.forLog(event.organizationId()),
                StringSanitizer.forLog(event.resourceType()),
                StringSanitizer.forLog(event.resourceId()),
                StringSanitizer.forLog(event.action()),
                event.policyIds(),
                StringSanitizer.forLog(String.join("; ", event.reasons()), 256),
                event.deniedFields());
    }
}
