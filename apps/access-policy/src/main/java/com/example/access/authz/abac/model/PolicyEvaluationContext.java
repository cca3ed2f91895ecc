package com.example.access.authz.abac.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the engine knows about one access request. Built by the caller, with any
 * remotely sourced attribute already resolved into the attribute maps.
 */
public record PolicyEvaluationContext(
        Subject subject,
        Resource resource,
        String action,
        Environment environment,
        String organizationId
) {
    public PolicyEvaluationContext {
        subject = subject != null ? subject : new Subject(null, List.of(), List.of(), Map.of());
        resource = resource != null ? resource : new Resource(null, null, Map.of());
        environment = environment != null ? environment : Environment.at(null);
    }

    /**
     * The requesting user.
     */
    public record Subject(
            String id,
            List<String> roles,
            List<String> groups,
            Map<String, Object> attributes
    ) {
        public Subject {
            roles = ModelCollections.list(roles);
            groups = ModelCollections.list(groups);
            attributes = ModelCollections.map(attributes);
        }
    }

    /**
     * The resource being accessed. {@code id} is absent for collection-level actions.
     */
    public record Resource(
            String type,
            String id,
            Map<String, Object> attributes
    ) {
        public Resource {
            attributes = ModelCollections.map(attributes);
        }
    }

    /**
     * Request environment. The {@value #CORRELATION_ID} attribute, when present, is copied
     * to audit events.
     */
    public record Environment(
            Instant timestamp,
            String ipAddress,
            String location,
            Map<String, Object> attributes
    ) {
        public static final String CORRELATION_ID = "correlationId";

        public Environment {
            attributes = ModelCollections.map(attributes);
        }

        public static Environment at(Instant timestamp) {
            return new Environment(timestamp, null, null, Map.of());
        }
    }

    /**
     * Same request, evaluated on behalf of another organization.
     */
    public PolicyEvaluationContext withOrganization(String otherOrganizationId) {
        return new PolicyEvaluationContext(subject, resource, action, environment, otherOrganizationId);
    }

    /**
     * Same request with extra environment attributes layered over the existing ones.
     */
    public PolicyEvaluationContext withEnvironmentAttributes(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(environment.attributes());
        merged.putAll(extra);
        Environment env = new Environment(environment.timestamp(), environment.ipAddress(),
                environment.location(), merged);
        return new PolicyEvaluationContext(subject, resource, action, env, organizationId);
    }
}
