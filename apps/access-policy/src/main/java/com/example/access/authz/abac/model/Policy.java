package com.example.access.authz.abac.model;

import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An ABAC policy: who ({@code subjects}) may or may not ({@code effect}) do what
 * ({@code actions}) to which resources ({@code resources}), under which
 * {@code conditions}. Under conflict the higher {@code priority} wins.
 *
 * <p>Policies are immutable snapshots handed to the engine by a store; the engine never
 * changes them. {@code version} is bumped by the editing side and only matters to
 * callers doing optimistic updates and cache keys.
 */
@Builder(toBuilder = true)
public record Policy(
        String id,
        String name,
        String description,
        PolicyScope scope,
        PolicyEffect effect,
        int priority,
        PolicySubjects subjects,
        PolicyResources resources,
        List<String> actions,
        PolicyConditions conditions,
        String organizationId,
        boolean active,
        int version,
        Map<String, FieldPermission> fieldPermissions
) {
    public static final int DEFAULT_PRIORITY = 100;
    public static final String ALL_ACTIONS = "*";

    /**
     * Builder defaults: priority {@value #DEFAULT_PRIORITY}, active.
     */
    public static class PolicyBuilder {
        private int priority = DEFAULT_PRIORITY;
        private boolean active = true;
    }

    public Policy {
        subjects = subjects != null ? subjects : PolicySubjects.any();
        resources = resources != null ? resources : PolicyResources.none();
        conditions = conditions != null ? conditions : PolicyConditions.none();
        actions = ModelCollections.list(actions);
        fieldPermissions = ModelCollections.map(fieldPermissions);
        if (scope == null) {
            scope = organizationId == null ? PolicyScope.SYSTEM : PolicyScope.ORGANIZATION;
        }
    }

    /**
     * Name for messages, falling back to the ID.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public boolean isSystemWide() {
        return organizationId == null;
    }

    public boolean isAllow() {
        return effect == PolicyEffect.ALLOW;
    }

    public boolean isDeny() {
        return effect == PolicyEffect.DENY;
    }

    /**
     * Field permissions this policy attaches to a resource type, matched case-insensitively.
     */
    public Optional<FieldPermission> fieldPermissionFor(String resourceType) {
        if (resourceType == null) {
            return Optional.empty();
        }
        FieldPermission exact = fieldPermissions.get(resourceType);
        if (exact != null) {
            return Optional.of(exact);
        }
        return fieldPermissions.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(resourceType))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
