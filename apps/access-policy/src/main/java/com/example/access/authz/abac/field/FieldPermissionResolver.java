package com.example.access.authz.abac.field;

import com.example.access.authz.abac.model.EffectiveFieldPermissions;
import com.example.access.authz.abac.model.FieldPermission;
import com.example.access.authz.abac.model.Policy;
import com.example.access.authz.abac.model.PolicyEvaluationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Combines field permissions from the base configuration and from the policies that
 * allowed a request into the effective readable/writable field sets.
 *
 * <p>Contributions are unioned. {@code "*"} expands to every catalog field of the type.
 * Denied fields are removed from both sets whatever grants them. When no contribution names
 * a readable (or writable) field the {@link FieldDefaultMode} decides.
 */
@Slf4j
public final class FieldPermissionResolver {

    private final ResourceFieldCatalog catalog;
    private final FieldDefaultMode defaultMode;

    public FieldPermissionResolver(ResourceFieldCatalog catalog, FieldDefaultMode defaultMode) {
        this.catalog = catalog != null ? catalog : ResourceFieldCatalog.empty();
        this.defaultMode = defaultMode != null ? defaultMode : FieldDefaultMode.OPEN;
    }

    /**
     * @param resourceType         resource type being accessed
     * @param permissions          base field permissions per resource type, may be empty
     * @param matchedAllowPolicies allow policies that applied to the request
     */
    public EffectiveFieldPermissions resolveFieldPermissions(String resourceType,
                                                             Map<String, FieldPermission> permissions,
                                                             List<Policy> matchedAllowPolicies) {
        List<FieldPermission> grants = new ArrayList<>();
        basePermission(resourceType, permissions).ifPresent(grants::add);
        grants.addAll(policyPermissions(resourceType, matchedAllowPolicies));
        return combine(resourceType, grants, grants);
    }

    /**
     * Resolve against an evaluation result: readable and writable fields come from the allow
     * policies, denied fields from every matched policy. A denied request gets no fields.
     */
    public EffectiveFieldPermissions resolveFieldPermissions(String resourceType,
                                                             Map<String, FieldPermission> permissions,
                                                             PolicyEvaluationResult result) {
        if (result == null || !result.allowed()) {
            return EffectiveFieldPermissions.none(resourceType);
        }
        List<FieldPermission> grants = new ArrayList<>();
        basePermission(resourceType, permissions).ifPresent(grants::add);
        grants.addAll(policyPermissions(resourceType, result.allowPolicies()));

        List<FieldPermission> denials = new ArrayList<>();
        basePermission(resourceType, permissions).ifPresent(denials::add);
        denials.addAll(policyPermissions(resourceType, result.matchedPolicies()));
        return combine(resourceType, grants, denials);
    }

    private EffectiveFieldPermissions combine(String resourceType,
                                              List<FieldPermission> grants,
                                              List<FieldPermission> denials) {
        Set<String> denied = new LinkedHashSet<>();
        denials.forEach(p -> denied.addAll(p.denied()));

        Set<String> knownFields = catalog.fieldsOf(resourceType);
        boolean readsAll = grants.stream().anyMatch(FieldPermission::readsAll);
        boolean writesAll = grants.stream().anyMatch(FieldPermission::writesAll);
        Set<String> readable = named(grants, true);
        Set<String> writable = named(grants, false);

        boolean allReadable = readsAll || (readable.isEmpty() && defaultMode == FieldDefaultMode.OPEN);
        boolean allWritable = writesAll || (writable.isEmpty() && defaultMode == FieldDefaultMode.OPEN);
        if (allReadable) {
            readable.addAll(knownFields);
        }
        if (allWritable) {
            writable.addAll(knownFields);
        }
        readable.removeAll(denied);
        writable.removeAll(denied);

        log.debug("Field permissions for {}: readable={}, writable={}, denied={}, allReadable={}, allWritable={}",
                resourceType, readable, writable, denied, allReadable, allWritable);
        return new EffectiveFieldPermissions(resourceType, readable, writable, denied, allReadable, allWritable);
    }

    private static Set<String> named(List<FieldPermission> grants, boolean read) {
        Set<String> fields = new LinkedHashSet<>();
        for (FieldPermission grant : grants) {
            (read ? grant.readable() : grant.writable()).stream()
                    .filter(f -> !f.equals(FieldPermission.WILDCARD))
                    .forEach(fields::add);
        }
        return fields;
    }

    private static Optional<FieldPermission> basePermission(String resourceType,
                                                            Map<String, FieldPermission> permissions) {
        if (permissions == null || resourceType == null) {
            return Optional.empty();
        }
        FieldPermission exact = permissions.get(resourceType);
        if (exact != null) {
            return Optional.of(exact);
        }
        return permissions.entrySet().stream()
                .filter(e -> resourceType.equalsIgnoreCase(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static List<FieldPermission> policyPermissions(String resourceType, List<Policy> policies) {
        if (policies == null) {
            return List.of();
        }
        return policies.stream()
                .map(p -> p.fieldPermissionFor(resourceType))
                .flatMap(Optional::stream)
                .toList();
    }
}
