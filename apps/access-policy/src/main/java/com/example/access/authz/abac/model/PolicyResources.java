package com.example.access.authz.abac.model;

import java.util.List;

/**
 * What a policy applies to. As with subjects, the channels are alternatives. A policy
 * with all three channels empty is treated as matching nothing.
 *
 * @param types      resource type names, {@code "*"} for any type
 * @param ids        specific resource IDs
 * @param attributes conditions on the resource's attributes, all of which must hold
 */
public record PolicyResources(
        List<String> types,
        List<String> ids,
        List<AttributeCondition> attributes
) {
    public PolicyResources {
        types = ModelCollections.list(types);
        ids = ModelCollections.list(ids);
        attributes = ModelCollections.list(attributes);
    }

    public static PolicyResources none() {
        return new PolicyResources(List.of(), List.of(), List.of());
    }

    public static PolicyResources types(String... types) {
        return new PolicyResources(List.of(types), List.of(), List.of());
    }

    public static PolicyResources ids(String... ids) {
        return new PolicyResources(List.of(), List.of(ids), List.of());
    }

    public static PolicyResources matching(AttributeCondition... conditions) {
        return new PolicyResources(List.of(), List.of(), List.of(conditions));
    }

    public boolean isEmpty() {
        return types.isEmpty() && ids.isEmpty() && attributes.isEmpty();
    }
}
