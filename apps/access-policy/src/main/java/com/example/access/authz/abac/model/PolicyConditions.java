package com.example.access.authz.abac.model;

import java.util.List;

/**
 * Environmental conditions of a policy. Every group that is present must hold.
 */
public record PolicyConditions(
        TimeWindow timeWindow,
        List<String> ipAddresses,
        List<String> locations,
        List<AttributeCondition> customConditions
) {
    public PolicyConditions {
        ipAddresses = ModelCollections.list(ipAddresses);
        locations = ModelCollections.list(locations);
        customConditions = ModelCollections.list(customConditions);
    }

    public static PolicyConditions none() {
        return new PolicyConditions(null, List.of(), List.of(), List.of());
    }

    public static PolicyConditions timeWindow(TimeWindow window) {
        return new PolicyConditions(window, List.of(), List.of(), List.of());
    }

    public static PolicyConditions custom(AttributeCondition... conditions) {
        return new PolicyConditions(null, List.of(), List.of(), List.of(conditions));
    }

    public boolean isEmpty() {
        return timeWindow == null && ipAddresses.isEmpty() && locations.isEmpty() && customConditions.isEmpty();
    }
}
