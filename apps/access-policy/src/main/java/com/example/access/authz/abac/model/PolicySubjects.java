package com.example.access.authz.abac.model;

import java.util.List;
import java.util.Map;

/**
 * Who a policy applies to. The four channels are alternatives: matching any one of them
 * is enough. A fully empty subjects section applies to everyone.
 *
 * @param users      user IDs
 * @param groups     group IDs
 * @param roles      role names
 * @param attributes subject attributes that must all be equal to the configured values
 */
public record PolicySubjects(
        List<String> users,
        List<String> groups,
        List<String> roles,
        Map<String, Object> attributes
) {
    public PolicySubjects {
        users = ModelCollections.list(users);
        groups = ModelCollections.list(groups);
        roles = ModelCollections.list(roles);
        attributes = ModelCollections.map(attributes);
    }

    public static PolicySubjects any() {
        return new PolicySubjects(List.of(), List.of(), List.of(), Map.of());
    }

    public static PolicySubjects users(String... users) {
        return new PolicySubjects(List.of(users), List.of(), List.of(), Map.of());
    }

    public static PolicySubjects groups(String... groups) {
        return new PolicySubjects(List.of(), List.of(groups), List.of(), Map.of());
    }

    public static PolicySubjects roles(String... roles) {
        return new PolicySubjects(List.of(), List.of(), List.of(roles), Map.of());
    }

    public static PolicySubjects withAttributes(Map<String, Object> attributes) {
        return new PolicySubjects(List.of(), List.of(), List.of(), attributes);
    }

    public boolean isEmpty() {
        return users.isEmpty() && groups.isEmpty() && roles.isEmpty() && attributes.isEmpty();
    }
}
