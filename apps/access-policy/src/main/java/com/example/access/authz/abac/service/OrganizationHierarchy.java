package com.example.access.authz.abac.service;

import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parent chain of organizations, used to inherit policies from ancestors.
 */
public interface OrganizationHierarchy {

    /**
     * Ancestors of an organization, nearest first, not including the organization itself.
     */
    Flux<String> ancestorsOf(String organizationId);

    /**
     * Hierarchy given as a child to parent map. Cycles end the walk.
     */
    static OrganizationHierarchy fromParents(Map<String, String> parents) {
        Map<String, String> copy = Map.copyOf(parents);
        return organizationId -> {
            List<String> ancestors = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            seen.add(organizationId);
            String parent = organizationId != null ? copy.get(organizationId) : null;
            while (parent != null && seen.add(parent)) {
                ancestors.add(parent);
                parent = copy.get(parent);
            }
            return Flux.fromIterable(ancestors);
        };
    }
}
