package com.example.access.authz.abac.store;

import com.example.access.authz.abac.model.Policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, versioned view of the policy set. A new snapshot (with a higher version) is
 * published whenever the policy set changes.
 */
public record PolicySnapshot(List<Policy> policies, long version) {

    public PolicySnapshot {
        policies = policies != null ? Collections.unmodifiableList(new ArrayList<>(policies)) : List.of();
    }

    public static PolicySnapshot empty() {
        return new PolicySnapshot(List.of(), 0L);
    }

    public Optional<Policy> findById(String policyId) {
        return policies.stream()
                .filter(p -> p != null && p.id() != null && p.id().equals(policyId))
                .findFirst();
    }
}
