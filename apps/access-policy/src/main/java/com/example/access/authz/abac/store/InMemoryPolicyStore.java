package com.example.access.authz.abac.store;

import com.example.access.authz.abac.model.Policy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Policy store holding the current snapshot in memory. Readers always see a complete
 * snapshot; {@link #replace(List)} swaps it atomically and bumps the version.
 */
@Slf4j
public class InMemoryPolicyStore implements PolicyStore {

    private final AtomicReference<PolicySnapshot> current;

    public InMemoryPolicyStore(List<Policy> initialPolicies) {
        this.current = new AtomicReference<>(new PolicySnapshot(initialPolicies, 1L));
        log.info("In-memory policy store initialized with {} policies", current.get().policies().size());
    }

    @Override
    public PolicySnapshot snapshot() {
        return current.get();
    }

    @Override
    public PolicySnapshot replace(List<Policy> policies) {
        PolicySnapshot published = current.updateAndGet(
                previous -> new PolicySnapshot(policies, previous.version() + 1));
        log.info("Policy snapshot replaced: version={}, policies={}", published.version(), published.policies().size());
        return published;
    }
}
