package com.example.access.authz.abac.store;

import com.example.access.authz.abac.model.Policy;

import java.util.List;

/**
 * Source of the policies evaluated by the authorization service.
 */
public interface PolicyStore {

    /**
     * The current policy set. Never null.
     */
    PolicySnapshot snapshot();

    /**
     * Publish a new policy set.
     *
     * @return the published snapshot
     */
    PolicySnapshot replace(List<Policy> policies);
}
