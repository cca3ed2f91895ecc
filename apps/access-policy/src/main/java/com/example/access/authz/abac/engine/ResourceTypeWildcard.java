package com.example.access.authz.abac.engine;

/**
 * What a policy with no resource types but with resource attribute conditions applies to.
 */
public enum ResourceTypeWildcard {
    /**
     * Every resource type.
     */
    ANY,
    /**
     * Only resource types listed in the field catalog.
     */
    KNOWN_TYPES
}
