package com.example.access.authz.abac.engine;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tunables of the policy matcher.
 *
 * @param resourceTypeWildcard scope of attribute-only resource sections
 * @param knownResourceTypes   resource types used by {@link ResourceTypeWildcard#KNOWN_TYPES}
 */
public record MatchingOptions(ResourceTypeWildcard resourceTypeWildcard, Set<String> knownResourceTypes) {

    public MatchingOptions {
        if (resourceTypeWildcard == null) {
            resourceTypeWildcard = ResourceTypeWildcard.ANY;
        }
        knownResourceTypes = knownResourceTypes == null ? Set.of() : knownResourceTypes.stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static MatchingOptions defaults() {
        return new MatchingOptions(ResourceTypeWildcard.ANY, Set.of());
    }

    public boolean attributeOnlyPoliciesApplyTo(String resourceType) {
        if (resourceTypeWildcard == ResourceTypeWildcard.ANY) {
            return true;
        }
        return resourceType != null && knownResourceTypes.contains(resourceType.toLowerCase(Locale.ROOT));
    }
}
