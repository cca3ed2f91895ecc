package com.example.access.config.properties;

import com.example.access.authz.abac.engine.ResourceTypeWildcard;
import com.example.access.authz.abac.field.FieldDefaultMode;
import com.example.access.authz.abac.model.FieldPermission;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the access policy engine and its services.
 */
@ConfigurationProperties(prefix = "app.access")
public record AccessPolicyProperties(
        CacheProperties cache,
        AuditProperties audit,
        FieldPermissionsProperties fieldPermissions,
        MatchingProperties matching,
        Map<String, List<String>> resourceFields,
        Map<String, String> organizationParents
) {
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 10_000;

    public AccessPolicyProperties {
        if (cache == null) {
            cache = CacheProperties.defaults();
        }
        if (audit == null) {
            audit = new AuditProperties(true, true);
        }
        if (fieldPermissions == null) {
            fieldPermissions = new FieldPermissionsProperties(FieldDefaultMode.OPEN, Map.of());
        }
        if (matching == null) {
            matching = new MatchingProperties(ResourceTypeWildcard.ANY);
        }
        if (resourceFields == null) {
            resourceFields = Map.of();
        }
        if (organizationParents == null) {
            organizationParents = Map.of();
        }
    }

    /**
     * Decision cache.
     */
    public record CacheProperties(
            boolean enabled,
            Duration ttl,
            int maxEntries
    ) {
        public CacheProperties {
            if (ttl == null) {
                ttl = DEFAULT_CACHE_TTL;
            }
            if (maxEntries <= 0) {
                maxEntries = DEFAULT_CACHE_MAX_ENTRIES;
            }
        }

        public static CacheProperties defaults() {
            return new CacheProperties(true, DEFAULT_CACHE_TTL, DEFAULT_CACHE_MAX_ENTRIES);
        }
    }

    public record AuditProperties(
            boolean enabled,
            boolean logAllowed
    ) {}

    /**
     * @param defaultMode visibility when no permission names a field for a type
     * @param base        base field permissions per resource type, merged with policy ones
     */
    public record FieldPermissionsProperties(
            FieldDefaultMode defaultMode,
            Map<String, FieldPermission> base
    ) {
        public FieldPermissionsProperties {
            if (defaultMode == null) {
                defaultMode = FieldDefaultMode.OPEN;
            }
            if (base == null) {
                base = Map.of();
            }
        }
    }

    public record MatchingProperties(
            ResourceTypeWildcard resourceTypeWildcard
    ) {
        public MatchingProperties {
            if (resourceTypeWildcard == null) {
                resourceTypeWildcard = ResourceTypeWildcard.ANY;
            }
        }
    }
}
