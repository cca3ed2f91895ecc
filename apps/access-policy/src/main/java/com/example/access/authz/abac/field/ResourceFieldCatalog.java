package com.example.access.authz.abac.field;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Known fields per resource type. Used to expand {@code "*"} field grants into concrete
 * field names and as the set of known resource types. Lookups ignore case.
 */
public final class ResourceFieldCatalog {

    private final Map<String, Set<String>> fieldsByType;

    public ResourceFieldCatalog(Map<String, List<String>> fieldsByType) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (fieldsByType != null) {
            fieldsByType.forEach((type, fields) -> copy.put(type.toLowerCase(Locale.ROOT),
                    fields == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(fields))));
        }
        this.fieldsByType = Map.copyOf(copy);
    }

    public static ResourceFieldCatalog empty() {
        return new ResourceFieldCatalog(Map.of());
    }

    public Set<String> fieldsOf(String resourceType) {
        if (resourceType == null) {
            return Set.of();
        }
        return fieldsByType.getOrDefault(resourceType.toLowerCase(Locale.ROOT), Set.of());
    }

    public boolean isKnown(String resourceType) {
        return resourceType != null && fieldsByType.containsKey(resourceType.toLowerCase(Locale.ROOT));
    }

    public Set<String> knownTypes() {
        return fieldsByType.keySet();
    }
}
