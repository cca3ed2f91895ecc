package com.example.access.authz.abac.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Null-tolerant immutable copies for the model records. Policy data comes from external
 * stores, so null lists and null elements are normalized away rather than rejected.
 */
final class ModelCollections {

    private ModelCollections() {}

    static <T> List<T> list(Collection<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    static <V> Map<String, V> map(Map<String, V> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        Map<String, V> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
