package com.example.access.authz.abac.model;

import java.util.List;
import java.util.Objects;

/**
 * Field-level permissions of one resource type, as attached to a policy.
 *
 * <p>{@value #WILDCARD} in {@code readable} or {@code writable} stands for every field of
 * the type. {@code denied} always wins over both lists.
 */
public record FieldPermission(
        List<String> readable,
        List<String> writable,
        List<String> denied
) {
    public static final String WILDCARD = "*";

    public FieldPermission {
        readable = clean(readable);
        writable = clean(writable);
        denied = clean(denied);
    }

    public static FieldPermission of(List<String> readable, List<String> writable, List<String> denied) {
        return new FieldPermission(readable, writable, denied);
    }

    public static FieldPermission readAllExcept(String... denied) {
        return new FieldPermission(List.of(WILDCARD), List.of(), List.of(denied));
    }

    public boolean readsAll() {
        return readable.contains(WILDCARD);
    }

    public boolean writesAll() {
        return writable.contains(WILDCARD);
    }

    private static List<String> clean(List<String> fields) {
        if (fields == null) {
            return List.of();
        }
        return fields.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(f -> !f.isEmpty())
                .distinct()
                .toList();
    }
}
