package com.example.access.authz.abac.model;

import java.util.Set;

/**
 * Resolved field visibility of one resource type for one request.
 *
 * <p>{@code readable} and {@code writable} are the enumerable permitted fields (denied
 * fields already removed). When {@code allReadable}/{@code allWritable} is set the
 * permission also covers fields the field catalog does not list, so callers should use
 * {@link #canRead(String)} and {@link #canWrite(String)} rather than set membership.
 */
public record EffectiveFieldPermissions(
        String resourceType,
        Set<String> readable,
        Set<String> writable,
        Set<String> denied,
        boolean allReadable,
        boolean allWritable
) {
    public EffectiveFieldPermissions {
        readable = readable != null ? Set.copyOf(readable) : Set.of();
        writable = writable != null ? Set.copyOf(writable) : Set.of();
        denied = denied != null ? Set.copyOf(denied) : Set.of();
    }

    public static EffectiveFieldPermissions none(String resourceType) {
        return new EffectiveFieldPermissions(resourceType, Set.of(), Set.of(), Set.of(), false, false);
    }

    public boolean canRead(String field) {
        return field != null && !denied.contains(field) && (allReadable || readable.contains(field));
    }

    public boolean canWrite(String field) {
        return field != null && !denied.contains(field) && (allWritable || writable.contains(field));
    }
}
