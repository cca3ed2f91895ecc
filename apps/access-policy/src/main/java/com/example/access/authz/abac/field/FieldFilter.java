package com.example.access.authz.abac.field;

import com.example.access.authz.abac.model.EffectiveFieldPermissions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies resolved field permissions to flat key/value payloads.
 */
public final class FieldFilter {

    /**
     * Copy of the payload without the fields the caller may not read.
     */
    public Map<String, Object> filterReadable(Map<String, Object> payload, EffectiveFieldPermissions permissions) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        if (payload == null) {
            return filtered;
        }
        payload.forEach((field, value) -> {
            if (permissions.canRead(field)) {
                filtered.put(field, value);
            }
        });
        return filtered;
    }

    /**
     * Fields of the payload the caller may not read, in payload order.
     */
    public List<String> unreadableFields(Map<String, Object> payload, EffectiveFieldPermissions permissions) {
        if (payload == null) {
            return List.of();
        }
        return payload.keySet().stream()
                .filter(field -> !permissions.canRead(field))
                .toList();
    }

    /**
     * Fields of an incoming payload the caller may not write, in payload order. Empty when
     * the whole payload may be written.
     */
    public List<String> checkWritable(Map<String, Object> payload, EffectiveFieldPermissions permissions) {
        if (payload == null) {
            return List.of();
        }
        return payload.keySet().stream()
                .filter(field -> !permissions.canWrite(field))
                .toList();
    }
}
