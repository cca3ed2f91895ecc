package com.example.access.authz.abac.field;

/**
 * Field visibility when no permission names any readable or writable field for a type.
 */
public enum FieldDefaultMode {
    /**
     * Every field except denied ones.
     */
    OPEN,
    /**
     * No field.
     */
    CLOSED
}
