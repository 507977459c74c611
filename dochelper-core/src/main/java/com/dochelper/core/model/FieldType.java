package com.dochelper.core.model;

import java.util.Locale;

/**
 * Kind of a form field. Decides which constraints apply and how formulas see the value.
 */
public enum FieldType {
    TEXT,
    TEXTAREA,
    NUMBER,
    DATE,
    DROPDOWN,
    CHECKBOX,
    RADIO,
    /** Value computed from a formula over other fields */
    CALCULATED,
    LOOKUP,
    FILE,
    IMAGE,
    TABLE;

    public boolean isCalculated() {
        return this == CALCULATED;
    }

    public boolean isFile() {
        return this == FILE || this == IMAGE;
    }

    /**
     * Parse a field type from a schema key (case-insensitive)
     */
    public static FieldType fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Field type must not be empty");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown field type: " + key, e);
        }
    }
}
