package com.dochelper.core.model;

import java.util.Locale;

/**
 * What a control rule changes on its target field.
 */
public enum ControlType {
    /** Set the field's value */
    VALUE_SET,
    /** Show or hide the field */
    VISIBILITY,
    /** Enable or disable the field */
    ENABLE;

    public static ControlType fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Control type must not be empty");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown control type: " + key, e);
        }
    }
}
