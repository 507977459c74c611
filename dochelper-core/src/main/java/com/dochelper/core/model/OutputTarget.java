package com.dochelper.core.model;

import java.util.Locale;

/**
 * Type a mapped output value is coerced to before it reaches a document.
 */
public enum OutputTarget {
    TEXT,
    NUMBER,
    BOOLEAN;

    public static OutputTarget fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Output target must not be empty");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output target: " + key, e);
        }
    }
}
