package com.dochelper.core.model;

import java.util.Locale;

/**
 * Severity of a validation issue.
 */
public enum Severity {
    /** Blocks document generation */
    ERROR,
    /** Shown to the user, who must confirm before generating */
    WARNING,
    /** Informational only */
    INFO;

    public boolean isBlocking() {
        return this == ERROR;
    }

    public static Severity fromKey(String key) {
        if (key == null || key.isBlank()) {
            return ERROR;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + key, e);
        }
    }
}
