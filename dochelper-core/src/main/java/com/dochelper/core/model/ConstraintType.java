package com.dochelper.core.model;

import java.util.Locale;

/**
 * Kinds of field constraint. The code is the key of the issue message.
 */
public enum ConstraintType {
    REQUIRED("validation.required"),
    MIN_LENGTH("validation.min_length"),
    MAX_LENGTH("validation.max_length"),
    MIN_VALUE("validation.min_value"),
    MAX_VALUE("validation.max_value"),
    PATTERN("validation.pattern"),
    ALLOWED_VALUES("validation.allowed_values"),
    FILE_EXTENSION("validation.invalid_file_extension"),
    MAX_FILE_SIZE("validation.file_too_large");

    private final String code;

    ConstraintType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ConstraintType fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Constraint type must not be empty");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown constraint type: " + key, e);
        }
    }
}
