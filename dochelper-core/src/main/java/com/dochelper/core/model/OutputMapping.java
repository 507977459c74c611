package com.dochelper.core.model;

import java.util.Objects;

/**
 * Formula whose value, coerced to {@code target}, is handed to document generation.
 */
public record OutputMapping(OutputTarget target, String formulaText) {

    public OutputMapping {
        Objects.requireNonNull(target, "target");
        if (formulaText == null || formulaText.isBlank()) {
            throw new IllegalArgumentException("Output mapping formula must not be empty");
        }
    }
}
