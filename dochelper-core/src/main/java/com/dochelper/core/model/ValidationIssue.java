package com.dochelper.core.model;

import java.util.Objects;

/**
 * A constraint violation (or formula failure) on one field.
 *
 * @param constraintType name of the violated constraint, or {@code FORMULA} for a calculation failure
 * @param code           stable message key, e.g. {@code validation.required}
 */
public record ValidationIssue(String fieldId, Severity severity, String message, String constraintType, String code) {

    public static final String FORMULA = "FORMULA";

    public ValidationIssue {
        Objects.requireNonNull(fieldId, "fieldId");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(constraintType, "constraintType");
        Objects.requireNonNull(code, "code");
    }

    public static ValidationIssue of(String fieldId, FieldConstraint constraint, String message) {
        return new ValidationIssue(fieldId, constraint.severity(), message,
            constraint.type().name(), constraint.type().getCode());
    }

    public static ValidationIssue formulaError(String fieldId, String message) {
        return new ValidationIssue(fieldId, Severity.ERROR, message, FORMULA, "validation.formula_error");
    }

    public boolean isBlocking() {
        return severity.isBlocking();
    }
}
