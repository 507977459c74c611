package com.dochelper.core.formula;

import java.util.Objects;

/**
 * Typed evaluation failure. Evaluation never throws; failures travel in an {@link EvaluationResult}.
 */
public record EvaluationError(Kind kind, String message) {

    public enum Kind {
        TYPE_MISMATCH,
        DIVISION_BY_ZERO,
        UNKNOWN_FUNCTION,
        INVALID_ARGUMENT,
        INVALID_OPERATION,
        CIRCULAR_DEPENDENCY,
        RECURSION_LIMIT
    }

    public EvaluationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static EvaluationError of(Kind kind, String message) {
        return new EvaluationError(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
