package com.dochelper.core.formula;

/**
 * Outcome of evaluating a formula: either a value or a typed error.
 */
public record EvaluationResult(boolean success, Value value, EvaluationError error) {

    public static EvaluationResult ok(Value value) {
        return new EvaluationResult(true, value, null);
    }

    public static EvaluationResult failed(EvaluationError error) {
        return new EvaluationResult(false, null, error);
    }

    public static EvaluationResult failed(EvaluationError.Kind kind, String message) {
        return failed(EvaluationError.of(kind, message));
    }

    /**
     * The value on success, the null value on failure.
     */
    public Value valueOrNull() {
        return success ? value : Value.nullValue();
    }
}
