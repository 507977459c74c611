package com.dochelper.engine.output;

import com.dochelper.core.model.OutputTarget;

/**
 * Outcome of one output mapping. On success {@code value} holds a {@code String}, {@code Double}
 * or {@code Boolean} matching the target; otherwise exactly one of the two errors is set.
 *
 * @param formulaError message of a formula that did not parse or evaluate
 */
public record OutputMappingResult(OutputTarget target, Object value, String formulaError, CoercionError coercionError) {

    public static OutputMappingResult ok(OutputTarget target, Object value) {
        return new OutputMappingResult(target, value, null, null);
    }

    public static OutputMappingResult formulaFailed(OutputTarget target, String message) {
        return new OutputMappingResult(target, null, message, null);
    }

    public static OutputMappingResult coercionFailed(CoercionError error) {
        return new OutputMappingResult(error.target(), null, null, error);
    }

    public boolean success() {
        return formulaError == null && coercionError == null;
    }

    public String errorMessage() {
        if (formulaError != null) {
            return formulaError;
        }
        return coercionError != null ? coercionError.message() : null;
    }
}
