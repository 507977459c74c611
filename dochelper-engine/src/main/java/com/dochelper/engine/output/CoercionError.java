package com.dochelper.engine.output;

import com.dochelper.core.model.OutputTarget;

/**
 * A formula value that cannot be converted to its output target type.
 */
public record CoercionError(OutputTarget target, String message) {
}
