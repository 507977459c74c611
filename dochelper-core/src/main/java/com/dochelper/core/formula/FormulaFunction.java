package com.dochelper.core.formula;

import java.util.List;

/**
 * A function callable from formulas. Arguments arrive already evaluated, left to right.
 * Implementations signal bad arguments with {@link IllegalArgumentException}.
 */
@FunctionalInterface
public interface FormulaFunction {

    Value apply(List<Value> args);
}
