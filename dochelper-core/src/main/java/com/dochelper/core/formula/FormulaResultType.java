package com.dochelper.core.formula;

/**
 * Statically inferred result type of a formula or function.
 */
public enum FormulaResultType {
    BOOLEAN,
    NUMBER,
    TEXT,
    UNKNOWN
}
