package com.dochelper.engine.analysis;

import com.dochelper.core.formula.FormulaResultType;

import java.util.List;

/**
 * Editor feedback for a formula.
 *
 * @param errorPosition offset of a syntax error, or null
 */
public record FormulaDiagnostics(
    boolean valid,
    List<String> errors,
    List<String> warnings,
    FormulaResultType inferredType,
    List<String> fieldReferences,
    Integer errorPosition
) {

    public FormulaDiagnostics {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        fieldReferences = List.copyOf(fieldReferences);
    }

    static FormulaDiagnostics invalid(String error, Integer errorPosition) {
        return new FormulaDiagnostics(false, List.of(error), List.of(), FormulaResultType.UNKNOWN, List.of(),
            errorPosition);
    }
}
