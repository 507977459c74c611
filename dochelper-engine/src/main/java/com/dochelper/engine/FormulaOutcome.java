package com.dochelper.engine;

import com.dochelper.core.formula.EvaluationError;
import com.dochelper.core.formula.EvaluationResult;
import com.dochelper.core.formula.Parser;
import com.dochelper.core.formula.Value;

/**
 * Result of parsing and evaluating formula text. At most one of the two errors is set.
 */
public record FormulaOutcome(Value value, Parser.ParseError parseError, EvaluationError evaluationError) {

    public static FormulaOutcome of(Value value) {
        return new FormulaOutcome(value, null, null);
    }

    public static FormulaOutcome of(EvaluationResult result) {
        return result.success() ? of(result.value()) : failed(result.error());
    }

    public static FormulaOutcome failed(Parser.ParseError error) {
        return new FormulaOutcome(null, error, null);
    }

    public static FormulaOutcome failed(EvaluationError error) {
        return new FormulaOutcome(null, null, error);
    }

    public boolean success() {
        return parseError == null && evaluationError == null;
    }

    public String errorMessage() {
        if (parseError != null) {
            return "Syntax error: " + parseError.message();
        }
        return evaluationError != null ? evaluationError.message() : null;
    }
}
