package com.dochelper.engine.output;

import com.dochelper.core.formula.EvaluationContext;
import com.dochelper.core.formula.Value;
import com.dochelper.core.model.OutputMapping;
import com.dochelper.core.model.OutputTarget;
import com.dochelper.engine.FormulaOutcome;
import com.dochelper.engine.FormulaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Evaluates output mapping formulas and coerces the results to their target type.
 *
 * <ul>
 *   <li>TEXT: any value, null becomes the empty string.</li>
 *   <li>NUMBER: numbers, and text that parses as a number.</li>
 *   <li>BOOLEAN: booleans, the numbers 0 and 1, null (false), and the words
 *       true/yes/on/1 and false/no/off/0 or empty text, ignoring case and surrounding blanks.</li>
 * </ul>
 * Anything else is a {@link CoercionError}.
 */
public class OutputMappingEvaluator {

    private static final Logger log = LoggerFactory.getLogger(OutputMappingEvaluator.class);

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "1", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "0", "off", "");

    private final FormulaService formulas;

    public OutputMappingEvaluator(FormulaService formulas) {
        this.formulas = formulas;
    }

    public OutputMappingResult evaluate(OutputMapping mapping, EvaluationContext context) {
        FormulaOutcome outcome = formulas.evaluate(mapping.formulaText(), context);
        if (!outcome.success()) {
            log.debug("Output mapping formula '{}' failed: {}", mapping.formulaText(), outcome.errorMessage());
            return OutputMappingResult.formulaFailed(mapping.target(), outcome.errorMessage());
        }
        return coerce(outcome.value(), mapping.target());
    }

    /**
     * Convert a formula value to the target type.
     */
    public static OutputMappingResult coerce(Value value, OutputTarget target) {
        return switch (target) {
            case TEXT -> OutputMappingResult.ok(target, value.asText());
            case NUMBER -> toNumber(value);
            case BOOLEAN -> toBoolean(value);
        };
    }

    private static OutputMappingResult toNumber(Value value) {
        if (value instanceof Value.NumberValue n) {
            return OutputMappingResult.ok(OutputTarget.NUMBER, n.value());
        }
        if (value instanceof Value.TextValue t) {
            String text = t.value().trim();
            if (NUMERIC.matcher(text).matches()) {
                double parsed = Double.parseDouble(text);
                if (!Double.isInfinite(parsed)) {
                    return OutputMappingResult.ok(OutputTarget.NUMBER, parsed);
                }
            }
            return OutputMappingResult.coercionFailed(new CoercionError(OutputTarget.NUMBER,
                "Cannot convert text '" + t.value() + "' to a number"));
        }
        return OutputMappingResult.coercionFailed(new CoercionError(OutputTarget.NUMBER,
            "Cannot convert " + value.typeName() + " to a number"));
    }

    private static OutputMappingResult toBoolean(Value value) {
        if (value instanceof Value.BooleanValue b) {
            return OutputMappingResult.ok(OutputTarget.BOOLEAN, b.value());
        }
        if (value.isNull()) {
            return OutputMappingResult.ok(OutputTarget.BOOLEAN, false);
        }
        if (value instanceof Value.NumberValue n && (n.value() == 0.0 || n.value() == 1.0)) {
            return OutputMappingResult.ok(OutputTarget.BOOLEAN, n.value() == 1.0);
        }
        if (value instanceof Value.TextValue t) {
            String word = t.value().trim().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(word)) {
                return OutputMappingResult.ok(OutputTarget.BOOLEAN, true);
            }
            if (FALSE_WORDS.contains(word)) {
                return OutputMappingResult.ok(OutputTarget.BOOLEAN, false);
            }
        }
        return OutputMappingResult.coercionFailed(new CoercionError(OutputTarget.BOOLEAN,
            "Cannot convert " + value + " to a boolean"));
    }
}
