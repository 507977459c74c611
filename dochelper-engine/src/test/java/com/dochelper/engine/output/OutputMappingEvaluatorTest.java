package com.dochelper.engine.output;

import com.dochelper.core.formula.EvaluationContext;
import com.dochelper.core.formula.Value;
import com.dochelper.core.model.OutputMapping;
import com.dochelper.core.model.OutputTarget;
import com.dochelper.engine.EngineConfig;
import com.dochelper.engine.FormulaService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputMappingEvaluatorTest {

    private OutputMappingEvaluator evaluator;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new OutputMappingEvaluator(new FormulaService(EngineConfig.defaults()));
        context = EvaluationContext.fromObjects(Map.of("name", "abc", "total", 12.5, "paid", true));
    }

    @Nested
    @DisplayName("Evaluation")
    class EvaluationTests {

        @Test
        @DisplayName("Evaluates and coerces the formula result")
        void success() {
            OutputMappingResult text = evaluator.evaluate(new OutputMapping(OutputTarget.TEXT, "upper(name)"), context);
            OutputMappingResult number = evaluator.evaluate(new OutputMapping(OutputTarget.NUMBER, "total * 2"), context);

            assertTrue(text.success());
            assertEquals("ABC", text.value());
            assertEquals(25.0, number.value());
        }

        @Test
        @DisplayName("Text that is not a number fails coercion")
        void coercionFailure() {
            OutputMappingResult result = evaluator.evaluate(new OutputMapping(OutputTarget.NUMBER, "name"), context);

            assertFalse(result.success());
            assertNull(result.formulaError());
            assertEquals(OutputTarget.NUMBER, result.coercionError().target());
            assertEquals("Cannot convert text 'abc' to a number", result.errorMessage());
        }

        @Test
        @DisplayName("A failing formula is reported as a formula error")
        void formulaFailure() {
            OutputMappingResult result = evaluator.evaluate(new OutputMapping(OutputTarget.TEXT, "total / 0"), context);

            assertFalse(result.success());
            assertNull(result.coercionError());
            assertEquals("Division by zero", result.formulaError());
        }

        @Test
        @DisplayName("A syntax error is a formula error")
        void syntaxError() {
            OutputMappingResult result = evaluator.evaluate(new OutputMapping(OutputTarget.TEXT, "concat(name"), context);

            assertTrue(result.formulaError().startsWith("Syntax error: "));
        }
    }

    @Nested
    @DisplayName("Coercion")
    class CoercionTests {

        @Test
        @DisplayName("To text")
        void toText() {
            assertEquals("12", OutputMappingEvaluator.coerce(Value.of(12), OutputTarget.TEXT).value());
            assertEquals("true", OutputMappingEvaluator.coerce(Value.of(true), OutputTarget.TEXT).value());
            assertEquals("", OutputMappingEvaluator.coerce(Value.nullValue(), OutputTarget.TEXT).value());
        }

        @Test
        @DisplayName("To number")
        void toNumber() {
            assertEquals(3.5, OutputMappingEvaluator.coerce(Value.of(" 3.5 "), OutputTarget.NUMBER).value());
            assertEquals(-1e3, OutputMappingEvaluator.coerce(Value.of("-1e3"), OutputTarget.NUMBER).value());
            assertFalse(OutputMappingEvaluator.coerce(Value.of("Infinity"), OutputTarget.NUMBER).success());
            assertFalse(OutputMappingEvaluator.coerce(Value.of("0x10"), OutputTarget.NUMBER).success());
            assertEquals("Cannot convert boolean to a number",
                OutputMappingEvaluator.coerce(Value.of(true), OutputTarget.NUMBER).errorMessage());
            assertFalse(OutputMappingEvaluator.coerce(Value.nullValue(), OutputTarget.NUMBER).success());
        }

        @Test
        @DisplayName("To boolean")
        void toBoolean() {
            assertEquals(true, OutputMappingEvaluator.coerce(Value.of(" Yes "), OutputTarget.BOOLEAN).value());
            assertEquals(false, OutputMappingEvaluator.coerce(Value.of("off"), OutputTarget.BOOLEAN).value());
            assertEquals(true, OutputMappingEvaluator.coerce(Value.of(1), OutputTarget.BOOLEAN).value());
            assertEquals(false, OutputMappingEvaluator.coerce(Value.nullValue(), OutputTarget.BOOLEAN).value());
            assertFalse(OutputMappingEvaluator.coerce(Value.of(2), OutputTarget.BOOLEAN).success());
            assertFalse(OutputMappingEvaluator.coerce(Value.of("maybe"), OutputTarget.BOOLEAN).success());
        }
    }
}
