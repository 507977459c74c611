package com.dochelper.engine.analysis;

import com.dochelper.core.formula.FormulaResultType;
import com.dochelper.core.model.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaAnalyzerTest {

    private static final List<SchemaFieldInfo> FIELDS = List.of(
        new SchemaFieldInfo("quantity", FieldType.NUMBER),
        new SchemaFieldInfo("price", FieldType.NUMBER),
        new SchemaFieldInfo("customer", FieldType.TEXT),
        new SchemaFieldInfo("urgent", FieldType.CHECKBOX));

    private FormulaAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new FormulaAnalyzer();
    }

    @Test
    @DisplayName("Valid formula with references and type")
    void valid() {
        FormulaDiagnostics diagnostics = analyzer.analyze("quantity * price", FIELDS);

        assertTrue(diagnostics.valid());
        assertTrue(diagnostics.errors().isEmpty());
        assertEquals(List.of("price", "quantity"), diagnostics.fieldReferences());
        assertEquals(FormulaResultType.NUMBER, diagnostics.inferredType());
        assertNull(diagnostics.errorPosition());
    }

    @Test
    @DisplayName("Empty formula")
    void empty() {
        FormulaDiagnostics diagnostics = analyzer.analyze("  ", FIELDS);

        assertFalse(diagnostics.valid());
        assertEquals(List.of("Formula cannot be empty"), diagnostics.errors());
    }

    @Test
    @DisplayName("Syntax error carries its position")
    void syntaxError() {
        FormulaDiagnostics diagnostics = analyzer.analyze("quantity *", FIELDS);

        assertFalse(diagnostics.valid());
        assertTrue(diagnostics.errors().get(0).startsWith("Syntax error: "));
        assertEquals(10, diagnostics.errorPosition());
    }

    @Test
    @DisplayName("An overlong formula is a syntax error rather than a stack overflow")
    void overlongFormula() {
        String formula = "quantity" + " + quantity".repeat(200_000);

        FormulaDiagnostics diagnostics = assertDoesNotThrow(() -> analyzer.analyze(formula, FIELDS));

        assertFalse(diagnostics.valid());
        assertTrue(diagnostics.errors().get(0).startsWith("Syntax error: "));
        assertEquals(FormulaResultType.UNKNOWN, analyzer.inferResultType(formula, FIELDS));
    }

    @Test
    @DisplayName("Unknown fields and functions")
    void unknownNames() {
        FormulaDiagnostics diagnostics = analyzer.analyze("discount + median(price)", FIELDS);

        assertFalse(diagnostics.valid());
        assertEquals(List.of("Unknown field: 'discount'", "Unknown function: 'median'"), diagnostics.errors());
    }

    @Test
    @DisplayName("Wrong argument count")
    void arity() {
        FormulaDiagnostics diagnostics = analyzer.analyze("abs(price, quantity)", FIELDS);

        assertEquals(List.of("Function 'abs' expects 1 argument, got 2"), diagnostics.errors());
    }

    @Test
    @DisplayName("Arithmetic on text warns but stays valid")
    void textArithmeticWarning() {
        FormulaDiagnostics diagnostics = analyzer.analyze("customer - 1", FIELDS);

        assertTrue(diagnostics.valid());
        assertEquals(List.of("Arithmetic operation '-' on TEXT type may fail"), diagnostics.warnings());
    }

    @Test
    @DisplayName("Infers result types")
    void inferTypes() {
        assertEquals(FormulaResultType.TEXT, analyzer.inferResultType("customer + '!'", FIELDS));
        assertEquals(FormulaResultType.BOOLEAN, analyzer.inferResultType("urgent and quantity > 1", FIELDS));
        assertEquals(FormulaResultType.TEXT, analyzer.inferResultType("upper(customer)", FIELDS));
        assertEquals(FormulaResultType.UNKNOWN, analyzer.inferResultType("if_else(urgent, 1, 'x')", FIELDS));
        assertEquals(FormulaResultType.UNKNOWN, analyzer.inferResultType("(", FIELDS));
    }
}
