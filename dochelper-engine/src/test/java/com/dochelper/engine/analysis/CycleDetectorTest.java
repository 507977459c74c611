package com.dochelper.engine.analysis;

import com.dochelper.core.model.EntityDefinition;
import com.dochelper.core.model.FieldDefinition;
import com.dochelper.core.model.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    private CycleDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CycleDetector();
    }

    private static Map<String, String> formulas(String... idAndFormula) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < idAndFormula.length; i += 2) {
            map.put(idAndFormula[i], idAndFormula[i + 1]);
        }
        return map;
    }

    @Test
    @DisplayName("Finds a two-field cycle")
    void twoFieldCycle() {
        CycleReport report = detector.detectCycles("e", formulas("A", "B + 1", "B", "A + 1"));

        assertTrue(report.hasCycles());
        assertEquals(List.of(List.of("A", "B")), report.cycles());
        assertEquals(List.of("A -> B -> A"), report.describeCycles());
        assertEquals(2, report.analyzedFieldCount());
    }

    @Test
    @DisplayName("Overlong formulas are skipped and the rest is still checked")
    void overlongFormulaSkipped() {
        CycleReport report = detector.detectCycles("e", formulas(
            "huge", "x" + " + x".repeat(200_000), "A", "B", "B", "A"));

        assertEquals(List.of(List.of("A", "B")), report.cycles());
        assertEquals(2, report.analyzedFieldCount());
    }

    @Test
    @DisplayName("Acyclic graphs report nothing")
    void acyclic() {
        CycleReport report = detector.detectCycles("e", formulas(
            "net", "qty * price", "tax", "net * 0.2", "gross", "net + tax"));

        assertFalse(report.hasCycles());
        assertTrue(report.fieldsInCycles().isEmpty());
    }

    @Test
    @DisplayName("Self reference is a one-field cycle")
    void selfLoop() {
        CycleReport report = detector.detectCycles("e", formulas("a", "a * 2"));

        assertEquals(List.of(List.of("a")), report.cycles());
    }

    @Test
    @DisplayName("Cycles are rotated to their smallest id and sorted")
    void canonicalOrder() {
        CycleReport report = detector.detectCycles("e", formulas(
            "z", "y", "y", "x", "x", "z",
            "c", "b", "b", "c"));

        assertEquals(List.of(List.of("b", "c"), List.of("x", "z", "y")), report.cycles());
        assertEquals(Set.of("b", "c", "x", "y", "z"), report.fieldsInCycles());
    }

    @Test
    @DisplayName("Order of the input does not change the report")
    void deterministic() {
        CycleReport forward = detector.detectCycles("e", formulas("p", "q", "q", "r", "r", "p", "s", "p"));
        CycleReport backward = detector.detectCycles("e", formulas("s", "p", "r", "p", "q", "r", "p", "q"));

        assertEquals(forward.cycles(), backward.cycles());
    }

    @Test
    @DisplayName("Unparseable formulas are skipped")
    void unparseableSkipped() {
        CycleReport report = detector.detectCycles("e", formulas("a", "b +", "b", "a"));

        assertFalse(report.hasCycles());
        assertEquals(1, report.analyzedFieldCount());
    }

    @Test
    @DisplayName("Checks the calculated fields of an entity")
    void entity() {
        EntityDefinition entity = new EntityDefinition("loop", List.of(
            FieldDefinition.builder("input", FieldType.NUMBER).build(),
            FieldDefinition.builder("first", FieldType.CALCULATED).formula("second + input").build(),
            FieldDefinition.builder("second", FieldType.CALCULATED).formula("first * 2").build()),
            List.of());

        CycleReport report = detector.detectCycles(entity);

        assertEquals("loop", report.entityId());
        assertEquals(List.of("first -> second -> first"), report.describeCycles());
    }
}
