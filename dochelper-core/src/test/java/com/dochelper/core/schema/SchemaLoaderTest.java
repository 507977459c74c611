package com.dochelper.core.schema;

import com.dochelper.core.formula.Value;
import com.dochelper.core.model.ControlRule;
import com.dochelper.core.model.ControlType;
import com.dochelper.core.model.EntityDefinition;
import com.dochelper.core.model.FieldConstraint;
import com.dochelper.core.model.FieldDefinition;
import com.dochelper.core.model.FieldType;
import com.dochelper.core.model.OutputTarget;
import com.dochelper.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaLoaderTest {

    private SchemaLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SchemaLoader();
    }

    private List<EntityDefinition> loadYaml(String yaml) {
        return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), false);
    }

    @Nested
    @DisplayName("Invoice schema")
    class InvoiceSchemaTests {

        private EntityDefinition invoice;

        @BeforeEach
        void loadInvoice() {
            List<EntityDefinition> entities = loader.loadResource("/schemas/invoice.yaml");
            assertEquals(2, entities.size());
            invoice = entities.get(0);
        }

        @Test
        @DisplayName("Reads entity and field attributes")
        void fields() {
            assertEquals("invoice", invoice.id());
            assertEquals("Invoice", invoice.name());
            assertEquals(8, invoice.fields().size());

            FieldDefinition customer = invoice.field("customer").orElseThrow();
            assertEquals("Customer name", customer.label());
            assertTrue(customer.required());
            assertEquals(FieldType.TEXT, customer.fieldType());
        }

        @Test
        @DisplayName("Reads constraints with their severity")
        void constraints() {
            List<FieldConstraint> customer = invoice.field("customer").orElseThrow().constraints();

            assertEquals(new FieldConstraint.MinLength(2), customer.get(0));
            FieldConstraint.PatternMatch pattern = assertInstanceOf(FieldConstraint.PatternMatch.class, customer.get(1));
            assertEquals("[A-Z].*", pattern.regex());
            assertEquals("a capitalized name", pattern.description());
            assertEquals(Severity.WARNING, pattern.severity());

            FieldConstraint.AllowedValues status = assertInstanceOf(FieldConstraint.AllowedValues.class,
                invoice.field("status").orElseThrow().constraints().get(0));
            assertEquals(List.of("draft", "sent", "paid"), status.allowedValues());
        }

        @Test
        @DisplayName("Date bounds are stored as epoch days")
        void dateBounds() {
            FieldConstraint.MinValue min = assertInstanceOf(FieldConstraint.MinValue.class,
                invoice.field("due_date").orElseThrow().constraints().get(0));

            assertEquals(LocalDate.of(2024, 1, 1).toEpochDay(), (long) min.minValue());
        }

        @Test
        @DisplayName("Reads file constraints")
        void fileConstraints() {
            List<FieldConstraint> contract = invoice.field("contract").orElseThrow().constraints();

            assertEquals(new FieldConstraint.FileExtension(List.of(".pdf", ".docx")), contract.get(0));
            assertEquals(new FieldConstraint.MaxFileSize(1_048_576L), contract.get(1));
        }

        @Test
        @DisplayName("Reads formulas and output mappings")
        void outputs() {
            FieldDefinition total = invoice.field("total").orElseThrow();

            assertEquals("quantity * unit_price", total.formula());
            assertEquals(2, total.outputMappings().size());
            assertEquals(OutputTarget.NUMBER, total.outputMappings().get(0).target());
            assertEquals("concat('EUR ', round(total, 2))", total.outputMappings().get(1).formulaText());
        }

        @Test
        @DisplayName("Reads control rules and skips those with unknown targets")
        void controlRules() {
            assertEquals(2, invoice.controlRules().size());

            ControlRule hide = invoice.controlRules().get(0);
            assertEquals("hide_notes", hide.id());
            assertEquals(5, hide.priority());
            assertEquals(ControlType.VISIBILITY, hide.controlType());
            assertEquals(Value.of(false), hide.effect().value());

            ControlRule lock = invoice.controlRules().get(1);
            assertFalse(lock.enabled());
            assertEquals(0, lock.priority());
        }

        @Test
        @DisplayName("Entity name defaults to its id")
        void defaultName() {
            EntityDefinition memo = loader.loadResource("/schemas/invoice.yaml").get(1);

            assertEquals("memo", memo.name());
        }
    }

    @Nested
    @DisplayName("Formats")
    class FormatTests {

        @Test
        @DisplayName("Loads JSON documents with a root array")
        void json() {
            List<EntityDefinition> entities = loader.loadResource("/schemas/simple.json");

            assertEquals(1, entities.size());
            assertEquals(FieldType.CALCULATED, entities.get(0).field("tax").orElseThrow().fieldType());
        }

        @Test
        @DisplayName("Builds a repository from resources")
        void repository() {
            InMemorySchemaRepository repository = loader.loadRepository("/schemas/invoice.yaml", "/schemas/simple.json");

            assertEquals(3, repository.size());
            assertTrue(repository.findEntity("receipt").isPresent());
            assertTrue(repository.contains("memo"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Missing resource")
        void missingResource() {
            SchemaException e = assertThrows(SchemaException.class, () -> loader.loadResource("/schemas/none.yaml"));
            assertTrue(e.getMessage().contains("not found"));
        }

        @Test
        @DisplayName("Constraint not available for the field type")
        void unavailableConstraint() {
            SchemaException e = assertThrows(SchemaException.class,
                () -> loader.loadResource("/schemas/bad-constraint.yaml"));
            assertTrue(e.getMessage().contains("broken.amount"));
        }

        @Test
        @DisplayName("Unknown field type")
        void unknownFieldType() {
            SchemaException e = assertThrows(SchemaException.class, () -> loadYaml(
                "entities:\n  - id: e\n    fields:\n      - { id: a, type: SLIDER }\n"));
            assertTrue(e.getMessage().contains("SLIDER"));
        }

        @Test
        @DisplayName("Calculated field without formula")
        void calculatedWithoutFormula() {
            assertThrows(SchemaException.class, () -> loadYaml(
                "entities:\n  - id: e\n    fields:\n      - { id: a, type: CALCULATED }\n"));
        }

        @Test
        @DisplayName("Duplicate field ids")
        void duplicateFields() {
            assertThrows(SchemaException.class, () -> loadYaml(
                "entities:\n  - id: e\n    fields:\n      - { id: a, type: TEXT }\n      - { id: a, type: NUMBER }\n"));
        }

        @Test
        @DisplayName("Document without entities")
        void noEntities() {
            assertThrows(SchemaException.class, () -> loadYaml("name: nothing\n"));
        }

        @Test
        @DisplayName("Malformed document")
        void malformed() {
            assertThrows(SchemaException.class, () -> loadYaml("entities: [ {id: e, fields: [\n"));
        }
    }
}
