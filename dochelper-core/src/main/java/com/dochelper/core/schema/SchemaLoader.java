package com.dochelper.core.schema;

import com.dochelper.core.formula.Value;
import com.dochelper.core.model.ConstraintAvailability;
import com.dochelper.core.model.ConstraintType;
import com.dochelper.core.model.ControlEffect;
import com.dochelper.core.model.ControlRule;
import com.dochelper.core.model.ControlType;
import com.dochelper.core.model.EntityDefinition;
import com.dochelper.core.model.FieldConstraint;
import com.dochelper.core.model.FieldDefinition;
import com.dochelper.core.model.FieldType;
import com.dochelper.core.model.OutputMapping;
import com.dochelper.core.model.OutputTarget;
import com.dochelper.core.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads entity definitions from YAML or JSON documents.
 *
 * <p>Document layout:</p>
 * <pre>
 * entities:
 *   - id: invoice
 *     name: Invoice
 *     fields:
 *       - id: quantity
 *         type: NUMBER
 *         required: true
 *         constraints:
 *           - { type: MIN_VALUE, value: 1 }
 *       - id: total
 *         type: CALCULATED
 *         formula: quantity * unit_price
 *         outputs:
 *           - { target: NUMBER, formula: total }
 *     control_rules:
 *       - id: hide_notes
 *         condition: quantity > 10
 *         effect: { type: VISIBILITY, target: notes, value: false }
 *         priority: 5
 * </pre>
 *
 * <p>Unknown keys are ignored. A constraint that does not apply to its field type is an error.</p>
 */
public class SchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final YAMLMapper yamlMapper = new YAMLMapper();

    /**
     * Load every entity from a classpath resource. {@code .json} resources are read as JSON,
     * anything else as YAML.
     */
    public List<EntityDefinition> loadResource(String resourcePath) {
        try (InputStream is = SchemaLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new SchemaException("Schema resource not found: " + resourcePath);
            }
            return load(is, isJson(resourcePath));
        } catch (IOException e) {
            throw new SchemaException("Failed to read schema resource " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    public List<EntityDefinition> load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, isJson(path.getFileName().toString()));
        } catch (IOException e) {
            throw new SchemaException("Failed to read schema file " + path + ": " + e.getMessage(), e);
        }
    }

    public List<EntityDefinition> load(InputStream is, boolean json) {
        JsonNode root;
        try {
            root = json ? jsonMapper.readTree(is) : yamlMapper.readTree(is);
        } catch (IOException e) {
            throw new SchemaException("Malformed schema document: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new SchemaException("Schema document is empty");
        }

        JsonNode entitiesNode = root.isArray() ? root : root.get("entities");
        if (entitiesNode == null || !entitiesNode.isArray()) {
            throw new SchemaException("Schema document has no 'entities' list");
        }

        List<EntityDefinition> entities = new ArrayList<>();
        for (JsonNode node : entitiesNode) {
            entities.add(parseEntity(node));
        }
        log.info("Loaded {} entity definitions", entities.size());
        return entities;
    }

    /**
     * Load documents into a fresh in-memory repository.
     */
    public InMemorySchemaRepository loadRepository(String... resourcePaths) {
        InMemorySchemaRepository repository = new InMemorySchemaRepository();
        for (String path : resourcePaths) {
            loadResource(path).forEach(repository::register);
        }
        return repository;
    }

    // ========== Node Parsing ==========

    EntityDefinition parseEntity(JsonNode node) {
        String entityId = requiredText(node, "id", "entity");

        List<FieldDefinition> fields = new ArrayList<>();
        JsonNode fieldsNode = node.get("fields");
        if (fieldsNode != null && fieldsNode.isArray()) {
            for (JsonNode fieldNode : fieldsNode) {
                fields.add(parseField(entityId, fieldNode));
            }
        }

        Set<String> fieldIds = new HashSet<>();
        fields.forEach(f -> fieldIds.add(f.id()));

        List<ControlRule> rules = new ArrayList<>();
        JsonNode rulesNode = node.has("control_rules") ? node.get("control_rules") : node.get("controlRules");
        if (rulesNode != null && rulesNode.isArray()) {
            for (JsonNode ruleNode : rulesNode) {
                ControlRule rule = parseRule(entityId, ruleNode);
                if (!fieldIds.contains(rule.targetFieldId())) {
                    log.warn("Control rule {} in entity {} targets unknown field '{}', skipping",
                        rule.id(), entityId, rule.targetFieldId());
                    continue;
                }
                rules.add(rule);
            }
        }

        try {
            return new EntityDefinition(entityId, text(node, "name"), fields, rules);
        } catch (IllegalArgumentException e) {
            throw new SchemaException(e.getMessage(), e);
        }
    }

    private FieldDefinition parseField(String entityId, JsonNode node) {
        String fieldId = requiredText(node, "id", "field of entity " + entityId);
        String where = entityId + "." + fieldId;
        try {
            FieldType type = FieldType.fromKey(requiredText(node, "type", "field " + where));
            FieldDefinition.Builder builder = FieldDefinition.builder(fieldId, type)
                .label(text(node, "label"))
                .required(node.path("required").asBoolean(false))
                .formula(text(node, "formula"));

            JsonNode constraintsNode = node.get("constraints");
            if (constraintsNode != null && constraintsNode.isArray()) {
                for (JsonNode constraintNode : constraintsNode) {
                    FieldConstraint constraint = parseConstraint(type, constraintNode);
                    if (!ConstraintAvailability.isAvailable(type, constraint.type())) {
                        throw new SchemaException("Constraint " + constraint.type() + " is not available for "
                            + type + " field " + where);
                    }
                    builder.constraint(constraint);
                }
            }

            JsonNode outputsNode = node.has("outputs") ? node.get("outputs") : node.get("output_mappings");
            if (outputsNode != null && outputsNode.isArray()) {
                for (JsonNode outputNode : outputsNode) {
                    builder.outputMapping(OutputTarget.fromKey(requiredText(outputNode, "target", "output of " + where)),
                        requiredText(outputNode, "formula", "output of " + where));
                }
            }

            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Invalid field " + where + ": " + e.getMessage(), e);
        }
    }

    private FieldConstraint parseConstraint(FieldType fieldType, JsonNode node) {
        ConstraintType type = ConstraintType.fromKey(requiredText(node, "type", "constraint"));
        Severity severity = Severity.fromKey(text(node, "severity"));

        return switch (type) {
            case REQUIRED -> new FieldConstraint.Required(severity);
            case MIN_LENGTH -> new FieldConstraint.MinLength(requiredNumber(node, type).intValue(), severity);
            case MAX_LENGTH -> new FieldConstraint.MaxLength(requiredNumber(node, type).intValue(), severity);
            case MIN_VALUE -> new FieldConstraint.MinValue(bound(fieldType, node, type), severity);
            case MAX_VALUE -> new FieldConstraint.MaxValue(bound(fieldType, node, type), severity);
            case PATTERN -> new FieldConstraint.PatternMatch(
                requiredText(node, "pattern", "PATTERN constraint"), text(node, "description"), severity);
            case ALLOWED_VALUES -> new FieldConstraint.AllowedValues(textList(node, "values"), severity);
            case FILE_EXTENSION -> new FieldConstraint.FileExtension(textList(node, "values"), severity);
            case MAX_FILE_SIZE -> new FieldConstraint.MaxFileSize(requiredNumber(node, type).longValue(), severity);
        };
    }

    /**
     * Numeric bound; DATE fields also accept an ISO date, stored as its epoch day.
     */
    private double bound(FieldType fieldType, JsonNode node, ConstraintType type) {
        JsonNode value = node.get("value");
        if (fieldType == FieldType.DATE && value != null && value.isTextual()) {
            try {
                return LocalDate.parse(value.asText()).toEpochDay();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(type + " bound is not an ISO date: " + value.asText(), e);
            }
        }
        return requiredNumber(node, type).doubleValue();
    }

    private ControlRule parseRule(String entityId, JsonNode node) {
        String ruleId = requiredText(node, "id", "control rule of entity " + entityId);
        JsonNode effectNode = node.get("effect");
        if (effectNode == null || !effectNode.isObject()) {
            throw new SchemaException("Control rule " + ruleId + " has no effect");
        }
        try {
            ControlEffect effect = new ControlEffect(
                ControlType.fromKey(requiredText(effectNode, "type", "effect of rule " + ruleId)),
                requiredText(effectNode, "target", "effect of rule " + ruleId),
                toValue(effectNode.get("value")));
            return new ControlRule(ruleId,
                requiredText(node, "condition", "control rule " + ruleId),
                effect,
                node.path("enabled").asBoolean(true),
                node.path("priority").asInt(0));
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Invalid control rule " + ruleId + ": " + e.getMessage(), e);
        }
    }

    // ========== Helper Methods ==========

    private static Value toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.nullValue();
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return Value.of(node.doubleValue());
        }
        return Value.of(node.asText());
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requiredText(JsonNode node, String key, String what) {
        String value = text(node, key);
        if (value == null || value.isBlank()) {
            throw new SchemaException("Missing '" + key + "' in " + what);
        }
        return value;
    }

    private static Number requiredNumber(JsonNode node, ConstraintType type) {
        JsonNode value = node.get("value");
        if (value == null || !value.isNumber()) {
            throw new SchemaException(type + " constraint needs a numeric 'value'");
        }
        return value.numberValue();
    }

    private static List<String> textList(JsonNode node, String key) {
        JsonNode values = node.get(key);
        if (values == null || !values.isArray()) {
            throw new SchemaException("Constraint needs a '" + key + "' list");
        }
        List<String> result = new ArrayList<>();
        values.forEach(v -> result.add(v.asText()));
        return result;
    }

    private static boolean isJson(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
