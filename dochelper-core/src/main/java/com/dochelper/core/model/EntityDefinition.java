package com.dochelper.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An entity of the schema: ordered fields plus the control rules that act on them.
 */
public record EntityDefinition(String id, String name, List<FieldDefinition> fields, List<ControlRule> controlRules) {

    public EntityDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be empty");
        }
        name = name != null ? name : id;
        fields = fields != null ? List.copyOf(fields) : List.of();
        controlRules = controlRules != null ? List.copyOf(controlRules) : List.of();

        Set<String> fieldIds = new HashSet<>();
        for (FieldDefinition field : fields) {
            if (!fieldIds.add(field.id())) {
                throw new IllegalArgumentException("Duplicate field id '" + field.id() + "' in entity " + id);
            }
        }
        Set<String> ruleIds = new HashSet<>();
        for (ControlRule rule : controlRules) {
            if (!ruleIds.add(rule.id())) {
                throw new IllegalArgumentException("Duplicate control rule id '" + rule.id() + "' in entity " + id);
            }
        }
    }

    public EntityDefinition(String id, List<FieldDefinition> fields, List<ControlRule> controlRules) {
        this(id, id, fields, controlRules);
    }

    public Optional<FieldDefinition> field(String fieldId) {
        return fields.stream().filter(f -> f.id().equals(fieldId)).findFirst();
    }

    public boolean hasField(String fieldId) {
        return field(fieldId).isPresent();
    }

    /**
     * Calculated fields keyed by id, in schema order.
     */
    public Map<String, FieldDefinition> calculatedFields() {
        Map<String, FieldDefinition> calculated = new LinkedHashMap<>();
        for (FieldDefinition field : fields) {
            if (field.isCalculated()) {
                calculated.put(field.id(), field);
            }
        }
        return calculated;
    }

    /**
     * Formula text of every calculated field, keyed by field id.
     */
    public Map<String, String> calculatedFormulas() {
        Map<String, String> formulas = new LinkedHashMap<>();
        calculatedFields().forEach((fieldId, field) -> formulas.put(fieldId, field.formula()));
        return formulas;
    }

    /**
     * Control rules, enabled or not, whose effect targets the given field.
     */
    public List<ControlRule> rulesFor(String fieldId) {
        List<ControlRule> rules = new ArrayList<>();
        for (ControlRule rule : controlRules) {
            if (rule.targetFieldId().equals(fieldId)) {
                rules.add(rule);
            }
        }
        return rules;
    }
}
