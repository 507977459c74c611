package com.dochelper.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A field of an entity: type, formula (CALCULATED fields only), constraints and output mappings.
 */
public record FieldDefinition(
    String id,
    FieldType fieldType,
    String label,
    boolean required,
    String formula,
    List<FieldConstraint> constraints,
    List<OutputMapping> outputMappings
) {

    public FieldDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Field id must not be empty");
        }
        Objects.requireNonNull(fieldType, "fieldType");
        label = label != null ? label : id;
        if (fieldType.isCalculated()) {
            if (formula == null || formula.isBlank()) {
                throw new IllegalArgumentException("Calculated field '" + id + "' needs a formula");
            }
            if (required) {
                throw new IllegalArgumentException("Calculated field '" + id + "' cannot be required");
            }
        } else if (formula != null) {
            throw new IllegalArgumentException("Only calculated fields have a formula: " + id);
        }
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        outputMappings = outputMappings != null ? List.copyOf(outputMappings) : List.of();
        if (outputMappings.stream().map(OutputMapping::target).distinct().count() != outputMappings.size()) {
            throw new IllegalArgumentException("Field '" + id + "' maps more than one output to the same target");
        }
    }

    public static Builder builder(String id, FieldType fieldType) {
        return new Builder(id, fieldType);
    }

    public boolean isCalculated() {
        return fieldType.isCalculated();
    }

    /**
     * Required either by flag or by a REQUIRED constraint.
     */
    public boolean isEffectivelyRequired() {
        return required || constraints.stream().anyMatch(c -> c.type() == ConstraintType.REQUIRED);
    }

    public Optional<String> formulaText() {
        return Optional.ofNullable(formula);
    }

    public static final class Builder {
        private final String id;
        private final FieldType fieldType;
        private String label;
        private boolean required;
        private String formula;
        private final List<FieldConstraint> constraints = new ArrayList<>();
        private final List<OutputMapping> outputMappings = new ArrayList<>();

        private Builder(String id, FieldType fieldType) {
            this.id = id;
            this.fieldType = fieldType;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder formula(String formula) {
            this.formula = formula;
            return this;
        }

        public Builder constraint(FieldConstraint constraint) {
            this.constraints.add(constraint);
            return this;
        }

        public Builder outputMapping(OutputTarget target, String formulaText) {
            this.outputMappings.add(new OutputMapping(target, formulaText));
            return this;
        }

        public FieldDefinition build() {
            return new FieldDefinition(id, fieldType, label, required, formula, constraints, outputMappings);
        }
    }
}
