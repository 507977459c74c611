package com.dochelper.engine.validation;

import com.dochelper.core.formula.Value;
import com.dochelper.core.model.ConstraintAvailability;
import com.dochelper.core.model.ConstraintType;
import com.dochelper.core.model.FieldConstraint;
import com.dochelper.core.model.FieldDefinition;
import com.dochelper.core.model.FieldType;
import com.dochelper.core.model.FileAttachment;
import com.dochelper.core.model.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks a field value against the field's constraints.
 *
 * <p>Only REQUIRED looks at empty values: every other constraint passes when the value is null or
 * empty text. A value of the wrong kind for a constraint (text under MIN_VALUE, say) violates it.
 * Constraints that do not apply to the field type are ignored with a warning.</p>
 */
public class ValidationRuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ValidationRuleEvaluator.class);

    public List<ValidationIssue> validate(FieldDefinition field, Value value) {
        return validate(field, value, null);
    }

    /**
     * @param attachment file metadata for FILE and IMAGE fields, may be null
     */
    public List<ValidationIssue> validate(FieldDefinition field, Value value, FileAttachment attachment) {
        Value v = value != null ? value : Value.nullValue();
        List<ValidationIssue> issues = new ArrayList<>();

        boolean hasRequiredConstraint = field.constraints().stream()
            .anyMatch(c -> c.type() == ConstraintType.REQUIRED);
        if (field.required() && !hasRequiredConstraint && isEmpty(field, v, attachment)) {
            issues.add(ValidationIssue.of(field.id(), new FieldConstraint.Required(), label(field) + " is required"));
        }

        for (FieldConstraint constraint : field.constraints()) {
            if (!ConstraintAvailability.isAvailable(field.fieldType(), constraint.type())) {
                log.warn("Ignoring {} constraint on {} field '{}'", constraint.type(), field.fieldType(), field.id());
                continue;
            }
            String violation = check(field, constraint, v, attachment);
            if (violation != null) {
                issues.add(ValidationIssue.of(field.id(), constraint, violation));
            }
        }
        return issues;
    }

    /**
     * @return the violation message, or null when the constraint holds
     */
    private String check(FieldDefinition field, FieldConstraint constraint, Value value, FileAttachment attachment) {
        String label = label(field);

        if (constraint instanceof FieldConstraint.Required) {
            return isEmpty(field, value, attachment) ? label + " is required" : null;
        }
        if (isEmpty(field, value, attachment)) {
            return null;
        }

        if (constraint instanceof FieldConstraint.MinLength c) {
            if (!(value instanceof Value.TextValue t)) {
                return label + " must be text";
            }
            return t.value().length() < c.minLength()
                ? label + " must be at least " + c.minLength() + " characters" : null;
        }
        if (constraint instanceof FieldConstraint.MaxLength c) {
            if (!(value instanceof Value.TextValue t)) {
                return label + " must be text";
            }
            return t.value().length() > c.maxLength()
                ? label + " must be at most " + c.maxLength() + " characters" : null;
        }
        if (constraint instanceof FieldConstraint.MinValue c) {
            return checkBound(field, value, c.minValue(), true);
        }
        if (constraint instanceof FieldConstraint.MaxValue c) {
            return checkBound(field, value, c.maxValue(), false);
        }
        if (constraint instanceof FieldConstraint.PatternMatch c) {
            if (!(value instanceof Value.TextValue t)) {
                return label + " must be text";
            }
            if (c.compiled().matcher(t.value()).lookingAt()) {
                return null;
            }
            return c.description() != null
                ? label + " must match " + c.description()
                : label + " does not match the required format";
        }
        if (constraint instanceof FieldConstraint.AllowedValues c) {
            return c.allowedValues().contains(value.asText())
                ? null : label + " must be one of " + String.join(", ", c.allowedValues());
        }
        if (constraint instanceof FieldConstraint.FileExtension c) {
            String name = (attachment != null ? attachment.name() : value.asText()).toLowerCase(Locale.ROOT);
            return c.allowedExtensions().stream().anyMatch(name::endsWith)
                ? null : label + " must be a " + String.join(", ", c.allowedExtensions()) + " file";
        }
        if (constraint instanceof FieldConstraint.MaxFileSize c) {
            // Without metadata the size is unknown and the check passes
            if (attachment == null || !attachment.hasSize()) {
                return null;
            }
            return attachment.sizeBytes() > c.maxSizeBytes()
                ? label + " must not exceed " + c.maxSizeBytes() + " bytes" : null;
        }
        return null;
    }

    private String checkBound(FieldDefinition field, Value value, double bound, boolean lower) {
        String label = label(field);
        double actual;
        String shownBound;

        if (field.fieldType() == FieldType.DATE) {
            if (!(value instanceof Value.TextValue t)) {
                return label + " must be a date (YYYY-MM-DD)";
            }
            try {
                actual = LocalDate.parse(t.value().trim()).toEpochDay();
            } catch (DateTimeParseException e) {
                return label + " must be a date (YYYY-MM-DD)";
            }
            shownBound = LocalDate.ofEpochDay((long) bound).toString();
        } else {
            if (!(value instanceof Value.NumberValue n)) {
                return label + " must be a number";
            }
            actual = n.value();
            shownBound = Value.of(bound).asText();
        }

        if (lower && actual < bound) {
            return label + " must be at least " + shownBound;
        }
        if (!lower && actual > bound) {
            return label + " must be at most " + shownBound;
        }
        return null;
    }

    private static boolean isEmpty(FieldDefinition field, Value value, FileAttachment attachment) {
        if (field.fieldType().isFile() && attachment != null && !attachment.name().isBlank()) {
            return false;
        }
        if (value.isNull()) {
            return true;
        }
        return value instanceof Value.TextValue t && t.value().isBlank();
    }

    private static String label(FieldDefinition field) {
        return field.label();
    }
}
