package com.dochelper.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Declarative validation rule attached to a field. Constraints only carry parameters;
 * the engine's validation evaluator applies them.
 */
public sealed interface FieldConstraint {

    ConstraintType type();

    Severity severity();

    /**
     * Value must not be null or blank text.
     */
    record Required(Severity severity) implements FieldConstraint {
        public Required {
            Objects.requireNonNull(severity, "severity");
        }

        public Required() {
            this(Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.REQUIRED;
        }
    }

    record MinLength(int minLength, Severity severity) implements FieldConstraint {
        public MinLength {
            if (minLength < 0) {
                throw new IllegalArgumentException("minLength must be >= 0, got " + minLength);
            }
            Objects.requireNonNull(severity, "severity");
        }

        public MinLength(int minLength) {
            this(minLength, Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.MIN_LENGTH;
        }
    }

    record MaxLength(int maxLength, Severity severity) implements FieldConstraint {
        public MaxLength {
            if (maxLength < 0) {
                throw new IllegalArgumentException("maxLength must be >= 0, got " + maxLength);
            }
            Objects.requireNonNull(severity, "severity");
        }

        public MaxLength(int maxLength) {
            this(maxLength, Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.MAX_LENGTH;
        }
    }

    /**
     * Lower bound. For DATE fields the bound is an epoch day.
     */
    record MinValue(double minValue, Severity severity) implements FieldConstraint {
        public MinValue {
            if (Double.isNaN(minValue)) {
                throw new IllegalArgumentException("minValue must be a number");
            }
            Objects.requireNonNull(severity, "severity");
        }

        public MinValue(double minValue) {
            this(minValue, Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.MIN_VALUE;
        }
    }

    /**
     * Upper bound. For DATE fields the bound is an epoch day.
     */
    record MaxValue(double maxValue, Severity severity) implements FieldConstraint {
        public MaxValue {
            if (Double.isNaN(maxValue)) {
                throw new IllegalArgumentException("maxValue must be a number");
            }
            Objects.requireNonNull(severity, "severity");
        }

        public MaxValue(double maxValue) {
            this(maxValue, Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.MAX_VALUE;
        }
    }

    /**
     * Text must match the regular expression from its first character.
     * The pattern is compiled once, when the constraint is created.
     */
    record PatternMatch(String regex, String description, Severity severity, Pattern compiled)
            implements FieldConstraint {
        public PatternMatch {
            if (regex == null || regex.isEmpty()) {
                throw new IllegalArgumentException("pattern must not be empty");
            }
            Objects.requireNonNull(severity, "severity");
            if (compiled == null) {
                try {
                    compiled = Pattern.compile(regex);
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid regex pattern: " + e.getDescription(), e);
                }
            }
        }

        public PatternMatch(String regex, String description, Severity severity) {
            this(regex, description, severity, null);
        }

        public PatternMatch(String regex) {
            this(regex, null, Severity.ERROR, null);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.PATTERN;
        }

        // Pattern has identity equality; compare by source instead
        @Override
        public boolean equals(Object o) {
            return o instanceof PatternMatch p
                && regex.equals(p.regex)
                && Objects.equals(description, p.description)
                && severity == p.severity;
        }

        @Override
        public int hashCode() {
            return Objects.hash(regex, description, severity);
        }
    }

    /**
     * Value (as text) must be one of the listed options.
     */
    record AllowedValues(List<String> allowedValues, Severity severity) implements FieldConstraint {
        public AllowedValues {
            if (allowedValues == null || allowedValues.isEmpty()) {
                throw new IllegalArgumentException("allowedValues must not be empty");
            }
            allowedValues = List.copyOf(allowedValues);
            Objects.requireNonNull(severity, "severity");
        }

        public AllowedValues(List<String> allowedValues) {
            this(allowedValues, Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.ALLOWED_VALUES;
        }
    }

    /**
     * File name must end with one of the extensions. Extensions start with '.' and are
     * stored lower-case.
     */
    record FileExtension(List<String> allowedExtensions, Severity severity) implements FieldConstraint {
        public FileExtension {
            if (allowedExtensions == null || allowedExtensions.isEmpty()) {
                throw new IllegalArgumentException("allowedExtensions must not be empty");
            }
            for (String ext : allowedExtensions) {
                if (ext == null || !ext.startsWith(".")) {
                    throw new IllegalArgumentException("Extension must start with '.', got: " + ext);
                }
            }
            allowedExtensions = allowedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
            Objects.requireNonNull(severity, "severity");
        }

        public FileExtension(List<String> allowedExtensions) {
            this(allowedExtensions, Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.FILE_EXTENSION;
        }
    }

    record MaxFileSize(long maxSizeBytes, Severity severity) implements FieldConstraint {
        public MaxFileSize {
            if (maxSizeBytes <= 0) {
                throw new IllegalArgumentException("maxSizeBytes must be positive, got " + maxSizeBytes);
            }
            Objects.requireNonNull(severity, "severity");
        }

        public MaxFileSize(long maxSizeBytes) {
            this(maxSizeBytes, Severity.ERROR);
        }

        @Override
        public ConstraintType type() {
            return ConstraintType.MAX_FILE_SIZE;
        }
    }
}
