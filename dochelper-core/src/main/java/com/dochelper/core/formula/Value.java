package com.dochelper.core.formula;

import java.util.Objects;

/**
 * Runtime value of the formula language.
 * Closed set of variants: number, text, boolean and null.
 */
public sealed interface Value {

    /**
     * Truthiness used by {@code and}, {@code or}, {@code not} and by rule conditions:
     * null is false, numbers are true when non-zero, text is true when non-empty.
     */
    boolean isTruthy();

    /**
     * Human readable name of the variant, used in error messages.
     */
    String typeName();

    /**
     * Render the value as display text. Null renders as the empty string.
     */
    String asText();

    default boolean isNull() {
        return this instanceof NullValue;
    }

    static Value of(double value) {
        return new NumberValue(value);
    }

    static Value of(String value) {
        return value == null ? NullValue.INSTANCE : new TextValue(value);
    }

    static Value of(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static Value nullValue() {
        return NullValue.INSTANCE;
    }

    /**
     * Convert a plain Java object (as produced by Jackson or by a form) into a value.
     */
    static Value fromObject(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof Value v) {
            return v;
        }
        if (raw instanceof Boolean b) {
            return of(b);
        }
        if (raw instanceof Number n) {
            return of(n.doubleValue());
        }
        return of(raw.toString());
    }

    /**
     * Number value. All numbers are doubles; integral values print without a fraction.
     */
    record NumberValue(double value) implements Value {
        @Override
        public boolean isTruthy() {
            return value != 0.0 && !Double.isNaN(value);
        }

        @Override
        public String typeName() {
            return "number";
        }

        @Override
        public String asText() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    record TextValue(String value) implements Value {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isTruthy() {
            return !value.isEmpty();
        }

        @Override
        public String typeName() {
            return "text";
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public String toString() {
            return "'" + value + "'";
        }
    }

    record BooleanValue(boolean value) implements Value {
        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public boolean isTruthy() {
            return value;
        }

        @Override
        public String typeName() {
            return "boolean";
        }

        @Override
        public String asText() {
            return value ? "true" : "false";
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    /**
     * The null value. Missing fields evaluate to this.
     */
    final class NullValue implements Value {
        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public boolean isTruthy() {
            return false;
        }

        @Override
        public String typeName() {
            return "null";
        }

        @Override
        public String asText() {
            return "";
        }

        @Override
        public String toString() {
            return "null";
        }
    }
}
