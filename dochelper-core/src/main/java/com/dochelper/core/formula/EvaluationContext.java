package com.dochelper.core.formula;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only field values a formula is evaluated against.
 * A field that is not present evaluates to the null value.
 */
public final class EvaluationContext {

    private static final EvaluationContext EMPTY = new EvaluationContext(Map.of());

    private final Map<String, Value> fields;

    private EvaluationContext(Map<String, Value> fields) {
        this.fields = fields;
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    public static EvaluationContext of(Map<String, Value> fields) {
        Map<String, Value> copy = new HashMap<>();
        fields.forEach((id, value) -> copy.put(Objects.requireNonNull(id, "field id"),
            value != null ? value : Value.nullValue()));
        return new EvaluationContext(Collections.unmodifiableMap(copy));
    }

    /**
     * Build a context from plain Java values (numbers, strings, booleans, nulls).
     */
    public static EvaluationContext fromObjects(Map<String, ?> raw) {
        Map<String, Value> values = new HashMap<>();
        raw.forEach((id, value) -> values.put(id, Value.fromObject(value)));
        return of(values);
    }

    public Value get(String fieldId) {
        Value value = fields.get(fieldId);
        return value != null ? value : Value.nullValue();
    }

    public boolean contains(String fieldId) {
        return fields.containsKey(fieldId);
    }

    public Map<String, Value> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "EvaluationContext" + fields;
    }
}
