package com.dochelper.engine;

import com.dochelper.core.formula.Value;
import com.dochelper.core.model.FileAttachment;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The field values of one entity instance, plus metadata of attached files.
 */
public final class FieldValueSnapshot {

    private final Map<String, Value> values;
    private final Map<String, FileAttachment> attachments;

    private FieldValueSnapshot(Map<String, Value> values, Map<String, FileAttachment> attachments) {
        this.values = values;
        this.attachments = attachments;
    }

    public static FieldValueSnapshot of(Map<String, Value> values) {
        return of(values, Map.of());
    }

    public static FieldValueSnapshot of(Map<String, Value> values, Map<String, FileAttachment> attachments) {
        Map<String, Value> copy = new HashMap<>();
        values.forEach((id, value) -> copy.put(Objects.requireNonNull(id, "field id"),
            value != null ? value : Value.nullValue()));
        return new FieldValueSnapshot(Collections.unmodifiableMap(copy), Map.copyOf(attachments));
    }

    public static FieldValueSnapshot empty() {
        return of(Map.of());
    }

    /**
     * Value of a field. A FILE or IMAGE field with only an attachment reads as the file name.
     */
    public Value get(String fieldId) {
        Value value = values.get(fieldId);
        if (value != null && !value.isNull()) {
            return value;
        }
        FileAttachment attachment = attachments.get(fieldId);
        return attachment != null ? Value.of(attachment.name()) : Value.nullValue();
    }

    public FileAttachment attachment(String fieldId) {
        return attachments.get(fieldId);
    }

    /**
     * Supplied values merged with attachment names.
     */
    public Map<String, Value> values() {
        Map<String, Value> merged = new HashMap<>(values);
        attachments.forEach((id, attachment) -> {
            if (merged.getOrDefault(id, Value.nullValue()).isNull()) {
                merged.put(id, Value.of(attachment.name()));
            }
        });
        return merged;
    }
}
