package com.dochelper.engine.analysis;

import com.dochelper.core.model.FieldType;

/**
 * Field id and type, the part of a schema formula analysis needs.
 */
public record SchemaFieldInfo(String fieldId, FieldType fieldType) {
}
