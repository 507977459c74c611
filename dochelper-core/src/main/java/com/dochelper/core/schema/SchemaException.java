package com.dochelper.core.schema;

/**
 * Thrown when a schema document cannot be read or describes an invalid entity.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
