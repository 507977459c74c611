package com.dochelper.core.model;

/**
 * Metadata of a file chosen for a FILE or IMAGE field.
 *
 * @param sizeBytes size in bytes, or {@code -1} when unknown
 */
public record FileAttachment(String name, long sizeBytes) {

    public static final long UNKNOWN_SIZE = -1;

    public FileAttachment {
        if (name == null) {
            throw new IllegalArgumentException("File name must not be null");
        }
        if (sizeBytes < UNKNOWN_SIZE) {
            throw new IllegalArgumentException("sizeBytes must be >= 0 or UNKNOWN_SIZE, got " + sizeBytes);
        }
    }

    public static FileAttachment named(String name) {
        return new FileAttachment(name, UNKNOWN_SIZE);
    }

    public boolean hasSize() {
        return sizeBytes != UNKNOWN_SIZE;
    }
}
