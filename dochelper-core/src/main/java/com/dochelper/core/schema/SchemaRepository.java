package com.dochelper.core.schema;

import com.dochelper.core.model.EntityDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of entity definitions for the runtime engine.
 */
public interface SchemaRepository {

    Optional<EntityDefinition> findEntity(String entityId);

    List<EntityDefinition> getAllEntities();

    default boolean contains(String entityId) {
        return findEntity(entityId).isPresent();
    }
}
