package com.dochelper.core.schema;

import com.dochelper.core.model.EntityDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe schema repository backed by a map. Registering an entity id again replaces it.
 */
public class InMemorySchemaRepository implements SchemaRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemorySchemaRepository.class);

    private final Map<String, EntityDefinition> entities = new ConcurrentHashMap<>();

    public static InMemorySchemaRepository of(EntityDefinition... definitions) {
        InMemorySchemaRepository repository = new InMemorySchemaRepository();
        for (EntityDefinition definition : definitions) {
            repository.register(definition);
        }
        return repository;
    }

    public static InMemorySchemaRepository of(Collection<EntityDefinition> definitions) {
        InMemorySchemaRepository repository = new InMemorySchemaRepository();
        definitions.forEach(repository::register);
        return repository;
    }

    public void register(EntityDefinition definition) {
        if (entities.put(definition.id(), definition) != null) {
            log.debug("Replaced entity definition: {}", definition.id());
        } else {
            log.debug("Registered entity definition: {}", definition.id());
        }
    }

    public void remove(String entityId) {
        entities.remove(entityId);
    }

    @Override
    public Optional<EntityDefinition> findEntity(String entityId) {
        return entityId == null ? Optional.empty() : Optional.ofNullable(entities.get(entityId));
    }

    @Override
    public List<EntityDefinition> getAllEntities() {
        List<EntityDefinition> all = new ArrayList<>(entities.values());
        all.sort(Comparator.comparing(EntityDefinition::id));
        return all;
    }

    public int size() {
        return entities.size();
    }
}
