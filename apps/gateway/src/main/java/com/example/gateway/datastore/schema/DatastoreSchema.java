package com.example.gateway.datastore.schema;

import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * All entity schemas of one datastore, keyed by schema name in configuration order.
 * Read-only once built.
 */
public final class DatastoreSchema {

    private final Map<String, EntitySchema> schemas;
    private final Map<String, Map<String, List<String>>> entityPaths;

    public DatastoreSchema(@NonNull Map<String, EntitySchema> schemas) {
        Objects.requireNonNull(schemas, "schemas");
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));

        Map<String, Map<String, List<String>>> paths = new LinkedHashMap<>();
        this.schemas.values().forEach(schema -> paths.putAll(schema.generateEntityPaths()));
        this.entityPaths = Collections.unmodifiableMap(paths);
    }

    public static DatastoreSchema of(String schemaName, EntitySchema schema) {
        return new DatastoreSchema(Map.of(schemaName, schema));
    }

    /**
     * Resolves a logical entity name to the schema containing it.
     */
    @NonNull
    public Optional<ResolvedEntity> findEntity(@NonNull String logicalName) {
        for (Map.Entry<String, EntitySchema> entry : schemas.entrySet()) {
            Optional<EntityDefinition> found = entry.getValue().containsEntity(logicalName);
            if (found.isPresent()) {
                return Optional.of(new ResolvedEntity(entry.getKey(), found.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Root logical name, then entity logical name, to physical path segments.
     */
    @NonNull
    public Map<String, Map<String, List<String>>> entityPaths() {
        return entityPaths;
    }

    @NonNull
    public Map<String, EntitySchema> schemas() {
        return schemas;
    }

    public boolean isEmpty() {
        return schemas.isEmpty();
    }

    /**
     * Entity together with the schema it was found in.
     */
    public record ResolvedEntity(String schemaName, EntityDefinition entity) {
    }
}
