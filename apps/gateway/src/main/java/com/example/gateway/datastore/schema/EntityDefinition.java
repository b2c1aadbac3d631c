package com.example.gateway.datastore.schema;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Physical table or collection, optionally exposed to policies under an alias.
 * Document stores may nest sub-documents through {@code entities}.
 */
public record EntityDefinition(
        String name,
        @Nullable String alias,
        List<EntityDefinition> entities
) {
    public EntityDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name is required");
        }
        if (alias != null && alias.isBlank()) {
            alias = null;
        }
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static EntityDefinition of(String name) {
        return new EntityDefinition(name, null, List.of());
    }

    /**
     * Name used by policies: the alias when present, otherwise the physical name.
     */
    public String logicalName() {
        return alias != null ? alias : name;
    }

    public boolean hasNestedEntities() {
        return !entities.isEmpty();
    }
}
