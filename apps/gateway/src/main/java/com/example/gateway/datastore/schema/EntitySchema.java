package com.example.gateway.datastore.schema;

import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entities contained in one schema (SQL schema or document database).
 */
public record EntitySchema(List<EntityDefinition> entities) {

    public EntitySchema {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static EntitySchema of(EntityDefinition... entities) {
        return new EntitySchema(List.of(entities));
    }

    /**
     * Searches this schema, including nested entities, for the given logical name.
     */
    @NonNull
    public Optional<EntityDefinition> containsEntity(@NonNull String search) {
        return find(entities, search);
    }

    public boolean hasNestedEntities() {
        return entities.stream().anyMatch(EntityDefinition::hasNestedEntities);
    }

    /**
     * Logical names that occur more than once anywhere in this schema.
     */
    @NonNull
    public Set<String> duplicateEntityNames() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new HashSet<>();
        collectNames(entities, seen, duplicates);
        return duplicates;
    }

    /**
     * Paths of every entity reachable from each root entity.
     *
     * <p>Keyed by root logical name, then entity logical name. A path starts with the root's physical
     * name followed by the physical names of each nested level, e.g.
     * {@code apps -> owner -> [apps, owner]}.
     */
    @NonNull
    public Map<String, Map<String, List<String>>> generateEntityPaths() {
        Map<String, Map<String, List<String>>> paths = new LinkedHashMap<>();
        for (EntityDefinition root : entities) {
            Map<String, List<String>> rootPaths = new LinkedHashMap<>();
            collectPaths(root, new ArrayList<>(), rootPaths);
            paths.put(root.logicalName(), rootPaths);
        }
        return paths;
    }

    private static Optional<EntityDefinition> find(List<EntityDefinition> candidates, String search) {
        for (EntityDefinition entity : candidates) {
            if (entity.logicalName().equals(search)) {
                return Optional.of(entity);
            }
            Optional<EntityDefinition> nested = find(entity.entities(), search);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    private static void collectNames(List<EntityDefinition> candidates, Set<String> seen, Set<String> duplicates) {
        for (EntityDefinition entity : candidates) {
            if (!seen.add(entity.logicalName())) {
                duplicates.add(entity.logicalName());
            }
            collectNames(entity.entities(), seen, duplicates);
        }
    }

    private static void collectPaths(EntityDefinition entity, List<String> parent, Map<String, List<String>> into) {
        List<String> path = new ArrayList<>(parent);
        path.add(entity.name());
        into.put(entity.logicalName(), List.copyOf(path));
        for (EntityDefinition nested : entity.entities()) {
            collectPaths(nested, path, into);
        }
    }
}
