package com.example.gateway.datastore.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DatastoreSchema")
class DatastoreSchemaTest {

    @Test
    @DisplayName("should resolve entities to the schema that declares them")
    void shouldResolveSchemaName() {
        Map<String, EntitySchema> schemas = new LinkedHashMap<>();
        schemas.put("public", EntitySchema.of(EntityDefinition.of("users")));
        schemas.put("billing", EntitySchema.of(new EntityDefinition("invoice_lines", "lines", List.of())));
        DatastoreSchema schema = new DatastoreSchema(schemas);

        assertThat(schema.findEntity("users"))
                .hasValueSatisfying(resolved -> assertThat(resolved.schemaName()).isEqualTo("public"));
        assertThat(schema.findEntity("lines"))
                .hasValueSatisfying(resolved -> {
                    assertThat(resolved.schemaName()).isEqualTo("billing");
                    assertThat(resolved.entity().name()).isEqualTo("invoice_lines");
                });
        assertThat(schema.findEntity("payments")).isEmpty();
    }

    @Test
    @DisplayName("should merge entity paths of all schemas")
    void shouldMergeEntityPaths() {
        Map<String, EntitySchema> schemas = new LinkedHashMap<>();
        schemas.put("appstore", EntitySchema.of(new EntityDefinition("apps", null, List.of(EntityDefinition.of("owner")))));
        schemas.put("audit", EntitySchema.of(EntityDefinition.of("events")));

        DatastoreSchema schema = new DatastoreSchema(schemas);

        assertThat(schema.entityPaths()).containsOnlyKeys("apps", "events");
        assertThat(schema.entityPaths().get("apps")).containsEntry("owner", List.of("apps", "owner"));
        assertThat(schema.isEmpty()).isFalse();
    }
}
