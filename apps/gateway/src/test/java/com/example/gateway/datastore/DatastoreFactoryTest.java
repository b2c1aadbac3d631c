package com.example.gateway.datastore;

import com.example.gateway.common.exception.ConfigurationException;
import com.example.gateway.config.properties.GatewayProperties;
import com.example.gateway.config.properties.GatewayProperties.ConnectionProperties;
import com.example.gateway.config.properties.GatewayProperties.DatastoreProperties;
import com.example.gateway.config.properties.GatewayProperties.ExecutionProperties;
import com.example.gateway.datastore.schema.EntityDefinition;
import com.example.gateway.datastore.schema.EntitySchema;
import com.example.gateway.query.model.Attribute;
import com.example.gateway.query.model.Call;
import com.example.gateway.query.model.Condition;
import com.example.gateway.query.model.Conjunction;
import com.example.gateway.query.model.Constant;
import com.example.gateway.query.model.Entity;
import com.example.gateway.query.model.Link;
import com.example.gateway.query.model.Query;
import com.example.gateway.query.model.Union;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DatastoreFactory")
class DatastoreFactoryTest {

    private static final ConnectionProperties NO_CONNECTION = new ConnectionProperties(null, null, null, null, null, null);
    private static final ExecutionProperties DRY_RUN =
            new ExecutionProperties(Duration.ofSeconds(1), Duration.ofSeconds(1), true, 10_000);

    private static GatewayProperties properties(
            Map<String, DatastoreProperties> datastores,
            Map<String, Map<String, EntitySchema>> schemas,
            ExecutionProperties execution) {
        return new GatewayProperties(datastores, schemas, null, null, execution);
    }

    private static DatastoreProperties datastore(String type) {
        return new DatastoreProperties(type, NO_CONNECTION, null);
    }

    @Nested
    @DisplayName("createAll")
    class CreateAll {

        @Test
        @DisplayName("should build every configured datastore in dry-run mode")
        void shouldCreateDryRunDatastores() {
            Map<String, DatastoreProperties> datastores = new LinkedHashMap<>();
            datastores.put("pg", datastore("postgres"));
            datastores.put("docs", datastore("mongo"));
            Map<String, Map<String, EntitySchema>> schemas = Map.of(
                    "pg", Map.of("public", EntitySchema.of(EntityDefinition.of("users"))),
                    "docs", Map.of("appstore", EntitySchema.of(
                            new EntityDefinition("apps", null, List.of(EntityDefinition.of("owner"))))));

            DatastoreRegistry registry = new DatastoreFactory(properties(datastores, schemas, DRY_RUN), new ObjectMapper())
                    .createAll();

            assertThat(registry.size()).isEqualTo(2);
            assertThat(registry.find("pg")).map(Datastore::type).contains(DatastoreType.POSTGRES);
            assertThat(registry.find("docs")).map(Datastore::type).contains(DatastoreType.MONGO);

            Union union = Union.of(new Query(new Entity("users"), Link.empty(), new Condition(Conjunction.of(
                    Call.of("eq", Attribute.of("users", "id"), Constant.of("5"))))));
            StepVerifier.create(registry.find("pg").orElseThrow().execute(union))
                    .expectNext(true)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should require an entity schema per datastore")
        void shouldRejectMissingSchema() {
            GatewayProperties properties = properties(Map.of("pg", datastore("postgres")), Map.of(), DRY_RUN);

            assertThatThrownBy(() -> new DatastoreFactory(properties, new ObjectMapper()).createAll())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("[pg]");
        }

        @Test
        @DisplayName("should reject nested entities for relational datastores")
        void shouldRejectNestedSqlEntities() {
            GatewayProperties properties = properties(Map.of("pg", datastore("postgres")),
                    Map.of("pg", Map.of("public", EntitySchema.of(
                            new EntityDefinition("users", null, List.of(EntityDefinition.of("address")))))),
                    DRY_RUN);

            assertThatThrownBy(() -> new DatastoreFactory(properties, new ObjectMapper()).createAll())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("nested entities");
        }

        @Test
        @DisplayName("should reject duplicate entity names")
        void shouldRejectDuplicateEntities() {
            GatewayProperties properties = properties(Map.of("docs", datastore("mongo")),
                    Map.of("docs", Map.of("appstore", EntitySchema.of(
                            new EntityDefinition("apps", null, List.of(EntityDefinition.of("owner"))),
                            EntityDefinition.of("owner")))),
                    DRY_RUN);

            assertThatThrownBy(() -> new DatastoreFactory(properties, new ObjectMapper()).createAll())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("owner");
        }

        @Test
        @DisplayName("should reject unsupported datastore types")
        void shouldRejectUnknownType() {
            GatewayProperties properties = properties(Map.of("ora", datastore("oracle")), Map.of(), DRY_RUN);

            assertThatThrownBy(() -> new DatastoreFactory(properties, new ObjectMapper()))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should require host and database for live relational datastores")
        void shouldRequireSqlConnection() {
            GatewayProperties properties = properties(Map.of("pg", datastore("postgres")),
                    Map.of("pg", Map.of("public", EntitySchema.of(EntityDefinition.of("users")))),
                    ExecutionProperties.defaults());

            assertThatThrownBy(() -> new DatastoreFactory(properties, new ObjectMapper()).createAll())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("host and database");
        }
    }

    @Nested
    @DisplayName("mongoUri")
    class MongoUri {

        @Test
        @DisplayName("should prefer an explicit uri")
        void shouldPreferUri() {
            ConnectionProperties connection =
                    new ConnectionProperties("mongodb://db:27017/?replicaSet=rs0", "ignored", 1, "appstore", null, null);

            assertThat(DatastoreFactory.mongoUri("docs", connection)).isEqualTo("mongodb://db:27017/?replicaSet=rs0");
        }

        @Test
        @DisplayName("should build a uri with encoded credentials")
        void shouldBuildUri() {
            ConnectionProperties connection =
                    new ConnectionProperties(null, "db", 27017, "appstore", "gateway", "p@ss:word");

            assertThat(DatastoreFactory.mongoUri("docs", connection))
                    .isEqualTo("mongodb://gateway:p%40ss%3Aword@db:27017");
        }

        @Test
        @DisplayName("should require a uri or host")
        void shouldRequireHost() {
            assertThatThrownBy(() -> DatastoreFactory.mongoUri("docs", NO_CONNECTION))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
