package com.example.gateway.datastore;

import com.example.gateway.common.exception.ConfigurationException;
import com.example.gateway.config.properties.GatewayProperties;
import com.example.gateway.config.properties.GatewayProperties.ConnectionProperties;
import com.example.gateway.config.properties.GatewayProperties.DatastoreProperties;
import com.example.gateway.config.properties.GatewayProperties.ExecutionProperties;
import com.example.gateway.datastore.mongo.MongoDatastoreExecutor;
import com.example.gateway.datastore.mongo.MongoQuery;
import com.example.gateway.datastore.mongo.MongoQueryTranslator;
import com.example.gateway.datastore.operand.CallOperandLoader;
import com.example.gateway.datastore.operand.CallOperandRegistry;
import com.example.gateway.datastore.schema.DatastoreSchema;
import com.example.gateway.datastore.schema.EntitySchema;
import com.example.gateway.datastore.sql.SqlDatastoreExecutor;
import com.example.gateway.datastore.sql.SqlDialect;
import com.example.gateway.datastore.sql.SqlQueryTranslator;
import com.example.gateway.datastore.sql.SqlStatement;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactoryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.lang.NonNull;
import org.springframework.r2dbc.core.DatabaseClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.r2dbc.spi.ConnectionFactoryOptions.DATABASE;
import static io.r2dbc.spi.ConnectionFactoryOptions.DRIVER;
import static io.r2dbc.spi.ConnectionFactoryOptions.HOST;
import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.PORT;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;

/**
 * Builds one {@link Datastore} per configured alias: validates its entity schemas, picks the
 * translator for its type and wires either a live executor or the dry-run logging executor.
 *
 * <p>Connections are created lazily by the drivers; nothing is contacted until the first query.
 */
@Slf4j
public class DatastoreFactory implements DisposableBean {

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<DatastoreType, CallOperandRegistry> callOperands;
    private final List<MongoClient> mongoClients = new ArrayList<>();

    public DatastoreFactory(@NonNull GatewayProperties properties, @NonNull ObjectMapper objectMapper) {
        this(properties, objectMapper, new CallOperandLoader());
    }

    public DatastoreFactory(
            @NonNull GatewayProperties properties,
            @NonNull ObjectMapper objectMapper,
            @NonNull CallOperandLoader callOperandLoader) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        Set<DatastoreType> types = new LinkedHashSet<>();
        properties.datastores().values().forEach(ds -> types.add(DatastoreType.fromKey(ds.type())));
        this.callOperands = callOperandLoader.loadAll(types, properties.callOperandsDir());
    }

    @NonNull
    public DatastoreRegistry createAll() {
        Map<String, Datastore> datastores = new LinkedHashMap<>();
        properties.datastores().forEach((alias, config) -> datastores.put(alias, create(alias, config)));
        log.info("Configured {} datastores: {}", datastores.size(), datastores.keySet());
        return new DatastoreRegistry(datastores);
    }

    @NonNull
    public Datastore create(@NonNull String alias, @NonNull DatastoreProperties config) {
        DatastoreType type = DatastoreType.fromKey(config.type());
        DatastoreSchema schema = schemaFor(alias, type);
        CallOperandRegistry registry = callOperands.get(type);
        if (registry == null) {
            throw new ConfigurationException(String.format(
                    "No call operands found for datastore [%s] with type [%s]", alias, type.key()));
        }

        ExecutionProperties execution = properties.execution();
        Datastore datastore;
        if (type.isSql()) {
            var translator = new SqlQueryTranslator(alias, SqlDialect.of(type), schema, registry);
            DatastoreExecutor<SqlStatement> executor = execution.dryRun()
                    ? new LoggingDatastoreExecutor<>(alias, objectMapper)
                    : new SqlDatastoreExecutor(alias, databaseClient(alias, type, config.connection()), execution.timeout());
            datastore = new DefaultDatastore<>(alias, type, translator, executor, execution.hugeQuerySize());
        } else {
            var translator = new MongoQueryTranslator(alias, schema, registry);
            DatastoreExecutor<MongoQuery> executor = execution.dryRun()
                    ? new LoggingDatastoreExecutor<>(alias, objectMapper)
                    : new MongoDatastoreExecutor(alias, mongoTemplate(alias, config.connection()),
                            execution.timeout(), execution.collectionTimeout());
            datastore = new DefaultDatastore<>(alias, type, translator, executor, execution.hugeQuerySize());
        }

        log.info("Configured datastore [{}] of type [{}]{}", alias, type.key(), execution.dryRun() ? " (dry run)" : "");
        return datastore;
    }

    DatastoreSchema schemaFor(String alias, DatastoreType type) {
        Map<String, EntitySchema> schemas = properties.entitySchemas().get(alias);
        if (schemas == null || schemas.isEmpty()) {
            throw new ConfigurationException(String.format(
                    "Datastore [%s] has no entity-schema-mapping configured", alias));
        }

        schemas.forEach((schemaName, schema) -> {
            Set<String> duplicates = schema.duplicateEntityNames();
            if (!duplicates.isEmpty()) {
                throw new ConfigurationException(String.format(
                        "Schema [%s] of datastore [%s] declares entities %s more than once", schemaName, alias, duplicates));
            }
            if (type.isSql() && schema.hasNestedEntities()) {
                throw new ConfigurationException(String.format(
                        "Schema [%s] of datastore [%s] contains nested entities which are not supported by SQL datastores",
                        schemaName, alias));
            }
        });
        return new DatastoreSchema(schemas);
    }

    private DatabaseClient databaseClient(String alias, DatastoreType type, ConnectionProperties connection) {
        if (connection.host() == null || connection.database() == null) {
            throw new ConfigurationException(String.format(
                    "Datastore [%s] requires connection host and database", alias));
        }
        ConnectionFactoryOptions.Builder options = ConnectionFactoryOptions.builder()
                .option(DRIVER, type.r2dbcDriver())
                .option(HOST, connection.host())
                .option(DATABASE, connection.database());
        if (connection.port() != null) {
            options.option(PORT, connection.port());
        }
        if (connection.user() != null) {
            options.option(USER, connection.user());
        }
        if (connection.password() != null) {
            options.option(PASSWORD, connection.password());
        }
        return DatabaseClient.create(ConnectionFactories.get(options.build()));
    }

    private ReactiveMongoTemplate mongoTemplate(String alias, ConnectionProperties connection) {
        if (connection.database() == null) {
            throw new ConfigurationException(String.format("Datastore [%s] requires connection database", alias));
        }
        MongoClient client = MongoClients.create(mongoUri(alias, connection));
        mongoClients.add(client);
        return new ReactiveMongoTemplate(client, connection.database());
    }

    static String mongoUri(String alias, ConnectionProperties connection) {
        if (connection.uri() != null && !connection.uri().isBlank()) {
            return connection.uri();
        }
        if (connection.host() == null) {
            throw new ConfigurationException(String.format("Datastore [%s] requires connection uri or host", alias));
        }
        StringBuilder uri = new StringBuilder("mongodb://");
        if (connection.user() != null) {
            uri.append(URLEncoder.encode(connection.user(), StandardCharsets.UTF_8));
            if (connection.password() != null) {
                uri.append(':').append(URLEncoder.encode(connection.password(), StandardCharsets.UTF_8));
            }
            uri.append('@');
        }
        uri.append(connection.host());
        if (connection.port() != null) {
            uri.append(':').append(connection.port());
        }
        return uri.toString();
    }

    @Override
    public void destroy() {
        mongoClients.forEach(MongoClient::close);
        mongoClients.clear();
    }
}
