package com.example.gateway.config.properties;

import com.example.gateway.datastore.schema.EntitySchema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Datastores, their entity schemas and the translation/execution settings of the gateway.
 *
 * <pre>
 * gateway:
 *   datastores:
 *     pg:
 *       type: postgres
 *       connection: { host: localhost, port: 5432, database: appstore, user: app, password: secret }
 *   entity-schemas:
 *     pg:
 *       public:
 *         entities:
 *           - name: users
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "gateway")
public record GatewayProperties(
        @NonNull Map<String, @Valid DatastoreProperties> datastores,
        @NonNull Map<String, Map<String, EntitySchema>> entitySchemas,
        @Nullable String callOperandsDir,
        @NonNull TranslationProperties translation,
        @NonNull ExecutionProperties execution
) {
    public GatewayProperties {
        datastores = datastores == null ? Map.of() : new LinkedHashMap<>(datastores);
        entitySchemas = entitySchemas == null ? Map.of() : new LinkedHashMap<>(entitySchemas);
        if (translation == null) {
            translation = new TranslationProperties(false, false);
        }
        if (execution == null) {
            execution = ExecutionProperties.defaults();
        }
    }

    /**
     * One backing datastore. {@code type} is postgres, mysql or mongo.
     */
    public record DatastoreProperties(
            @NotBlank String type,
            @NonNull ConnectionProperties connection,
            @NonNull Map<String, String> metadata
    ) {
        public DatastoreProperties {
            if (connection == null) {
                connection = new ConnectionProperties(null, null, null, null, null, null);
            }
            metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        }
    }

    /**
     * Connection settings. For mongo a full {@code uri} takes precedence over host and port.
     */
    public record ConnectionProperties(
            @Nullable String uri,
            @Nullable String host,
            @Nullable Integer port,
            @Nullable String database,
            @Nullable String user,
            @Nullable String password
    ) {
    }

    public record TranslationProperties(
            boolean skipUnknown,
            boolean validateMode
    ) {
    }

    /**
     * @param timeout           overall deadline for one datastore execution
     * @param collectionTimeout deadline for each per-collection count on document stores
     * @param dryRun            log queries instead of executing them
     * @param hugeQuerySize     maximum generated statement length
     */
    public record ExecutionProperties(
            @NonNull Duration timeout,
            @NonNull Duration collectionTimeout,
            boolean dryRun,
            @NonNull Integer hugeQuerySize
    ) {
        public ExecutionProperties {
            if (timeout == null) {
                timeout = Duration.ofSeconds(10);
            }
            if (collectionTimeout == null) {
                collectionTimeout = Duration.ofSeconds(5);
            }
            if (hugeQuerySize == null) {
                hugeQuerySize = Integer.MAX_VALUE;
            }
        }

        public static ExecutionProperties defaults() {
            return new ExecutionProperties(null, null, false, null);
        }
    }
}
