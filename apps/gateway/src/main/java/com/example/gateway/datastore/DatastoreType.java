package com.example.gateway.datastore;

import com.example.gateway.common.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Supported backends. The key is used in configuration and in call-operand resource names.
 */
public enum DatastoreType {
    POSTGRES("postgres", "postgresql"),
    MYSQL("mysql", "mysql"),
    MONGO("mongo", null);

    private final String key;
    private final String r2dbcDriver;

    DatastoreType(String key, String r2dbcDriver) {
        this.key = key;
        this.r2dbcDriver = r2dbcDriver;
    }

    public String key() {
        return key;
    }

    /**
     * R2DBC driver identifier, null for non-relational stores.
     */
    public String r2dbcDriver() {
        return r2dbcDriver;
    }

    public boolean isSql() {
        return r2dbcDriver != null;
    }

    public static DatastoreType fromKey(String key) {
        if (key == null) {
            throw new ConfigurationException("Datastore type is required");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(String.format(
                        "Unsupported datastore type [%s], expected one of %s",
                        key, Arrays.stream(values()).map(DatastoreType::key).toList())));
    }
}
