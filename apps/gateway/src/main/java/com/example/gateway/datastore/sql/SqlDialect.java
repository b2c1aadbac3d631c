package com.example.gateway.datastore.sql;

import com.example.gateway.common.exception.ConfigurationException;
import com.example.gateway.datastore.DatastoreType;
import org.springframework.lang.Nullable;

/**
 * Relational dialect differences that affect generated text.
 */
public enum SqlDialect {
    POSTGRES("public") {
        @Override
        public String placeholder(int position) {
            return "$" + position;
        }
    },
    MYSQL(null) {
        @Override
        public String placeholder(int position) {
            return "?";
        }
    };

    private final String unqualifiedSchema;

    SqlDialect(@Nullable String unqualifiedSchema) {
        this.unqualifiedSchema = unqualifiedSchema;
    }

    /**
     * Positional parameter marker, {@code position} starting at 1.
     */
    public abstract String placeholder(int position);

    /**
     * Whether tables in this schema are referenced without schema qualification.
     */
    public boolean omitsSchema(String schemaName) {
        return unqualifiedSchema != null && unqualifiedSchema.equals(schemaName);
    }

    public static SqlDialect of(DatastoreType type) {
        return switch (type) {
            case POSTGRES -> POSTGRES;
            case MYSQL -> MYSQL;
            case MONGO -> throw new ConfigurationException("Datastore type [mongo] has no SQL dialect");
        };
    }
}
