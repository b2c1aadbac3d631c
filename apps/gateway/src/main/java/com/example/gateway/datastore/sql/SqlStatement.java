package com.example.gateway.datastore.sql;

import com.example.gateway.datastore.DatastoreQuery;

import java.util.List;
import java.util.Objects;

/**
 * Parameterized SQL statement. Parameters are positional and carry the literal text of each constant.
 */
public record SqlStatement(String text, List<Object> parameters) implements DatastoreQuery {

    public SqlStatement {
        Objects.requireNonNull(text, "text");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    @Override
    public Object statement() {
        return text;
    }

    @Override
    public int length() {
        return text.length();
    }
}
