package com.example.gateway.query.model;

import java.util.Objects;

/**
 * Logical table or collection name, resolved against the datastore's entity schema.
 */
public record Entity(String name) implements QueryNode {

    public Entity {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        visitor.visitEntity(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
