package com.example.gateway.query.model;

import java.util.List;
import java.util.Objects;

/**
 * Entities joined (relational) or nested-path resolved (document) into a query.
 * Order is insertion order and feeds directly into the generated text.
 */
public record Link(List<Entity> entities) implements QueryNode {

    private static final Link EMPTY = new Link(List.of());

    public Link {
        Objects.requireNonNull(entities, "entities");
        entities = List.copyOf(entities);
    }

    public static Link empty() {
        return EMPTY;
    }

    public boolean contains(Entity entity) {
        return entities.contains(entity);
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        for (Entity entity : entities) {
            entity.walk(visitor);
        }
        visitor.visitLink(this);
    }

    @Override
    public String toString() {
        return "link" + entities;
    }
}
