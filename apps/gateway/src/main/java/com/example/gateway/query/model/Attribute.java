package com.example.gateway.query.model;

import java.util.Objects;

/**
 * Field of exactly one entity.
 */
public record Attribute(Entity entity, String name) implements Operand {

    public Attribute {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(name, "name");
    }

    public static Attribute of(String entity, String name) {
        return new Attribute(new Entity(entity), name);
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        entity.walk(visitor);
        visitor.visitAttribute(this);
    }

    @Override
    public String toString() {
        return entity.name() + "." + name;
    }
}
