package com.example.gateway.query.model;

import java.util.Objects;

/**
 * One branch of a {@link Union}: a root entity, the entities joined into it and a condition.
 */
public record Query(Entity from, Link link, Condition condition) implements QueryNode {

    public Query {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(condition, "condition");
        if (link == null) {
            link = Link.empty();
        }
    }

    /**
     * Walks link, then condition, then from.
     */
    @Override
    public void walk(QueryNodeVisitor visitor) {
        link.walk(visitor);
        condition.walk(visitor);
        from.walk(visitor);
        visitor.visitQuery(this);
    }

    @Override
    public String toString() {
        return "query(from=" + from + ", link=" + link + ", " + condition + ")";
    }
}
