package com.example.gateway.query.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Disjunction of queries: authorized if any branch matches.
 */
public record Union(List<Query> queries) implements QueryNode {

    public Union {
        Objects.requireNonNull(queries, "queries");
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("Union requires at least one query");
        }
        queries = List.copyOf(queries);
    }

    public static Union of(Query... queries) {
        return new Union(List.of(queries));
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        for (Query query : queries) {
            query.walk(visitor);
        }
        visitor.visitUnion(this);
    }

    @Override
    public String toString() {
        return queries.stream().map(Query::toString).collect(Collectors.joining(" UNION ", "union(", ")"));
    }
}
