package com.example.gateway.query.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record Conjunction(List<Clause> clauses) implements Clause {

    public Conjunction {
        Objects.requireNonNull(clauses, "clauses");
        clauses = List.copyOf(clauses);
    }

    public static Conjunction of(Clause... clauses) {
        return new Conjunction(List.of(clauses));
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        for (Clause clause : clauses) {
            clause.walk(visitor);
        }
        visitor.visitConjunction(this);
    }

    @Override
    public String toString() {
        return clauses.stream().map(Object::toString).collect(Collectors.joining(" AND ", "(", ")"));
    }
}
