package com.example.gateway.query.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record Disjunction(List<Clause> clauses) implements Clause {

    public Disjunction {
        Objects.requireNonNull(clauses, "clauses");
        clauses = List.copyOf(clauses);
    }

    public static Disjunction of(Clause... clauses) {
        return new Disjunction(List.of(clauses));
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        for (Clause clause : clauses) {
            clause.walk(visitor);
        }
        visitor.visitDisjunction(this);
    }

    @Override
    public String toString() {
        return clauses.stream().map(Object::toString).collect(Collectors.joining(" OR ", "(", ")"));
    }
}
