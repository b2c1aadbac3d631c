package com.example.gateway.query.model;

import java.util.Objects;

public record Condition(Clause clause) implements QueryNode {

    public Condition {
        Objects.requireNonNull(clause, "clause");
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        clause.walk(visitor);
        visitor.visitCondition(this);
    }

    @Override
    public String toString() {
        return "where(" + clause + ")";
    }
}
