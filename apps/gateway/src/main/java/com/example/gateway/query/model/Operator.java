package com.example.gateway.query.model;

import java.util.Objects;

public record Operator(String name) implements QueryNode {

    public Operator {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        visitor.visitOperator(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
