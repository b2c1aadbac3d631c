package com.example.gateway.query.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Operator applied to ordered operands. Used both as a top-level relation and as a nested operand.
 */
public record Call(Operator operator, List<Operand> operands) implements Clause, Operand {

    public Call {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operands, "operands");
        operands = List.copyOf(operands);
    }

    public static Call of(String operator, Operand... operands) {
        return new Call(new Operator(operator), List.of(operands));
    }

    /**
     * Walks the operator, then each operand, then this call.
     */
    @Override
    public void walk(QueryNodeVisitor visitor) {
        operator.walk(visitor);
        for (Operand operand : operands) {
            operand.walk(visitor);
        }
        visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return operands.stream().map(Object::toString)
                .collect(Collectors.joining(", ", operator.name() + "(", ")"));
    }
}
