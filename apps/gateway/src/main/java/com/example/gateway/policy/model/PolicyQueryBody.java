package com.example.gateway.policy.model;

import java.util.List;
import java.util.Objects;

/**
 * Conjunction of expressions; one disjunct of a partial evaluation.
 */
public record PolicyQueryBody(List<PolicyExpression> expressions) {

    public PolicyQueryBody {
        Objects.requireNonNull(expressions, "expressions");
        expressions = List.copyOf(expressions);
    }

    public static PolicyQueryBody of(PolicyExpression... expressions) {
        return new PolicyQueryBody(List.of(expressions));
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }
}
