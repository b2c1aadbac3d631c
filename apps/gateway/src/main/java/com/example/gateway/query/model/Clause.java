package com.example.gateway.query.model;

/**
 * Boolean expression that may be wrapped by a {@link Condition}.
 */
public sealed interface Clause extends QueryNode permits Conjunction, Disjunction, Call {
}
