package com.example.gateway.policy.model;

import java.util.Objects;

/**
 * Number kept in its original textual form so classification happens once, downstream.
 */
public record NumberValue(String literal) implements PolicyTerm {

    public NumberValue {
        Objects.requireNonNull(literal, "literal");
    }

    @Override
    public String text() {
        return literal;
    }
}
