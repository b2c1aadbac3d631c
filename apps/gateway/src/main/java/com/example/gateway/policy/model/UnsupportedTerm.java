package com.example.gateway.policy.model;

/**
 * Term kind the query compiler cannot lower (arrays, sets, objects, comprehensions).
 */
public record UnsupportedTerm(String type, String raw) implements PolicyTerm {

    @Override
    public String text() {
        return raw;
    }
}
