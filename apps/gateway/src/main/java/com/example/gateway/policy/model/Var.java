package com.example.gateway.policy.model;

import java.util.Objects;

public record Var(String name) implements PolicyTerm {

    public Var {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String text() {
        return name;
    }
}
