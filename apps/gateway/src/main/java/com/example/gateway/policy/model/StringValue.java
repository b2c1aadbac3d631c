package com.example.gateway.policy.model;

import java.util.Objects;

public record StringValue(String value) implements PolicyTerm {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String text() {
        return value;
    }
}
