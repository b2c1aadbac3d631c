package com.example.gateway.policy.model;

public record BooleanValue(boolean value) implements PolicyTerm {

    @Override
    public String text() {
        return Boolean.toString(value);
    }
}
