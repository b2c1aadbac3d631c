package com.example.gateway.policy.model;

public record NullValue() implements PolicyTerm {

    @Override
    public String text() {
        return "null";
    }
}
