package com.example.gateway.query.model;

public enum ConstantType {
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
