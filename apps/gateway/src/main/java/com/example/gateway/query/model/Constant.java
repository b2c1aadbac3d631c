package com.example.gateway.query.model;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Literal operand. The type decides between bare emission, quoting and parameter binding downstream.
 */
public record Constant(String value, ConstantType type) implements Operand {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public Constant {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Classifies a literal: surrounding double quotes are removed, then integer, then float,
     * otherwise string.
     */
    public static Constant of(String literal) {
        String value = unquote(literal);
        if (INTEGER.matcher(value).matches() && new BigInteger(value).bitLength() < Long.SIZE) {
            return new Constant(value, ConstantType.INTEGER);
        }
        if (FLOAT.matcher(value).matches()) {
            return new Constant(value, ConstantType.FLOAT);
        }
        return new Constant(value, ConstantType.STRING);
    }

    public static Constant ofBoolean(boolean value) {
        return new Constant(Boolean.toString(value), ConstantType.BOOLEAN);
    }

    public boolean isNumeric() {
        return type.isNumeric();
    }

    @Override
    public void walk(QueryNodeVisitor visitor) {
        visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return type == ConstantType.STRING ? "\"" + value + "\"" : value;
    }

    private static String unquote(String literal) {
        if (literal.length() >= 2 && literal.startsWith("\"") && literal.endsWith("\"")) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }
}
