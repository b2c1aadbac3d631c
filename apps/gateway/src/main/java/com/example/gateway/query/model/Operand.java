package com.example.gateway.query.model;

/**
 * Argument of a {@link Call}.
 */
public sealed interface Operand extends QueryNode permits Attribute, Constant, Call {
}
