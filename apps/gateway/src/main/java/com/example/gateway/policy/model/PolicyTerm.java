package com.example.gateway.policy.model;

/**
 * Term of a partially evaluated policy expression, as returned by the policy engine's compile API.
 */
public sealed interface PolicyTerm
        permits Ref, Var, StringValue, NumberValue, BooleanValue, NullValue, CallTerm, UnsupportedTerm {

    /**
     * Text of this term when used as a reference segment or operator name.
     */
    String text();
}
