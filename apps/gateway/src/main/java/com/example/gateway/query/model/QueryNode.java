package com.example.gateway.query.model;

/**
 * Node of the backend-neutral query tree built from a partial policy evaluation.
 *
 * <p>The hierarchy is closed; backend translators handle every variant through
 * {@link QueryNodeVisitor}. Nodes are immutable and never shared across requests.
 */
public sealed interface QueryNode permits Union, Query, Link, Condition, Clause, Operand, Operator, Entity {

    /**
     * Post-order traversal: children first, then this node.
     */
    void walk(QueryNodeVisitor visitor);
}
