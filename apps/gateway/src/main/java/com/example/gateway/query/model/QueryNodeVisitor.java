package com.example.gateway.query.model;

/**
 * Callback for {@link QueryNode#walk}. One method per node kind, so implementations
 * cannot silently miss a variant.
 */
public interface QueryNodeVisitor {

    void visitUnion(Union union);

    void visitQuery(Query query);

    void visitLink(Link link);

    void visitCondition(Condition condition);

    void visitConjunction(Conjunction conjunction);

    void visitDisjunction(Disjunction disjunction);

    void visitCall(Call call);

    void visitOperator(Operator operator);

    void visitAttribute(Attribute attribute);

    void visitEntity(Entity entity);

    void visitConstant(Constant constant);
}
