package com.example.gateway.policy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One expression of a query body. A call expression is an operator reference followed by operands.
 */
public record PolicyExpression(List<PolicyTerm> terms, boolean negated) {

    public PolicyExpression {
        Objects.requireNonNull(terms, "terms");
        terms = List.copyOf(terms);
    }

    public static PolicyExpression call(String operator, PolicyTerm... operands) {
        List<PolicyTerm> terms = new ArrayList<>();
        terms.add(Ref.of(operator));
        terms.addAll(List.of(operands));
        return new PolicyExpression(terms, false);
    }

    public boolean isCall() {
        return terms.size() > 1 && terms.get(0) instanceof Ref;
    }

    public PolicyTerm operator() {
        return terms.get(0);
    }

    public List<PolicyTerm> operands() {
        return terms.isEmpty() ? List.of() : terms.subList(1, terms.size());
    }

    public PolicyExpression withTerms(List<PolicyTerm> replacement) {
        return new PolicyExpression(replacement, negated);
    }

    @Override
    public String toString() {
        String body = isCall()
                ? operands().stream().map(PolicyTerm::text).collect(Collectors.joining(", ", operator().text() + "(", ")"))
                : terms.stream().map(PolicyTerm::text).collect(Collectors.joining(" "));
        return negated ? "not " + body : body;
    }
}
