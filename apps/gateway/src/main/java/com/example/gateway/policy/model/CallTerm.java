package com.example.gateway.policy.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Function call nested inside an expression, e.g. {@code abs(x)} in {@code gt(abs(x), 3)}.
 * The first term is the operator reference.
 */
public record CallTerm(List<PolicyTerm> terms) implements PolicyTerm {

    public CallTerm {
        Objects.requireNonNull(terms, "terms");
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("Call term requires an operator");
        }
        terms = List.copyOf(terms);
    }

    public PolicyTerm operator() {
        return terms.get(0);
    }

    public List<PolicyTerm> arguments() {
        return terms.subList(1, terms.size());
    }

    @Override
    public String text() {
        return arguments().stream().map(PolicyTerm::text)
                .collect(Collectors.joining(", ", operator().text() + "(", ")"));
    }
}
