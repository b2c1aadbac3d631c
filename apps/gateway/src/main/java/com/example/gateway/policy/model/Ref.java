package com.example.gateway.policy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference such as {@code data.pg.users[x].id}. The head is a {@link Var}; the rest are
 * string keys or iterator variables.
 */
public record Ref(List<PolicyTerm> path) implements PolicyTerm {

    public Ref {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Reference path must not be empty");
        }
        path = List.copyOf(path);
    }

    /**
     * Builds a reference whose head is a variable and whose remaining segments are string keys.
     */
    public static Ref of(String head, String... keys) {
        List<PolicyTerm> path = new ArrayList<>();
        path.add(new Var(head));
        for (String key : keys) {
            path.add(new StringValue(key));
        }
        return new Ref(path);
    }

    public int size() {
        return path.size();
    }

    public PolicyTerm get(int index) {
        return path.get(index);
    }

    public PolicyTerm head() {
        return path.get(0);
    }

    public List<PolicyTerm> tail(int fromIndex) {
        return path.subList(fromIndex, path.size());
    }

    public Ref concat(List<PolicyTerm> prefix, List<PolicyTerm> rest) {
        List<PolicyTerm> joined = new ArrayList<>(prefix);
        joined.addAll(rest);
        return new Ref(joined);
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder(head().text());
        for (PolicyTerm segment : tail(1)) {
            if (segment instanceof StringValue s) {
                sb.append('.').append(s.value());
            } else {
                sb.append('[').append(segment.text()).append(']');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return text();
    }
}
