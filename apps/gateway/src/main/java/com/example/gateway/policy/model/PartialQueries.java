package com.example.gateway.policy.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Result of partially evaluating a policy. {@code queries} is null when the policy is
 * undefined for the input, which always denies.
 */
public record PartialQueries(@Nullable List<PolicyQueryBody> queries) {

    public PartialQueries {
        if (queries != null) {
            queries = List.copyOf(queries);
        }
    }

    public static PartialQueries undefined() {
        return new PartialQueries(null);
    }

    public static PartialQueries of(PolicyQueryBody... bodies) {
        return new PartialQueries(List.of(bodies));
    }

    public boolean isUndefined() {
        return queries == null;
    }

    /**
     * An empty body means the policy holds without consulting any datastore.
     */
    public boolean hasUnconditionalBody() {
        return queries != null && queries.stream().anyMatch(PolicyQueryBody::isEmpty);
    }
}
