package com.example.gateway.support;

import com.example.gateway.policy.model.PolicyExpression;
import com.example.gateway.policy.model.PolicyTerm;
import com.example.gateway.policy.model.Ref;
import com.example.gateway.policy.model.StringValue;
import com.example.gateway.policy.model.Var;

import java.util.ArrayList;
import java.util.List;

/**
 * Builders for partial-evaluation terms used across tests.
 */
public final class QueryFixtures {

    private QueryFixtures() {}

    /**
     * {@code data.<datastore>.<table>[<iterator>].<columns...>}
     */
    public static Ref dataRef(String datastore, String table, String iterator, String... columns) {
        List<PolicyTerm> path = new ArrayList<>();
        path.add(new Var("data"));
        path.add(new StringValue(datastore));
        path.add(new StringValue(table));
        path.add(new Var(iterator));
        for (String column : columns) {
            path.add(new StringValue(column));
        }
        return new Ref(path);
    }

    /**
     * {@code <iterator>.<columns...>}
     */
    public static Ref varRef(String iterator, String... columns) {
        return Ref.of(iterator, columns);
    }

    /**
     * Canonical attribute reference {@code data.<table>.<column>}.
     */
    public static Ref attributeRef(String table, String column) {
        return Ref.of("data", table, column);
    }

    public static PolicyExpression call(String operator, PolicyTerm... operands) {
        return PolicyExpression.call(operator, operands);
    }
}
