package com.example.gateway.translate.preprocess;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.common.exception.TranslationException;
import com.example.gateway.policy.model.CallTerm;
import com.example.gateway.policy.model.PolicyExpression;
import com.example.gateway.policy.model.PolicyQueryBody;
import com.example.gateway.policy.model.PolicyTerm;
import com.example.gateway.policy.model.Ref;
import com.example.gateway.policy.model.StringValue;
import com.example.gateway.policy.model.Var;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites data references of partially evaluated bodies into canonical form so that they map
 * directly onto entities and attributes.
 *
 * <p>{@code data.<datastore>.<table>[x].<column>} becomes {@code data.<table>.<column>}; a later
 * {@code x.<other>} is expanded to {@code data.<table>.<other>}. Local variable declarations of
 * the form {@code eq(v, <ref>)} are inlined and dropped.
 *
 * <p>Stateless: per-body state lives in {@link BodyScope}, so one instance serves concurrent requests.
 */
@Slf4j
@Component
public class ReferencePreprocessor {

    static final String DATA_ROOT = "data";
    private static final String EQUALITY = "eq";

    @NonNull
    public List<PolicyQueryBody> process(@NonNull List<PolicyQueryBody> bodies, @NonNull String datastore) {
        List<PolicyQueryBody> transformed = new ArrayList<>(bodies.size());
        for (PolicyQueryBody body : bodies) {
            log.debug("Preprocessing body for datastore [{}]: {}", datastore, body.expressions());
            transformed.add(processBody(body, new BodyScope(datastore)));
        }
        return transformed;
    }

    private PolicyQueryBody processBody(PolicyQueryBody body, BodyScope scope) {
        List<PolicyExpression> expressions = new ArrayList<>();
        for (PolicyExpression expression : body.expressions()) {
            if (expression.terms().isEmpty()) {
                continue;
            }
            // Only operands are rewritten; the operator reference stays as is
            List<PolicyTerm> terms = new ArrayList<>();
            terms.add(expression.operator());
            for (PolicyTerm operand : expression.operands()) {
                terms.add(transformTerm(operand, scope));
            }

            if (isLocalVarDeclaration(terms)) {
                scope.localVars.put(((Var) terms.get(1)).name(), terms.get(2));
                continue;
            }
            expressions.add(expression.withTerms(substituteVars(terms, scope, expression)));
        }
        return new PolicyQueryBody(expressions);
    }

    private PolicyTerm transformTerm(PolicyTerm term, BodyScope scope) {
        if (term instanceof Ref ref) {
            return transformRef(ref, scope);
        }
        if (term instanceof CallTerm call) {
            List<PolicyTerm> terms = new ArrayList<>();
            terms.add(call.operator());
            for (PolicyTerm argument : call.arguments()) {
                terms.add(transformTerm(argument, scope));
            }
            return new CallTerm(terms);
        }
        return term;
    }

    private Ref transformRef(Ref ref, BodyScope scope) {
        if (ref.size() == 1) {
            return ref;
        }

        String head = ref.head().text();
        List<PolicyTerm> prefix = scope.tableVars.get(head);
        if (prefix != null) {
            // "data.pg.foo[x]; x.bar" => "data.foo.bar"
            return ref.concat(prefix, ref.tail(1));
        }
        if (!DATA_ROOT.equals(head)) {
            return ref;
        }

        if (!(ref.get(1) instanceof StringValue store) || !scope.datastore.equals(store.value())) {
            throw new TranslationException(TranslationError.REFERENCE_MISMATCH, String.format(
                    "expected [data.%s.<table>] but found reference [%s]", scope.datastore, ref));
        }
        if (ref.size() < 4) {
            throw new TranslationException(TranslationError.INVALID_REFERENCE, String.format(
                    "expected [data.%s.<table>[<iterator>].<column>] but found reference [%s]", scope.datastore, ref));
        }
        if (!(ref.get(3) instanceof Var rowId)) {
            throw new TranslationException(TranslationError.INVALID_REFERENCE,
                    "row identifier type not supported: " + ref.get(3).text());
        }

        // Datastore segment is dropped from the canonical prefix
        List<PolicyTerm> tablePrefix = List.of(ref.head(), ref.get(2));
        scope.tableVars.put(rowId.name(), tablePrefix);

        String table = ref.get(2).text();
        String registered = scope.tableNames.putIfAbsent(table, rowId.name());
        if (registered != null && !registered.equals(rowId.name())) {
            throw new TranslationException(TranslationError.SELF_LINK, String.format(
                    "table [%s] is bound to iterators [%s] and [%s]; self-links are not supported",
                    table, registered, rowId.name()));
        }
        return ref.concat(tablePrefix, ref.tail(4));
    }

    private List<PolicyTerm> substituteVars(List<PolicyTerm> terms, BodyScope scope, PolicyExpression source) {
        List<PolicyTerm> substituted = new ArrayList<>(terms.size());
        for (PolicyTerm term : terms) {
            substituted.add(substitute(term, scope, source));
        }
        return substituted;
    }

    private PolicyTerm substitute(PolicyTerm term, BodyScope scope, PolicyExpression source) {
        if (term instanceof Var variable) {
            PolicyTerm value = scope.localVars.get(variable.name());
            if (value == null) {
                throw new TranslationException(TranslationError.UNDEFINED_VARIABLE, String.format(
                        "undefined variable %s in expression [%s]", variable.name(), source));
            }
            return value;
        }
        if (term instanceof CallTerm call) {
            List<PolicyTerm> terms = new ArrayList<>();
            terms.add(call.operator());
            for (PolicyTerm argument : call.arguments()) {
                terms.add(substitute(argument, scope, source));
            }
            return new CallTerm(terms);
        }
        return term;
    }

    private static boolean isLocalVarDeclaration(List<PolicyTerm> terms) {
        return terms.size() == 3
                && terms.get(0) instanceof Ref operator
                && operator.size() == 1
                && operator.head() instanceof Var op
                && EQUALITY.equals(op.name())
                && terms.get(1) instanceof Var
                && terms.get(2) instanceof Ref;
    }

    private static final class BodyScope {
        private final String datastore;
        private final Map<String, String> tableNames = new HashMap<>();
        private final Map<String, List<PolicyTerm>> tableVars = new HashMap<>();
        private final Map<String, PolicyTerm> localVars = new HashMap<>();

        private BodyScope(String datastore) {
            this.datastore = datastore;
        }
    }
}
