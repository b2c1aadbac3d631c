package com.example.gateway.translate.process;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.common.exception.TranslationException;
import com.example.gateway.policy.model.BooleanValue;
import com.example.gateway.policy.model.CallTerm;
import com.example.gateway.policy.model.NumberValue;
import com.example.gateway.policy.model.PolicyExpression;
import com.example.gateway.policy.model.PolicyQueryBody;
import com.example.gateway.policy.model.PolicyTerm;
import com.example.gateway.policy.model.Ref;
import com.example.gateway.policy.model.StringValue;
import com.example.gateway.query.model.Attribute;
import com.example.gateway.query.model.Call;
import com.example.gateway.query.model.Clause;
import com.example.gateway.query.model.Condition;
import com.example.gateway.query.model.Conjunction;
import com.example.gateway.query.model.Constant;
import com.example.gateway.query.model.Entity;
import com.example.gateway.query.model.Link;
import com.example.gateway.query.model.Operand;
import com.example.gateway.query.model.Operator;
import com.example.gateway.query.model.Query;
import com.example.gateway.query.model.Union;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the Query-AST from preprocessed bodies: one {@link Query} per body, combined in a {@link Union}.
 *
 * <p>Within a body every top-level call expression becomes one relation. The first entity referenced
 * becomes {@code from}; every other entity the body references is linked, in the order first seen.
 * Relations are combined into a single conjunction.
 *
 * <p>Terms that cannot be lowered are collected as errors and reported together. With
 * {@code skipUnknown} they are logged and ignored instead.
 */
@Slf4j
public class QueryAstProcessor {

    private static final int ATTRIBUTE_REF_SIZE = 3;

    private final boolean skipUnknown;
    private final boolean validateMode;

    public QueryAstProcessor(boolean skipUnknown, boolean validateMode) {
        this.skipUnknown = skipUnknown;
        this.validateMode = validateMode;
    }

    @NonNull
    public Union process(@NonNull List<PolicyQueryBody> bodies) {
        if (bodies.isEmpty()) {
            throw new TranslationException(TranslationError.INVALID_REQUEST, "no query bodies to translate");
        }
        List<Query> queries = new ArrayList<>(bodies.size());
        for (PolicyQueryBody body : bodies) {
            queries.add(processBody(body));
        }
        return new Union(queries);
    }

    @NonNull
    public Query processBody(@NonNull PolicyQueryBody body) {
        log.debug("Processing body: {}", body.expressions());
        BodyState state = new BodyState();

        for (PolicyExpression expression : body.expressions()) {
            translateExpression(expression, state);
        }

        if (!state.errors.isEmpty()) {
            throw new TranslationException(TranslationError.INVALID_REQUEST, state.errors);
        }
        if (state.from == null) {
            throw new TranslationException(TranslationError.INVALID_REQUEST,
                    "body references no entity: " + body.expressions());
        }

        state.entities.remove(state.from);
        Query query = new Query(
                state.from,
                new Link(new ArrayList<>(state.entities)),
                new Condition(new Conjunction(state.relations)));
        log.debug("Built query: {}", query);
        return query;
    }

    private void translateExpression(PolicyExpression expression, BodyState state) {
        if (expression.negated()) {
            unknown(state, "negated expressions are not supported: " + expression);
            return;
        }
        if (!expression.isCall()) {
            unknown(state, "unexpected non-call expression: " + expression);
            return;
        }

        state.operands.push(new ArrayList<>());
        for (PolicyTerm term : expression.operands()) {
            translateTerm(term, state);
        }
        List<Operand> operands = state.operands.pop();
        state.relations.add(new Call(new Operator(expression.operator().text()), operands));
    }

    private void translateTerm(PolicyTerm term, BodyState state) {
        if (term instanceof StringValue s) {
            state.append(Constant.of(s.value()));
        } else if (term instanceof NumberValue n) {
            state.append(Constant.of(n.literal()));
        } else if (term instanceof BooleanValue b) {
            state.append(Constant.ofBoolean(b.value()));
        } else if (term instanceof Ref ref && ref.size() == ATTRIBUTE_REF_SIZE) {
            Entity entity = new Entity(normalize(ref.get(1).text()));
            state.entities.add(entity);
            if (state.from == null) {
                state.from = entity;
            }
            state.append(new Attribute(entity, normalize(ref.get(2).text())));
        } else if (term instanceof CallTerm call) {
            state.operands.push(new ArrayList<>());
            for (PolicyTerm argument : call.arguments()) {
                translateTerm(argument, state);
            }
            List<Operand> operands = state.operands.pop();
            state.append(new Call(new Operator(call.operator().text()), operands));
        } else {
            unknown(state, String.format("unexpected term %s -> %s", term.getClass().getSimpleName(), term.text()));
        }
    }

    private void unknown(BodyState state, String message) {
        if (skipUnknown || validateMode) {
            log.warn("Query processor: {}", message);
        }
        if (!skipUnknown) {
            state.errors.add(message);
        }
    }

    private static String normalize(String value) {
        return value.replace("\"", "");
    }

    private static final class BodyState {
        private final Deque<List<Operand>> operands = new ArrayDeque<>();
        private final List<Clause> relations = new ArrayList<>();
        private final Set<Entity> entities = new LinkedHashSet<>();
        private final List<String> errors = new ArrayList<>();
        private Entity from;

        private void append(Operand operand) {
            List<Operand> top = operands.peek();
            if (top == null) {
                throw new IllegalStateException("No open call to receive operand " + operand);
            }
            top.add(operand);
        }
    }
}
