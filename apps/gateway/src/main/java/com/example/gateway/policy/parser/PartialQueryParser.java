package com.example.gateway.policy.parser;

import com.example.gateway.common.exception.PolicyParseException;
import com.example.gateway.policy.model.BooleanValue;
import com.example.gateway.policy.model.CallTerm;
import com.example.gateway.policy.model.NullValue;
import com.example.gateway.policy.model.NumberValue;
import com.example.gateway.policy.model.PartialQueries;
import com.example.gateway.policy.model.PolicyExpression;
import com.example.gateway.policy.model.PolicyQueryBody;
import com.example.gateway.policy.model.PolicyTerm;
import com.example.gateway.policy.model.Ref;
import com.example.gateway.policy.model.StringValue;
import com.example.gateway.policy.model.UnsupportedTerm;
import com.example.gateway.policy.model.Var;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the policy engine's compile-API response into {@link PartialQueries}.
 *
 * <p>Expected shape:
 * <pre>
 * {"result": {"queries": [[{"index": 0, "terms": [{"type": "ref", "value": [...]}, ...]}]]}}
 * </pre>
 * A missing {@code result} or {@code queries} means the policy is undefined for the input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PartialQueryParser {

    private final ObjectMapper objectMapper;

    @NonNull
    public PartialQueries parse(@NonNull String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PolicyParseException("Partial evaluation result is not valid JSON", e);
        }
        return parse(root);
    }

    @NonNull
    public PartialQueries parse(@NonNull JsonNode root) {
        JsonNode queries = root.path("result").path("queries");
        if (queries.isMissingNode() || queries.isNull()) {
            log.debug("Partial evaluation returned no queries, policy is undefined");
            return PartialQueries.undefined();
        }
        if (!queries.isArray()) {
            throw new PolicyParseException("Expected 'queries' to be an array but got " + queries.getNodeType());
        }

        List<PolicyQueryBody> bodies = new ArrayList<>();
        for (JsonNode body : queries) {
            bodies.add(parseBody(body));
        }
        return new PartialQueries(bodies);
    }

    private PolicyQueryBody parseBody(JsonNode body) {
        if (!body.isArray()) {
            throw new PolicyParseException("Expected query body to be an array but got " + body.getNodeType());
        }
        List<PolicyExpression> expressions = new ArrayList<>();
        for (JsonNode expr : body) {
            expressions.add(parseExpression(expr));
        }
        return new PolicyQueryBody(expressions);
    }

    private PolicyExpression parseExpression(JsonNode expr) {
        JsonNode terms = expr.get("terms");
        if (terms == null) {
            throw new PolicyParseException("Expression without terms: " + expr);
        }
        boolean negated = expr.path("negated").asBoolean(false);

        List<PolicyTerm> parsed = new ArrayList<>();
        if (terms.isArray()) {
            for (JsonNode term : terms) {
                parsed.add(parseTerm(term));
            }
        } else {
            parsed.add(parseTerm(terms));
        }
        return new PolicyExpression(parsed, negated);
    }

    PolicyTerm parseTerm(JsonNode term) {
        String type = term.path("type").asText("");
        JsonNode value = term.path("value");

        return switch (type) {
            case "ref" -> new Ref(parseTerms(value, "ref"));
            case "var" -> new Var(value.asText());
            case "string" -> new StringValue(value.asText());
            case "number" -> new NumberValue(value.asText());
            case "boolean" -> new BooleanValue(value.asBoolean());
            case "null" -> new NullValue();
            case "call" -> new CallTerm(parseTerms(value, "call"));
            case "array", "set", "object", "arraycomprehension", "setcomprehension", "objectcomprehension" ->
                    new UnsupportedTerm(type, value.toString());
            default -> throw new PolicyParseException("Unknown term type [" + type + "] in " + term);
        };
    }

    private List<PolicyTerm> parseTerms(JsonNode value, String type) {
        if (!value.isArray() || value.isEmpty()) {
            throw new PolicyParseException("Expected non-empty array value for " + type + " term but got " + value);
        }
        List<PolicyTerm> terms = new ArrayList<>();
        for (JsonNode element : value) {
            terms.add(parseTerm(element));
        }
        return terms;
    }
}
