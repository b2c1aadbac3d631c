package com.example.gateway.datastore.mongo;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.common.exception.TranslationException;
import com.example.gateway.datastore.DatastoreTranslator;
import com.example.gateway.datastore.operand.CallOperandRegistry;
import com.example.gateway.datastore.schema.DatastoreSchema;
import com.example.gateway.query.model.Attribute;
import com.example.gateway.query.model.Call;
import com.example.gateway.query.model.Condition;
import com.example.gateway.query.model.Conjunction;
import com.example.gateway.query.model.Constant;
import com.example.gateway.query.model.Disjunction;
import com.example.gateway.query.model.Entity;
import com.example.gateway.query.model.Link;
import com.example.gateway.query.model.Operator;
import com.example.gateway.query.model.Query;
import com.example.gateway.query.model.QueryNodeVisitor;
import com.example.gateway.query.model.Union;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lowers a Query-AST into JSON filters, one per root collection.
 *
 * <p>Document stores cannot join, so linked entities are addressed as nested fields of the root
 * document. Because a query's root is only known once the whole branch has been visited, attributes
 * are emitted as {@code "{{entity.}}field"} markers and resolved against the schema's entity paths
 * after all branches are grouped by collection.
 */
@Slf4j
public class MongoQueryTranslator implements DatastoreTranslator<MongoQuery> {

    static final Pattern ENTITY_MARKER = Pattern.compile("\\{\\{(.*?)\\.}}");
    private static final Set<String> EQUALITY_OPERATORS = Set.of("eq", "equal");
    private static final String NO_MATCH = "\"$expr\": false";

    private final String alias;
    private final DatastoreSchema schema;
    private final CallOperandRegistry callOperands;

    public MongoQueryTranslator(
            @NonNull String alias,
            @NonNull DatastoreSchema schema,
            @NonNull CallOperandRegistry callOperands) {
        this.alias = alias;
        this.schema = schema;
        this.callOperands = callOperands;
    }

    @Override
    public MongoQuery translate(Union union) {
        log.debug("Translating for [{}]: {}", alias, union);
        Generator generator = new Generator();
        union.walk(generator);
        log.debug("Translated for [{}]: {}", alias, generator.result);
        return new MongoQuery(generator.result);
    }

    /**
     * JSON string body with every opening brace escaped, so literal text never forms an entity marker.
     */
    private static String quote(String text) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(text)).replace("{", "\\u007b");
    }

    private record CollectionFilter(String rootEntity, String filter) {
    }

    private final class Generator implements QueryNodeVisitor {

        private final Deque<String> entities = new ArrayDeque<>();
        private final Deque<List<String>> operands = new ArrayDeque<>();
        private final Deque<String> relations = new ArrayDeque<>();
        private final List<CollectionFilter> filters = new ArrayList<>();
        private final Map<String, String> result = new LinkedHashMap<>();
        private String condition = "{}";

        @Override
        public void visitUnion(Union union) {
            Map<String, List<String>> byRoot = new LinkedHashMap<>();
            for (CollectionFilter filter : filters) {
                byRoot.computeIfAbsent(filter.rootEntity(), k -> new ArrayList<>()).add(filter.filter());
            }

            for (Map.Entry<String, List<String>> entry : byRoot.entrySet()) {
                String root = entry.getKey();
                List<String> rootFilters = entry.getValue();
                String combined = rootFilters.size() == 1
                        ? rootFilters.get(0)
                        : "{ \"$or\": [ " + String.join(", ", rootFilters) + " ] }";
                result.put(collectionOf(root), resolveMarkers(root, combined));
            }
        }

        @Override
        public void visitQuery(Query query) {
            filters.add(new CollectionFilter(entities.pop(), condition));
            condition = "{}";
        }

        /**
         * Linked entities are reached through nested paths instead of joins.
         */
        @Override
        public void visitLink(Link link) {
            entities.clear();
        }

        @Override
        public void visitCondition(Condition condition) {
            this.condition = "{" + relations.pop() + "}";
        }

        @Override
        public void visitConjunction(Conjunction conjunction) {
            relations.push(combine("$and", popRelations(conjunction.clauses().size())));
        }

        @Override
        public void visitDisjunction(Disjunction disjunction) {
            relations.push(combine("$or", popRelations(disjunction.clauses().size())));
        }

        @Override
        public void visitCall(Call call) {
            List<String> frame = operands.pop();
            String operator = frame.get(0);
            List<String> arguments = new ArrayList<>(frame.subList(1, frame.size()));

            // Native equality maps a field name to a value, so the field must come first
            if (EQUALITY_OPERATORS.contains(operator)
                    && (arguments.size() == 2 || arguments.size() == 3)
                    && !ENTITY_MARKER.matcher(arguments.get(0)).find()) {
                Collections.swap(arguments, 0, 1);
            }

            String generated = callOperands.map(operator, arguments);
            List<String> enclosing = operands.peek();
            if (enclosing != null) {
                enclosing.add(generated);
            } else {
                relations.push(generated);
            }
        }

        @Override
        public void visitOperator(Operator operator) {
            List<String> frame = new ArrayList<>();
            frame.add(operator.name());
            operands.push(frame);
        }

        @Override
        public void visitAttribute(Attribute attribute) {
            String entity = entities.pop();
            top(attribute.toString()).add("\"{{" + entity + ".}}" + quote(attribute.name()) + "\"");
        }

        @Override
        public void visitEntity(Entity entity) {
            entities.push(entity.name());
        }

        @Override
        public void visitConstant(Constant constant) {
            String value = switch (constant.type()) {
                case INTEGER -> Long.toString(Long.parseLong(constant.value()));
                case FLOAT -> new BigDecimal(constant.value()).toString();
                case BOOLEAN -> constant.value();
                case STRING -> "\"" + quote(constant.value()) + "\"";
            };
            top(constant.toString()).add(value);
        }

        private String combine(String operator, List<String> clauses) {
            if (clauses.isEmpty()) {
                // An empty AND holds for every document, an empty OR for none
                return "$or".equals(operator) ? NO_MATCH : "";
            }
            if (clauses.size() == 1) {
                return clauses.get(0);
            }
            return clauses.stream()
                    .map(c -> "{" + c + "}")
                    .collect(Collectors.joining(", ", "\"" + operator + "\": [ ", " ]"));
        }

        private String collectionOf(String root) {
            List<String> path = schema.entityPaths().getOrDefault(root, Map.of()).get(root);
            if (path == null) {
                throw new TranslationException(TranslationError.ENTITY_MAPPING_NOT_FOUND, String.format(
                        "no collection of datastore [%s] is mapped to entity [%s]", alias, root));
            }
            return path.get(0);
        }

        private String resolveMarkers(String root, String filter) {
            Map<String, List<String>> paths = schema.entityPaths().getOrDefault(root, Map.of());
            Matcher matcher = ENTITY_MARKER.matcher(filter);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                String entity = matcher.group(1);
                String replacement;
                if (entity.equals(root)) {
                    replacement = "";
                } else {
                    List<String> path = paths.get(entity);
                    if (path == null) {
                        throw new TranslationException(TranslationError.ENTITY_MAPPING_NOT_FOUND, String.format(
                                "unable to find mapping for entity \"%s\" in collection \"%s\"", entity, root));
                    }
                    replacement = String.join(".", path.subList(1, path.size())) + ".";
                }
                matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            matcher.appendTail(sb);
            return sb.toString();
        }

        private List<String> top(String operand) {
            List<String> frame = operands.peek();
            if (frame == null) {
                throw new TranslationException(TranslationError.INVALID_REQUEST,
                        "operand [" + operand + "] appears outside of a call");
            }
            return frame;
        }

        private List<String> popRelations(int count) {
            List<String> popped = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                popped.add(0, relations.pop());
            }
            return popped;
        }
    }
}
