package com.example.gateway.datastore.sql;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lowers a Query-AST into one parameterized {@code SELECT count(*)} statement, branches joined
 * with {@code UNION}.
 *
 * <p>Linked entities become {@code INNER JOIN}s. Each join takes as its {@code ON} predicate the
 * top-level conjuncts that reference the joined table and otherwise only tables already in scope;
 * whatever is left stays in {@code WHERE}. Literals are never inlined: they are bound as positional
 * parameters, numbered in the order they appear in the final text.
 */
@Slf4j
public class SqlQueryTranslator implements DatastoreTranslator<SqlStatement> {

    private static final Pattern PARAMETER_MARKER = Pattern.compile("\\{\\{\\?(\\d+)}}");

    private final String alias;
    private final SqlDialect dialect;
    private final DatastoreSchema schema;
    private final CallOperandRegistry callOperands;

    public SqlQueryTranslator(
            @NonNull String alias,
            @NonNull SqlDialect dialect,
            @NonNull DatastoreSchema schema,
            @NonNull CallOperandRegistry callOperands) {
        this.alias = alias;
        this.dialect = dialect;
        this.schema = schema;
        this.callOperands = callOperands;
    }

    @Override
    public SqlStatement translate(Union union) {
        log.debug("Translating for [{}]: {}", alias, union);
        Generator generator = new Generator();
        union.walk(generator);
        SqlStatement statement = generator.finish();
        log.debug("Translated for [{}]: {} params: {}", alias, statement.text(), statement.parameters());
        return statement;
    }

    private record Table(String qualifiedName, String name) {
    }

    /**
     * Operand list of a call being generated, plus the tables its arguments touch.
     */
    private record Frame(String operator, List<String> arguments, Set<String> tables) {
        Frame(String operator) {
            this(operator, new ArrayList<>(), new LinkedHashSet<>());
        }
    }

    /**
     * Generated predicate. {@code parts} is null for an atomic predicate, otherwise the flattened
     * top-level conjuncts it is made of.
     */
    private record Relation(String text, Set<String> tables, List<Relation> parts) {

        static final Relation EMPTY = new Relation("", Set.of(), List.of());

        static Relation atom(String text, Set<String> tables) {
            return new Relation(text, tables, null);
        }

        List<Relation> conjuncts() {
            return parts == null ? List.of(this) : parts;
        }
    }

    /**
     * Single-use visitor holding the generation stacks for one translation.
     */
    private final class Generator implements QueryNodeVisitor {

        private final Deque<Table> entities = new ArrayDeque<>();
        private final Deque<Frame> operands = new ArrayDeque<>();
        private final Deque<Relation> relations = new ArrayDeque<>();
        private final List<Table> joins = new ArrayList<>();
        private final List<String> selects = new ArrayList<>();
        private final List<Object> values = new ArrayList<>();
        private Relation condition = Relation.EMPTY;
        private String result = "";

        @Override
        public void visitUnion(Union union) {
            result = String.join(" UNION ", selects);
            selects.clear();
        }

        @Override
        public void visitQuery(Query query) {
            Table from = entities.pop();
            StringBuilder select = new StringBuilder("SELECT count(*) FROM ").append(from.qualifiedName());

            String where = condition.text();
            if (!joins.isEmpty()) {
                Set<String> inScope = new LinkedHashSet<>();
                inScope.add(from.name());
                List<Relation> remaining = new ArrayList<>(condition.conjuncts());

                for (Table joined : joins) {
                    inScope.add(joined.name());
                    List<Relation> on = remaining.stream()
                            .filter(r -> r.tables().contains(joined.name()) && inScope.containsAll(r.tables()))
                            .toList();
                    remaining.removeAll(on);
                    select.append(" INNER JOIN ").append(joined.qualifiedName())
                            .append(" ON ").append(on.isEmpty() ? "1 = 1" : conjoin(on));
                }
                where = remaining.isEmpty() ? "" : conjoin(remaining);
            }
            if (!where.isEmpty()) {
                select.append(" WHERE ").append(where);
            }

            selects.add(select.toString());
            joins.clear();
            condition = Relation.EMPTY;
        }

        @Override
        public void visitLink(Link link) {
            List<Table> linked = popEntities(link.entities().size());
            joins.addAll(linked);
        }

        @Override
        public void visitCondition(Condition condition) {
            this.condition = relations.pop();
        }

        @Override
        public void visitConjunction(Conjunction conjunction) {
            List<Relation> clauses = popRelations(conjunction.clauses().size());
            if (clauses.isEmpty()) {
                relations.push(Relation.EMPTY);
            } else if (clauses.size() == 1) {
                relations.push(clauses.get(0));
            } else {
                List<Relation> parts = clauses.stream()
                        .flatMap(c -> c.conjuncts().stream())
                        .toList();
                relations.push(new Relation(join(clauses, " AND "), tablesOf(clauses), parts));
            }
        }

        @Override
        public void visitDisjunction(Disjunction disjunction) {
            List<Relation> clauses = popRelations(disjunction.clauses().size());
            if (clauses.isEmpty()) {
                relations.push(Relation.atom("1 = 0", Set.of()));
            } else if (clauses.size() == 1) {
                relations.push(clauses.get(0));
            } else {
                relations.push(Relation.atom(join(clauses, " OR "), tablesOf(clauses)));
            }
        }

        @Override
        public void visitCall(Call call) {
            Frame frame = operands.pop();
            String generated = callOperands.map(frame.operator(), frame.arguments());

            Frame enclosing = operands.peek();
            if (enclosing != null) {
                enclosing.arguments().add(generated);
                enclosing.tables().addAll(frame.tables());
            } else {
                relations.push(Relation.atom(generated, frame.tables()));
            }
        }

        @Override
        public void visitOperator(Operator operator) {
            operands.push(new Frame(operator.name()));
        }

        @Override
        public void visitAttribute(Attribute attribute) {
            Table table = entities.pop();
            Frame frame = top(attribute.toString());
            frame.arguments().add(table.name() + "." + attribute.name());
            frame.tables().add(table.name());
        }

        @Override
        public void visitEntity(Entity entity) {
            var resolved = schema.findEntity(entity.name())
                    .orElseThrow(() -> new TranslationException(TranslationError.SCHEMA_MISMATCH, String.format(
                            "no schema of datastore [%s] contains entity [%s]", alias, entity.name())));
            String table = resolved.entity().name();
            String qualified = dialect.omitsSchema(resolved.schemaName())
                    ? table
                    : resolved.schemaName() + "." + table;
            entities.push(new Table(qualified, table));
        }

        @Override
        public void visitConstant(Constant constant) {
            values.add(constant.value());
            top(constant.toString()).arguments().add("{{?" + (values.size() - 1) + "}}");
        }

        private SqlStatement finish() {
            List<Object> parameters = new ArrayList<>();
            Matcher matcher = PARAMETER_MARKER.matcher(result);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                parameters.add(values.get(Integer.parseInt(matcher.group(1))));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(dialect.placeholder(parameters.size())));
            }
            matcher.appendTail(sb);
            return new SqlStatement(sb.toString(), parameters);
        }

        private Frame top(String operand) {
            Frame frame = operands.peek();
            if (frame == null) {
                throw new TranslationException(TranslationError.INVALID_REQUEST,
                        "operand [" + operand + "] appears outside of a call");
            }
            return frame;
        }

        private List<Table> popEntities(int count) {
            List<Table> popped = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                popped.add(0, entities.pop());
            }
            return popped;
        }

        private List<Relation> popRelations(int count) {
            List<Relation> popped = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                popped.add(0, relations.pop());
            }
            return popped;
        }

        private String conjoin(List<Relation> conjuncts) {
            return conjuncts.size() == 1 ? conjuncts.get(0).text() : join(conjuncts, " AND ");
        }

        private String join(List<Relation> clauses, String operator) {
            return clauses.stream().map(Relation::text).collect(Collectors.joining(operator, "(", ")"));
        }

        private Set<String> tablesOf(List<Relation> clauses) {
            Set<String> tables = new LinkedHashSet<>();
            clauses.forEach(c -> tables.addAll(c.tables()));
            return tables;
        }
    }
}
