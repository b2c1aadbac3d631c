package com.example.gateway.datastore.mongo;

import com.example.gateway.common.exception.TranslationError;
import com.example.gateway.common.exception.TranslationException;
import com.example.gateway.datastore.DatastoreType;
import com.example.gateway.datastore.operand.CallOperandLoader;
import com.example.gateway.datastore.operand.CallOperandRegistry;
import com.example.gateway.datastore.schema.DatastoreSchema;
import com.example.gateway.datastore.schema.EntityDefinition;
import com.example.gateway.datastore.schema.EntitySchema;
import com.example.gateway.query.model.Attribute;
import com.example.gateway.query.model.Call;
import com.example.gateway.query.model.Condition;
import com.example.gateway.query.model.Conjunction;
import com.example.gateway.query.model.Constant;
import com.example.gateway.query.model.Disjunction;
import com.example.gateway.query.model.Entity;
import com.example.gateway.query.model.Link;
import com.example.gateway.query.model.Query;
import com.example.gateway.query.model.Union;
import org.bson.Document;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("MongoQueryTranslator")
class MongoQueryTranslatorTest {

    private static final Entity APPS = new Entity("apps");

    private static CallOperandRegistry callOperands;

    private final DatastoreSchema schema = DatastoreSchema.of("appstore", EntitySchema.of(
            new EntityDefinition("apps", null, List.of(
                    new EntityDefinition("owner", null, List.of(EntityDefinition.of("address"))))),
            new EntityDefinition("app_catalog", "catalog", List.of())));

    private final MongoQueryTranslator translator = new MongoQueryTranslator("mongo", schema, callOperands);

    @BeforeAll
    static void loadCallOperands() {
        callOperands = new CallOperandLoader().loadAll(List.of(DatastoreType.MONGO), null).get(DatastoreType.MONGO);
    }

    private static Query query(Entity from, Link link, Call... relations) {
        return new Query(from, link, new Condition(Conjunction.of(relations)));
    }

    @Nested
    @DisplayName("filters")
    class Filters {

        @Test
        @DisplayName("should strip the root marker from fields")
        void shouldTranslateSimpleEquality() {
            MongoQuery result = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("eq", Attribute.of("apps", "name"), Constant.of("chat")))));

            assertThat(result.filters()).containsExactly(entry("apps", "{\"name\": \"chat\"}"));
        }

        @Test
        @DisplayName("should put the field first regardless of operand order")
        void shouldSwapEqualityOperands() {
            MongoQuery fieldFirst = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("equal", Attribute.of("apps", "stars"), Constant.of("5")))));
            MongoQuery valueFirst = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("equal", Constant.of("5"), Attribute.of("apps", "stars")))));

            assertThat(valueFirst).isEqualTo(fieldFirst);
            assertThat(valueFirst.filters()).containsEntry("apps", "{\"stars\": 5}");
        }

        @Test
        @DisplayName("should render conjunctions as $and and disjunctions as $or")
        void shouldRenderBooleanStructure() {
            Query query = new Query(APPS, Link.empty(), new Condition(Conjunction.of(
                    Call.of("gt", Attribute.of("apps", "stars"), Constant.of("3")),
                    Disjunction.of(
                            Call.of("eq", Attribute.of("apps", "public"), Constant.ofBoolean(true)),
                            Call.of("neq", Attribute.of("apps", "state"), Constant.of("hidden"))))));

            MongoQuery result = translator.translate(Union.of(query));

            assertThat(result.filters()).containsEntry("apps",
                    "{\"$and\": [ {\"stars\": { \"$gt\": 3 }}, "
                            + "{\"$or\": [ {\"public\": true}, {\"state\": { \"$ne\": \"hidden\" }} ]} ]}");
        }

        @Test
        @DisplayName("should escape string constants")
        void shouldEscapeStrings() {
            MongoQuery result = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("eq", Attribute.of("apps", "name"), Constant.of("say \"hi\"")))));

            assertThat(result.filters()).containsEntry("apps", "{\"name\": \"say \\\"hi\\\"\"}");
        }
    }

    @Nested
    @DisplayName("literal values")
    class LiteralValues {

        @Test
        @DisplayName("should keep marker-like text inside string constants")
        void shouldNotResolveMarkersInStrings() {
            MongoQuery fieldFirst = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("eq", Attribute.of("apps", "owner_id"), Constant.of("{{apps.}}alice")))));
            MongoQuery valueFirst = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("eq", Constant.of("{{apps.}}alice"), Attribute.of("apps", "owner_id")))));

            String filter = fieldFirst.filters().get("apps");
            assertThat(filter).isEqualTo("{\"owner_id\": \"\\u007b\\u007bapps.}}alice\"}");
            assertThat(Document.parse(filter).getString("owner_id")).isEqualTo("{{apps.}}alice");
            assertThat(valueFirst).isEqualTo(fieldFirst);
        }

        @Test
        @DisplayName("should not treat nested entity markers in strings as paths")
        void shouldNotResolveNestedMarkersInStrings() {
            MongoQuery result = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("eq", Attribute.of("apps", "owner_id"), Constant.of("{{owner.}}alice")))));

            assertThat(Document.parse(result.filters().get("apps")).getString("owner_id"))
                    .isEqualTo("{{owner.}}alice");
        }

        @Test
        @DisplayName("should normalise signed and bare-point numerals into valid JSON")
        void shouldNormaliseNumerals() {
            MongoQuery result = translator.translate(Union.of(query(APPS, Link.empty(),
                    Call.of("eq", Attribute.of("apps", "stars"), Constant.of("+5")),
                    Call.of("eq", Attribute.of("apps", "rating"), Constant.of(".5")),
                    Call.of("eq", Attribute.of("apps", "price"), Constant.of("5.")),
                    Call.of("eq", Attribute.of("apps", "rank"), Constant.of("007")))));

            String filter = result.filters().get("apps");
            assertThat(filter).isEqualTo("{\"$and\": [ {\"stars\": 5}, {\"rating\": 0.5}, "
                    + "{\"price\": 5}, {\"rank\": 7} ]}");
            assertThat(Document.parse(filter).getList("$and", Document.class))
                    .extracting(d -> d.values().iterator().next())
                    .containsExactly(5, 0.5, 5, 7);
        }

        @Test
        @DisplayName("should match nothing for an empty disjunction")
        void shouldRenderEmptyDisjunctionAsNoMatch() {
            Query query = new Query(APPS, Link.empty(), new Condition(Conjunction.of(
                    Call.of("eq", Attribute.of("apps", "name"), Constant.of("chat")),
                    Disjunction.of())));

            MongoQuery result = translator.translate(Union.of(query));

            assertThat(result.filters()).containsEntry("apps",
                    "{\"$and\": [ {\"name\": \"chat\"}, {\"$expr\": false} ]}");
        }

        @Test
        @DisplayName("should match everything for an empty conjunction")
        void shouldRenderEmptyConjunctionAsMatchAll() {
            MongoQuery result = translator.translate(Union.of(query(APPS, Link.empty())));

            assertThat(result.filters()).containsEntry("apps", "{}");
        }
    }

    @Nested
    @DisplayName("nesting and grouping")
    class NestingAndGrouping {

        @Test
        @DisplayName("should address linked entities through their nested path")
        void shouldResolveNestedPaths() {
            MongoQuery result = translator.translate(Union.of(query(APPS,
                    new Link(List.of(new Entity("owner"), new Entity("address"))),
                    Call.of("eq", Attribute.of("owner", "name"), Constant.of("bob")),
                    Call.of("eq", Attribute.of("address", "city"), Constant.of("Oslo")))));

            assertThat(result.filters()).containsEntry("apps",
                    "{\"$and\": [ {\"owner.name\": \"bob\"}, {\"owner.address.city\": \"Oslo\"} ]}");
        }

        @Test
        @DisplayName("should combine branches on the same collection with $or")
        void shouldGroupByCollection() {
            MongoQuery result = translator.translate(Union.of(
                    query(APPS, Link.empty(), Call.of("eq", Attribute.of("apps", "name"), Constant.of("chat"))),
                    query(new Entity("catalog"), Link.empty(),
                            Call.of("eq", Attribute.of("catalog", "id"), Constant.of("7"))),
                    query(APPS, Link.empty(), Call.of("eq", Attribute.of("apps", "stars"), Constant.of("5")))));

            assertThat(result.filters()).containsExactly(
                    entry("apps", "{ \"$or\": [ {\"name\": \"chat\"}, {\"stars\": 5} ] }"),
                    entry("app_catalog", "{\"id\": 7}"));
        }

        @Test
        @DisplayName("should fail when a linked entity is not nested under the root")
        void shouldFailOnMissingMapping() {
            Union union = Union.of(query(APPS, new Link(List.of(new Entity("catalog"))),
                    Call.of("eq", Attribute.of("catalog", "id"), Constant.of("7"))));

            assertThatThrownBy(() -> translator.translate(union))
                    .isInstanceOfSatisfying(TranslationException.class,
                            e -> assertThat(e.getError()).isEqualTo(TranslationError.ENTITY_MAPPING_NOT_FOUND));
        }

        @Test
        @DisplayName("should fail when the root is not a collection")
        void shouldFailOnNestedRoot() {
            Union union = Union.of(query(new Entity("owner"), Link.empty(),
                    Call.of("eq", Attribute.of("owner", "name"), Constant.of("bob"))));

            assertThatThrownBy(() -> translator.translate(union))
                    .isInstanceOfSatisfying(TranslationException.class,
                            e -> assertThat(e.getError()).isEqualTo(TranslationError.ENTITY_MAPPING_NOT_FOUND));
        }
    }
}
