package com.example.gateway.datastore.mongo;

import com.example.gateway.common.exception.ExecutionException;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MongoDatastoreExecutor")
class MongoDatastoreExecutorTest {

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    private MongoDatastoreExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new MongoDatastoreExecutor("mongo", mongoTemplate, Duration.ofSeconds(2), Duration.ofMillis(200));
    }

    private static MongoQuery query(String... collectionAndFilter) {
        Map<String, String> filters = new LinkedHashMap<>();
        for (int i = 0; i < collectionAndFilter.length; i += 2) {
            filters.put(collectionAndFilter[i], collectionAndFilter[i + 1]);
        }
        return new MongoQuery(filters);
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        @DisplayName("should allow when any collection has a match")
        void shouldAllowWhenAnyCountPositive() {
            when(mongoTemplate.count(any(Query.class), eq("apps"))).thenReturn(Mono.just(0L));
            when(mongoTemplate.count(any(Query.class), eq("users"))).thenReturn(Mono.just(2L));

            StepVerifier.create(executor.execute(query("apps", "{\"name\": \"chat\"}", "users", "{\"id\": 5}")))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when no collection has a match")
        void shouldDenyWhenAllCountsZero() {
            when(mongoTemplate.count(any(Query.class), eq("apps"))).thenReturn(Mono.just(0L));

            StepVerifier.create(executor.execute(query("apps", "{\"name\": \"chat\"}")))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should pass the parsed filter to the count")
        void shouldParseFilter() {
            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            when(mongoTemplate.count(captor.capture(), eq("apps"))).thenReturn(Mono.just(1L));

            StepVerifier.create(executor.execute(query("apps", "{\"owner.name\": \"bob\"}")))
                    .expectNext(true)
                    .verifyComplete();

            assertThat(captor.getValue().getQueryObject()).isEqualTo(new Document("owner.name", "bob"));
        }

        @Test
        @DisplayName("should deny without querying when there are no filters")
        void shouldDenyEmptyQuery() {
            StepVerifier.create(executor.execute(new MongoQuery(Map.of())))
                    .expectNext(false)
                    .verifyComplete();

            verifyNoInteractions(mongoTemplate);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should wrap driver errors")
        void shouldWrapDriverErrors() {
            when(mongoTemplate.count(any(Query.class), eq("apps")))
                    .thenReturn(Mono.error(new IllegalStateException("connection reset")));

            StepVerifier.create(executor.execute(query("apps", "{\"name\": \"chat\"}")))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(ExecutionException.class)
                            .hasMessageContaining("connection reset"))
                    .verify();
        }

        @Test
        @DisplayName("should fail a collection count that exceeds its timeout")
        void shouldTimeOutCollection() {
            when(mongoTemplate.count(any(Query.class), eq("apps"))).thenReturn(Mono.never());

            StepVerifier.create(executor.execute(query("apps", "{\"name\": \"chat\"}")))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(ExecutionException.class)
                            .hasMessageContaining("collection [apps] timed out"))
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should reject malformed filters")
        void shouldRejectMalformedFilter() {
            StepVerifier.create(executor.execute(query("apps", "{\"name\": ")))
                    .expectError(ExecutionException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("should ping with the server command")
    void shouldPing() {
        when(mongoTemplate.executeCommand("{ping: 1}")).thenReturn(Mono.just(new Document("ok", 1.0)));

        StepVerifier.create(executor.ping()).verifyComplete();

        verify(mongoTemplate).executeCommand("{ping: 1}");
    }
}
