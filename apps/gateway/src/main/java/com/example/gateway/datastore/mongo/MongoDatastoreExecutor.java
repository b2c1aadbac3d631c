package com.example.gateway.datastore.mongo;

import com.example.gateway.common.exception.ExecutionException;
import com.example.gateway.common.exception.GatewayException;
import com.example.gateway.datastore.DatastoreExecutor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Counts matching documents in every collection of a {@link MongoQuery} concurrently.
 *
 * <p>Each count has its own sub-timeout; the whole fan-out is bound by the overall timeout, which
 * cancels outstanding counts when it fires. The first failing count fails the execution. Allows when
 * any collection has a match.
 */
@Slf4j
public class MongoDatastoreExecutor implements DatastoreExecutor<MongoQuery> {

    private final String alias;
    private final ReactiveMongoTemplate mongoTemplate;
    private final Duration timeout;
    private final Duration collectionTimeout;

    public MongoDatastoreExecutor(
            @NonNull String alias,
            @NonNull ReactiveMongoTemplate mongoTemplate,
            @NonNull Duration timeout,
            @NonNull Duration collectionTimeout) {
        this.alias = alias;
        this.mongoTemplate = mongoTemplate;
        this.timeout = timeout;
        this.collectionTimeout = collectionTimeout;
    }

    @Override
    public Mono<Boolean> execute(MongoQuery query) {
        Map<String, String> filters = query.filters();
        if (filters.isEmpty()) {
            return Mono.just(Boolean.FALSE);
        }

        return Flux.fromIterable(filters.entrySet())
                .flatMap(entry -> count(entry.getKey(), entry.getValue()), filters.size())
                .collectList()
                .map(counts -> counts.stream().anyMatch(count -> count > 0))
                .timeout(timeout)
                .doOnNext(allowed -> log.debug("Datastore [{}] returned allowed={}", alias, allowed))
                .onErrorMap(e -> !(e instanceof GatewayException),
                        e -> toExecutionException(e, "query timed out after " + timeout));
    }

    @Override
    public Mono<Void> ping() {
        return mongoTemplate.executeCommand("{ping: 1}").then();
    }

    private Mono<Long> count(String collection, String filter) {
        return Mono.fromCallable(() -> new BasicQuery(Document.parse(filter)))
                .flatMap(query -> mongoTemplate.count(query, collection))
                .timeout(collectionTimeout)
                .doOnNext(count -> log.debug("Datastore [{}] collection [{}] matched {} documents",
                        alias, collection, count))
                .onErrorMap(e -> !(e instanceof GatewayException), e -> toExecutionException(e,
                        String.format("count on collection [%s] timed out after %s", collection, collectionTimeout)));
    }

    private ExecutionException toExecutionException(Throwable e, String timeoutMessage) {
        if (e instanceof TimeoutException) {
            log.error("Datastore [{}]: {}", alias, timeoutMessage);
            return new ExecutionException(alias, timeoutMessage, e);
        }
        log.error("Datastore [{}] query failed: {}", alias, e.getMessage());
        return new ExecutionException(alias, "query failed: " + e.getMessage(), e);
    }
}
