package com.example.gateway.datastore;

import com.example.gateway.query.model.Union;
import reactor.core.publisher.Mono;

/**
 * A configured backend: translates a Query-AST and executes it.
 */
public interface Datastore {

    String alias();

    DatastoreType type();

    /**
     * Emits {@code true} when any branch of the union matches at least one row or document.
     * Translation and execution failures are signalled as errors.
     */
    Mono<Boolean> execute(Union union);

    Mono<Void> ping();
}
