package com.example.gateway.datastore;

import reactor.core.publisher.Mono;

/**
 * Runs a native query and reduces the result to allow ({@code true}) or deny.
 */
public interface DatastoreExecutor<Q extends DatastoreQuery> {

    Mono<Boolean> execute(Q query);

    /**
     * Lightweight round trip used by the health indicator.
     */
    Mono<Void> ping();
}
