package com.example.gateway.datastore;

import com.example.gateway.query.model.Union;

/**
 * Lowers a Query-AST into a backend-native query. Implementations are pure and thread-safe.
 */
@FunctionalInterface
public interface DatastoreTranslator<Q extends DatastoreQuery> {

    Q translate(Union union);
}
