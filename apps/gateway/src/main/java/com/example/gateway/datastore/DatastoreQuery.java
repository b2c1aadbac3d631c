package com.example.gateway.datastore;

import java.util.List;

/**
 * Native query produced by a {@link DatastoreTranslator}.
 */
public interface DatastoreQuery {

    /**
     * Statement in the form the executor consumes (SQL text or collection filters).
     */
    Object statement();

    List<Object> parameters();

    /**
     * Size of the generated text, checked against the huge-query limit.
     */
    int length();
}
