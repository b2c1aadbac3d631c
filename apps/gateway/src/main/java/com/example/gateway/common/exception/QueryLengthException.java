package com.example.gateway.common.exception;

/**
 * Raised when a generated statement exceeds the configured huge-query size.
 */
public class QueryLengthException extends ExecutionException {

    private final int length;
    private final int limit;

    public QueryLengthException(String datastore, int length, int limit) {
        super(datastore, String.format("Query length %d exceeds configured limit of %d", length, limit));
        this.length = length;
        this.limit = limit;
    }

    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
