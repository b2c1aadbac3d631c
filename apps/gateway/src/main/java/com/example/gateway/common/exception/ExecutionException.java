package com.example.gateway.common.exception;

/**
 * Raised when running a native query fails (driver, connection or timeout).
 */
public class ExecutionException extends GatewayException {

    private final String datastore;

    public ExecutionException(String datastore, String message) {
        super(String.format("Datastore [%s]: %s", datastore, message));
        this.datastore = datastore;
    }

    public ExecutionException(String datastore, String message, Throwable cause) {
        super(String.format("Datastore [%s]: %s", datastore, message), cause);
        this.datastore = datastore;
    }

    public String getDatastore() {
        return datastore;
    }
}
