package com.example.gateway.common.exception;

/**
 * Base type for every failure raised by the query-compilation engine.
 * The decision layer treats any subtype as a deny.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
