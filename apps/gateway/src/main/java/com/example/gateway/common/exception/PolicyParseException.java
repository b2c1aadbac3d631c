package com.example.gateway.common.exception;

/**
 * Raised when a partial-evaluation result cannot be read.
 */
public class PolicyParseException extends GatewayException {

    public PolicyParseException(String message) {
        super(message);
    }

    public PolicyParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
