package com.example.gateway.common.exception;

/**
 * Raised at startup when datastores, entity schemas or call operands are misconfigured.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
