package com.example.gateway.common.exception;

import java.util.List;

/**
 * Raised while turning a partial evaluation into a native datastore query.
 */
public class TranslationException extends GatewayException {

    private final TranslationError error;
    private final List<String> causes;

    public TranslationException(TranslationError error, String message) {
        super(String.format("%s: %s", error, message));
        this.error = error;
        this.causes = List.of(message);
    }

    public TranslationException(TranslationError error, List<String> causes) {
        super(String.format("%s: %s", error, String.join("; ", causes)));
        this.error = error;
        this.causes = List.copyOf(causes);
    }

    public TranslationError getError() {
        return error;
    }

    public List<String> getCauses() {
        return causes;
    }
}
