package com.example.gateway.common.exception;

/**
 * Per-request translation failure codes. Bounded set, safe to use as a metric tag.
 */
public enum TranslationError {
    REFERENCE_MISMATCH,
    INVALID_REFERENCE,
    SELF_LINK,
    UNDEFINED_VARIABLE,
    INVALID_REQUEST,
    SCHEMA_MISMATCH,
    UNSUPPORTED_OPERATOR,
    WRONG_ARGUMENT_COUNT,
    ENTITY_MAPPING_NOT_FOUND
}
