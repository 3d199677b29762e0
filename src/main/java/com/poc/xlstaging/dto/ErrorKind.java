package com.poc.xlstaging.dto;

/**
 * Failure kinds that may cross a component boundary.
 * Presentation callers map these codes to user copy.
 */
public enum ErrorKind {
    FILE_ERROR("file_error"),
    CONVERSION_FAILED("conversion_failed"),
    MISSING_ID("missing_id"),
    INVALID_ID("invalid_id"),
    SCHEMA_NOT_FOUND("schema_not_found"),
    SCHEMA_INVALID("schema_invalid"),
    SCHEMA_MANIFEST_MISSING("schema_manifest_missing"),
    MALFORMED_ADDRESS("malformed_address"),
    COMPOUND_FIELD_INVALID("compound_field_invalid"),
    VALIDATION_ERROR("validation_error"),
    DATABASE_ERROR("database_error");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
