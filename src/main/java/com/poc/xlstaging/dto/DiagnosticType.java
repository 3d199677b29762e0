package com.poc.xlstaging.dto;

public enum DiagnosticType {
    LABEL_MISMATCH,
    VALUE_COERCED,
    VALUE_DROPPED,
    PLACEHOLDER_VALUE,
    SCHEMA_ALIASED,
    TAB_SKIPPED,
    DUPLICATE_FIELD
}
