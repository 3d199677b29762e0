package com.poc.xlstaging.dto;

import java.util.Locale;
import java.util.Optional;

/**
 * Expected value type a schema declares for a spreadsheet cell.
 */
public enum FieldType {
    STRING,
    INTEGER,
    FLOAT,
    DATETIME,
    BOOLEAN;

    /**
     * Resolves the type names used in schema documents ("string", "str", "int", "datetime", ...).
     */
    public static Optional<FieldType> fromSchemaName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "string":
            case "str":
                return Optional.of(STRING);
            case "integer":
            case "int":
                return Optional.of(INTEGER);
            case "float":
            case "double":
                return Optional.of(FLOAT);
            case "datetime":
                return Optional.of(DATETIME);
            case "boolean":
            case "bool":
                return Optional.of(BOOLEAN);
            default:
                return Optional.empty();
        }
    }

    public String getSchemaName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
