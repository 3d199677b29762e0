package com.poc.xlstaging.dto;

import lombok.Value;

/**
 * Recoverable, non-fatal issue found while extracting a workbook.
 */
@Value
public class Diagnostic {

    DiagnosticType type;
    String tabName;
    /** Null for tab-level diagnostics. */
    String fieldName;
    String message;

    public static Diagnostic forTab(DiagnosticType type, String tabName, String message) {
        return new Diagnostic(type, tabName, null, message);
    }

    public static Diagnostic forField(DiagnosticType type, String tabName, String fieldName, String message) {
        return new Diagnostic(type, tabName, fieldName, message);
    }

    @Override
    public String toString() {
        return type + " [" + tabName + (fieldName == null ? "" : "." + fieldName) + "] " + message;
    }
}
