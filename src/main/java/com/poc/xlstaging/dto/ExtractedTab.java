package com.poc.xlstaging.dto;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed contents of one worksheet tab, in schema field order.
 */
@Value
public class ExtractedTab {

    String tabName;
    String schemaId;
    Map<String, FieldValue> fields;
    List<Diagnostic> diagnostics;

    public ExtractedTab(String tabName, String schemaId, Map<String, FieldValue> fields, List<Diagnostic> diagnostics) {
        this.tabName = tabName;
        this.schemaId = schemaId;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.diagnostics = List.copyOf(diagnostics);
    }
}
