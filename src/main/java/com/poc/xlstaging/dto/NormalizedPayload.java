package com.poc.xlstaging.dto;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole-workbook extraction result: metadata, the schema manifest, and every extracted data tab.
 */
@Value
public class NormalizedPayload {

    public static final String SECTOR_KEY = "sector";

    Map<String, Object> metadata;
    /** Data tab name to declared schema name, in manifest order. */
    Map<String, String> schemaManifest;
    Map<String, ExtractedTab> tabs;
    List<String> skippedTabs;
    List<Diagnostic> diagnostics;

    public NormalizedPayload(Map<String, Object> metadata,
                             Map<String, String> schemaManifest,
                             Map<String, ExtractedTab> tabs,
                             List<String> skippedTabs,
                             List<Diagnostic> diagnostics) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.schemaManifest = Collections.unmodifiableMap(new LinkedHashMap<>(schemaManifest));
        this.tabs = Collections.unmodifiableMap(new LinkedHashMap<>(tabs));
        this.skippedTabs = List.copyOf(skippedTabs);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getSector() {
        Object sector = metadata.get(SECTOR_KEY);
        return sector == null ? null : sector.toString().trim();
    }

    /**
     * Merges the extracted tabs into one field map in manifest order and adds the sector from metadata.
     * A field already supplied by an earlier tab keeps that tab's value.
     */
    public FlattenedFields flatten() {
        Map<String, FieldValue> flat = new LinkedHashMap<>();
        List<Diagnostic> duplicates = new ArrayList<>();
        for (ExtractedTab tab : tabs.values()) {
            for (Map.Entry<String, FieldValue> entry : tab.getFields().entrySet()) {
                if (flat.containsKey(entry.getKey())) {
                    duplicates.add(Diagnostic.forField(DiagnosticType.DUPLICATE_FIELD, tab.getTabName(), entry.getKey(),
                            "Field already supplied by an earlier tab; value from this tab ignored"));
                    continue;
                }
                flat.put(entry.getKey(), entry.getValue());
            }
        }
        String sector = getSector();
        if (sector != null && !sector.isEmpty() && !flat.containsKey(SECTOR_KEY)) {
            flat.put(SECTOR_KEY, FieldValue.ofString(sector));
        }
        return new FlattenedFields(flat, duplicates);
    }

    @Value
    public static class FlattenedFields {
        Map<String, FieldValue> fields;
        List<Diagnostic> diagnostics;
    }
}
