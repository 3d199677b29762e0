package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.CellAddress;
import com.poc.xlstaging.dto.Diagnostic;
import com.poc.xlstaging.dto.DiagnosticType;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.ExtractedTab;
import com.poc.xlstaging.dto.NormalizedPayload;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaVersion;
import com.poc.xlstaging.service.schema.SchemaCatalog;
import com.poc.xlstaging.service.schema.SchemaCatalogProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a whole workbook into a {@link NormalizedPayload}. The reserved tabs describe the workbook: {@code _json_schema}
 * maps each data tab to its schema name and {@code _json_metadata} carries free-form key/values such as the sector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkbookIngestor {

    public static final String METADATA_TAB = "_json_metadata";
    public static final String SCHEMA_TAB = "_json_schema";
    public static final CellAddress TABLE_ANCHOR = new CellAddress("B", 15);

    private final SchemaCatalogProvider schemaCatalogProvider;
    private final FieldExtractor fieldExtractor;

    public Result<NormalizedPayload> ingest(WorkbookReader reader) {
        if (!reader.hasSheet(SCHEMA_TAB)) {
            return Result.failure(ErrorKind.SCHEMA_MANIFEST_MISSING,
                    "Workbook has no '" + SCHEMA_TAB + "' tab; tabs present: " + reader.getSheetNames());
        }
        Map<String, String> manifest = readKeyValueTable(reader, SCHEMA_TAB);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (reader.hasSheet(METADATA_TAB)) {
            metadata.putAll(readKeyValueTable(reader, METADATA_TAB));
        } else {
            log.debug("Workbook has no '{}' tab", METADATA_TAB);
        }

        SchemaCatalog catalog = schemaCatalogProvider.current();
        Map<String, ExtractedTab> tabs = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Map.Entry<String, String> entry : manifest.entrySet()) {
            String tabName = entry.getKey();
            String schemaName = entry.getValue();

            if (METADATA_TAB.equals(tabName) || SCHEMA_TAB.equals(tabName)) {
                skip(tabName, "reserved tab listed in the schema manifest", skipped, diagnostics);
                continue;
            }
            if (!reader.hasSheet(tabName)) {
                skip(tabName, "tab listed in the schema manifest does not exist", skipped, diagnostics);
                continue;
            }
            Result<SchemaVersion> schema = catalog.resolve(schemaName);
            if (schema.isFailure()) {
                skip(tabName, schema.getMessage(), skipped, diagnostics);
                continue;
            }
            Optional<String> aliasTarget = catalog.aliasTarget(schemaName);
            if (aliasTarget.isPresent() && !catalog.getSchemaNames().contains(schemaName)) {
                diagnostics.add(Diagnostic.forTab(DiagnosticType.SCHEMA_ALIASED, tabName,
                        "Schema '" + schemaName + "' is retired; used '" + aliasTarget.get() + "'"));
            }

            Result<ExtractedTab> extracted = fieldExtractor.extract(reader, tabName, schema.getValue());
            if (extracted.isFailure()) {
                return extracted.propagate();
            }
            tabs.put(tabName, extracted.getValue());
            diagnostics.addAll(extracted.getValue().getDiagnostics());
        }

        log.info("Ingested {} tab(s), skipped {}, {} diagnostic(s)", tabs.size(), skipped.size(), diagnostics.size());
        return Result.success(new NormalizedPayload(metadata, manifest, tabs, skipped, diagnostics));
    }

    private void skip(String tabName, String reason, List<String> skipped, List<Diagnostic> diagnostics) {
        log.warn("Skipping tab '{}': {}", tabName, reason);
        skipped.add(tabName);
        diagnostics.add(Diagnostic.forTab(DiagnosticType.TAB_SKIPPED, tabName, reason));
    }

    /**
     * Reads keys down column B from row 15 with their values in column C, stopping at the first blank key.
     */
    static Map<String, String> readKeyValueTable(WorkbookReader reader, String tabName) {
        Map<String, String> table = new LinkedHashMap<>();
        for (int offset = 0; ; offset++) {
            CellAddress keyAddress = TABLE_ANCHOR.offset(offset, 0);
            String key = reader.getCellText(tabName, keyAddress);
            if (key == null || key.isEmpty()) {
                break;
            }
            String value = reader.getCellText(tabName, keyAddress.offset(0, 1));
            if (table.putIfAbsent(key, value) != null) {
                log.warn("Tab '{}' repeats key '{}' at {}; first value kept", tabName, key, keyAddress);
            }
        }
        return table;
    }
}
