package com.poc.xlstaging.service.staging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.xlstaging.dto.Diagnostic;
import com.poc.xlstaging.dto.DiagnosticType;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.ExtractedTab;
import com.poc.xlstaging.dto.FieldSpec;
import com.poc.xlstaging.dto.FieldType;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.NormalizedPayload;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaVersion;
import com.poc.xlstaging.service.excel.CompoundFieldExpander;
import com.poc.xlstaging.service.excel.ValueCoercer;
import com.poc.xlstaging.service.schema.SchemaCatalog;
import com.poc.xlstaging.service.schema.SchemaCatalogProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads an upload that is already a normalized payload in JSON:
 * <pre>{"metadata": {...}, "schemas": {tab: schema}, "tab_contents": {tab: {field: value}}}</pre>
 * The document may also be wrapped as {@code {"_data_": {...}, "_metadata_": {...}}}. Values are typed through the
 * tab's schema where it declares the field, and by their JSON type otherwise.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NormalizedPayloadReader {

    private final ObjectMapper objectMapper;
    private final SchemaCatalogProvider schemaCatalogProvider;
    private final ValueCoercer valueCoercer;
    private final CompoundFieldExpander compoundFieldExpander;

    public Result<NormalizedPayload> read(byte[] content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            return Result.failure(ErrorKind.CONVERSION_FAILED, "Malformed JSON payload: " + e.getOriginalMessage());
        } catch (IOException e) {
            return Result.failure(ErrorKind.CONVERSION_FAILED, "Unreadable JSON payload: " + e.getMessage());
        }
        if (root == null || !root.isObject()) {
            return Result.failure(ErrorKind.CONVERSION_FAILED, "JSON payload must be an object");
        }
        if (root.has("_data_")) {
            root = root.get("_data_");
        }
        JsonNode schemas = root.get("schemas");
        if (schemas == null || !schemas.isObject()) {
            return Result.failure(ErrorKind.SCHEMA_MANIFEST_MISSING, "JSON payload has no 'schemas' object");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode metadataNode = root.path("metadata");
        metadataNode.fields().forEachRemaining(e -> metadata.put(e.getKey(), e.getValue().isNull() ? null : e.getValue().asText()));

        Map<String, String> manifest = new LinkedHashMap<>();
        schemas.fields().forEachRemaining(e -> manifest.put(e.getKey(), e.getValue().isNull() ? null : e.getValue().asText()));

        SchemaCatalog catalog = schemaCatalogProvider.current();
        JsonNode contents = root.path("tab_contents");
        Map<String, ExtractedTab> tabs = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Map.Entry<String, String> entry : manifest.entrySet()) {
            String tabName = entry.getKey();
            JsonNode tabNode = contents.get(tabName);
            Result<SchemaVersion> schema = catalog.resolve(entry.getValue());
            if (tabNode == null || !tabNode.isObject() || schema.isFailure()) {
                String reason = schema.isFailure() ? schema.getMessage() : "no contents for tab";
                log.warn("Skipping tab '{}' in JSON payload: {}", tabName, reason);
                skipped.add(tabName);
                diagnostics.add(Diagnostic.forTab(DiagnosticType.TAB_SKIPPED, tabName, reason));
                continue;
            }
            Optional<String> aliasTarget = catalog.aliasTarget(entry.getValue());
            if (aliasTarget.isPresent() && !catalog.getSchemaNames().contains(entry.getValue())) {
                diagnostics.add(Diagnostic.forTab(DiagnosticType.SCHEMA_ALIASED, tabName,
                        "Schema '" + entry.getValue() + "' is retired; used '" + aliasTarget.get() + "'"));
            }
            Result<ExtractedTab> tab = readTab(tabName, tabNode, schema.getValue());
            if (tab.isFailure()) {
                return tab.propagate();
            }
            tabs.put(tabName, tab.getValue());
            diagnostics.addAll(tab.getValue().getDiagnostics());
        }
        log.info("Read JSON payload with {} tab(s), skipped {}", tabs.size(), skipped.size());
        return Result.success(new NormalizedPayload(metadata, manifest, tabs, skipped, diagnostics));
    }

    private Result<ExtractedTab> readTab(String tabName, JsonNode tabNode, SchemaVersion schema) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = tabNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String fieldName = entry.getKey();
            JsonNode node = entry.getValue();
            FieldSpec spec = schema.getFields().get(fieldName);
            FieldType type = spec != null ? spec.getExpectedType() : inferType(node);
            if (type == null) {
                diagnostics.add(Diagnostic.forField(DiagnosticType.VALUE_DROPPED, tabName, fieldName,
                        "Nested JSON value is not a field value; treated as absent"));
                fields.put(fieldName, FieldValue.absent());
                continue;
            }
            ValueCoercer.Coercion coercion = valueCoercer.coerce(toRaw(node), type);
            if (coercion.hasIssue()) {
                diagnostics.add(Diagnostic.forField(coercion.getIssue(), tabName, fieldName, coercion.getMessage()));
            }
            fields.put(fieldName, coercion.getValue());
        }
        return compoundFieldExpander.expand(tabName, fields, diagnostics)
                .map(expanded -> new ExtractedTab(tabName, schema.getId(), expanded, diagnostics));
    }

    private static FieldType inferType(JsonNode node) {
        if (node.isNull() || node.isTextual()) {
            return FieldType.STRING;
        }
        if (node.isIntegralNumber()) {
            return FieldType.INTEGER;
        }
        if (node.isNumber()) {
            return FieldType.FLOAT;
        }
        if (node.isBoolean()) {
            return FieldType.BOOLEAN;
        }
        return null;
    }

    private static Object toRaw(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return node.asText();
    }
}
