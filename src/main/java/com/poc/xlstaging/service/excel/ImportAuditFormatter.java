package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.AddressOrder;
import com.poc.xlstaging.dto.Diagnostic;
import com.poc.xlstaging.dto.ExtractedTab;
import com.poc.xlstaging.dto.FieldSpec;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.NormalizedPayload;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaVersion;
import com.poc.xlstaging.service.schema.SchemaCatalog;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders an ingest as plain text for the import log: manifest, metadata, then every field with its cell address.
 */
@Component
public class ImportAuditFormatter {

    public String format(NormalizedPayload payload, SchemaCatalog catalog) {
        StringBuilder out = new StringBuilder();
        out.append("Schema manifest:\n");
        payload.getSchemaManifest().forEach((tab, schema) -> out.append("  ").append(tab).append(" -> ").append(schema).append('\n'));
        out.append("Metadata:\n");
        payload.getMetadata().forEach((key, value) -> out.append("  ").append(key).append(" = ").append(value).append('\n'));

        for (ExtractedTab tab : payload.getTabs().values()) {
            out.append("Tab '").append(tab.getTabName()).append("' (").append(tab.getSchemaId()).append("):\n");
            Map<String, List<Diagnostic>> byField = tab.getDiagnostics().stream()
                    .filter(d -> d.getFieldName() != null)
                    .collect(Collectors.groupingBy(Diagnostic::getFieldName));
            Set<String> listed = new HashSet<>();

            Result<SchemaVersion> schema = catalog.resolve(tab.getSchemaId());
            if (schema.isOk()) {
                for (FieldSpec spec : schema.getValue().fieldsInWorksheetOrder(AddressOrder.ROW)) {
                    FieldValue value = tab.getFields().get(spec.getFieldName());
                    appendField(out, spec.getValueAddress().toString(), spec.getFieldName(),
                            value == null ? "<expanded>" : value.toString(), byField.get(spec.getFieldName()));
                    listed.add(spec.getFieldName());
                }
            }
            tab.getFields().forEach((name, value) -> {
                if (!listed.contains(name)) {
                    appendField(out, "derived", name, value.toString(), byField.get(name));
                }
            });
        }

        List<Diagnostic> tabLevel = payload.getDiagnostics().stream()
                .filter(d -> d.getFieldName() == null)
                .collect(Collectors.toList());
        if (!tabLevel.isEmpty()) {
            out.append("Tab notes:\n");
            tabLevel.forEach(d -> out.append("  ").append(d).append('\n'));
        }
        return out.toString();
    }

    private static void appendField(StringBuilder out, String where, String name, String value, List<Diagnostic> notes) {
        out.append(String.format("  %-8s %s = %s%n", where, name, value));
        if (notes != null) {
            notes.forEach(d -> out.append("           ! ").append(d.getType()).append(": ").append(d.getMessage()).append('\n'));
        }
    }
}
