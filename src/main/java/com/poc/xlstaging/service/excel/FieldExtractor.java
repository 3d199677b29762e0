package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.Diagnostic;
import com.poc.xlstaging.dto.DiagnosticType;
import com.poc.xlstaging.dto.ExtractedTab;
import com.poc.xlstaging.dto.FieldSpec;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one worksheet tab through its schema: one typed value per declared field, plus diagnostics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldExtractor {

    public static final String PLACEHOLDER = "Please Select";

    private final ValueCoercer valueCoercer;
    private final CompoundFieldExpander compoundFieldExpander;

    public Result<ExtractedTab> extract(WorkbookReader reader, String tabName, SchemaVersion schema) {
        if (!reader.hasSheet(tabName)) {
            throw new IllegalArgumentException("Workbook has no tab named '" + tabName + "'");
        }
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (FieldSpec spec : schema.getFields().values()) {
            if (spec.hasLabelCheck()) {
                checkLabel(reader, tabName, spec, diagnostics);
            }

            Object raw = reader.getCellValue(tabName, spec.getValueAddress());
            ValueCoercer.Coercion coercion = valueCoercer.coerce(raw, spec.getExpectedType());
            if (coercion.hasIssue()) {
                diagnostics.add(Diagnostic.forField(coercion.getIssue(), tabName, spec.getFieldName(),
                        spec.getValueAddress() + ": " + coercion.getMessage()));
                if (coercion.getIssue() == DiagnosticType.VALUE_DROPPED) {
                    log.warn("{}.{} at {}: {}", tabName, spec.getFieldName(), spec.getValueAddress(), coercion.getMessage());
                }
            }
            FieldValue value = coercion.getValue();
            if (spec.isDropDown() && value.getKind() == FieldValue.Kind.STRING && PLACEHOLDER.equals(value.asString().trim())) {
                diagnostics.add(Diagnostic.forField(DiagnosticType.PLACEHOLDER_VALUE, tabName, spec.getFieldName(),
                        "Drop-down still shows '" + PLACEHOLDER + "'"));
            }
            fields.put(spec.getFieldName(), value);
        }

        Result<Map<String, FieldValue>> expanded = compoundFieldExpander.expand(tabName, fields, diagnostics);
        if (expanded.isFailure()) {
            log.warn("Extraction of tab '{}' failed: {}", tabName, expanded.getMessage());
            return expanded.propagate();
        }
        log.debug("Extracted {} field(s) from tab '{}' with schema {} ({} diagnostic(s))",
                expanded.getValue().size(), tabName, schema.getId(), diagnostics.size());
        return Result.success(new ExtractedTab(tabName, schema.getId(), expanded.getValue(), diagnostics));
    }

    private void checkLabel(WorkbookReader reader, String tabName, FieldSpec spec, List<Diagnostic> diagnostics) {
        String text = reader.getCellText(tabName, spec.getLabelAddress());
        String found = text == null ? "" : text;
        String expected = spec.getLabelText().trim();
        if (!expected.equals(found)) {
            diagnostics.add(Diagnostic.forField(DiagnosticType.LABEL_MISMATCH, tabName, spec.getFieldName(),
                    String.format("Expected label '%s' at %s but found '%s'", expected, spec.getLabelAddress(),
                            found)));
        }
    }
}
