package com.poc.xlstaging.dto;

import com.poc.xlstaging.service.excel.CellAddressing;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One loaded schema version: an ordered field name to {@link FieldSpec} mapping plus free-form metadata.
 */
@Value
public class SchemaVersion {

    String id;
    Map<String, FieldSpec> fields;
    Map<String, Object> metadata;

    public SchemaVersion(String id, Map<String, FieldSpec> fields, Map<String, Object> metadata) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public List<FieldSpec> fieldsInWorksheetOrder(AddressOrder order) {
        List<FieldSpec> sorted = new ArrayList<>(fields.values());
        sorted.sort((a, b) -> CellAddressing.compare(a.getValueAddress(), b.getValueAddress(), order));
        return sorted;
    }

    /**
     * Payload with every declared field absent, in worksheet row order. Used as the starting point for blank forms.
     */
    public Map<String, FieldValue> defaultPayload() {
        Map<String, FieldValue> payload = new LinkedHashMap<>();
        for (FieldSpec spec : fieldsInWorksheetOrder(AddressOrder.ROW)) {
            payload.put(spec.getFieldName(), FieldValue.absent());
        }
        return payload;
    }
}
