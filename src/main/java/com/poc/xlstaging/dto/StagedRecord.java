package com.poc.xlstaging.dto;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one upload's extracted payload, ready to be routed to the store and/or a staging artifact.
 */
@Value
public class StagedRecord {

    long identityKey;
    String sector;
    String sourceFilename;
    String savedLocation;
    Map<String, FieldValue> fields;
    CaptureMetadata capture;
    List<Diagnostic> diagnostics;

    @Builder
    public StagedRecord(long identityKey,
                        String sector,
                        @NonNull String sourceFilename,
                        String savedLocation,
                        @NonNull Map<String, FieldValue> fields,
                        @NonNull CaptureMetadata capture,
                        List<Diagnostic> diagnostics) {
        if (identityKey < 1) {
            throw new IllegalArgumentException("Identity key must be positive: " + identityKey);
        }
        this.identityKey = identityKey;
        this.sector = sector;
        this.sourceFilename = sourceFilename;
        this.savedLocation = savedLocation;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.capture = capture;
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
