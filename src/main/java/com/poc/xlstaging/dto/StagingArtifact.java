package com.poc.xlstaging.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted review document for one staged upload. Carries everything needed to rebuild the {@link StagedRecord}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StagingArtifact {

    @JsonProperty("original_filename")
    private String originalFilename;

    @JsonProperty("captured_at")
    private String capturedAt;

    @JsonProperty("identity_key")
    private long identityKey;

    @JsonProperty("sector")
    private String sector;

    @JsonProperty("saved_location")
    private String savedLocation;

    @JsonProperty("size_bytes")
    private long sizeBytes;

    @JsonProperty("sha256")
    private String sha256;

    @JsonProperty("confirmed_fields")
    private List<String> confirmedFields = new ArrayList<>();

    @JsonProperty("last_confirmed_at")
    private String lastConfirmedAt;

    @JsonProperty("fields")
    private Map<String, ArtifactField> fields = new LinkedHashMap<>();
}
