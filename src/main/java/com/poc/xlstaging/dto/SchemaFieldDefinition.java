package com.poc.xlstaging.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw, unvalidated field entry as it appears in a schema document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaFieldDefinition {

    @JsonProperty("value_address")
    private String valueAddress;

    @JsonProperty("value_type")
    private String valueType;

    @JsonProperty("label_address")
    private String labelAddress;

    @JsonProperty("label")
    private String label;

    @JsonProperty("is_drop_down")
    private boolean dropDown;
}
