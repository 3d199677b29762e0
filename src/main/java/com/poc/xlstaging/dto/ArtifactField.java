package com.poc.xlstaging.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Self-describing field value inside a staging artifact document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactField {
    private FieldValue.Kind type;
    private Object value;
}
