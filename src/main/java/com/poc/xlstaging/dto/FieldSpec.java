package com.poc.xlstaging.dto;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Validated mapping of one named field to a worksheet cell.
 */
@Value
@Builder
public class FieldSpec {

    @NonNull
    String fieldName;

    @NonNull
    CellAddress valueAddress;

    /** Optional; when present together with {@link #labelText} the worksheet label is cross-checked. */
    CellAddress labelAddress;

    String labelText;

    @NonNull
    FieldType expectedType;

    boolean dropDown;

    public boolean hasLabelCheck() {
        return labelAddress != null && labelText != null;
    }
}
