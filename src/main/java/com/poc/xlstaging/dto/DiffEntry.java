package com.poc.xlstaging.dto;

import lombok.Value;
import lombok.With;

/**
 * One field where the staged payload differs from the stored record. Values are normalized strings.
 */
@Value
public class DiffEntry {

    String fieldName;
    String storedValue;
    String incomingValue;
    @With
    boolean confirmed;
}
