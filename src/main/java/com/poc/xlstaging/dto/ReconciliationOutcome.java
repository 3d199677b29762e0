package com.poc.xlstaging.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReconciliationOutcome {

    boolean ok;
    long identityKey;
    int remainingDiffCount;
    ReconciliationState state;
    List<String> appliedFields;
    ErrorKind errorKind;
    String message;
}
