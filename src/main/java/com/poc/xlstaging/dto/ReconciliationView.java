package com.poc.xlstaging.dto;

import lombok.Value;

import java.util.List;

/**
 * Review snapshot of a staged artifact against the current store.
 */
@Value
public class ReconciliationView {
    StagedRecord stagedRecord;
    List<DiffEntry> entries;
    ReconciliationState state;
    boolean newRecord;
}
