package com.poc.xlstaging.dto;

public enum ReconciliationState {
    /** Staged artifact with unconfirmed diff entries. */
    PENDING,
    /** Some entries accepted and written; others still outstanding. */
    PARTIALLY_CONFIRMED,
    /** Diff against the current store is empty; the artifact has been retired. */
    CONVERGED
}
