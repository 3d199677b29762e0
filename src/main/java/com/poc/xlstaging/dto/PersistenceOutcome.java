package com.poc.xlstaging.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Result of routing a staged record.
 */
@Value
@Builder
public class PersistenceOutcome {

    boolean ok;
    Long identityKey;
    /** Storage location of the staging artifact, when one was written. */
    String stagedArtifactRef;
    /** Number of fields written to the record store; zero when nothing was committed. */
    int committedFieldCount;
    ErrorKind errorKind;
    String message;
}
