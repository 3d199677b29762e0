package com.poc.xlstaging.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Independent switches controlling where a staged record goes. With both persistence switches off the route is a dry run.
 */
@Value
@Builder(toBuilder = true)
public class RoutingConfig {

    /** Commit the record straight to the record store. */
    boolean autoConfirm;

    /** Write a durable staging artifact for later review. */
    boolean persistStagingArtifact;

    /** On commit, write every payload field instead of only the changed ones. */
    boolean fullFieldOverwrite;

    public boolean isDryRun() {
        return !autoConfirm && !persistStagingArtifact;
    }
}
