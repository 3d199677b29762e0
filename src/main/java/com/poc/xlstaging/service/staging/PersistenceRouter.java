package com.poc.xlstaging.service.staging;

import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.PersistenceOutcome;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.RoutingConfig;
import com.poc.xlstaging.dto.StagedRecord;
import com.poc.xlstaging.service.reconcile.ValueNormalizer;
import com.poc.xlstaging.service.record.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends a staged record to a review artifact, straight to the record store, both, or nowhere (dry run).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersistenceRouter {

    private final StagingArtifactStore stagingArtifactStore;
    private final RecordStore recordStore;
    private final ValueNormalizer valueNormalizer;

    public PersistenceOutcome route(StagedRecord record, RoutingConfig config) {
        long key = record.getIdentityKey();
        if (config.isDryRun()) {
            log.info("Dry run for record {}: nothing persisted", key);
            return PersistenceOutcome.builder().ok(true).identityKey(key).build();
        }

        String artifactRef = null;
        if (config.isPersistStagingArtifact()) {
            Result<String> written = stagingArtifactStore.write(record, List.of(), null);
            if (written.isFailure()) {
                return failure(key, null, written.getErrorKind(), written.getMessage());
            }
            artifactRef = written.getValue();
        }

        int committed = 0;
        if (config.isAutoConfirm()) {
            Result<Map<String, Object>> patch = buildPatch(record, config.isFullFieldOverwrite());
            if (patch.isFailure()) {
                return failure(key, artifactRef, patch.getErrorKind(), patch.getMessage());
            }
            if (!patch.getValue().isEmpty()) {
                Result<Integer> written = recordStore.upsert(key, patch.getValue(),
                        "Auto-confirmed upload " + record.getSourceFilename());
                if (written.isFailure()) {
                    return failure(key, artifactRef, written.getErrorKind(), written.getMessage());
                }
                committed = patch.getValue().size();
            } else {
                log.info("Record {} already matches upload '{}'; nothing to commit", key, record.getSourceFilename());
            }
        }
        return PersistenceOutcome.builder()
                .ok(true)
                .identityKey(key)
                .stagedArtifactRef(artifactRef)
                .committedFieldCount(committed)
                .build();
    }

    /**
     * Every payload field when overwriting, otherwise only fields whose normalized value differs from the store.
     */
    private Result<Map<String, Object>> buildPatch(StagedRecord record, boolean fullFieldOverwrite) {
        Map<String, Object> patch = new LinkedHashMap<>();
        if (fullFieldOverwrite) {
            record.getFields().forEach((name, value) -> patch.put(name, value.toStoredValue()));
            return Result.success(patch);
        }
        Result<Optional<Map<String, Object>>> stored = recordStore.get(record.getIdentityKey());
        if (stored.isFailure()) {
            return stored.propagate();
        }
        Map<String, Object> current = stored.getValue().orElse(Map.of());
        for (Map.Entry<String, FieldValue> entry : record.getFields().entrySet()) {
            if (!valueNormalizer.normalize(entry.getValue()).equals(valueNormalizer.normalize(current.get(entry.getKey())))) {
                patch.put(entry.getKey(), entry.getValue().toStoredValue());
            }
        }
        return Result.success(patch);
    }

    private static PersistenceOutcome failure(long key, String artifactRef, ErrorKind kind, String message) {
        log.warn("Routing of record {} failed: [{}] {}", key, kind.getCode(), message);
        return PersistenceOutcome.builder()
                .ok(false)
                .identityKey(key)
                .stagedArtifactRef(artifactRef)
                .errorKind(kind)
                .message(message)
                .build();
    }
}
