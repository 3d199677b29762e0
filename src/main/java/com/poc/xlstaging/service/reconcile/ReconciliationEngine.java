package com.poc.xlstaging.service.reconcile;

import com.poc.xlstaging.dto.DiffEntry;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.ReconciliationOutcome;
import com.poc.xlstaging.dto.ReconciliationState;
import com.poc.xlstaging.dto.ReconciliationView;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.StagedRecord;
import com.poc.xlstaging.dto.StagingArtifact;
import com.poc.xlstaging.service.record.RecordStore;
import com.poc.xlstaging.service.staging.StagingArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Field-level review of a staged upload against the stored record. Reviewers accept a subset of differing fields
 * at a time until no differences remain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final StagingArtifactStore stagingArtifactStore;
    private final RecordStore recordStore;
    private final ValueNormalizer valueNormalizer;
    private final Clock clock;

    /**
     * Fields of the staged payload whose normalized value differs from the stored one, ordered by field name.
     * Stored fields the payload does not mention are never reported.
     */
    public List<DiffEntry> diff(Map<String, FieldValue> stagedPayload, Map<String, Object> storedFields) {
        Map<String, Object> stored = storedFields == null ? Map.of() : storedFields;
        List<DiffEntry> entries = new ArrayList<>();
        for (Map.Entry<String, FieldValue> entry : stagedPayload.entrySet()) {
            String incoming = valueNormalizer.normalize(entry.getValue());
            String current = valueNormalizer.normalize(stored.get(entry.getKey()));
            if (!incoming.equals(current)) {
                entries.add(new DiffEntry(entry.getKey(), current, incoming, false));
            }
        }
        entries.sort(Comparator.comparing(DiffEntry::getFieldName));
        return entries;
    }

    public Result<ReconciliationView> review(long identityKey) {
        Result<StagingArtifact> artifact = stagingArtifactStore.read(identityKey);
        if (artifact.isFailure()) {
            return artifact.propagate();
        }
        Result<StagedRecord> staged = toStagedRecord(artifact.getValue());
        if (staged.isFailure()) {
            return staged.propagate();
        }
        StagedRecord record = staged.getValue();
        Result<Optional<Map<String, Object>>> stored = recordStore.get(identityKey);
        if (stored.isFailure()) {
            return stored.propagate();
        }
        Set<String> confirmed = new LinkedHashSet<>(artifact.getValue().getConfirmedFields());
        List<DiffEntry> entries = diff(record.getFields(), stored.getValue().orElse(null)).stream()
                .map(entry -> entry.withConfirmed(confirmed.contains(entry.getFieldName())))
                .collect(Collectors.toList());
        ReconciliationState state = entries.isEmpty() ? ReconciliationState.CONVERGED
                : confirmed.isEmpty() ? ReconciliationState.PENDING : ReconciliationState.PARTIALLY_CONFIRMED;
        return Result.success(new ReconciliationView(record, entries, state, stored.getValue().isEmpty()));
    }

    /**
     * Writes the accepted fields verbatim in one all-or-nothing upsert, records them on the artifact and recomputes
     * the diff. Once nothing differs the artifact is archived.
     */
    public ReconciliationOutcome apply(long identityKey, Collection<String> acceptedFieldNames) {
        Result<StagingArtifact> artifactResult = stagingArtifactStore.read(identityKey);
        if (artifactResult.isFailure()) {
            return failed(identityKey, artifactResult.getErrorKind(), artifactResult.getMessage(), 0);
        }
        StagingArtifact artifact = artifactResult.getValue();
        Result<StagedRecord> staged = toStagedRecord(artifact);
        if (staged.isFailure()) {
            return failed(identityKey, staged.getErrorKind(), staged.getMessage(), 0);
        }
        StagedRecord record = staged.getValue();

        Result<Optional<Map<String, Object>>> stored = recordStore.get(identityKey);
        if (stored.isFailure()) {
            return failed(identityKey, stored.getErrorKind(), stored.getMessage(), 0);
        }
        List<DiffEntry> current = diff(record.getFields(), stored.getValue().orElse(null));
        Set<String> diffFields = current.stream().map(DiffEntry::getFieldName).collect(Collectors.toSet());

        Set<String> accepted = new LinkedHashSet<>(acceptedFieldNames == null ? List.of() : acceptedFieldNames);
        List<String> unknown = accepted.stream().filter(name -> !diffFields.contains(name)).collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            return failed(identityKey, ErrorKind.VALIDATION_ERROR,
                    "Not pending changes for record " + identityKey + ": " + unknown, current.size());
        }

        if (accepted.isEmpty()) {
            if (current.isEmpty()) {
                return converged(identityKey, List.of());
            }
            return outcome(identityKey, current.size(), ReconciliationState.PENDING, List.of());
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        for (String name : accepted) {
            patch.put(name, record.getFields().get(name).toStoredValue());
        }
        Result<Integer> written = recordStore.upsert(identityKey, patch,
                "Confirmed from upload " + record.getSourceFilename());
        if (written.isFailure()) {
            return failed(identityKey, written.getErrorKind(), written.getMessage(), current.size());
        }

        Set<String> confirmed = new LinkedHashSet<>(artifact.getConfirmedFields());
        confirmed.addAll(accepted);
        Result<String> rewritten = stagingArtifactStore.write(record, new ArrayList<>(confirmed), LocalDateTime.now(clock));

        Result<Optional<Map<String, Object>>> after = recordStore.get(identityKey);
        if (after.isFailure()) {
            return failed(identityKey, after.getErrorKind(), after.getMessage(), current.size() - accepted.size());
        }
        int remaining = diff(record.getFields(), after.getValue().orElse(null)).size();
        List<String> applied = new ArrayList<>(accepted);
        log.info("Record {}: applied {} field(s), {} difference(s) remain", identityKey, applied.size(), remaining);

        if (rewritten.isFailure()) {
            return ReconciliationOutcome.builder()
                    .ok(false)
                    .identityKey(identityKey)
                    .remainingDiffCount(remaining)
                    .state(remaining == 0 ? ReconciliationState.CONVERGED : ReconciliationState.PARTIALLY_CONFIRMED)
                    .appliedFields(applied)
                    .errorKind(rewritten.getErrorKind())
                    .message("Fields were stored but the staging artifact was not updated: " + rewritten.getMessage())
                    .build();
        }
        if (remaining == 0) {
            return converged(identityKey, applied);
        }
        return outcome(identityKey, remaining, ReconciliationState.PARTIALLY_CONFIRMED, applied);
    }

    /**
     * Abandons the staged upload for a key without touching the stored record.
     */
    public Result<Boolean> discard(long identityKey) {
        return stagingArtifactStore.discard(identityKey);
    }

    private Result<StagedRecord> toStagedRecord(StagingArtifact artifact) {
        try {
            return Result.success(stagingArtifactStore.toStagedRecord(artifact));
        } catch (IllegalArgumentException e) {
            return Result.failure(ErrorKind.FILE_ERROR, "Staging artifact is corrupt: " + e.getMessage());
        }
    }

    /**
     * Archives the artifact of a record with no remaining differences. The record stays converged when the archive
     * fails; the outcome message then says where the artifact was left.
     */
    private ReconciliationOutcome converged(long identityKey, List<String> applied) {
        Result<String> archived = stagingArtifactStore.archive(identityKey);
        if (archived.isOk()) {
            return outcome(identityKey, 0, ReconciliationState.CONVERGED, applied);
        }
        log.warn("Record {} converged but its artifact stays in staging: {}", identityKey, archived.getMessage());
        return ReconciliationOutcome.builder()
                .ok(true)
                .identityKey(identityKey)
                .remainingDiffCount(0)
                .state(ReconciliationState.CONVERGED)
                .appliedFields(applied)
                .errorKind(archived.getErrorKind())
                .message("Converged, but the staging artifact was not archived: " + archived.getMessage())
                .build();
    }

    private static ReconciliationOutcome outcome(long identityKey, int remaining, ReconciliationState state, List<String> applied) {
        return ReconciliationOutcome.builder()
                .ok(true)
                .identityKey(identityKey)
                .remainingDiffCount(remaining)
                .state(state)
                .appliedFields(applied)
                .build();
    }

    private static ReconciliationOutcome failed(long identityKey, ErrorKind kind, String message, int remaining) {
        log.warn("Reconciliation of record {} failed: [{}] {}", identityKey, kind.getCode(), message);
        return ReconciliationOutcome.builder()
                .ok(false)
                .identityKey(identityKey)
                .remainingDiffCount(remaining)
                .state(ReconciliationState.PENDING)
                .appliedFields(List.of())
                .errorKind(kind)
                .message(message)
                .build();
    }
}
