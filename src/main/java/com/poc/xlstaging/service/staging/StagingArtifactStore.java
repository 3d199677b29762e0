package com.poc.xlstaging.service.staging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.xlstaging.dto.ArtifactField;
import com.poc.xlstaging.dto.CaptureMetadata;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.StagedRecord;
import com.poc.xlstaging.dto.StagingArtifact;
import com.poc.xlstaging.service.storage.FileStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one review artifact per identity key under {@code staging/}. Converged artifacts move to {@code processed/}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagingArtifactStore {

    public static final String STAGING_FOLDER = "staging/";
    public static final String PROCESSED_FOLDER = "processed/";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final FileStorageService fileStorageService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public static String artifactName(long identityKey) {
        return STAGING_FOLDER + "id_" + identityKey + ".json";
    }

    public boolean exists(long identityKey) {
        return fileStorageService.exists(artifactName(identityKey));
    }

    /**
     * Writes the artifact for the record's key, superseding any earlier one.
     * @return the artifact's storage location
     */
    public Result<String> write(StagedRecord record, List<String> confirmedFields, LocalDateTime lastConfirmedAt) {
        String name = artifactName(record.getIdentityKey());
        if (confirmedFields.isEmpty() && fileStorageService.exists(name)) {
            log.info("New upload for id {} supersedes the staged artifact {}", record.getIdentityKey(), name);
        }
        try {
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(toArtifact(record, confirmedFields, lastConfirmedAt));
            String location = fileStorageService.saveFile(json, name);
            log.debug("Wrote staging artifact {}", location);
            return Result.success(location);
        } catch (IOException e) {
            log.error("Could not write staging artifact {}", name, e);
            return Result.failure(ErrorKind.FILE_ERROR, "Could not write staging artifact " + name + ": " + e.getMessage());
        }
    }

    public Result<StagingArtifact> read(long identityKey) {
        String name = artifactName(identityKey);
        if (!fileStorageService.exists(name)) {
            return Result.failure(ErrorKind.FILE_ERROR, "No staged upload for id " + identityKey);
        }
        try {
            return Result.success(objectMapper.readValue(fileStorageService.loadFile(name), StagingArtifact.class));
        } catch (IOException e) {
            log.error("Could not read staging artifact {}", name, e);
            return Result.failure(ErrorKind.FILE_ERROR, "Could not read staging artifact " + name + ": " + e.getMessage());
        }
    }

    /**
     * Moves the artifact out of staging once its record has converged.
     */
    public Result<String> archive(long identityKey) {
        String target = PROCESSED_FOLDER + "id_" + identityKey + "_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json";
        try {
            String location = fileStorageService.moveFile(artifactName(identityKey), target);
            log.info("Archived staging artifact for id {} to {}", identityKey, location);
            return Result.success(location);
        } catch (IOException e) {
            log.error("Could not archive staging artifact for id {}", identityKey, e);
            return Result.failure(ErrorKind.FILE_ERROR, "Could not archive staging artifact: " + e.getMessage());
        }
    }

    public Result<Boolean> discard(long identityKey) {
        try {
            boolean deleted = fileStorageService.deleteFile(artifactName(identityKey));
            if (deleted) {
                log.info("Discarded staging artifact for id {}", identityKey);
            }
            return Result.success(deleted);
        } catch (IOException e) {
            log.error("Could not discard staging artifact for id {}", identityKey, e);
            return Result.failure(ErrorKind.FILE_ERROR, "Could not discard staging artifact: " + e.getMessage());
        }
    }

    StagingArtifact toArtifact(StagedRecord record, List<String> confirmedFields, LocalDateTime lastConfirmedAt) {
        StagingArtifact artifact = new StagingArtifact();
        artifact.setOriginalFilename(record.getSourceFilename());
        artifact.setCapturedAt(record.getCapture().getCapturedAt().toString());
        artifact.setIdentityKey(record.getIdentityKey());
        artifact.setSector(record.getSector());
        artifact.setSavedLocation(record.getSavedLocation());
        artifact.setSizeBytes(record.getCapture().getSizeBytes());
        artifact.setSha256(record.getCapture().getSha256());
        artifact.setConfirmedFields(new ArrayList<>(confirmedFields));
        artifact.setLastConfirmedAt(lastConfirmedAt == null ? null : lastConfirmedAt.toString());
        Map<String, ArtifactField> fields = new LinkedHashMap<>();
        record.getFields().forEach((name, value) -> fields.put(name, new ArtifactField(value.getKind(), value.toStoredValue())));
        artifact.setFields(fields);
        return artifact;
    }

    /**
     * Rebuilds the staged record an artifact was written from.
     * @throws IllegalArgumentException when the artifact content is inconsistent with its declared types
     */
    public StagedRecord toStagedRecord(StagingArtifact artifact) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        artifact.getFields().forEach((name, field) -> fields.put(name, toFieldValue(name, field)));
        if (artifact.getCapturedAt() == null) {
            throw new IllegalArgumentException("Artifact has no captured_at");
        }
        LocalDateTime capturedAt;
        try {
            capturedAt = LocalDateTime.parse(artifact.getCapturedAt());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Artifact has an invalid captured_at: " + artifact.getCapturedAt(), e);
        }
        return StagedRecord.builder()
                .identityKey(artifact.getIdentityKey())
                .sector(artifact.getSector())
                .sourceFilename(artifact.getOriginalFilename())
                .savedLocation(artifact.getSavedLocation())
                .fields(fields)
                .capture(new CaptureMetadata(capturedAt, artifact.getSizeBytes(), artifact.getSha256()))
                .build();
    }

    private static FieldValue toFieldValue(String name, ArtifactField field) {
        Object value = field.getValue();
        if (field.getType() == null || field.getType() == FieldValue.Kind.ABSENT || value == null) {
            return FieldValue.absent();
        }
        try {
            switch (field.getType()) {
                case STRING:
                    return FieldValue.ofString((String) value);
                case INTEGER:
                    return FieldValue.ofInteger(((Number) value).longValue());
                case FLOAT:
                    return FieldValue.ofFloat(((Number) value).doubleValue());
                case DATETIME:
                    return FieldValue.ofDateTime(LocalDateTime.parse((String) value));
                case BOOLEAN:
                    return FieldValue.ofBoolean((Boolean) value);
                default:
                    throw new IllegalArgumentException("Unknown field type " + field.getType());
            }
        } catch (ClassCastException | DateTimeParseException e) {
            throw new IllegalArgumentException("Artifact field '" + name + "' does not hold a " + field.getType() + ": " + value, e);
        }
    }
}
