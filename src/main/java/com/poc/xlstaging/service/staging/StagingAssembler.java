package com.poc.xlstaging.service.staging;

import com.poc.xlstaging.dto.CaptureMetadata;
import com.poc.xlstaging.dto.Diagnostic;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.ExtractedTab;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.NormalizedPayload;
import com.poc.xlstaging.dto.RawUpload;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.StagedRecord;
import com.poc.xlstaging.service.excel.ImportAuditFormatter;
import com.poc.xlstaging.service.excel.PoiWorkbookReader;
import com.poc.xlstaging.service.excel.WorkbookIngestor;
import com.poc.xlstaging.service.schema.SchemaCatalogProvider;
import com.poc.xlstaging.service.storage.FileStorageService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one uploaded file into an immutable {@link StagedRecord}: save the raw bytes, convert, check the identity key.
 */
@Slf4j
@Service
public class StagingAssembler {

    public static final String UPLOAD_FOLDER = "uploads/";

    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("(_\\d{14})$");
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final Set<String> WORKBOOK_EXTENSIONS = Set.of(".xlsx", ".xlsm", ".xls");

    private final FileStorageService fileStorageService;
    private final WorkbookIngestor workbookIngestor;
    private final NormalizedPayloadReader normalizedPayloadReader;
    private final ImportAuditFormatter importAuditFormatter;
    private final SchemaCatalogProvider schemaCatalogProvider;
    private final Clock clock;
    private final String identityField;

    public StagingAssembler(FileStorageService fileStorageService,
                            WorkbookIngestor workbookIngestor,
                            NormalizedPayloadReader normalizedPayloadReader,
                            ImportAuditFormatter importAuditFormatter,
                            SchemaCatalogProvider schemaCatalogProvider,
                            Clock clock,
                            @Value("${xl.staging.identity-field:id_incidence}") String identityField) {
        this.fileStorageService = fileStorageService;
        this.workbookIngestor = workbookIngestor;
        this.normalizedPayloadReader = normalizedPayloadReader;
        this.importAuditFormatter = importAuditFormatter;
        this.schemaCatalogProvider = schemaCatalogProvider;
        this.clock = clock;
        this.identityField = identityField;
    }

    public Result<StagedRecord> assemble(RawUpload upload) {
        LocalDateTime capturedAt = LocalDateTime.now(clock);
        String fileName = generateCleanFileName(upload.getOriginalFilename(), capturedAt.format(FILE_TIMESTAMP));

        // 1. Keep the raw upload before anything can fail on its contents
        String savedLocation;
        try {
            savedLocation = fileStorageService.saveFile(upload.getContent(), UPLOAD_FOLDER + fileName);
        } catch (IOException e) {
            log.error("Could not save upload '{}'", upload.getOriginalFilename(), e);
            return Result.failure(ErrorKind.FILE_ERROR, "Could not save upload: " + e.getMessage());
        }
        log.info("Saved upload '{}' ({} bytes) to {}", upload.getOriginalFilename(), upload.getContent().length, savedLocation);

        // 2. Convert to a normalized payload
        Result<NormalizedPayload> converted = convert(upload);
        if (converted.isFailure()) {
            log.warn("Conversion of '{}' failed: {}", upload.getOriginalFilename(), converted.getMessage());
            return Result.failure(ErrorKind.CONVERSION_FAILED,
                    "[" + converted.getErrorKind().getCode() + "] " + converted.getMessage());
        }
        NormalizedPayload payload = converted.getValue();

        // 3. Identity
        Result<Long> identity = resolveIdentity(payload);
        if (identity.isFailure()) {
            log.warn("Upload '{}' rejected: {}", upload.getOriginalFilename(), identity.getMessage());
            return identity.propagate();
        }

        NormalizedPayload.FlattenedFields flattened = payload.flatten();
        List<Diagnostic> diagnostics = new ArrayList<>(payload.getDiagnostics());
        diagnostics.addAll(flattened.getDiagnostics());

        StagedRecord record = StagedRecord.builder()
                .identityKey(identity.getValue())
                .sector(payload.getSector())
                .sourceFilename(upload.getOriginalFilename())
                .savedLocation(savedLocation)
                .fields(flattened.getFields())
                .capture(new CaptureMetadata(capturedAt, upload.getContent().length, DigestUtils.sha256Hex(upload.getContent())))
                .diagnostics(diagnostics)
                .build();
        log.info("Staged record {} from '{}' with {} field(s)", record.getIdentityKey(), record.getSourceFilename(),
                record.getFields().size());
        return Result.success(record);
    }

    private Result<NormalizedPayload> convert(RawUpload upload) {
        String extension = upload.getExtension();
        if (".json".equals(extension)) {
            return normalizedPayloadReader.read(upload.getContent());
        }
        if (!WORKBOOK_EXTENSIONS.contains(extension)) {
            return Result.failure(ErrorKind.CONVERSION_FAILED, "Unsupported file type '" + extension + "'");
        }
        try (PoiWorkbookReader reader = PoiWorkbookReader.open(upload.getContent())) {
            Result<NormalizedPayload> ingested = workbookIngestor.ingest(reader);
            if (ingested.isOk() && log.isInfoEnabled()) {
                log.info("Import audit for '{}':\n{}", upload.getOriginalFilename(),
                        importAuditFormatter.format(ingested.getValue(), schemaCatalogProvider.current()));
            }
            return ingested;
        } catch (IOException e) {
            return Result.failure(ErrorKind.CONVERSION_FAILED, "Unreadable workbook: " + e.getMessage());
        }
    }

    /**
     * The identity field must hold one positive integer. Tabs that each carry it must agree.
     */
    private Result<Long> resolveIdentity(NormalizedPayload payload) {
        Map<String, Object> seen = new LinkedHashMap<>();
        for (ExtractedTab tab : payload.getTabs().values()) {
            FieldValue value = tab.getFields().get(identityField);
            if (value != null && !value.isAbsent()) {
                seen.put(tab.getTabName(), value.toStoredValue());
            }
        }
        if (seen.values().stream().distinct().count() > 1) {
            return Result.failure(ErrorKind.INVALID_ID, "Tabs disagree on " + identityField + ": " + seen);
        }
        FieldValue identity = payload.flatten().getFields().get(identityField);
        if (identity == null || identity.isAbsent()) {
            return Result.failure(ErrorKind.MISSING_ID, "No " + identityField + " in upload");
        }
        if (identity.getKind() != FieldValue.Kind.INTEGER || identity.asInteger() < 1) {
            return Result.failure(ErrorKind.MISSING_ID,
                    identityField + " must be a positive integer, found " + identity);
        }
        return Result.success(identity.asInteger());
    }

    static String generateCleanFileName(String originalFilename, String newTimestamp) {
        if (originalFilename == null || originalFilename.isBlank()) originalFilename = "Unknown_File.xlsx";

        // keep only the last path segment of a client-supplied name
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);

        int dotIndex = name.lastIndexOf('.');
        String baseName = (dotIndex == -1) ? name : name.substring(0, dotIndex);
        String extension = (dotIndex == -1) ? "" : name.substring(dotIndex);

        Matcher matcher = TIMESTAMP_PATTERN.matcher(baseName);
        if (matcher.find()) {
            baseName = baseName.substring(0, matcher.start());
        }

        return baseName + "_" + newTimestamp + extension;
    }
}
