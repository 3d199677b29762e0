package com.poc.xlstaging.service.staging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.RawUpload;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.StagedRecord;
import com.poc.xlstaging.service.excel.CompoundFieldExpander;
import com.poc.xlstaging.service.excel.FieldExtractor;
import com.poc.xlstaging.service.excel.ImportAuditFormatter;
import com.poc.xlstaging.service.excel.ValueCoercer;
import com.poc.xlstaging.service.excel.WorkbookIngestor;
import com.poc.xlstaging.service.schema.SchemaCatalogProvider;
import com.poc.xlstaging.service.storage.FileStorageService;
import com.poc.xlstaging.service.storage.LocalFileStorageService;
import com.poc.xlstaging.support.TestSchemas;
import com.poc.xlstaging.support.TestWorkbooks;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StagingAssemblerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-15T17:45:30Z"), ZoneOffset.UTC);

    @TempDir
    Path storageRoot;

    private StagingAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = assembler(new LocalFileStorageService(storageRoot.toString()));
    }

    private StagingAssembler assembler(FileStorageService storage) {
        SchemaCatalogProvider provider = TestSchemas.provider();
        ValueCoercer coercer = new ValueCoercer();
        CompoundFieldExpander expander = new CompoundFieldExpander();
        return new StagingAssembler(storage,
                new WorkbookIngestor(provider, new FieldExtractor(coercer, expander)),
                new NormalizedPayloadReader(new ObjectMapper(), provider, coercer, expander),
                new ImportAuditFormatter(), provider, CLOCK, "id_incidence");
    }

    @Test
    void assemble_shouldStageWorkbookWithCaptureMetadata() {
        byte[] content = TestWorkbooks.landfillBytes(TestWorkbooks.sampleLandfillValues());

        Result<StagedRecord> staged = assembler.assemble(new RawUpload("feedback_20240101120000.xlsx", content));

        Assertions.assertTrue(staged.isOk(), String.valueOf(staged));
        StagedRecord record = staged.getValue();
        Assertions.assertEquals(1002001L, record.getIdentityKey());
        Assertions.assertEquals("Landfill", record.getSector());
        Assertions.assertEquals("feedback_20240101120000.xlsx", record.getSourceFilename());
        Assertions.assertEquals(LocalDateTime.of(2025, 3, 15, 17, 45, 30), record.getCapture().getCapturedAt());
        Assertions.assertEquals(content.length, record.getCapture().getSizeBytes());
        Assertions.assertEquals(DigestUtils.sha256Hex(content), record.getCapture().getSha256());
        Assertions.assertEquals(FieldValue.ofString("Acme Landfill"), record.getFields().get("facility_name"));
        Assertions.assertTrue(Files.exists(storageRoot.resolve("uploads/feedback_20250315174530.xlsx")));
    }

    @Test
    void assemble_shouldRejectUploadWithoutIdentity() {
        Map<String, Object> values = TestWorkbooks.sampleLandfillValues();
        values.remove("id_incidence");

        Result<StagedRecord> staged = assembler.assemble(new RawUpload("feedback.xlsx", TestWorkbooks.landfillBytes(values)));

        Assertions.assertEquals(ErrorKind.MISSING_ID, staged.getErrorKind());
    }

    @Test
    void assemble_shouldRejectNonPositiveIdentity() {
        Map<String, Object> values = TestWorkbooks.sampleLandfillValues();
        values.put("id_incidence", 0d);

        Assertions.assertEquals(ErrorKind.MISSING_ID,
                assembler.assemble(new RawUpload("feedback.xlsx", TestWorkbooks.landfillBytes(values))).getErrorKind());
    }

    @Test
    void assemble_shouldRejectTabsThatDisagreeOnIdentity() {
        Workbook workbook = TestWorkbooks.landfillWorkbook(TestWorkbooks.sampleLandfillValues());
        Sheet second = workbook.createSheet("Follow Up");
        TestWorkbooks.set(workbook, second, "$C$15", 1002002d);
        Sheet manifest = workbook.getSheet("_json_schema");
        TestWorkbooks.set(workbook, manifest, "$B$16", "Follow Up");
        TestWorkbooks.set(workbook, manifest, "$C$16", TestSchemas.LANDFILL);

        Result<StagedRecord> staged = assembler.assemble(new RawUpload("feedback.xlsx", TestWorkbooks.toBytes(workbook)));

        Assertions.assertEquals(ErrorKind.INVALID_ID, staged.getErrorKind());
    }

    @Test
    void assemble_shouldReportUnsupportedAndUnreadableFilesAsConversionFailures() {
        Assertions.assertEquals(ErrorKind.CONVERSION_FAILED,
                assembler.assemble(new RawUpload("notes.txt", "hello".getBytes(StandardCharsets.UTF_8))).getErrorKind());
        Assertions.assertEquals(ErrorKind.CONVERSION_FAILED,
                assembler.assemble(new RawUpload("broken.xlsx", "not a workbook".getBytes(StandardCharsets.UTF_8))).getErrorKind());
    }

    @Test
    void assemble_shouldReportPasswordProtectedWorkbookAsConversionFailure() {
        byte[] encrypted = TestWorkbooks.encrypt(TestWorkbooks.landfillBytes(TestWorkbooks.sampleLandfillValues()), "secret");

        Result<StagedRecord> staged = assembler.assemble(new RawUpload("feedback.xlsx", encrypted));

        Assertions.assertEquals(ErrorKind.CONVERSION_FAILED, staged.getErrorKind());
        Assertions.assertTrue(staged.getMessage().contains("password protected"));
    }

    @Test
    void assemble_shouldReportCorruptWorkbookAsConversionFailure() {
        byte[] corrupt = TestWorkbooks.replaceEntry(TestWorkbooks.landfillBytes(TestWorkbooks.sampleLandfillValues()),
                "xl/workbook.xml", "<workbook><broken");

        Result<StagedRecord> staged = assembler.assemble(new RawUpload("feedback.xlsx", corrupt));

        Assertions.assertEquals(ErrorKind.CONVERSION_FAILED, staged.getErrorKind());
    }

    @Test
    void assemble_shouldCarryIngestFailureKindInMessage() {
        Workbook workbook = TestWorkbooks.landfillWorkbook(TestWorkbooks.sampleLandfillValues());
        workbook.removeSheetAt(workbook.getSheetIndex("_json_schema"));

        Result<StagedRecord> staged = assembler.assemble(new RawUpload("feedback.xlsx", TestWorkbooks.toBytes(workbook)));

        Assertions.assertEquals(ErrorKind.CONVERSION_FAILED, staged.getErrorKind());
        Assertions.assertTrue(staged.getMessage().startsWith("[schema_manifest_missing]"));
    }

    @Test
    void assemble_shouldStageNormalizedJsonPayload() {
        String json = "{\"metadata\": {\"sector\": \"Oil and Gas\"},"
                + " \"schemas\": {\"Feedback Form\": \"oil_and_gas_v01_00\"},"
                + " \"tab_contents\": {\"Feedback Form\": {\"id_incidence\": 2002, \"facility_name\": \"Well 7\","
                + " \"lat_arb\": 35.1, \"long_arb\": -119.2, \"observation_timestamp\": \"2025-03-01T08:15:00\"}}}";

        Result<StagedRecord> staged = assembler.assemble(new RawUpload("payload.json", json.getBytes(StandardCharsets.UTF_8)));

        Assertions.assertTrue(staged.isOk(), String.valueOf(staged));
        Assertions.assertEquals(2002L, staged.getValue().getIdentityKey());
        Assertions.assertEquals(FieldValue.ofFloat(35.1), staged.getValue().getFields().get("lat_arb"));
        Assertions.assertEquals(FieldValue.ofDateTime(LocalDateTime.of(2025, 3, 1, 8, 15)),
                staged.getValue().getFields().get("observation_timestamp"));
    }

    @Test
    void assemble_shouldReportStorageFailureAsFileError() throws IOException {
        FileStorageService storage = mock(FileStorageService.class);
        when(storage.saveFile(any(), anyString())).thenThrow(new IOException("disk full"));

        Result<StagedRecord> staged = assembler(storage)
                .assemble(new RawUpload("feedback.xlsx", TestWorkbooks.landfillBytes(TestWorkbooks.sampleLandfillValues())));

        Assertions.assertEquals(ErrorKind.FILE_ERROR, staged.getErrorKind());
    }

    @Test
    void generateCleanFileName_shouldReplaceExistingTimestamp() {
        Assertions.assertEquals("form_20250315174530.xlsx",
                StagingAssembler.generateCleanFileName("form_20240101120000.xlsx", "20250315174530"));
        Assertions.assertEquals("form_20250315174530.xlsx",
                StagingAssembler.generateCleanFileName("C:\\Users\\dana\\form.xlsx", "20250315174530"));
    }
}
