package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.Diagnostic;
import com.poc.xlstaging.dto.DiagnosticType;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.ExtractedTab;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaVersion;
import com.poc.xlstaging.support.InMemoryWorkbookReader;
import com.poc.xlstaging.support.TestSchemas;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

class FieldExtractorTest {

    private static final String TAB = "Feedback Form";

    private final FieldExtractor extractor = new FieldExtractor(new ValueCoercer(), new CompoundFieldExpander());
    private SchemaVersion landfill;
    private InMemoryWorkbookReader reader;

    @BeforeEach
    void setUp() {
        landfill = TestSchemas.catalog().resolve(TestSchemas.LANDFILL).getValue();
        reader = new InMemoryWorkbookReader()
                .put(TAB, "$B$15", "Incidence/Emission ID:").put(TAB, "$C$15", 1002001d)
                .put(TAB, "$B$16", "Facility Name:").put(TAB, "$C$16", "Acme Landfill")
                .put(TAB, "$B$20", "Latitude, Longitude:").put(TAB, "$C$20", "34.05,-118.25")
                .put(TAB, "$B$21", "Inspection Date and Time:").put(TAB, "$C$21", LocalDateTime.of(2025, 3, 14, 9, 30))
                .put(TAB, "$B$22", "Initial Leak Concentration (ppmv):").put(TAB, "$C$22", 512.5d)
                .put(TAB, "$B$23", "Emission Identified:").put(TAB, "$C$23", "Yes");
    }

    private static List<Diagnostic> ofType(ExtractedTab tab, DiagnosticType type) {
        return tab.getDiagnostics().stream().filter(d -> d.getType() == type).collect(Collectors.toList());
    }

    @Test
    void extract_shouldTypeEveryDeclaredField() {
        Result<ExtractedTab> extracted = extractor.extract(reader, TAB, landfill);

        Assertions.assertTrue(extracted.isOk());
        ExtractedTab tab = extracted.getValue();
        Assertions.assertEquals(TestSchemas.LANDFILL, tab.getSchemaId());
        Assertions.assertEquals(FieldValue.ofInteger(1002001L), tab.getFields().get("id_incidence"));
        Assertions.assertEquals(FieldValue.ofString("Acme Landfill"), tab.getFields().get("facility_name"));
        Assertions.assertEquals(FieldValue.ofDateTime(LocalDateTime.of(2025, 3, 14, 9, 30)), tab.getFields().get("inspection_timestamp"));
        Assertions.assertEquals(FieldValue.ofFloat(34.05), tab.getFields().get("lat_arb"));
        Assertions.assertTrue(tab.getFields().get("contact_name").isAbsent());
        Assertions.assertFalse(tab.getFields().containsKey("lat_and_long"));
    }

    @Test
    void extract_shouldReportLabelMismatchWithoutFailing() {
        reader.put(TAB, "$B$16", "Site Name:");

        ExtractedTab tab = extractor.extract(reader, TAB, landfill).getValue();

        List<Diagnostic> mismatches = ofType(tab, DiagnosticType.LABEL_MISMATCH);
        Assertions.assertTrue(mismatches.stream().anyMatch(d -> "facility_name".equals(d.getFieldName())
                && d.getMessage().contains("Site Name:")));
        Assertions.assertEquals(FieldValue.ofString("Acme Landfill"), tab.getFields().get("facility_name"));
    }

    @Test
    void extract_shouldIgnoreSurroundingWhitespaceInLabels() {
        reader.put(TAB, "$B$16", "  Facility Name:  ");

        ExtractedTab tab = extractor.extract(reader, TAB, landfill).getValue();

        Assertions.assertTrue(ofType(tab, DiagnosticType.LABEL_MISMATCH).stream()
                .noneMatch(d -> "facility_name".equals(d.getFieldName())));
    }

    @Test
    void extract_shouldKeepPlaceholderAsValueWithDiagnostic() {
        reader.put(TAB, "$C$23", "Please Select");

        ExtractedTab tab = extractor.extract(reader, TAB, landfill).getValue();

        Assertions.assertEquals(FieldValue.ofString("Please Select"), tab.getFields().get("emission_identified_flag_fk"));
        Assertions.assertEquals(1, ofType(tab, DiagnosticType.PLACEHOLDER_VALUE).size());
    }

    @Test
    void extract_shouldDropUnusableValueWithDiagnostic() {
        reader.put(TAB, "$C$15", "ten");

        ExtractedTab tab = extractor.extract(reader, TAB, landfill).getValue();

        Assertions.assertTrue(tab.getFields().get("id_incidence").isAbsent());
        Assertions.assertEquals("id_incidence", ofType(tab, DiagnosticType.VALUE_DROPPED).get(0).getFieldName());
    }

    @Test
    void extract_shouldFailTabOnBadCompoundValue() {
        reader.put(TAB, "$C$20", "34.05");

        Result<ExtractedTab> extracted = extractor.extract(reader, TAB, landfill);

        Assertions.assertEquals(ErrorKind.COMPOUND_FIELD_INVALID, extracted.getErrorKind());
    }

    @Test
    void extract_shouldBeDeterministic() {
        Assertions.assertEquals(extractor.extract(reader, TAB, landfill).getValue(), extractor.extract(reader, TAB, landfill).getValue());
    }
}
