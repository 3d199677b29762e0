package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.DiagnosticType;
import com.poc.xlstaging.dto.FieldType;
import com.poc.xlstaging.dto.FieldValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

class ValueCoercerTest {

    private final ValueCoercer coercer = new ValueCoercer();

    @Test
    void coerce_shouldTreatNullAndEmptyAsAbsentForEveryType() {
        for (FieldType type : FieldType.values()) {
            Assertions.assertTrue(coercer.coerce(null, type).getValue().isAbsent(), type.name());
            Assertions.assertTrue(coercer.coerce("", type).getValue().isAbsent(), type.name());
            Assertions.assertFalse(coercer.coerce("", type).hasIssue(), type.name());
        }
    }

    @Test
    void coerce_shouldReadWholeSpreadsheetNumberAsInteger() {
        ValueCoercer.Coercion coercion = coercer.coerce(1002001d, FieldType.INTEGER);

        Assertions.assertEquals(FieldValue.ofInteger(1002001L), coercion.getValue());
        Assertions.assertFalse(coercion.hasIssue());
    }

    @Test
    void coerce_shouldDropFractionalInteger() {
        ValueCoercer.Coercion coercion = coercer.coerce(12.5d, FieldType.INTEGER);

        Assertions.assertTrue(coercion.getValue().isAbsent());
        Assertions.assertEquals(DiagnosticType.VALUE_DROPPED, coercion.getIssue());
    }

    @Test
    void coerce_shouldConvertNumericTextAndRecordIt() {
        ValueCoercer.Coercion integer = coercer.coerce(" 42 ", FieldType.INTEGER);
        ValueCoercer.Coercion floating = coercer.coerce("512.5", FieldType.FLOAT);

        Assertions.assertEquals(FieldValue.ofInteger(42L), integer.getValue());
        Assertions.assertEquals(DiagnosticType.VALUE_COERCED, integer.getIssue());
        Assertions.assertEquals(FieldValue.ofFloat(512.5), floating.getValue());
        Assertions.assertEquals(DiagnosticType.VALUE_COERCED, floating.getIssue());
    }

    @Test
    void coerce_shouldRefuseBooleanAsNumber() {
        Assertions.assertEquals(DiagnosticType.VALUE_DROPPED, coercer.coerce(true, FieldType.INTEGER).getIssue());
        Assertions.assertEquals(DiagnosticType.VALUE_DROPPED, coercer.coerce(false, FieldType.FLOAT).getIssue());
        Assertions.assertEquals(DiagnosticType.VALUE_DROPPED, coercer.coerce("n/a", FieldType.FLOAT).getIssue());
    }

    @Test
    void coerce_shouldRenderNumbersAsPlainText() {
        Assertions.assertEquals(FieldValue.ofString("1002001"), coercer.coerce(1002001d, FieldType.STRING).getValue());
        Assertions.assertEquals(FieldValue.ofString("0.25"), coercer.coerce(0.25d, FieldType.STRING).getValue());
    }

    @Test
    void coerce_shouldKeepStringsVerbatim() {
        ValueCoercer.Coercion coercion = coercer.coerce("  Acme  ", FieldType.STRING);

        Assertions.assertEquals(FieldValue.ofString("  Acme  "), coercion.getValue());
        Assertions.assertFalse(coercion.hasIssue());
    }

    @Test
    void coerce_shouldParseCivilDateTimeText() {
        LocalDateTime expected = LocalDateTime.of(2025, 3, 14, 9, 30);
        for (String text : List.of("2025-03-14T09:30", "2025-03-14 09:30", "2025-03-14 09:30:00", "3/14/2025 9:30")) {
            Assertions.assertEquals(FieldValue.ofDateTime(expected), coercer.coerce(text, FieldType.DATETIME).getValue(), text);
        }
        Assertions.assertEquals(FieldValue.ofDateTime(LocalDateTime.of(2025, 3, 14, 0, 0)),
                coercer.coerce("2025-03-14", FieldType.DATETIME).getValue());
    }

    @Test
    void coerce_shouldDropZonedAndAmbiguousDateTimes() {
        for (String text : List.of("2025-03-14T09:30:00Z", "2025-03-14T09:30:00-07:00", "2025-03-14 09:30 PST",
                "3/14/25", "2025-02-30", "next tuesday")) {
            ValueCoercer.Coercion coercion = coercer.coerce(text, FieldType.DATETIME);
            Assertions.assertTrue(coercion.getValue().isAbsent(), text);
            Assertions.assertEquals(DiagnosticType.VALUE_DROPPED, coercion.getIssue(), text);
        }
    }

    @Test
    void coerce_shouldConvertSpreadsheetDateSerial() {
        ValueCoercer.Coercion coercion = coercer.coerce(45730.5d, FieldType.DATETIME);

        Assertions.assertEquals(FieldValue.ofDateTime(LocalDateTime.of(2025, 3, 14, 12, 0)), coercion.getValue());
    }

    @Test
    void coerce_shouldMapYesNoToBoolean() {
        Assertions.assertEquals(FieldValue.ofBoolean(true), coercer.coerce("Yes", FieldType.BOOLEAN).getValue());
        Assertions.assertEquals(FieldValue.ofBoolean(false), coercer.coerce(0d, FieldType.BOOLEAN).getValue());
        Assertions.assertTrue(coercer.coerce("maybe", FieldType.BOOLEAN).getValue().isAbsent());
    }
}
