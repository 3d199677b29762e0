package com.poc.xlstaging.service.reconcile;

import com.poc.xlstaging.dto.FieldValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

class ValueNormalizerTest {

    private final ValueNormalizer normalizer = new ValueNormalizer("America/Los_Angeles");

    @Test
    void normalize_shouldCollapseAbsentNullAndEmpty() {
        Assertions.assertEquals("", normalizer.normalize(FieldValue.absent()));
        Assertions.assertEquals("", normalizer.normalize((Object) null));
        Assertions.assertEquals("", normalizer.normalize(""));
    }

    @Test
    void normalize_shouldDropFractionOfWholeFloats() {
        Assertions.assertEquals("500", normalizer.normalize(FieldValue.ofFloat(500.0)));
        Assertions.assertEquals("500", normalizer.normalize(500));
        Assertions.assertEquals("34.05", normalizer.normalize(34.05));
    }

    @Test
    void normalize_shouldTreatTypedAndTextDateTimesAlike() {
        String typed = normalizer.normalize(FieldValue.ofDateTime(LocalDateTime.of(2025, 3, 14, 9, 30)));

        Assertions.assertEquals("2025-03-14T09:30:00", typed);
        Assertions.assertEquals(typed, normalizer.normalize("2025-03-14T09:30"));
        Assertions.assertEquals(typed, normalizer.normalize(LocalDateTime.of(2025, 3, 14, 9, 30)));
    }

    @Test
    void normalize_shouldShiftOffsetTextIntoReferenceZone() {
        Assertions.assertEquals("2025-03-14T09:30:00", normalizer.normalize("2025-03-14T16:30:00Z"));
        Assertions.assertEquals("2025-01-10T08:00:00", normalizer.normalize("2025-01-10T16:00:00+00:00"));
    }

    @Test
    void normalize_shouldLeaveOrdinaryTextAlone() {
        Assertions.assertEquals("Tank T-4", normalizer.normalize("Tank T-4"));
        Assertions.assertEquals("true", normalizer.normalize(FieldValue.ofBoolean(true)));
    }
}
