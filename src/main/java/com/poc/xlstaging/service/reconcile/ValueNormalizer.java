package com.poc.xlstaging.service.reconcile;

import com.poc.xlstaging.dto.FieldValue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Canonical string form used to decide whether a stored value and an incoming value are the same.
 * Incoming values go through {@link FieldValue#toStoredValue()} first, so both sides share one path.
 */
@Component
public class ValueNormalizer {

    private static final DateTimeFormatter CANONICAL_DATE_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final ZoneId referenceZone;

    public ValueNormalizer(@Value("${xl.reconcile.reference-zone:America/Los_Angeles}") String referenceZone) {
        this.referenceZone = ZoneId.of(referenceZone);
    }

    public String normalize(FieldValue value) {
        return normalize(value == null ? null : value.toStoredValue());
    }

    public String normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(CANONICAL_DATE_TIME);
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            BigDecimal number = value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString());
            return number.stripTrailingZeros().toPlainString();
        }
        if (value instanceof String) {
            String text = (String) value;
            if (text.indexOf('T') > 0) {
                String dateTime = normalizeDateTimeText(text.trim());
                if (dateTime != null) {
                    return dateTime;
                }
            }
            return text;
        }
        return String.valueOf(value);
    }

    /**
     * ISO text with an offset or zone is shifted to the reference zone; ISO local text is already civil time there.
     */
    private String normalizeDateTimeText(String text) {
        try {
            return LocalDateTime.parse(text).format(CANONICAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            // not a local date-time
        }
        try {
            return OffsetDateTime.parse(text).atZoneSameInstant(referenceZone).toLocalDateTime().format(CANONICAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            // not an offset date-time
        }
        try {
            return ZonedDateTime.parse(text).withZoneSameInstant(referenceZone).toLocalDateTime().format(CANONICAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
