package com.poc.xlstaging.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Typed value of one extracted field. Absence is an explicit variant rather than a null.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldValue {

    private static final FieldValue ABSENT = new FieldValue(Kind.ABSENT, null);

    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        DATETIME,
        BOOLEAN,
        ABSENT
    }

    Kind kind;
    Object value;

    public static FieldValue ofString(String value) {
        return new FieldValue(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static FieldValue ofInteger(long value) {
        return new FieldValue(Kind.INTEGER, value);
    }

    public static FieldValue ofFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Float field values must be finite: " + value);
        }
        return new FieldValue(Kind.FLOAT, value);
    }

    public static FieldValue ofDateTime(LocalDateTime value) {
        return new FieldValue(Kind.DATETIME, Objects.requireNonNull(value, "value"));
    }

    public static FieldValue ofBoolean(boolean value) {
        return new FieldValue(Kind.BOOLEAN, value);
    }

    public static FieldValue absent() {
        return ABSENT;
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public String asString() {
        return (String) expect(Kind.STRING);
    }

    public long asInteger() {
        return (Long) expect(Kind.INTEGER);
    }

    public double asFloat() {
        return (Double) expect(Kind.FLOAT);
    }

    public LocalDateTime asDateTime() {
        return (LocalDateTime) expect(Kind.DATETIME);
    }

    public boolean asBoolean() {
        return (Boolean) expect(Kind.BOOLEAN);
    }

    /**
     * JSON-friendly form written to the record store: datetimes become ISO-8601 local strings, absence becomes null.
     */
    public Object toStoredValue() {
        if (kind == Kind.DATETIME) {
            return value.toString();
        }
        return value;
    }

    private Object expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Field value is " + kind + ", not " + expected);
        }
        return value;
    }

    @Override
    public String toString() {
        return isAbsent() ? "<absent>" : kind + ":" + value;
    }
}
