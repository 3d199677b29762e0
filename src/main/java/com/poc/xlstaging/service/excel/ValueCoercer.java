package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.DiagnosticType;
import com.poc.xlstaging.dto.FieldType;
import com.poc.xlstaging.dto.FieldValue;
import lombok.Value;
import org.apache.poi.ss.usermodel.DateUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts raw cell values (String, Double, Boolean, LocalDateTime or null) to the type a schema expects.
 * Conversions that would lose or invent information produce an absent value, never a default.
 */
@Component
public class ValueCoercer {

    private static final BigDecimal MAX_SAFE_WHOLE = BigDecimal.valueOf(9_007_199_254_740_992L);

    private static final Pattern TWO_DIGIT_YEAR = Pattern.compile("^\\d{1,2}[/-]\\d{1,2}[/-]\\d{2}(\\s.*)?$");
    private static final Pattern TRAILING_OFFSET = Pattern.compile(".*(Z|[+-]\\d{2}(:?\\d{2})?)$");
    private static final Pattern TRAILING_ZONE_NAME = Pattern.compile(".*(\\s[A-Za-z]{3,5}|\\[.+])$");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm[:ss]").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu H:mm[:ss]").withResolverStyle(ResolverStyle.STRICT)
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    /**
     * Outcome of one coercion. {@code issue} is null when the raw value already had the expected type.
     */
    @Value
    public static class Coercion {
        FieldValue value;
        DiagnosticType issue;
        String message;

        static Coercion clean(FieldValue value) {
            return new Coercion(value, null, null);
        }

        static Coercion converted(FieldValue value, Object raw) {
            return new Coercion(value, DiagnosticType.VALUE_COERCED,
                    "Converted " + describe(raw) + " to " + value.getKind().name().toLowerCase(Locale.ROOT));
        }

        static Coercion dropped(Object raw, FieldType expected, String reason) {
            return new Coercion(FieldValue.absent(), DiagnosticType.VALUE_DROPPED,
                    "Could not use " + describe(raw) + " as " + expected.getSchemaName() + " (" + reason + "); treated as absent");
        }

        public boolean hasIssue() {
            return issue != null;
        }
    }

    public Coercion coerce(Object raw, FieldType expected) {
        if (raw == null) {
            return Coercion.clean(FieldValue.absent());
        }
        if (raw instanceof String && ((String) raw).isEmpty()) {
            return Coercion.clean(FieldValue.absent());
        }
        if (raw instanceof String && expected != FieldType.STRING && ((String) raw).isBlank()) {
            return Coercion.clean(FieldValue.absent());
        }
        switch (expected) {
            case STRING:
                return toStringValue(raw);
            case INTEGER:
                return toIntegerValue(raw);
            case FLOAT:
                return toFloatValue(raw);
            case DATETIME:
                return toDateTimeValue(raw);
            case BOOLEAN:
                return toBooleanValue(raw);
            default:
                throw new IllegalArgumentException("Unhandled field type " + expected);
        }
    }

    private Coercion toStringValue(Object raw) {
        if (raw instanceof String) {
            return Coercion.clean(FieldValue.ofString((String) raw));
        }
        if (raw instanceof Number) {
            return Coercion.converted(FieldValue.ofString(plainNumber((Number) raw)), raw);
        }
        if (raw instanceof Boolean || raw instanceof LocalDateTime) {
            return Coercion.converted(FieldValue.ofString(raw.toString()), raw);
        }
        return Coercion.dropped(raw, FieldType.STRING, "unsupported cell value");
    }

    private Coercion toIntegerValue(Object raw) {
        if (raw instanceof Long || raw instanceof Integer) {
            return Coercion.clean(FieldValue.ofInteger(((Number) raw).longValue()));
        }
        BigDecimal number;
        if (raw instanceof Number) {
            number = new BigDecimal(raw.toString());
        } else if (raw instanceof String) {
            number = parseDecimal((String) raw);
            if (number == null) {
                return Coercion.dropped(raw, FieldType.INTEGER, "not a number");
            }
        } else {
            return Coercion.dropped(raw, FieldType.INTEGER, "incompatible cell type");
        }
        try {
            BigInteger whole = number.stripTrailingZeros().toBigIntegerExact();
            if (raw instanceof Double && number.abs().compareTo(MAX_SAFE_WHOLE) > 0) {
                return Coercion.dropped(raw, FieldType.INTEGER, "beyond exact floating point range");
            }
            FieldValue value = FieldValue.ofInteger(whole.longValueExact());
            // spreadsheets store every number as a double
            return raw instanceof Double ? Coercion.clean(value) : Coercion.converted(value, raw);
        } catch (ArithmeticException e) {
            return Coercion.dropped(raw, FieldType.INTEGER, "not a whole number in range");
        }
    }

    private Coercion toFloatValue(Object raw) {
        if (raw instanceof Double) {
            double value = (Double) raw;
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Coercion.dropped(raw, FieldType.FLOAT, "not finite");
            }
            return Coercion.clean(FieldValue.ofFloat(value));
        }
        if (raw instanceof Number) {
            return Coercion.converted(FieldValue.ofFloat(((Number) raw).doubleValue()), raw);
        }
        if (raw instanceof String) {
            BigDecimal number = parseDecimal((String) raw);
            if (number == null) {
                return Coercion.dropped(raw, FieldType.FLOAT, "not a number");
            }
            double value = number.doubleValue();
            if (Double.isInfinite(value)) {
                return Coercion.dropped(raw, FieldType.FLOAT, "out of range");
            }
            return Coercion.converted(FieldValue.ofFloat(value), raw);
        }
        return Coercion.dropped(raw, FieldType.FLOAT, "incompatible cell type");
    }

    private Coercion toDateTimeValue(Object raw) {
        if (raw instanceof LocalDateTime) {
            return Coercion.clean(FieldValue.ofDateTime((LocalDateTime) raw));
        }
        if (raw instanceof Double) {
            double serial = (Double) raw;
            if (!DateUtil.isValidExcelDate(serial)) {
                return Coercion.dropped(raw, FieldType.DATETIME, "not a valid spreadsheet date serial");
            }
            return Coercion.converted(FieldValue.ofDateTime(DateUtil.getLocalDateTime(serial)), raw);
        }
        if (!(raw instanceof String)) {
            return Coercion.dropped(raw, FieldType.DATETIME, "incompatible cell type");
        }
        String text = ((String) raw).trim();
        if (TWO_DIGIT_YEAR.matcher(text).matches()) {
            return Coercion.dropped(raw, FieldType.DATETIME, "ambiguous two-digit year");
        }
        boolean hasTime = text.indexOf(':') >= 0 || text.indexOf('T') > 0;
        if (hasTime && (TRAILING_OFFSET.matcher(text).matches() || TRAILING_ZONE_NAME.matcher(text).matches())) {
            return Coercion.dropped(raw, FieldType.DATETIME, "timezone-aware values are not accepted");
        }
        LocalDateTime parsed = parseCivilDateTime(text);
        if (parsed == null) {
            return Coercion.dropped(raw, FieldType.DATETIME, "unrecognized date format");
        }
        return Coercion.converted(FieldValue.ofDateTime(parsed), raw);
    }

    private Coercion toBooleanValue(Object raw) {
        if (raw instanceof Boolean) {
            return Coercion.clean(FieldValue.ofBoolean((Boolean) raw));
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            if (value == 1d || value == 0d) {
                return Coercion.converted(FieldValue.ofBoolean(value == 1d), raw);
            }
            return Coercion.dropped(raw, FieldType.BOOLEAN, "only 1 and 0 map to booleans");
        }
        if (raw instanceof String) {
            switch (((String) raw).trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "yes":
                case "y":
                case "1":
                    return Coercion.converted(FieldValue.ofBoolean(true), raw);
                case "false":
                case "no":
                case "n":
                case "0":
                    return Coercion.converted(FieldValue.ofBoolean(false), raw);
                default:
                    return Coercion.dropped(raw, FieldType.BOOLEAN, "not a recognized yes/no value");
            }
        }
        return Coercion.dropped(raw, FieldType.BOOLEAN, "incompatible cell type");
    }

    static LocalDateTime parseCivilDateTime(String text) {
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                TemporalAccessor parsed = format.parse(text);
                return LocalDateTime.from(parsed);
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.from(format.parse(text)).atStartOfDay();
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        return null;
    }

    private static BigDecimal parseDecimal(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String plainNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue()).stripTrailingZeros().toPlainString();
        }
        return number.toString();
    }

    private static String describe(Object raw) {
        return raw.getClass().getSimpleName().toLowerCase(Locale.ROOT) + " '" + raw + "'";
    }
}
