package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.Diagnostic;
import com.poc.xlstaging.dto.DiagnosticType;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.FieldValue;
import com.poc.xlstaging.dto.Result;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits synthetic fields that pack several numbers into one cell (for example "lat, long") into separate float fields.
 */
@Slf4j
@Component
public class CompoundFieldExpander {

    public static final CompoundRule LAT_AND_LONG = new CompoundRule("lat_and_long", List.of("lat_arb", "long_arb"), ",");

    @Value
    public static class CompoundRule {
        String sourceField;
        List<String> targetFields;
        String separator;

        public CompoundRule(String sourceField, List<String> targetFields, String separator) {
            if (targetFields == null || targetFields.size() < 2) {
                throw new IllegalArgumentException("A compound rule needs at least two target fields");
            }
            this.sourceField = sourceField;
            this.targetFields = List.copyOf(targetFields);
            this.separator = separator;
        }
    }

    private final List<CompoundRule> rules;

    public CompoundFieldExpander() {
        this(List.of(LAT_AND_LONG));
    }

    public CompoundFieldExpander(List<CompoundRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Replaces each compound source field by its parts, in the source field's position. An absent source is removed
     * without adding parts. A part that the tab also supplies directly keeps the split value; the direct value is
     * dropped with a {@code DUPLICATE_FIELD} diagnostic added to {@code diagnostics}.
     */
    public Result<Map<String, FieldValue>> expand(String tabName, Map<String, FieldValue> fields,
                                                  List<Diagnostic> diagnostics) {
        Map<String, String> derivedFrom = derivedTargets(fields);
        Map<String, FieldValue> expanded = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValue> entry : fields.entrySet()) {
            CompoundRule rule = ruleFor(entry.getKey());
            if (rule == null) {
                String source = derivedFrom.get(entry.getKey());
                if (source != null) {
                    diagnostics.add(Diagnostic.forField(DiagnosticType.DUPLICATE_FIELD, tabName, entry.getKey(),
                            "Field is also produced by splitting '" + source + "'; the split value is used"));
                    continue;
                }
                expanded.put(entry.getKey(), entry.getValue());
                continue;
            }
            FieldValue source = entry.getValue();
            if (source.isAbsent()) {
                continue;
            }
            String text = source.getKind() == FieldValue.Kind.STRING
                    ? source.asString()
                    : String.valueOf(source.toStoredValue());
            String[] parts = text.split(Pattern.quote(rule.getSeparator()), -1);
            if (parts.length != rule.getTargetFields().size()) {
                return Result.failure(ErrorKind.COMPOUND_FIELD_INVALID, String.format(
                        "%s.%s: expected %d parts separated by '%s' but found %d in '%s'",
                        tabName, rule.getSourceField(), rule.getTargetFields().size(), rule.getSeparator(), parts.length, text));
            }
            for (int i = 0; i < parts.length; i++) {
                String part = parts[i].trim();
                Double number = parseNumber(part);
                if (number == null) {
                    return Result.failure(ErrorKind.COMPOUND_FIELD_INVALID, String.format(
                            "%s.%s: part '%s' for %s is not a number", tabName, rule.getSourceField(), part,
                            rule.getTargetFields().get(i)));
                }
                expanded.put(rule.getTargetFields().get(i), FieldValue.ofFloat(number));
            }
            log.debug("Expanded {}.{} into {}", tabName, rule.getSourceField(), rule.getTargetFields());
        }
        return Result.success(expanded);
    }

    /** Target field to source field, for every rule whose source holds a value. */
    private Map<String, String> derivedTargets(Map<String, FieldValue> fields) {
        Map<String, String> derivedFrom = new HashMap<>();
        for (CompoundRule rule : rules) {
            FieldValue source = fields.get(rule.getSourceField());
            if (source != null && !source.isAbsent()) {
                rule.getTargetFields().forEach(target -> derivedFrom.put(target, rule.getSourceField()));
            }
        }
        return derivedFrom;
    }

    /** Plain decimal notation only; Java literal suffixes and hex floats are not numbers here. */
    private static Double parseNumber(String part) {
        try {
            double value = new BigDecimal(part).doubleValue();
            return Double.isInfinite(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private CompoundRule ruleFor(String fieldName) {
        for (CompoundRule rule : rules) {
            if (rule.getSourceField().equals(fieldName)) {
                return rule;
            }
        }
        return null;
    }
}
