package com.poc.xlstaging.service.schema;

import com.poc.xlstaging.dto.CellAddress;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.FieldSpec;
import com.poc.xlstaging.dto.FieldType;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaFieldDefinition;
import com.poc.xlstaging.dto.SchemaSource;
import com.poc.xlstaging.dto.SchemaVersion;
import com.poc.xlstaging.service.excel.CellAddressing;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of validated schema versions plus the single-hop alias table used to resolve retired names.
 */
@Slf4j
public final class SchemaCatalog {

    private final Map<String, SchemaVersion> versions;
    private final Map<String, String> aliases;

    private SchemaCatalog(Map<String, SchemaVersion> versions, Map<String, String> aliases) {
        this.versions = Collections.unmodifiableMap(versions);
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    /**
     * Validates every source and builds a catalog. Violations are collected across all sources rather than stopping
     * at the first one, and are reported together in a single {@code schema_invalid} failure.
     */
    public static Result<SchemaCatalog> load(Collection<SchemaSource> sources, Map<String, String> aliases) {
        List<String> violations = new ArrayList<>();
        Map<String, SchemaVersion> versions = new LinkedHashMap<>();

        for (SchemaSource source : sources) {
            String name = source.getName();
            if (name == null || name.isBlank()) {
                violations.add("Schema without a name");
                continue;
            }
            if (versions.containsKey(name)) {
                violations.add(name + ": duplicate schema name");
                continue;
            }
            Map<String, FieldSpec> specs = new LinkedHashMap<>();
            Map<String, SchemaFieldDefinition> fields = source.getFields() == null ? Map.of() : source.getFields();
            if (fields.isEmpty()) {
                violations.add(name + ": schema declares no fields");
            }
            for (Map.Entry<String, SchemaFieldDefinition> entry : fields.entrySet()) {
                toFieldSpec(name, entry.getKey(), entry.getValue(), violations).ifPresent(spec -> specs.put(spec.getFieldName(), spec));
            }
            versions.put(name, new SchemaVersion(name, specs, source.getMetadata()));
        }

        Map<String, String> aliasTable = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((retired, current) -> {
                if (versions.containsKey(retired)) {
                    violations.add(retired + ": alias shadows a loaded schema");
                } else {
                    aliasTable.put(retired, current);
                }
            });
        }

        if (!violations.isEmpty()) {
            String message = violations.size() + " schema violation(s): " + String.join("; ", violations);
            log.error(message);
            return Result.failure(ErrorKind.SCHEMA_INVALID, message);
        }
        log.info("Loaded {} schema version(s) {} with {} alias(es)", versions.size(), versions.keySet(), aliasTable.size());
        return Result.success(new SchemaCatalog(versions, aliasTable));
    }

    private static Optional<FieldSpec> toFieldSpec(String schemaName,
                                                   String fieldName,
                                                   SchemaFieldDefinition definition,
                                                   List<String> violations) {
        String where = schemaName + "." + fieldName;
        if (definition == null) {
            violations.add(where + ": missing field definition");
            return Optional.empty();
        }
        int before = violations.size();

        Result<CellAddress> valueAddress = CellAddressing.parse(definition.getValueAddress());
        if (valueAddress.isFailure()) {
            violations.add(where + ": value_address " + valueAddress.getMessage());
        }
        CellAddress labelAddress = null;
        if (definition.getLabelAddress() != null) {
            Result<CellAddress> parsed = CellAddressing.parse(definition.getLabelAddress());
            if (parsed.isFailure()) {
                violations.add(where + ": label_address " + parsed.getMessage());
            } else {
                labelAddress = parsed.getValue();
            }
        }
        Optional<FieldType> type = FieldType.fromSchemaName(definition.getValueType());
        if (type.isEmpty()) {
            violations.add(where + ": unsupported value_type '" + definition.getValueType() + "'");
        }
        if (violations.size() > before) {
            return Optional.empty();
        }
        return Optional.of(FieldSpec.builder()
                .fieldName(fieldName)
                .valueAddress(valueAddress.getValue())
                .labelAddress(labelAddress)
                .labelText(definition.getLabel())
                .expectedType(type.get())
                .dropDown(definition.isDropDown())
                .build());
    }

    /**
     * Resolves a schema by name, following at most one alias hop.
     */
    public Result<SchemaVersion> resolve(String name) {
        if (name == null) {
            return Result.failure(ErrorKind.SCHEMA_NOT_FOUND, "Schema name is missing");
        }
        SchemaVersion direct = versions.get(name);
        if (direct != null) {
            return Result.success(direct);
        }
        String target = aliases.get(name);
        if (target == null) {
            return Result.failure(ErrorKind.SCHEMA_NOT_FOUND, "Unknown schema '" + name + "'");
        }
        log.warn("Schema '{}' is retired; resolving through alias to '{}'", name, target);
        SchemaVersion aliased = versions.get(target);
        if (aliased == null) {
            return Result.failure(ErrorKind.SCHEMA_NOT_FOUND,
                    "Schema alias '" + name + "' points to unknown schema '" + target + "'");
        }
        return Result.success(aliased);
    }

    public Optional<String> aliasTarget(String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    public Set<String> getSchemaNames() {
        return versions.keySet();
    }

    public Map<String, String> getAliases() {
        return aliases;
    }
}
