package com.poc.xlstaging.service.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaFieldDefinition;
import com.poc.xlstaging.dto.SchemaSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads schema documents of the form {@code {"_metadata_": {...}, "_data_": {field: {...}}}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaSourceLoader {

    static final String DATA_KEY = "_data_";
    static final String METADATA_KEY = "_metadata_";
    static final String VERSION_KEY = "schema_version";

    private static final TypeReference<LinkedHashMap<String, SchemaFieldDefinition>> FIELDS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resourcePatternResolver;

    /**
     * Loads every document matching the pattern. Unreadable documents do not stop the scan; they are all reported in
     * one {@code schema_invalid} failure.
     */
    public Result<List<SchemaSource>> loadAll(String locationPattern) {
        Resource[] resources;
        try {
            resources = resourcePatternResolver.getResources(locationPattern);
        } catch (IOException e) {
            return Result.failure(ErrorKind.SCHEMA_INVALID, "Cannot list schema documents at " + locationPattern + ": " + e.getMessage());
        }
        Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));

        List<SchemaSource> sources = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        for (Resource resource : resources) {
            String fallbackName = baseName(resource.getFilename());
            try (InputStream in = resource.getInputStream()) {
                Result<SchemaSource> parsed = parse(fallbackName, in);
                if (parsed.isOk()) {
                    sources.add(parsed.getValue());
                } else {
                    problems.add(parsed.getMessage());
                }
            } catch (IOException e) {
                problems.add(resource.getDescription() + ": " + e.getMessage());
            }
        }
        if (!problems.isEmpty()) {
            return Result.failure(ErrorKind.SCHEMA_INVALID,
                    problems.size() + " unreadable schema document(s): " + String.join("; ", problems));
        }
        log.debug("Read {} schema document(s) from {}", sources.size(), locationPattern);
        return Result.success(sources);
    }

    public Result<SchemaSource> parse(String fallbackName, InputStream in) {
        try {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isObject() || !root.has(DATA_KEY)) {
                return Result.failure(ErrorKind.SCHEMA_INVALID, fallbackName + ": missing '" + DATA_KEY + "' section");
            }
            Map<String, SchemaFieldDefinition> fields = objectMapper.convertValue(root.get(DATA_KEY), FIELDS_TYPE);
            Map<String, Object> metadata = root.has(METADATA_KEY)
                    ? objectMapper.convertValue(root.get(METADATA_KEY), METADATA_TYPE)
                    : new LinkedHashMap<>();
            Object declared = metadata.get(VERSION_KEY);
            String name = declared != null ? declared.toString() : fallbackName;
            return Result.success(new SchemaSource(name, fields, metadata));
        } catch (IOException | IllegalArgumentException e) {
            return Result.failure(ErrorKind.SCHEMA_INVALID, fallbackName + ": " + e.getMessage());
        }
    }

    private static String baseName(String filename) {
        if (filename == null) {
            return "unnamed";
        }
        int dot = filename.lastIndexOf('.');
        return dot == -1 ? filename : filename.substring(0, dot);
    }
}
