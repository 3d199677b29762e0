package com.poc.xlstaging.dto;

import lombok.Value;

import java.util.Map;

/**
 * A named schema document before validation.
 */
@Value
public class SchemaSource {
    String name;
    Map<String, SchemaFieldDefinition> fields;
    Map<String, Object> metadata;
}
