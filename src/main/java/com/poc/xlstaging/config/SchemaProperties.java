package com.poc.xlstaging.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where schema documents live and which retired schema names map to current ones.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "xl.schema")
public class SchemaProperties {

    /**
     * Resource pattern of the schema JSON documents.
     */
    private String location = "classpath*:schemas/*.json";

    /**
     * Retired schema name to current schema name. Single hop only.
     */
    private Map<String, String> aliases = new LinkedHashMap<>();
}
