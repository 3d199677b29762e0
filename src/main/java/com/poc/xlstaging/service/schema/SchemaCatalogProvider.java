package com.poc.xlstaging.service.schema;

import com.poc.xlstaging.config.SchemaProperties;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.dto.SchemaSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the process-wide {@link SchemaCatalog}. The catalog only changes on an explicit {@link #reload()}.
 */
@Slf4j
@Component
public class SchemaCatalogProvider {

    private final SchemaSourceLoader loader;
    private final SchemaProperties properties;
    private final AtomicReference<SchemaCatalog> current = new AtomicReference<>();

    public SchemaCatalogProvider(SchemaSourceLoader loader, SchemaProperties properties) {
        this.loader = loader;
        this.properties = properties;
        Result<SchemaCatalog> initial = build();
        if (initial.isFailure()) {
            throw new IllegalStateException("Schema catalog failed to load: " + initial.getMessage());
        }
        current.set(initial.getValue());
    }

    public SchemaCatalog current() {
        return current.get();
    }

    /**
     * Rebuilds the catalog from its sources. On failure the previously loaded catalog stays in place.
     */
    public Result<SchemaCatalog> reload() {
        Result<SchemaCatalog> rebuilt = build();
        if (rebuilt.isOk()) {
            current.set(rebuilt.getValue());
            log.info("Schema catalog reloaded: {}", rebuilt.getValue().getSchemaNames());
        } else {
            log.warn("Schema catalog reload failed, keeping previous catalog: {}", rebuilt.getMessage());
        }
        return rebuilt;
    }

    private Result<SchemaCatalog> build() {
        Result<List<SchemaSource>> sources = loader.loadAll(properties.getLocation());
        return sources.flatMap(list -> SchemaCatalog.load(list, properties.getAliases()));
    }
}
