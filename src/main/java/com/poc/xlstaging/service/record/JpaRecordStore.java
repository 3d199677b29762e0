package com.poc.xlstaging.service.record;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.NormalizedPayload;
import com.poc.xlstaging.dto.Result;
import com.poc.xlstaging.entity.FieldChangeLog;
import com.poc.xlstaging.entity.IncidenceRecord;
import com.poc.xlstaging.repository.FieldChangeLogRepository;
import com.poc.xlstaging.repository.IncidenceRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RecordStore} over the {@code incidences} table. The field map lives in the {@code misc_json} column and every
 * change is logged to {@code portal_updates} in the same transaction.
 */
@Slf4j
@Service
public class JpaRecordStore implements RecordStore {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private final IncidenceRecordRepository incidenceRecordRepository;
    private final FieldChangeLogRepository fieldChangeLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final String identityField;

    public JpaRecordStore(IncidenceRecordRepository incidenceRecordRepository,
                          FieldChangeLogRepository fieldChangeLogRepository,
                          ObjectMapper objectMapper,
                          PlatformTransactionManager transactionManager,
                          @Value("${xl.staging.identity-field:id_incidence}") String identityField) {
        this.incidenceRecordRepository = incidenceRecordRepository;
        this.fieldChangeLogRepository = fieldChangeLogRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.identityField = identityField;
    }

    @Override
    public Result<Optional<Map<String, Object>>> get(long identityKey) {
        try {
            Optional<IncidenceRecord> record = incidenceRecordRepository.findById(identityKey);
            if (record.isEmpty()) {
                return Result.success(Optional.empty());
            }
            return Result.success(Optional.of(readFields(record.get())));
        } catch (DataAccessException | UncheckedIOException e) {
            log.error("Could not read record {}", identityKey, e);
            return Result.failure(ErrorKind.DATABASE_ERROR, "Could not read record " + identityKey + ": " + e.getMessage());
        }
    }

    @Override
    public Result<Integer> upsert(long identityKey, Map<String, Object> fields, String comment) {
        if (identityKey < 1) {
            return Result.failure(ErrorKind.VALIDATION_ERROR, "Identity key must be positive: " + identityKey);
        }
        if (fields == null || fields.isEmpty()) {
            return Result.failure(ErrorKind.VALIDATION_ERROR, "Nothing to write for record " + identityKey);
        }
        if (fields.containsKey(identityField) && !sameValue(fields.get(identityField), identityKey)) {
            return Result.failure(ErrorKind.VALIDATION_ERROR, String.format(
                    "%s %s conflicts with record key %d", identityField, fields.get(identityField), identityKey));
        }
        try {
            Integer changed = transactionTemplate.execute(status -> write(identityKey, fields, comment));
            log.info("Record {}: {} field(s) written, {} changed", identityKey, fields.size(), changed);
            return Result.success(changed);
        } catch (DataAccessException | TransactionException | UncheckedIOException e) {
            log.error("Could not write record {}; all changes rolled back", identityKey, e);
            return Result.failure(ErrorKind.DATABASE_ERROR, "Could not write record " + identityKey + ": " + e.getMessage());
        }
    }

    private int write(long identityKey, Map<String, Object> fields, String comment) {
        IncidenceRecord record = incidenceRecordRepository.findById(identityKey)
                .orElseGet(() -> new IncidenceRecord(identityKey));
        Map<String, Object> stored = record.getMiscJson() == null ? new LinkedHashMap<>() : readFields(record);

        List<FieldChangeLog> changes = new ArrayList<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Object oldValue = stored.get(entry.getKey());
            Object newValue = entry.getValue();
            if (!sameValue(oldValue, newValue)) {
                if (!(isBlank(oldValue) && isBlank(newValue))) {
                    changes.add(new FieldChangeLog(identityKey, entry.getKey(), asText(oldValue), asText(newValue), comment));
                }
            }
            stored.put(entry.getKey(), newValue);
        }
        if (fields.containsKey(NormalizedPayload.SECTOR_KEY)) {
            Object sector = fields.get(NormalizedPayload.SECTOR_KEY);
            record.setSector(sector == null ? null : sector.toString());
        }
        record.setMiscJson(writeFields(stored));
        incidenceRecordRepository.save(record);
        fieldChangeLogRepository.saveAll(changes);
        return changes.size();
    }

    private Map<String, Object> readFields(IncidenceRecord record) {
        if (record.getMiscJson() == null) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(record.getMiscJson(), FIELD_MAP);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored fields of record " + record.getIdIncidence() + " are not valid JSON", e);
        }
    }

    private String writeFields(Map<String, Object> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Fields cannot be stored as JSON", e);
        }
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        }
        return Objects.equals(a, b);
    }

    private static boolean isBlank(Object value) {
        return value == null || "".equals(value);
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }
}
