package com.poc.xlstaging.service.record;

import com.poc.xlstaging.dto.Result;

import java.util.Map;
import java.util.Optional;

/**
 * Durable store of one JSON-like field map per identity key.
 */
public interface RecordStore {

    /**
     * @return the stored fields, or empty when no record exists for the key
     */
    Result<Optional<Map<String, Object>>> get(long identityKey);

    /**
     * Writes the given fields verbatim, creating the record if needed. All fields are written or none are.
     * @param comment audit note recorded with each changed field
     * @return the number of fields whose stored value changed
     */
    Result<Integer> upsert(long identityKey, Map<String, Object> fields, String comment);
}
