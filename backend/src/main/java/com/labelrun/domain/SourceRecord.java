package com.labelrun.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row to classify. Identity is (sourceId, recordId); fields are the free-text prompt values in prompt order.
 */
public record SourceRecord(String sourceId, long recordId, Map<String, String> fields) {

    public SourceRecord {
        Objects.requireNonNull(sourceId, "sourceId");
        if (recordId < 0) {
            throw new IllegalArgumentException("recordId must not be negative");
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public RecordKey key() {
        return new RecordKey(sourceId, recordId);
    }
}
