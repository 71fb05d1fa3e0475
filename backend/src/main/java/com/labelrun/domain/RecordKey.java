package com.labelrun.domain;

/**
 * Globally unique record identity: originating source plus stable row index.
 */
public record RecordKey(String sourceId, long recordId) {
}
