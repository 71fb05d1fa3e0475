package com.labelrun.api.dto;

import java.time.Instant;

/**
 * One FAILED ledger entry in GET /api/v1/progress/failures.
 */
public record FailedEntryResponse(
        String sourceId,
        long recordId,
        int attemptCount,
        String errorMessage,
        Instant updatedAt
) {
}
