package com.labelrun.api.controller;

import com.labelrun.api.dto.ErrorBody;
import com.labelrun.api.dto.FailedEntryResponse;
import com.labelrun.api.dto.ProgressStatsResponse;
import com.labelrun.ingestion.store.ProgressStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of the progress ledger: overall and per-source counts, recent failures.
 */
@RestController
@RequestMapping("/api/v1/progress")
@RequiredArgsConstructor
public class ProgressController {

    static final int MAX_FAILURES_LIMIT = 500;

    private final ProgressStore progressStore;

    @GetMapping
    public ProgressStatsResponse overall() {
        return ProgressStatsResponse.from(null, progressStore.stats());
    }

    /** Source ids are relative paths, so they travel as a query parameter. */
    @GetMapping("/source")
    public ResponseEntity<?> source(@RequestParam(name = "sourceId", required = false) String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "sourceId is required"));
        }
        return ResponseEntity.ok(ProgressStatsResponse.from(sourceId, progressStore.stats(sourceId)));
    }

    @GetMapping("/failures")
    public ResponseEntity<?> failures(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_FAILURES_LIMIT) {
            return ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_LIMIT", "limit must be between 1 and " + MAX_FAILURES_LIMIT));
        }
        List<FailedEntryResponse> items = progressStore.recentFailures(limit).stream()
                .map(e -> new FailedEntryResponse(e.getSourceId(), e.getRecordId(), e.getAttemptCount(),
                        e.getErrorMessage(), e.getUpdatedAt()))
                .toList();
        return ResponseEntity.ok(items);
    }
}
