package com.labelrun.ingestion.store;

import com.labelrun.domain.Label;
import com.labelrun.domain.ProgressEntry;
import com.labelrun.domain.ProgressEntryRepository;
import com.labelrun.domain.ProgressStats;
import com.labelrun.domain.ProgressStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Durable per-record ledger. Every write is an idempotent upsert that completes (or throws) before it returns.
 */
@Service
@RequiredArgsConstructor
public class ProgressStore {

    private final ProgressEntryRepository repository;
    private final Clock clock;

    public boolean isCompleted(String sourceId, long recordId) {
        return execute("isCompleted " + sourceId + "#" + recordId,
                () -> repository.existsBySourceIdAndRecordIdAndStatus(sourceId, recordId, ProgressStatus.COMPLETED));
    }

    public void markCompleted(String sourceId, long recordId, Label label) {
        markCompleted(sourceId, recordId, label, 1);
    }

    /**
     * Upserts a COMPLETED entry; overwrites any prior entry for the identity.
     */
    public void markCompleted(String sourceId, long recordId, Label label, int attemptCount) {
        if (label == null || !label.isValid()) {
            throw new IllegalArgumentException("COMPLETED entry requires a whitelist label, got " + label);
        }
        ProgressEntry entry = ProgressEntry.completed(sourceId, recordId, label, attemptCount, clock.instant());
        execute("markCompleted " + sourceId + "#" + recordId, () -> {
            repository.upsert(entry);
            return null;
        });
    }

    /**
     * Upserts a FAILED entry; overwrites any prior entry for the identity.
     */
    public void markFailed(String sourceId, long recordId, String errorMessage, int attemptCount) {
        String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        ProgressEntry entry = ProgressEntry.failed(sourceId, recordId, message, attemptCount, clock.instant());
        execute("markFailed " + sourceId + "#" + recordId, () -> {
            repository.upsert(entry);
            return null;
        });
    }

    public ProgressStats stats() {
        return toStats(execute("stats", repository::countByStatus));
    }

    public ProgressStats stats(String sourceId) {
        return toStats(execute("stats " + sourceId, () -> repository.countByStatusForSource(sourceId)));
    }

    /**
     * Labels of COMPLETED records of one source, keyed by recordId. Used to fill output rows skipped on resume.
     */
    public Map<Long, Label> completedLabels(String sourceId) {
        List<ProgressEntry> entries = execute("completedLabels " + sourceId,
                () -> repository.findBySourceIdAndStatus(sourceId, ProgressStatus.COMPLETED));
        Map<Long, Label> labels = new HashMap<>(entries.size() * 2);
        for (ProgressEntry e : entries) {
            labels.put(e.getRecordId(), e.getLabel());
        }
        return labels;
    }

    public List<ProgressEntry> recentFailures(int limit) {
        return execute("recentFailures", () -> repository.findRecentByStatus(ProgressStatus.FAILED, limit));
    }

    private static ProgressStats toStats(Map<ProgressStatus, Long> counts) {
        return ProgressStats.of(
                counts.getOrDefault(ProgressStatus.COMPLETED, 0L),
                counts.getOrDefault(ProgressStatus.FAILED, 0L));
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new ProgressStoreException("Progress store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
