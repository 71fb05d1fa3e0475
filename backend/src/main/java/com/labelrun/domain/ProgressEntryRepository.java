package com.labelrun.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for progress_entry. Writes are synchronous upserts keyed by (sourceId, recordId).
 */
public interface ProgressEntryRepository {

    Optional<ProgressEntry> findBySourceIdAndRecordId(String sourceId, long recordId);

    boolean existsBySourceIdAndRecordIdAndStatus(String sourceId, long recordId, ProgressStatus status);

    /** Insert or overwrite the entry for its identity (last write wins). */
    void upsert(ProgressEntry entry);

    Map<ProgressStatus, Long> countByStatus();

    Map<ProgressStatus, Long> countByStatusForSource(String sourceId);

    List<ProgressEntry> findBySourceIdAndStatus(String sourceId, ProgressStatus status);

    /** Most recently updated entries with the given status, newest first. */
    List<ProgressEntry> findRecentByStatus(ProgressStatus status, int limit);
}
