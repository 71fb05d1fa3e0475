package com.labelrun.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Progress ledger row per (sourceId, recordId). Table progress_entry, unique on the identity pair.
 */
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProgressEntry {

    @EqualsAndHashCode.Include
    private String sourceId;
    @EqualsAndHashCode.Include
    private long recordId;
    private ProgressStatus status;
    /** Present iff COMPLETED. */
    private Label label;
    private int attemptCount;
    /** Present iff FAILED. */
    private String errorMessage;
    private Instant updatedAt;

    public static ProgressEntry completed(String sourceId, long recordId, Label label, int attemptCount, Instant now) {
        ProgressEntry e = new ProgressEntry();
        e.setSourceId(sourceId);
        e.setRecordId(recordId);
        e.setStatus(ProgressStatus.COMPLETED);
        e.setLabel(label);
        e.setAttemptCount(attemptCount);
        e.setUpdatedAt(now);
        return e;
    }

    public static ProgressEntry failed(String sourceId, long recordId, String errorMessage, int attemptCount, Instant now) {
        ProgressEntry e = new ProgressEntry();
        e.setSourceId(sourceId);
        e.setRecordId(recordId);
        e.setStatus(ProgressStatus.FAILED);
        e.setErrorMessage(errorMessage);
        e.setAttemptCount(attemptCount);
        e.setUpdatedAt(now);
        return e;
    }
}
