package com.labelrun.domain;

/**
 * Terminal outcome of a record in the progress ledger.
 * COMPLETED: labelled by the service (possibly with a per-index fallback); never resubmitted.
 * FAILED: batch exhausted its retries; fallback written to output, record retried on the next run.
 */
public enum ProgressStatus {
    COMPLETED,
    FAILED
}
