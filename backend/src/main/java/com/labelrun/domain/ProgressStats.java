package com.labelrun.domain;

/**
 * Aggregated ledger counts. total = completed + failed (entries, not input rows).
 */
public record ProgressStats(long completed, long failed, long total) {

    public static ProgressStats of(long completed, long failed) {
        return new ProgressStats(completed, failed, completed + failed);
    }

    public static ProgressStats empty() {
        return new ProgressStats(0, 0, 0);
    }

    public double completedPct() {
        return total == 0 ? 0.0 : completed * 100.0 / total;
    }
}
