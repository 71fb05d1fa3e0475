package com.labelrun.api.dto;

import com.labelrun.domain.ProgressStats;

/**
 * GET /api/v1/progress and /api/v1/progress/source response. sourceId is null for the overall view.
 */
public record ProgressStatsResponse(
        String sourceId,
        long completed,
        long failed,
        long total,
        double completedPct
) {

    public static ProgressStatsResponse from(String sourceId, ProgressStats stats) {
        double pct = Math.round(stats.completedPct() * 10.0) / 10.0;
        return new ProgressStatsResponse(sourceId, stats.completed(), stats.failed(), stats.total(), pct);
    }
}
