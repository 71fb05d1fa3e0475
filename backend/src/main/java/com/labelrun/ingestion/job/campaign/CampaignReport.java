package com.labelrun.ingestion.job.campaign;

import com.labelrun.domain.ProgressStats;
import com.labelrun.ingestion.pipeline.FileResult;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one campaign run: per-file outcomes, files that failed, and ledger totals at the end.
 */
public record CampaignReport(List<FileResult> files, List<String> failedFiles, ProgressStats totals, Duration elapsed) {

    public CampaignReport {
        files = List.copyOf(files);
        failedFiles = List.copyOf(failedFiles);
    }
}
