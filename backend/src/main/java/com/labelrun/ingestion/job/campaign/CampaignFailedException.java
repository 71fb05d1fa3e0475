package com.labelrun.ingestion.job.campaign;

import lombok.Getter;

import java.util.List;

/**
 * Raised after a campaign finishes when one or more files could not be written intact.
 */
@Getter
public class CampaignFailedException extends RuntimeException {

    private final CampaignReport report;

    public CampaignFailedException(CampaignReport report) {
        super("Campaign finished with " + report.failedFiles().size() + " failed file(s): " + report.failedFiles());
        this.report = report;
    }

    public List<String> failedFiles() {
        return report.failedFiles();
    }
}
