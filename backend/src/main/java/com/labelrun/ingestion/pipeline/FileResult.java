package com.labelrun.ingestion.pipeline;

/**
 * Outcome of one file: rows read and written, rows labelled this run, rows already complete and rows written with
 * a fallback after a soft-failed batch.
 */
public record FileResult(String sourceId, int rows, int labelledThisRun, int skipped, int failed) {
}
