package com.labelrun.ingestion.pipeline.classification;

import com.labelrun.domain.Label;

import java.util.Map;
import java.util.Set;

/**
 * Result of labelling one source: labels produced this run by recordId (fallbacks of soft-failed batches
 * included), the recordIds of those soft-failed rows, and recordIds skipped because they were already COMPLETED.
 */
public record SourceLabeling(String sourceId, Map<Long, Label> labels, Set<Long> failed, Set<Long> skipped) {

    public SourceLabeling {
        labels = Map.copyOf(labels);
        failed = Set.copyOf(failed);
        skipped = Set.copyOf(skipped);
    }
}
