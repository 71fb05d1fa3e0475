package com.labelrun.ingestion.classifier;

import com.labelrun.domain.Label;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of classifying one batch: exactly one whitelist label per submitted record, in submission order.
 *
 * @param softFailed     retries were exhausted and every label is the fallback
 * @param attempts       calls issued, including the initial one
 * @param fallbackCount  positions that carry the fallback label
 * @param errorMessage   last failure cause when softFailed, otherwise null
 */
public record BatchClassification(List<Label> labels, boolean softFailed, int attempts,
                                  int fallbackCount, String errorMessage) {

    public BatchClassification {
        labels = List.copyOf(labels);
    }

    static BatchClassification success(List<Label> labels, int attempts, int fallbackCount) {
        return new BatchClassification(labels, false, attempts, fallbackCount, null);
    }

    static BatchClassification softFailure(int size, Label fallback, int attempts, String errorMessage) {
        return new BatchClassification(Collections.nCopies(size, fallback), true, attempts, size, errorMessage);
    }
}
