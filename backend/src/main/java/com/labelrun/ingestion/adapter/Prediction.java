package com.labelrun.ingestion.adapter;

import com.labelrun.domain.Label;

/**
 * One index -> label pair from a service answer. rawLabel keeps the original string for diagnostics.
 */
public record Prediction(int index, Label label, String rawLabel) {
}
