package com.labelrun.ingestion.adapter;

/**
 * Raw model answer plus the capacity units the service billed for the call (null when not reported).
 */
public record ClassificationReply(String content, Long unitsUsed) {
}
