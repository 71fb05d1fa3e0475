package com.labelrun.ingestion.classifier;

import com.labelrun.common.RetryPolicy;
import com.labelrun.common.Sleeper;
import com.labelrun.domain.Label;
import com.labelrun.domain.SourceRecord;
import com.labelrun.ingestion.adapter.ClassificationPromptBuilder;
import com.labelrun.ingestion.adapter.ClassificationReply;
import com.labelrun.ingestion.adapter.ClassificationServiceClient;
import com.labelrun.ingestion.adapter.ClassificationServiceException;
import com.labelrun.ingestion.adapter.Prediction;
import com.labelrun.ingestion.adapter.PredictionParser;
import com.labelrun.ingestion.config.ClassifierProperties;
import com.labelrun.ingestion.governor.RateGovernor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one batch into an ordered label vector. Each attempt waits for rate budget, issues a single call for the
 * whole batch and reconciles the answer by index. Failed attempts back off per {@link RetryPolicy}; when retries
 * run out the batch is soft-failed with the fallback label at every position. Never returns fewer labels than
 * records and never lets a service failure escape.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BatchClassifier {

    private final ClassificationServiceClient serviceClient;
    private final RateGovernor rateGovernor;
    private final ClassificationPromptBuilder promptBuilder;
    private final PredictionParser predictionParser;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final ClassifierProperties classifierProperties;

    public BatchClassification classify(List<SourceRecord> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("batch must not be empty");
        }
        Label fallback = classifierProperties.getFallbackLabel();
        long estimatedUnits = classifierProperties.getEstimatedUnitsPerCall();
        String systemPrompt = promptBuilder.systemPrompt();
        String userPrompt = promptBuilder.userPrompt(batch);

        String lastError = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                backoff(attempt - 1);
            }
            rateGovernor.awaitCapacity(estimatedUnits);
            try {
                ClassificationReply reply = serviceClient.complete(systemPrompt, userPrompt)
                        .block(Duration.ofMillis(classifierProperties.getCallTimeoutMs()));
                if (reply == null) {
                    throw new ClassificationServiceException("Empty reply from classification service");
                }
                // billed once the service answered, even if the answer turns out to be unusable
                rateGovernor.recordCall(reply.unitsUsed() != null ? reply.unitsUsed() : estimatedUnits);
                List<Prediction> predictions = predictionParser.parse(reply.content());
                return reconcile(batch, predictions, fallback, attempt + 1);
            } catch (RuntimeException e) {
                lastError = describe(e);
                log.warn("Batch classification failed for {} record(s) starting {} (attempt {}/{}): {}",
                        batch.size(), firstKey(batch), attempt + 1, retryPolicy.getMaxAttempts(), lastError);
            }
        }
        log.error("Retries exhausted for batch of {} record(s) starting {}; using fallback label {}",
                batch.size(), firstKey(batch), fallback);
        return BatchClassification.softFailure(batch.size(), fallback, retryPolicy.getMaxAttempts(), lastError);
    }

    private BatchClassification reconcile(List<SourceRecord> batch, List<Prediction> predictions,
                                          Label fallback, int attempts) {
        Map<Integer, Prediction> byIndex = new HashMap<>();
        for (Prediction p : predictions) {
            // first match wins; later duplicates are ignored
            if (byIndex.putIfAbsent(p.index(), p) != null) {
                log.warn("Duplicate prediction for index {} ignored (kept first)", p.index());
            }
        }
        List<Label> labels = new ArrayList<>(batch.size());
        int fallbacks = 0;
        for (int i = 0; i < batch.size(); i++) {
            Prediction p = byIndex.get(i);
            if (p == null) {
                log.warn("No prediction for index {} ({}), using fallback {}", i, batch.get(i).key(), fallback);
                labels.add(fallback);
                fallbacks++;
            } else if (!p.label().isValid()) {
                log.warn("Invalid label '{}' for index {} ({}), using fallback {}", p.rawLabel(), i, batch.get(i).key(), fallback);
                labels.add(fallback);
                fallbacks++;
            } else {
                labels.add(p.label());
            }
        }
        long outOfRange = byIndex.keySet().stream().filter(i -> i < 0 || i >= batch.size()).count();
        if (outOfRange > 0) {
            log.debug("Ignored {} prediction(s) with out-of-range index", outOfRange);
        }
        return BatchClassification.success(labels, attempts, fallbacks);
    }

    private void backoff(int failedAttempt) {
        long delayMs = retryPolicy.delayMs(failedAttempt);
        log.info("Retrying batch in {} ms", delayMs);
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during classification retry backoff", e);
        }
    }

    private static String describe(RuntimeException e) {
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e.getCause() != null && e.getCause().getMessage() != null && !e.getCause().getMessage().isBlank()
                && !detail.contains(e.getCause().getMessage())) {
            detail = detail + " (" + e.getCause().getMessage() + ")";
        }
        return detail;
    }

    private static Object firstKey(List<SourceRecord> batch) {
        return batch.get(0).key();
    }
}
