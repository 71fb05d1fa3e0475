package com.labelrun.ingestion.pipeline.classification;

import com.labelrun.common.Sleeper;
import com.labelrun.config.AsyncConfig;
import com.labelrun.domain.Label;
import com.labelrun.domain.SourceRecord;
import com.labelrun.ingestion.classifier.BatchClassification;
import com.labelrun.ingestion.classifier.BatchClassifier;
import com.labelrun.ingestion.config.ClassifierProperties;
import com.labelrun.ingestion.store.ProgressStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Drives one source's records to full coverage. Records are cut into windows of batchSize; COMPLETED records are
 * dropped from each window (resume), empty windows are skipped without a call, and the rest go to
 * {@link BatchClassifier}. Windows are dispatched in chunks of maxParallel and each chunk is joined before the
 * next starts, so an interruption between chunks leaves only whole batches behind.
 */
@Component
@Slf4j
public class BatchOrchestrator {

    record WindowResult(Map<Long, Label> labels, Set<Long> failed, Set<Long> skipped) {}

    private final BatchClassifier batchClassifier;
    private final ProgressStore progressStore;
    private final ClassifierProperties classifierProperties;
    private final Executor classificationExecutor;
    private final Clock clock;
    private final Sleeper sleeper;

    public BatchOrchestrator(BatchClassifier batchClassifier,
                             ProgressStore progressStore,
                             ClassifierProperties classifierProperties,
                             @Qualifier(AsyncConfig.CLASSIFICATION_EXECUTOR) Executor classificationExecutor,
                             Clock clock,
                             Sleeper sleeper) {
        this.batchClassifier = batchClassifier;
        this.progressStore = progressStore;
        this.classifierProperties = classifierProperties;
        this.classificationExecutor = classificationExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Labels every record of one source that is not yet COMPLETED. Store failures propagate and abort the run.
     */
    public SourceLabeling labelSource(String sourceId, List<SourceRecord> records, RunStats stats) {
        List<List<SourceRecord>> windows = partition(records, Math.max(1, classifierProperties.getBatchSize()));
        int maxParallel = Math.max(1, classifierProperties.getMaxParallel());
        Map<Long, Label> labels = new HashMap<>();
        Set<Long> failed = new HashSet<>();
        Set<Long> skipped = new HashSet<>();

        for (int start = 0; start < windows.size(); start += maxParallel) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("Labelling of " + sourceId + " interrupted between chunks");
            }
            List<List<SourceRecord>> chunk = windows.subList(start, Math.min(start + maxParallel, windows.size()));
            for (WindowResult result : runChunk(chunk, stats)) {
                labels.putAll(result.labels());
                failed.addAll(result.failed());
                skipped.addAll(result.skipped());
            }
        }
        log.debug("Source {}: {} labelled this run ({} failed), {} already complete",
                sourceId, labels.size(), failed.size(), skipped.size());
        return new SourceLabeling(sourceId, labels, failed, skipped);
    }

    private List<WindowResult> runChunk(List<List<SourceRecord>> chunk, RunStats stats) {
        if (chunk.size() == 1) {
            return List.of(processWindow(chunk.get(0), stats));
        }
        List<CompletableFuture<WindowResult>> futures = new ArrayList<>(chunk.size());
        for (List<SourceRecord> window : chunk) {
            futures.add(CompletableFuture.supplyAsync(() -> processWindow(window, stats), classificationExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            // let every batch of the chunk finish before surfacing the first failure
            futures.forEach(f -> f.exceptionally(ex -> null).join());
            throw unwrap(e);
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    WindowResult processWindow(List<SourceRecord> window, RunStats stats) {
        List<SourceRecord> pending = new ArrayList<>(window.size());
        Set<Long> skipped = new HashSet<>();
        for (SourceRecord r : window) {
            if (progressStore.isCompleted(r.sourceId(), r.recordId())) {
                skipped.add(r.recordId());
            } else {
                pending.add(r);
            }
        }
        stats.recordSkipped(skipped.size());
        if (pending.isEmpty()) {
            return new WindowResult(Map.of(), Set.of(), skipped);
        }

        long startedAt = clock.millis();
        BatchClassification classification = batchClassifier.classify(pending);
        stats.recordBatch();
        Map<Long, Label> labels = new HashMap<>();
        Set<Long> failed = new HashSet<>();
        for (int i = 0; i < pending.size(); i++) {
            SourceRecord r = pending.get(i);
            Label label = classification.labels().get(i);
            if (classification.softFailed()) {
                progressStore.markFailed(r.sourceId(), r.recordId(), classification.errorMessage(), classification.attempts());
                stats.recordFailure(label);
                failed.add(r.recordId());
            } else {
                progressStore.markCompleted(r.sourceId(), r.recordId(), label, classification.attempts());
                stats.recordSuccess(label);
            }
            labels.put(r.recordId(), label);
        }
        pace(clock.millis() - startedAt);
        return new WindowResult(labels, failed, skipped);
    }

    private void pace(long elapsedMs) {
        long remaining = classifierProperties.getMinBatchDurationMs() - elapsedMs;
        if (remaining <= 0) {
            return;
        }
        try {
            sleeper.sleep(Duration.ofMillis(remaining));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing batches", e);
        }
    }

    static List<List<SourceRecord>> partition(List<SourceRecord> records, int size) {
        List<List<SourceRecord>> windows = new ArrayList<>((records.size() + size - 1) / size);
        for (int i = 0; i < records.size(); i += size) {
            windows.add(records.subList(i, Math.min(i + size, records.size())));
        }
        return windows;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }
}
