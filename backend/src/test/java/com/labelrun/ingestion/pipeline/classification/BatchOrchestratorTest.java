package com.labelrun.ingestion.pipeline.classification;

import com.labelrun.domain.Label;
import com.labelrun.domain.ProgressEntry;
import com.labelrun.domain.ProgressStatus;
import com.labelrun.domain.SourceRecord;
import com.labelrun.ingestion.classifier.BatchClassification;
import com.labelrun.ingestion.classifier.BatchClassifier;
import com.labelrun.ingestion.config.ClassifierProperties;
import com.labelrun.ingestion.store.ProgressStore;
import com.labelrun.ingestion.store.ProgressStoreException;
import com.labelrun.testsupport.InMemoryProgressEntryRepository;
import com.labelrun.testsupport.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchOrchestratorTest {

    private static final String SOURCE = "district/ward-1.csv";

    @Mock
    private BatchClassifier batchClassifier;

    private ManualClock clock;
    private InMemoryProgressEntryRepository repository;
    private ProgressStore store;
    private ClassifierProperties props;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = ManualClock.startingAt("2026-01-01T00:00:00Z");
        repository = new InMemoryProgressEntryRepository();
        store = new ProgressStore(repository, clock);
        props = new ClassifierProperties();
        props.setBatchSize(3);
        props.setMinBatchDurationMs(0);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private BatchOrchestrator orchestrator() {
        return new BatchOrchestrator(batchClassifier, store, props, Runnable::run, clock, clock.sleeper());
    }

    @Test
    @DisplayName("every record is labelled and COMPLETED, windows of batchSize")
    void coversEveryRecord() {
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> success(inv.getArgument(0), Label.CHRISTIAN));
        RunStats stats = new RunStats(clock);

        SourceLabeling result = orchestrator().labelSource(SOURCE, records(7), stats);

        assertThat(result.labels()).hasSize(7).containsValue(Label.CHRISTIAN);
        assertThat(result.skipped()).isEmpty();
        verify(batchClassifier, times(3)).classify(anyList());
        assertThat(store.stats().completed()).isEqualTo(7);
        assertThat(stats.successful()).isEqualTo(7);
        assertThat(stats.batches()).isEqualTo(3);
        assertThat(stats.labelDistribution()).containsEntry(Label.CHRISTIAN, 7L);
    }

    @Test
    @DisplayName("completed records are dropped from their window; a fully completed window makes no call")
    void skipsCompletedRecords() {
        for (long id = 0; id < 3; id++) {
            store.markCompleted(SOURCE, id, Label.MUSLIM);
        }
        store.markCompleted(SOURCE, 4, Label.MUSLIM);
        List<List<SourceRecord>> submitted = new ArrayList<>();
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> {
            List<SourceRecord> batch = inv.getArgument(0);
            submitted.add(List.copyOf(batch));
            return success(batch, Label.HINDU);
        });
        RunStats stats = new RunStats(clock);

        SourceLabeling result = orchestrator().labelSource(SOURCE, records(6), stats);

        assertThat(submitted).hasSize(1);
        assertThat(submitted.get(0)).extracting(SourceRecord::recordId).containsExactly(3L, 5L);
        assertThat(result.skipped()).containsExactlyInAnyOrder(0L, 1L, 2L, 4L);
        assertThat(result.labels()).containsOnlyKeys(3L, 5L);
        assertThat(stats.skipped()).isEqualTo(4);
        assertThat(repository.findBySourceIdAndRecordId(SOURCE, 0).orElseThrow().getLabel()).isEqualTo(Label.MUSLIM);
    }

    @Test
    @DisplayName("soft-failed batch: FAILED entries with the attempt count, fallback still returned")
    void softFailedBatchMarksFailed() {
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> {
            List<SourceRecord> batch = inv.getArgument(0);
            return new BatchClassification(Collections.nCopies(batch.size(), Label.HINDU), true, 4, batch.size(), "HTTP 503");
        });
        RunStats stats = new RunStats(clock);

        SourceLabeling result = orchestrator().labelSource(SOURCE, records(2), stats);

        assertThat(result.labels()).containsOnly(Map.entry(0L, Label.HINDU), Map.entry(1L, Label.HINDU));
        assertThat(result.failed()).containsExactlyInAnyOrder(0L, 1L);
        ProgressEntry e = repository.findBySourceIdAndRecordId(SOURCE, 1).orElseThrow();
        assertThat(e.getStatus()).isEqualTo(ProgressStatus.FAILED);
        assertThat(e.getAttemptCount()).isEqualTo(4);
        assertThat(e.getErrorMessage()).isEqualTo("HTTP 503");
        assertThat(stats.failed()).isEqualTo(2);
    }

    @Test
    @DisplayName("FAILED records are retried on the next run")
    void failedRecordsRetried() {
        store.markFailed(SOURCE, 0, "HTTP 503", 4);
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> success(inv.getArgument(0), Label.MUSLIM));

        SourceLabeling result = orchestrator().labelSource(SOURCE, records(1), new RunStats(clock));

        assertThat(result.labels()).containsEntry(0L, Label.MUSLIM);
        assertThat(repository.findBySourceIdAndRecordId(SOURCE, 0).orElseThrow().getStatus())
                .isEqualTo(ProgressStatus.COMPLETED);
    }

    @Test
    @DisplayName("second run over a completed source makes no classification call")
    void idempotentResume() {
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> success(inv.getArgument(0), Label.HINDU));
        orchestrator().labelSource(SOURCE, records(5), new RunStats(clock));
        verify(batchClassifier, times(2)).classify(anyList());

        RunStats second = new RunStats(clock);
        SourceLabeling result = orchestrator().labelSource(SOURCE, records(5), second);

        verify(batchClassifier, times(2)).classify(anyList());
        assertThat(result.labels()).isEmpty();
        assertThat(result.skipped()).hasSize(5);
        assertThat(second.batches()).isZero();
    }

    @Test
    @DisplayName("each batch is paced to the minimum duration; skipped windows are not")
    void pacing() {
        props.setMinBatchDurationMs(1500);
        store.markCompleted(SOURCE, 0, Label.HINDU);
        store.markCompleted(SOURCE, 1, Label.HINDU);
        store.markCompleted(SOURCE, 2, Label.HINDU);
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> {
            clock.advance(Duration.ofMillis(400));
            return success(inv.getArgument(0), Label.HINDU);
        });

        orchestrator().labelSource(SOURCE, records(9), new RunStats(clock));

        assertThat(clock.sleeps()).containsExactly(Duration.ofMillis(1100), Duration.ofMillis(1100));
    }

    @Test
    @DisplayName("parallel chunks cover every record exactly once")
    void parallelChunks() {
        props.setMaxParallel(3);
        props.setBatchSize(4);
        pool = Executors.newFixedThreadPool(3);
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> success(inv.getArgument(0), Label.CHRISTIAN));
        BatchOrchestrator orchestrator = new BatchOrchestrator(batchClassifier, store, props, pool, clock, clock.sleeper());

        SourceLabeling result = orchestrator.labelSource(SOURCE, records(30), new RunStats(clock));

        assertThat(result.labels()).hasSize(30);
        assertThat(repository.size()).isEqualTo(30);
        verify(batchClassifier, times(8)).classify(anyList());
    }

    @Test
    @DisplayName("store failure aborts the run, also from a parallel chunk")
    void storeFailurePropagates() {
        props.setMaxParallel(2);
        pool = Executors.newFixedThreadPool(2);
        InMemoryProgressEntryRepository failing = new InMemoryProgressEntryRepository() {
            @Override
            public void upsert(ProgressEntry entry) {
                throw new DataAccessResourceFailureException("database closed");
            }
        };
        ProgressStore failingStore = new ProgressStore(failing, clock);
        when(batchClassifier.classify(anyList())).thenAnswer(inv -> success(inv.getArgument(0), Label.HINDU));
        BatchOrchestrator orchestrator = new BatchOrchestrator(batchClassifier, failingStore, props, pool, clock, clock.sleeper());

        assertThatThrownBy(() -> orchestrator.labelSource(SOURCE, records(12), new RunStats(clock)))
                .isInstanceOf(ProgressStoreException.class)
                .hasMessageContaining("database closed");
        verify(batchClassifier, times(2)).classify(anyList());
    }

    @Test
    void emptySourceMakesNoCall() {
        SourceLabeling result = orchestrator().labelSource(SOURCE, List.of(), new RunStats(clock));

        assertThat(result.labels()).isEmpty();
        verify(batchClassifier, never()).classify(anyList());
    }

    @Test
    void partitionKeepsOrderAndRemainder() {
        List<List<SourceRecord>> windows = BatchOrchestrator.partition(records(7), 3);
        assertThat(windows).extracting(List::size).containsExactly(3, 3, 1);
        assertThat(windows.get(2).get(0).recordId()).isEqualTo(6L);
    }

    private static BatchClassification success(List<SourceRecord> batch, Label label) {
        return new BatchClassification(Collections.nCopies(batch.size(), label), false, 1, 0, null);
    }

    private static List<SourceRecord> records(int n) {
        List<SourceRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            records.add(new SourceRecord(SOURCE, i, Map.of("Name", "Voter " + i)));
        }
        return records;
    }
}
