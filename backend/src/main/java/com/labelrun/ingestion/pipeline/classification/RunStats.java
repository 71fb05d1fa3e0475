package com.labelrun.ingestion.pipeline.classification;

import com.labelrun.domain.Label;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for one run, owned by the run and passed to the orchestrator. Safe to update from concurrent batches.
 */
public class RunStats {

    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong calls = new AtomicLong();
    private final Map<Label, LongAdder> distribution = new ConcurrentHashMap<>();

    public RunStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    void recordSuccess(Label label) {
        successful.incrementAndGet();
        distribution.computeIfAbsent(label, l -> new LongAdder()).increment();
    }

    void recordFailure(Label fallback) {
        failed.incrementAndGet();
        distribution.computeIfAbsent(fallback, l -> new LongAdder()).increment();
    }

    void recordSkipped(long count) {
        skipped.addAndGet(count);
    }

    void recordBatch() {
        calls.incrementAndGet();
    }

    /** Records submitted to the service this run (successful + failed). */
    public long processed() {
        return successful.get() + failed.get();
    }

    public long successful() {
        return successful.get();
    }

    public long failed() {
        return failed.get();
    }

    public long skipped() {
        return skipped.get();
    }

    /** Batches handed to the classifier this run. */
    public long batches() {
        return calls.get();
    }

    /** Labels written this run, by label. */
    public Map<Label, Long> labelDistribution() {
        Map<Label, Long> copy = new EnumMap<>(Label.class);
        distribution.forEach((label, count) -> copy.put(label, count.sum()));
        return copy;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public double recordsPerMinute() {
        double minutes = elapsed().toMillis() / 60_000.0;
        return minutes > 0 ? processed() / minutes : 0.0;
    }

    /**
     * Minutes until {@code remaining} records are processed at the current rate; -1 when no rate is known yet.
     */
    public double etaMinutes(long remaining) {
        double rate = recordsPerMinute();
        if (rate <= 0) {
            return -1;
        }
        return Math.max(0, remaining) / rate;
    }
}
