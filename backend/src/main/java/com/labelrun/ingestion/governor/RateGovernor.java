package com.labelrun.ingestion.governor;

import com.labelrun.common.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Trailing-window budget for calls and capacity units. Samples live in memory only; a restart starts with an
 * empty window. Methods are synchronized because batches of one chunk run on separate executor threads.
 */
@Slf4j
public class RateGovernor {

    private record UnitSample(Instant at, long units) {}

    private final int maxCalls;
    private final long maxUnits;
    private final Duration window;
    private final Duration pollInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    private final Deque<Instant> callSamples = new ArrayDeque<>();
    private final Deque<UnitSample> unitSamples = new ArrayDeque<>();

    public RateGovernor(int maxCalls, long maxUnits, Duration window, Duration pollInterval,
                        Clock clock, Sleeper sleeper) {
        if (maxCalls <= 0 || maxUnits <= 0) {
            throw new IllegalArgumentException("maxCalls and maxUnits must be positive");
        }
        if (window.isNegative() || window.isZero() || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("window and pollInterval must be positive");
        }
        this.maxCalls = maxCalls;
        this.maxUnits = maxUnits;
        this.window = window;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * True when one more call of the estimated size fits both budgets.
     */
    public synchronized boolean canProceed(long estimatedUnits) {
        purge(clock.instant());
        return callSamples.size() < maxCalls && unitsInWindow() + estimatedUnits < maxUnits;
    }

    /**
     * Records a successful call. Failed calls are never recorded.
     */
    public synchronized void recordCall(long actualUnits) {
        Instant now = clock.instant();
        callSamples.addLast(now);
        unitSamples.addLast(new UnitSample(now, Math.max(0, actualUnits)));
    }

    /**
     * Blocks, polling on the configured interval, until {@link #canProceed(long)} admits the call.
     */
    public void awaitCapacity(long estimatedUnits) {
        boolean waited = false;
        while (!canProceed(estimatedUnits)) {
            if (!waited) {
                log.debug("Rate budget exhausted ({} calls, {} units in window); waiting", callsInWindow(), currentUnits());
                waited = true;
            }
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for rate budget", e);
            }
        }
    }

    public synchronized int callsInWindow() {
        purge(clock.instant());
        return callSamples.size();
    }

    public synchronized long currentUnits() {
        purge(clock.instant());
        return unitsInWindow();
    }

    private long unitsInWindow() {
        long total = 0;
        for (UnitSample s : unitSamples) {
            total += s.units();
        }
        return total;
    }

    private void purge(Instant now) {
        Instant cutoff = now.minus(window);
        while (!callSamples.isEmpty() && !callSamples.peekFirst().isAfter(cutoff)) {
            callSamples.pollFirst();
        }
        while (!unitSamples.isEmpty() && !unitSamples.peekFirst().at().isAfter(cutoff)) {
            unitSamples.pollFirst();
        }
    }
}
