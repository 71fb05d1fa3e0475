package com.labelrun.common;

import java.time.Duration;

/**
 * Suspends the calling thread. Injected wherever the pipeline waits so tests can drive time.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
