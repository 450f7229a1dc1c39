package io.batchrun.core.util;

import java.time.Duration;

/// Blocks the calling thread; replaceable in tests.
@FunctionalInterface
public interface Sleeper {

    /// Sleeps on the current thread.
    Sleeper SYSTEM =
            duration -> {
                if (!duration.isNegative() && !duration.isZero()) {
                    Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
                }
            };

    /// Sleeps for `duration`; zero and negative durations return immediately.
    ///
    /// @param duration how long to sleep, not null
    /// @throws InterruptedException if the thread is interrupted while sleeping
    void sleep(Duration duration) throws InterruptedException;
}
