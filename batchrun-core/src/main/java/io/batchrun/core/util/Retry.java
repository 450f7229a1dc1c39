package io.batchrun.core.util;

import io.batchrun.core.exception.BatchrunException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Bounded retry with exponential back-off for transient storage errors.
///
/// Any {@link RuntimeException} other than {@link BatchrunException} is treated as
/// transient. Validation failures are rethrown at once.
///
/// {@snippet :
/// Retry retry = new Retry(5, Duration.ofMillis(200), Sleeper.SYSTEM);
/// retry.run("append log entry", () -> logStore.append(entry));
/// }
public final class Retry {

    private static final Logger logger = Logger.getLogger(Retry.class.getName());

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Sleeper sleeper;

    /// @param maxAttempts total attempts including the first, at least 1
    /// @param initialBackoff pause after the first failure, doubled after each further one
    /// @param sleeper performs the pauses, not null
    public Retry(int maxAttempts, Duration initialBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff =
                Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /// Calls `action` until it succeeds or the attempts are exhausted.
    ///
    /// @param description what the action does, for log messages
    /// @param action the action, not null
    /// @return the action's result
    /// @throws RuntimeException the last failure when all attempts fail, or the first
    ///     non-transient failure
    public <T> T call(String description, Supplier<T> action) {
        Duration backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (BatchrunException e) {
                throw e;
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                logger.log(
                        Level.FINE,
                        "Attempt " + attempt + " to " + description + " failed, retrying in "
                                + backoff.toMillis() + " ms",
                        e);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    throw e;
                }
                backoff = backoff.multipliedBy(2);
            }
        }
    }

    /// Runs `action` until it succeeds or the attempts are exhausted.
    ///
    /// @see #call(String, Supplier)
    public void run(String description, Runnable action) {
        call(
                description,
                () -> {
                    action.run();
                    return null;
                });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
