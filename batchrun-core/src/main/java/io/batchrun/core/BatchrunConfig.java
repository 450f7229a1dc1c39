package io.batchrun.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/// Configuration options for the batchrun environment.
///
/// Use the {@link Builder} for fluent configuration or construct directly and adjust
/// with setters.
///
/// ### Default Values
/// - `pollInterval`: 10 seconds
/// - `gracePeriod`: 5 minutes
/// - `queueWindowSize`: 10 events per scheduled job
/// - `cleanerBatchSize`: 10 runs per deletion batch
/// - `chunkSize`: 4096 bytes per output read
/// - `maxWriteAttempts`: 5 attempts per storage write
/// - `retryBackoff`: 200 milliseconds, doubled per failed attempt
/// - `selfCommand`: empty, managed commands then cannot be rendered
///
/// The self command may be given as a resolver that runs on first use, so an
/// environment that never starts a managed command or worker never derives it.
///
/// @implNote **Not thread-safe**. Configure before passing to {@link BatchrunFactory}
/// and do not modify afterwards.
///
/// @see BatchrunFactory
public class BatchrunConfig {
    private Duration pollInterval = Duration.ofSeconds(10);
    private Duration gracePeriod = Duration.ofMinutes(5);
    private int queueWindowSize = 10;
    private int cleanerBatchSize = 10;
    private int chunkSize = 4096;
    private int maxWriteAttempts = 5;
    private Duration retryBackoff = Duration.ofMillis(200);
    private Supplier<List<String>> selfCommand = List::of;

    /// Creates a configuration with default values.
    public BatchrunConfig() {}

    /// Returns how long the scheduler sleeps when nothing is due.
    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
    }

    /// Returns how late a scheduled time may still be run.
    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public void setGracePeriod(Duration gracePeriod) {
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod must not be null");
    }

    /// Returns the number of upcoming events queued per scheduled job.
    public int getQueueWindowSize() {
        return queueWindowSize;
    }

    public void setQueueWindowSize(int queueWindowSize) {
        this.queueWindowSize = queueWindowSize;
    }

    public int getCleanerBatchSize() {
        return cleanerBatchSize;
    }

    public void setCleanerBatchSize(int cleanerBatchSize) {
        this.cleanerBatchSize = cleanerBatchSize;
    }

    /// Returns the maximum number of bytes read from a child's output at once.
    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getMaxWriteAttempts() {
        return maxWriteAttempts;
    }

    public void setMaxWriteAttempts(int maxWriteAttempts) {
        this.maxWriteAttempts = maxWriteAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff must not be null");
    }

    /// Returns the argv prefix that re-invokes this application.
    ///
    /// @return the prefix, never null, may be empty
    /// @throws IllegalStateException if a resolver is set and cannot derive the prefix
    public List<String> getSelfCommand() {
        return selfCommand.get();
    }

    public void setSelfCommand(List<String> selfCommand) {
        List<String> copy = List.copyOf(selfCommand);
        this.selfCommand = () -> copy;
    }

    /// Sets a resolver called each time {@link #getSelfCommand()} is; it should cache.
    public void setSelfCommandResolver(Supplier<List<String>> resolver) {
        this.selfCommand = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link BatchrunConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final BatchrunConfig config = new BatchrunConfig();

        public Builder pollInterval(Duration pollInterval) {
            config.setPollInterval(pollInterval);
            return this;
        }

        public Builder gracePeriod(Duration gracePeriod) {
            config.setGracePeriod(gracePeriod);
            return this;
        }

        public Builder queueWindowSize(int queueWindowSize) {
            config.queueWindowSize = queueWindowSize;
            return this;
        }

        public Builder cleanerBatchSize(int cleanerBatchSize) {
            config.cleanerBatchSize = cleanerBatchSize;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            config.chunkSize = chunkSize;
            return this;
        }

        public Builder maxWriteAttempts(int maxWriteAttempts) {
            config.maxWriteAttempts = maxWriteAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            config.setRetryBackoff(retryBackoff);
            return this;
        }

        public Builder selfCommand(List<String> selfCommand) {
            config.setSelfCommand(selfCommand);
            return this;
        }

        public Builder selfCommandResolver(Supplier<List<String>> resolver) {
            config.setSelfCommandResolver(resolver);
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        public BatchrunConfig build() {
            return config;
        }
    }
}
