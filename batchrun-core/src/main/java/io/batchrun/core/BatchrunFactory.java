package io.batchrun.core;

import io.batchrun.core.cleaning.HistoryCleaner;
import io.batchrun.core.cleaning.RunPruner;
import io.batchrun.core.compactor.LogCompactor;
import io.batchrun.core.execution.InProcessJobLauncher;
import io.batchrun.core.execution.JobLauncher;
import io.batchrun.core.execution.JobRunExecutor;
import io.batchrun.core.queue.RunQueue;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.util.Retry;
import io.batchrun.core.util.Sleeper;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/// Factory for creating and wiring batchrun environments.
///
/// {@snippet :
/// var env = BatchrunFactory.builder()
///     .config(BatchrunConfig.builder().gracePeriod(Duration.ofMinutes(5)).build())
///     .storage(jdbcStorage)
///     .launcher(runs -> new ProcessJobLauncher(runs, logStore, Clock.systemUTC(), selfCommand))
///     .build();
/// }
///
/// Without explicit storage the environment is in-memory; without an explicit
/// launcher runs execute on a thread pool of the current process.
///
/// @see BatchrunEnvironment
public final class BatchrunFactory {

    private BatchrunFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an in-memory environment with default configuration.
    ///
    /// @return the environment, never null
    public static BatchrunEnvironment createEnvironment() {
        return builder().build();
    }

    /// Creates a new builder.
    ///
    /// @return the builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link BatchrunEnvironment}.
    public static final class Builder {
        private BatchrunConfig config = new BatchrunConfig();
        private BatchrunStorage storage;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Function<JobRunRepository, JobLauncher> launcherFactory;

        private Builder() {}

        public Builder config(BatchrunConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder storage(BatchrunStorage storage) {
            this.storage = Objects.requireNonNull(storage, "storage must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /// Sets how runs are launched.
        ///
        /// @param launcherFactory creates the launcher from the run repository, not null
        /// @return this builder, never null
        public Builder launcher(Function<JobRunRepository, JobLauncher> launcherFactory) {
            this.launcherFactory =
                    Objects.requireNonNull(launcherFactory, "launcherFactory must not be null");
            return this;
        }

        public BatchrunEnvironment build() {
            BatchrunStorage store = storage != null ? storage : BatchrunStorage.inMemory();
            Retry writeRetry =
                    new Retry(config.getMaxWriteAttempts(), config.getRetryBackoff(), sleeper);

            RunQueue runQueue =
                    new RunQueue(
                            store.scheduledJobs(),
                            store.queueItems(),
                            clock,
                            config.getGracePeriod(),
                            config.getQueueWindowSize());
            JobRunExecutor executor =
                    new JobRunExecutor(
                            store.runs(),
                            store.catalog(),
                            store.logStore(),
                            clock,
                            writeRetry,
                            config.getChunkSize(),
                            config::getSelfCommand);

            ExecutorService executorService = null;
            JobLauncher launcher;
            if (launcherFactory != null) {
                launcher = launcherFactory.apply(store.runs());
            } else {
                executorService = Executors.newCachedThreadPool();
                launcher = new InProcessJobLauncher(store.runs(), executor, executorService, clock);
            }

            LogCompactor compactor = new LogCompactor(store.runs(), store.logStore());
            HistoryCleaner cleaner =
                    new HistoryCleaner(
                            store.runs(),
                            store.logStore(),
                            compactor,
                            clock,
                            config.getCleanerBatchSize());

            return new BatchrunEnvironment(
                    config,
                    store,
                    clock,
                    sleeper,
                    runQueue,
                    executor,
                    launcher,
                    compactor,
                    cleaner,
                    new RunPruner(store.runs()),
                    executorService);
        }
    }
}
