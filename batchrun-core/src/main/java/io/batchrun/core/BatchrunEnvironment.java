package io.batchrun.core;

import io.batchrun.core.cleaning.HistoryCleaner;
import io.batchrun.core.cleaning.RunPruner;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.compactor.LogCompactor;
import io.batchrun.core.execution.JobLauncher;
import io.batchrun.core.execution.JobRunExecutor;
import io.batchrun.core.queue.RunQueue;
import io.batchrun.core.queue.RunQueueRepository;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.LogStore;
import io.batchrun.core.schedule.ScheduledJobRepository;
import io.batchrun.core.scheduler.SchedulerLoop;
import io.batchrun.core.util.Retry;
import io.batchrun.core.util.Sleeper;
import java.time.Clock;
import java.util.concurrent.ExecutorService;

/// Container holding the wired batchrun components.
///
/// Implements {@link AutoCloseable} to shut down the thread pool of the in-process
/// launcher, when one was created.
///
/// ### Contracts
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link BatchrunFactory#builder()} rather than direct
/// construction.
///
/// @see BatchrunFactory
public final class BatchrunEnvironment implements AutoCloseable {

    private final BatchrunConfig config;
    private final BatchrunStorage storage;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RunQueue runQueue;
    private final JobRunExecutor executor;
    private final JobLauncher launcher;
    private final LogCompactor compactor;
    private final HistoryCleaner cleaner;
    private final RunPruner pruner;
    private final ExecutorService executorService;

    BatchrunEnvironment(
            BatchrunConfig config,
            BatchrunStorage storage,
            Clock clock,
            Sleeper sleeper,
            RunQueue runQueue,
            JobRunExecutor executor,
            JobLauncher launcher,
            LogCompactor compactor,
            HistoryCleaner cleaner,
            RunPruner pruner,
            ExecutorService executorService) {
        this.config = config;
        this.storage = storage;
        this.clock = clock;
        this.sleeper = sleeper;
        this.runQueue = runQueue;
        this.executor = executor;
        this.launcher = launcher;
        this.compactor = compactor;
        this.cleaner = cleaner;
        this.pruner = pruner;
        this.executorService = executorService;
    }

    public BatchrunConfig getConfig() {
        return config;
    }

    public JobCatalog getCatalog() {
        return storage.catalog();
    }

    public ScheduledJobRepository getScheduledJobs() {
        return storage.scheduledJobs();
    }

    public JobRunRepository getRuns() {
        return storage.runs();
    }

    public LogStore getLogStore() {
        return storage.logStore();
    }

    public RunQueueRepository getQueueItems() {
        return storage.queueItems();
    }

    /// Returns the service that keeps the queue in step with the scheduled jobs.
    ///
    /// @return the run queue, never null
    public RunQueue getRunQueue() {
        return runQueue;
    }

    /// Returns the worker body that executes one stored run.
    ///
    /// @return the executor, never null
    public JobRunExecutor getExecutor() {
        return executor;
    }

    public JobLauncher getLauncher() {
        return launcher;
    }

    public LogCompactor getCompactor() {
        return compactor;
    }

    public HistoryCleaner getCleaner() {
        return cleaner;
    }

    public RunPruner getPruner() {
        return pruner;
    }

    public Clock getClock() {
        return clock;
    }

    /// Creates a scheduler loop identified by `pid` in queue claims.
    ///
    /// @param pid process id recorded on claimed items
    /// @return a new loop, never null
    public SchedulerLoop createSchedulerLoop(int pid) {
        return new SchedulerLoop(
                runQueue,
                storage.queueItems(),
                storage.scheduledJobs(),
                launcher,
                clock,
                sleeper,
                new Retry(config.getMaxWriteAttempts(), config.getRetryBackoff(), sleeper),
                config.getPollInterval(),
                pid);
    }

    /// Shuts down the in-process launcher's thread pool, if any.
    ///
    /// Runs already executing are allowed to finish.
    @Override
    public void close() {
        if (executorService != null) {
            executorService.shutdown();
        }
    }
}
