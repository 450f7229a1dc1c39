package io.batchrun.core;

import io.batchrun.core.command.InMemoryJobCatalog;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.queue.InMemoryRunQueueRepository;
import io.batchrun.core.queue.RunQueueRepository;
import io.batchrun.core.run.InMemoryJobRunRepository;
import io.batchrun.core.run.InMemoryLogStore;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.LogStore;
import io.batchrun.core.schedule.InMemoryScheduledJobRepository;
import io.batchrun.core.schedule.ScheduledJobRepository;
import java.util.Objects;

/// The repositories of one storage backend.
///
/// The repositories of a backend refer to each other (deleting a run deletes its logs,
/// claiming checks the scheduled job), so they are supplied together.
///
/// @param catalog commands, retention policies and jobs, not null
/// @param scheduledJobs scheduled jobs, not null
/// @param runs job runs, not null
/// @param logStore run output, not null
/// @param queueItems run queue, not null
public record BatchrunStorage(
        JobCatalog catalog,
        ScheduledJobRepository scheduledJobs,
        JobRunRepository runs,
        LogStore logStore,
        RunQueueRepository queueItems) {

    public BatchrunStorage {
        Objects.requireNonNull(catalog, "catalog must not be null");
        Objects.requireNonNull(scheduledJobs, "scheduledJobs must not be null");
        Objects.requireNonNull(runs, "runs must not be null");
        Objects.requireNonNull(logStore, "logStore must not be null");
        Objects.requireNonNull(queueItems, "queueItems must not be null");
    }

    /// Creates a fresh, empty in-memory backend.
    ///
    /// @return the storage, never null
    public static BatchrunStorage inMemory() {
        InMemoryJobCatalog catalog = new InMemoryJobCatalog();
        InMemoryScheduledJobRepository scheduledJobs = new InMemoryScheduledJobRepository();
        InMemoryLogStore logStore = new InMemoryLogStore();
        InMemoryJobRunRepository runs = new InMemoryJobRunRepository(catalog, logStore);
        InMemoryRunQueueRepository queueItems = new InMemoryRunQueueRepository(scheduledJobs);
        scheduledJobs.onDelete(queueItems::deleteForScheduledJob);
        return new BatchrunStorage(catalog, scheduledJobs, runs, logStore, queueItems);
    }
}
