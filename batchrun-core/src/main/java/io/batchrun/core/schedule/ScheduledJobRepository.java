package io.batchrun.core.schedule;

import java.util.List;
import java.util.Optional;

/// Storage of scheduled jobs.
///
/// Saving does not touch the run queue; callers refill it through
/// {@link io.batchrun.core.queue.RunQueue#refill(ScheduledJob)}.
///
/// @see InMemoryScheduledJobRepository
public interface ScheduledJobRepository {

    /// Creates or replaces the scheduled job with the same name.
    ///
    /// @param scheduledJob the definition, its job must already be stored, not null
    /// @return the stored scheduled job with its identifier, never null
    ScheduledJob save(ScheduledJob scheduledJob);

    Optional<ScheduledJob> findById(long id);

    Optional<ScheduledJob> findByName(String name);

    /// Returns all scheduled jobs in ascending id order.
    List<ScheduledJob> findAll();

    /// Deletes a scheduled job and its queue items.
    ///
    /// @return `true` if it existed
    boolean delete(long id);
}
