package io.batchrun.core.queue;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/// Storage of run queue items, unique on `(scheduledJobId, runAt)`.
///
/// ### Contracts
/// - **Invariant**: an item is claimable iff it is unassigned and its scheduled job is enabled
/// - **Invariant**: {@link #claim(long, Instant, int)} succeeds for at most one caller per item
///
/// @see InMemoryRunQueueRepository
public interface RunQueueRepository {

    /// Returns the item for the scheduled time, creating it if missing.
    ///
    /// @return the existing or created item, never null
    RunQueueItem getOrCreate(long scheduledJobId, Instant runAt);

    /// Deletes the items of a scheduled job except the listed ones.
    ///
    /// @param keepIds item ids to keep, may be empty
    /// @return the number of deleted items
    int deleteForScheduledJobExcept(long scheduledJobId, Collection<Long> keepIds);

    /// Deletes unassigned items scheduled strictly before `limit`.
    ///
    /// @return the number of deleted items
    int deleteExpired(Instant limit);

    /// Returns the claimable item with the earliest run time.
    Optional<RunQueueItem> findFirstClaimable();

    /// Assigns an item to the caller if it is still claimable and nobody else is
    /// claiming it at the same moment.
    ///
    /// @param itemId the item to claim
    /// @param now the assignment time, not null
    /// @param pid process id of the caller
    /// @return `true` if this caller now owns the item
    boolean claim(long itemId, Instant now, int pid);

    /// Returns all items ordered by run time.
    List<RunQueueItem> findAll();

    /// Returns the earliest unassigned run time of a scheduled job.
    Optional<Instant> findNextRunAt(long scheduledJobId);
}
