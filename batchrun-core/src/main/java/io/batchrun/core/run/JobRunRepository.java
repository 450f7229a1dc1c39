package io.batchrun.core.run;

import io.batchrun.core.command.Job;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/// Persistence of job runs and the history-wide queries the cleaner needs.
///
/// @see InMemoryJobRunRepository
public interface JobRunRepository {

    /// Creates a run of `job` that started at `startedAt`.
    ///
    /// @return the stored run with its identifier, never null
    JobRun create(Job job, Instant startedAt);

    Optional<JobRun> findById(long runId);

    /// Records the process id of the spawned child.
    void updatePid(long runId, int pid);

    /// Records the reaping of the child.
    void markStopped(long runId, Instant stoppedAt, int exitCode);

    /// Lists the most recently started runs first.
    ///
    /// @param limit maximum number of runs, positive
    /// @param exitCode when present, only runs that finished with this code
    /// @return runs ordered by descending start time, never null
    List<JobRun> findRecent(int limit, OptionalInt exitCode);

    /// Returns the start time of the most recently started run.
    Optional<Instant> latestStartedAt();

    long count();

    /// Deletes runs started strictly before `cutoff` with all their logs.
    ///
    /// @return the number of deleted runs
    long deleteStartedBefore(Instant cutoff);

    /// Returns the runs whose compact delay has elapsed at `now`, with the facts the
    /// history cleaner partitions on.
    ///
    /// Because delays are ordered, every run eligible for any clean action is included.
    ///
    /// @param now the clean time, not null
    /// @return candidates in ascending id order, never null
    List<RunRetention> findRetentionCandidates(Instant now);

    /// Deletes the given runs together with their log entries and compact logs.
    ///
    /// Missing ids are ignored.
    ///
    /// @param runIds runs to delete, not null
    /// @return how many rows of each kind were deleted, never null
    DeletionCounts deleteWithLogs(Collection<Long> runIds);
}
