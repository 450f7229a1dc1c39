package io.batchrun.core.run;

import io.batchrun.core.compactor.CompactLog;
import java.util.List;
import java.util.Optional;

/// Storage of the captured output of runs, both fine-grained and compacted.
///
/// ### Contracts
/// - **Invariant**: {@link #compact(JobRun)} is atomic; a reader sees either the entries
///   or the compact log, never neither for a run that had output
///
/// @see InMemoryLogStore
public interface LogStore {

    /// Appends one fine-grained entry.
    void append(LogEntry entry);

    /// Returns the fine-grained entries of a run ordered by time and insertion.
    ///
    /// @return the entries, empty if none or already compacted, never null
    List<LogEntry> findEntries(long runId);

    long countEntries(long runId);

    Optional<CompactLog> findCompactLog(long runId);

    /// Replaces the fine-grained entries of a run with a compact log.
    ///
    /// If the run already has a compact log it is kept and the remaining entries are
    /// only deleted. A run without entries still gets an empty compact log.
    ///
    /// @param run the run to compact, not null
    /// @return the number of deleted fine-grained entries
    long compact(JobRun run);

    /// Deletes all logs of a run.
    ///
    /// @return the deleted compact logs and log entries, runs always `0`, never null
    DeletionCounts deleteLogs(long runId);
}
