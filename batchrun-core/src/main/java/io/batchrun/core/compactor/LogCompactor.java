package io.batchrun.core.compactor;

import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Logger;

/// Compacts run logs and reads them back in either form.
///
/// @see CompactLog
public class LogCompactor {

    private static final Logger logger = Logger.getLogger(LogCompactor.class.getName());

    private final JobRunRepository runs;
    private final LogStore logStore;

    public LogCompactor(JobRunRepository runs, LogStore logStore) {
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
    }

    /// Compacts the log of one run.
    ///
    /// @param runId the run
    /// @param dryRun when `true`, only counts the entries that would be compacted
    /// @return the number of compacted entries, empty if the run does not exist
    public OptionalLong compact(long runId, boolean dryRun) {
        Optional<JobRun> run = runs.findById(runId);
        if (run.isEmpty()) {
            return OptionalLong.empty();
        }
        if (dryRun) {
            long count = logStore.countEntries(runId);
            logger.info(
                    "Would compact " + count + " log entries of job run " + runId + " / "
                            + run.get());
            return OptionalLong.of(count);
        }
        logger.info("Compacting logs of job run " + runId + " / " + run.get());
        return OptionalLong.of(logStore.compact(run.get()));
    }

    /// Returns the log of a run, from its fine-grained entries if there are any and
    /// otherwise by expanding its compact log.
    ///
    /// @param runId the run
    /// @return the entries in log order, empty if the run has no logs, never null
    public List<LogEntry> readLog(long runId) {
        List<LogEntry> entries = logStore.findEntries(runId);
        if (!entries.isEmpty()) {
            return entries;
        }
        return logStore.findCompactLog(runId).map(log -> log.expand(runId)).orElse(List.of());
    }
}
