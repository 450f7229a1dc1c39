package io.batchrun.core.cleaning;

import io.batchrun.core.command.RetentionPolicy;
import io.batchrun.core.compactor.LogCompactor;
import io.batchrun.core.run.DeletionCounts;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.LogStore;
import io.batchrun.core.run.RunRetention;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.logging.Logger;

/// Applies retention policies to the run history.
///
/// Every run whose compact delay has elapsed falls into at most one bucket:
///
/// | Action | Condition |
/// |--------|-----------|
/// | {@link CleanAction#DELETE_RUN} | delete-run delay elapsed |
/// | {@link CleanAction#DELETE_LOGS} | delete-logs delay elapsed and some log exists |
/// | {@link CleanAction#COMPACT_LOGS} | compact delay elapsed and fine-grained entries exist |
///
/// Buckets are executed in that order, so a run about to be deleted is never compacted
/// first. Run deletions go in batches of ascending ids to bound transaction size.
///
/// @implNote Idempotent; rows deleted concurrently are skipped.
public class HistoryCleaner {

    private static final Logger logger = Logger.getLogger(HistoryCleaner.class.getName());

    private final JobRunRepository runs;
    private final LogStore logStore;
    private final LogCompactor compactor;
    private final Clock clock;
    private final int batchSize;

    public HistoryCleaner(
            JobRunRepository runs,
            LogStore logStore,
            LogCompactor compactor,
            Clock clock,
            int batchSize) {
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.compactor = Objects.requireNonNull(compactor, "compactor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
    }

    /// Partitions the runs by clean action at `cleanTime`.
    ///
    /// @param cleanTime the time delays are evaluated against, not null
    /// @return the plan, never null
    public CleaningPlan plan(Instant cleanTime) {
        Map<CleanAction, SortedSet<Long>> buckets = new EnumMap<>(CleanAction.class);
        for (CleanAction action : CleanAction.values()) {
            buckets.put(action, new TreeSet<>());
        }
        for (RunRetention run : runs.findRetentionCandidates(cleanTime)) {
            RetentionPolicy policy = run.policy();
            if (elapsed(run, policy.deleteRunDelay(), cleanTime)) {
                planned(buckets, CleanAction.DELETE_RUN, run, policy.deleteRunDelay());
            } else if (elapsed(run, policy.deleteLogsDelay(), cleanTime) && run.hasLogs()) {
                planned(buckets, CleanAction.DELETE_LOGS, run, policy.deleteLogsDelay());
            } else if (elapsed(run, policy.compactDelay(), cleanTime) && run.hasLogEntries()) {
                planned(buckets, CleanAction.COMPACT_LOGS, run, policy.compactDelay());
            }
        }
        return new CleaningPlan(cleanTime, buckets);
    }

    /// Plans and executes a clean at the current time.
    ///
    /// @param dryRun when `true`, only logs what would be done
    /// @return the plan and the deleted row counts, never null
    public CleaningReport clean(boolean dryRun) {
        return execute(plan(clock.instant()), dryRun);
    }

    /// Executes a plan.
    ///
    /// @param plan the actions, not null
    /// @param dryRun when `true`, only logs what would be done
    /// @return the plan and the deleted row counts, never null
    public CleaningReport execute(CleaningPlan plan, boolean dryRun) {
        DeletionCounts deleted = DeletionCounts.NONE;
        try {
            deleted = deleted.plus(deleteRuns(plan.get(CleanAction.DELETE_RUN), dryRun));
            deleted = deleted.plus(
                    forEachRun(plan.get(CleanAction.DELETE_LOGS), dryRun, logStore::deleteLogs));
            deleted = deleted.plus(
                    forEachRun(plan.get(CleanAction.COMPACT_LOGS), dryRun, this::compact));
        } finally {
            String performed = dryRun ? "to be performed" : "performed";
            for (CleanAction action : CleanAction.values()) {
                int count = plan.get(action).size();
                if (count > 0) {
                    logger.info(
                            "Clean-up statistics: Total " + action + " actions " + performed
                                    + ": " + count);
                }
            }
            logger.info(
                    "Deleted " + deleted.runs() + " job run objects, " + deleted.compactLogs()
                            + " compact logs and " + deleted.logEntries() + " log entries");
        }
        return new CleaningReport(plan, dryRun, deleted);
    }

    private DeletionCounts deleteRuns(SortedSet<Long> runIds, boolean dryRun) {
        DeletionCounts deleted = DeletionCounts.NONE;
        List<Long> remaining = new ArrayList<>(runIds);
        for (int from = 0; from < remaining.size(); from += batchSize) {
            List<Long> batch =
                    remaining.subList(from, Math.min(from + batchSize, remaining.size()));
            logger.info(
                    (dryRun ? "Would delete" : "Deleting") + " information of job runs: " + batch);
            if (!dryRun) {
                deleted = deleted.plus(runs.deleteWithLogs(batch));
            }
        }
        return deleted;
    }

    private DeletionCounts compact(long runId) {
        long entries = compactor.compact(runId, false).orElse(0);
        return new DeletionCounts(0, 0, entries);
    }

    private static DeletionCounts forEachRun(
            SortedSet<Long> runIds, boolean dryRun, Function<Long, DeletionCounts> action) {
        DeletionCounts total = DeletionCounts.NONE;
        if (dryRun) {
            return total;
        }
        for (Long runId : runIds) {
            total = total.plus(action.apply(runId));
        }
        return total;
    }

    private static boolean elapsed(RunRetention run, Duration delay, Instant cleanTime) {
        return !run.startedAt().plus(delay).isAfter(cleanTime);
    }

    private static void planned(
            Map<CleanAction, SortedSet<Long>> buckets,
            CleanAction action,
            RunRetention run,
            Duration delay) {
        buckets.get(action).add(run.runId());
        logger.info(
                String.format(
                        "Planning clean action %-12s for run %6d (%s + %20s -> %s)",
                        action,
                        run.runId(),
                        run.startedAt(),
                        delay,
                        run.startedAt().plus(delay)));
    }
}
