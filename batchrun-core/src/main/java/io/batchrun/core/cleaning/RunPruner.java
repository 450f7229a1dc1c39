package io.batchrun.core.cleaning;

import io.batchrun.core.run.JobRunRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Logger;

/// Drops whole runs relative to the newest run rather than to the current time.
///
/// The cutoff is the newest run's start minus the retained days, truncated to midnight
/// UTC. Runs started strictly before it are deleted together with their logs.
public class RunPruner {

    private static final Logger logger = Logger.getLogger(RunPruner.class.getName());

    public static final int DEFAULT_RETAIN_DAYS = 7;

    private final JobRunRepository runs;

    public RunPruner(JobRunRepository runs) {
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
    }

    /// Returns the cutoff for the given newest start time.
    static Instant cutoff(Instant latestStart, int retainDays) {
        return latestStart
                .minus(Duration.ofDays(retainDays))
                .atOffset(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.DAYS)
                .toInstant();
    }

    /// Deletes the runs older than the cutoff.
    ///
    /// @param retainDays days of history to keep before the newest run, not negative
    /// @return number of deleted runs, empty if there are no runs at all
    public OptionalLong prune(int retainDays) {
        if (retainDays < 0) {
            throw new IllegalArgumentException("retainDays must not be negative");
        }
        Optional<Instant> latest = runs.latestStartedAt();
        if (latest.isEmpty()) {
            logger.info("No job runs saved");
            return OptionalLong.empty();
        }
        Instant cutoff = cutoff(latest.get(), retainDays);
        long total = runs.count();
        long deleted = runs.deleteStartedBefore(cutoff);
        logger.info(
                "Latest run started " + latest.get() + ", sparing runs started after " + cutoff
                        + ". Deleted " + deleted + " of " + total + " job runs");
        return OptionalLong.of(deleted);
    }
}
