package io.batchrun.core.queue;

import io.batchrun.core.schedule.ScheduledJob;
import io.batchrun.core.schedule.ScheduledJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Keeps the run queue in step with the scheduled jobs.
///
/// Each scheduled job owns a window of its next `windowSize` events counted from
/// `now - gracePeriod`. Refilling creates the missing items of the window and deletes
/// every other item of the job, so a disabled or changed rule leaves nothing stale
/// behind.
///
/// ### Contracts
/// - **Postcondition**: refilling twice at the same instant leaves the queue unchanged
/// - **Invariant**: an unassigned item is never removed as expired before
///   `runAt + gracePeriod`
///
/// @see RunQueueRepository
public class RunQueue {

    private static final Logger logger = Logger.getLogger(RunQueue.class.getName());

    private final ScheduledJobRepository scheduledJobs;
    private final RunQueueRepository items;
    private final Clock clock;
    private final Duration gracePeriod;
    private final int windowSize;

    /// @param scheduledJobs source of the rules, not null
    /// @param items queue storage, not null
    /// @param clock source of "now", not null
    /// @param gracePeriod how late a scheduled time may still run, not negative
    /// @param windowSize number of upcoming events kept per scheduled job, positive
    public RunQueue(
            ScheduledJobRepository scheduledJobs,
            RunQueueRepository items,
            Clock clock,
            Duration gracePeriod,
            int windowSize) {
        this.scheduledJobs =
                Objects.requireNonNull(scheduledJobs, "scheduledJobs must not be null");
        this.items = Objects.requireNonNull(items, "items must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod must not be null");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        this.windowSize = windowSize;
    }

    /// Stores a scheduled job and regenerates its window.
    ///
    /// @param scheduledJob the definition, not null
    /// @return the stored scheduled job, never null
    public ScheduledJob save(ScheduledJob scheduledJob) {
        ScheduledJob saved = scheduledJobs.save(scheduledJob);
        refill(saved);
        return saved;
    }

    /// Regenerates the window of one scheduled job.
    ///
    /// @param scheduledJob the stored scheduled job, not null
    /// @return the ids of the items in the window, empty if the job is disabled
    public List<Long> refill(ScheduledJob scheduledJob) {
        Objects.requireNonNull(scheduledJob, "scheduledJob must not be null");
        List<Long> fresh = new ArrayList<>();
        if (scheduledJob.enabled()) {
            Instant startFrom = clock.instant().minus(gracePeriod);
            for (ZonedDateTime event :
                    scheduledJob.recurrenceRule().nextEvents(startFrom, windowSize)) {
                fresh.add(items.getOrCreate(scheduledJob.id(), event.toInstant()).id());
            }
        }
        int deleted = items.deleteForScheduledJobExcept(scheduledJob.id(), fresh);
        if (deleted > 0) {
            logger.fine("Deleted " + deleted + " stale queue items of " + scheduledJob);
        }
        return fresh;
    }

    /// Reloads a scheduled job by id and regenerates its window.
    ///
    /// Does nothing if the scheduled job no longer exists.
    public void refill(long scheduledJobId) {
        scheduledJobs.findById(scheduledJobId).ifPresent(this::refill);
    }

    /// Removes expired items and regenerates the window of every scheduled job.
    public void refreshAll() {
        removeExpired();
        for (ScheduledJob scheduledJob : scheduledJobs.findAll()) {
            refill(scheduledJob);
        }
    }

    /// Deletes unassigned items whose run time is more than the grace period ago.
    ///
    /// @return the number of deleted items
    public int removeExpired() {
        int deleted = items.deleteExpired(clock.instant().minus(gracePeriod));
        if (deleted > 0) {
            logger.info("Removed " + deleted + " expired queue items");
        }
        return deleted;
    }

    /// Returns the next unassigned run time of a scheduled job.
    public Optional<Instant> nextRunAt(long scheduledJobId) {
        return items.findNextRunAt(scheduledJobId);
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
