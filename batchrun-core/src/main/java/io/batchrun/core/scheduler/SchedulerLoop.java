package io.batchrun.core.scheduler;

import io.batchrun.core.execution.JobLauncher;
import io.batchrun.core.queue.RunQueue;
import io.batchrun.core.queue.RunQueueItem;
import io.batchrun.core.queue.RunQueueRepository;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.schedule.ScheduledJob;
import io.batchrun.core.schedule.ScheduledJobRepository;
import io.batchrun.core.util.Retry;
import io.batchrun.core.util.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Polls the run queue and launches due jobs.
///
/// Each iteration looks at the earliest claimable item. If nothing is due within the
/// poll interval it sleeps one interval, since a nearer item may be added meanwhile.
/// Otherwise it sleeps until the run time, claims the item and launches the job.
/// Losing a claim to another scheduler is expected and only means moving on.
///
/// Every storage call and the launch go through the {@link Retry} policy, so a short
/// database outage delays the loop instead of ending it.
///
/// ### Contracts
/// - **Invariant**: a queue item is launched at most once across all schedulers sharing
///   the queue storage
///
/// @implNote Not thread-safe. Run one loop per process; several processes may share
/// one database.
public class SchedulerLoop {

    private static final Logger logger = Logger.getLogger(SchedulerLoop.class.getName());

    /// What one iteration did.
    public enum Outcome {
        /// The queue had no claimable item.
        IDLE,
        /// The first item was further away than the poll interval.
        WAITING,
        /// Another scheduler claimed the item first.
        CLAIM_LOST,
        /// The item was claimed and its job launched.
        LAUNCHED
    }

    private final RunQueue runQueue;
    private final RunQueueRepository items;
    private final ScheduledJobRepository scheduledJobs;
    private final JobLauncher launcher;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Retry retry;
    private final Duration pollInterval;
    private final int pid;
    private volatile boolean stopped;

    public SchedulerLoop(
            RunQueue runQueue,
            RunQueueRepository items,
            ScheduledJobRepository scheduledJobs,
            JobLauncher launcher,
            Clock clock,
            Sleeper sleeper,
            Retry retry,
            Duration pollInterval,
            int pid) {
        this.runQueue = Objects.requireNonNull(runQueue, "runQueue must not be null");
        this.items = Objects.requireNonNull(items, "items must not be null");
        this.scheduledJobs =
                Objects.requireNonNull(scheduledJobs, "scheduledJobs must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pid = pid;
    }

    /// Refreshes the queue and then iterates until {@link #stop()} is called.
    ///
    /// @throws InterruptedException if interrupted while sleeping
    public void run() throws InterruptedException {
        logger.info("Scheduler " + pid + " starting, poll interval " + pollInterval);
        retry.run("refresh the run queue", runQueue::refreshAll);
        while (!stopped) {
            runOnce();
        }
        logger.info("Scheduler " + pid + " stopped");
    }

    /// Performs one iteration of the loop.
    ///
    /// @return what happened, never null
    /// @throws InterruptedException if interrupted while sleeping
    public Outcome runOnce() throws InterruptedException {
        Optional<RunQueueItem> first =
                retry.call("find the first queue item", items::findFirstClaimable);
        if (first.isEmpty()) {
            sleeper.sleep(pollInterval);
            return Outcome.IDLE;
        }
        RunQueueItem item = first.get();
        Duration untilDue = Duration.between(clock.instant(), item.runAt());
        if (untilDue.compareTo(pollInterval) > 0) {
            sleeper.sleep(pollInterval);
            return Outcome.WAITING;
        }
        if (!untilDue.isNegative()) {
            sleeper.sleep(untilDue);
        }

        boolean claimed =
                retry.call(
                        "claim queue item " + item.id(),
                        () -> items.claim(item.id(), clock.instant(), pid));
        if (!claimed) {
            logger.fine("Queue item " + item.id() + " was claimed by another scheduler");
            return Outcome.CLAIM_LOST;
        }

        Optional<ScheduledJob> scheduledJob =
                retry.call(
                        "look up scheduled job " + item.scheduledJobId(),
                        () -> scheduledJobs.findById(item.scheduledJobId()));
        if (scheduledJob.isPresent()) {
            ScheduledJob found = scheduledJob.get();
            JobRun run = retry.call("launch " + found.job(), () -> launcher.launch(found.job()));
            logger.info("Launched run " + run.id() + " of " + found);
            retry.call("refill the queue of " + found, () -> runQueue.refill(found));
        }
        retry.call("remove expired queue items", runQueue::removeExpired);
        return Outcome.LAUNCHED;
    }

    /// Makes {@link #run()} return after the current iteration.
    public void stop() {
        stopped = true;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
