package io.batchrun.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import io.batchrun.core.BatchrunStorage;
import io.batchrun.core.MutableClock;
import io.batchrun.core.TestJobs;
import io.batchrun.core.command.Job;
import io.batchrun.core.execution.JobLauncher;
import io.batchrun.core.queue.RunQueue;
import io.batchrun.core.queue.RunQueueItem;
import io.batchrun.core.queue.RunQueueRepository;
import io.batchrun.core.scheduler.SchedulerLoop.Outcome;
import io.batchrun.core.util.Retry;
import io.batchrun.core.util.Sleeper;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.AdditionalAnswers;

@DisplayName("SchedulerLoop")
class SchedulerLoopTest {

    private static final Duration POLL = Duration.ofSeconds(10);

    private MutableClock clock;
    private BatchrunStorage storage;
    private RunQueue runQueue;
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<Job> launched = new ArrayList<>();
    private Runnable duringSleep = () -> {};
    private Job job;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T09:59:55Z");
        storage = BatchrunStorage.inMemory();
        runQueue =
                new RunQueue(
                        storage.scheduledJobs(), storage.queueItems(), clock, Duration.ofMinutes(5), 3);
        job = TestJobs.shellJob(storage.catalog(), "report", "true");
    }

    private SchedulerLoop loop(int pid) {
        return loop(
                pid,
                storage.queueItems(),
                j -> {
                    launched.add(j);
                    return storage.runs().create(j, clock.instant());
                });
    }

    private SchedulerLoop loop(int pid, RunQueueRepository items, JobLauncher launcher) {
        Sleeper sleeper =
                duration -> {
                    sleeps.add(duration);
                    clock.advance(duration);
                    duringSleep.run();
                };
        return new SchedulerLoop(
                runQueue,
                items,
                storage.scheduledJobs(),
                launcher,
                clock,
                sleeper,
                new Retry(3, Duration.ofMillis(1), sleeper),
                POLL,
                pid);
    }

    @Test
    @DisplayName("sleeps one poll interval when the queue is empty")
    void shouldIdleOnEmptyQueue() throws Exception {
        assertThat(loop(1).runOnce()).isEqualTo(Outcome.IDLE);
        assertThat(sleeps).containsExactly(POLL);
    }

    @Test
    @DisplayName("sleeps one poll interval when the first item is further away")
    void shouldWaitForDistantItem() throws Exception {
        runQueue.save(TestJobs.hourly(job).hours("11").build());

        assertThat(loop(1).runOnce()).isEqualTo(Outcome.WAITING);
        assertThat(sleeps).containsExactly(POLL);
        assertThat(launched).isEmpty();
    }

    @Test
    @DisplayName("sleeps until a near item is due, then claims and launches it")
    void shouldLaunchDueItem() throws Exception {
        runQueue.save(TestJobs.hourly(job).build());

        assertThat(loop(1234).runOnce()).isEqualTo(Outcome.LAUNCHED);

        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
        assertThat(launched).containsExactly(job);
        RunQueueItem claimed = storage.queueItems().findAll().get(0);
        assertThat(claimed.runAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(claimed.assigneePid()).isEqualTo(1234);
        assertThat(claimed.assignedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("launches an overdue item without sleeping")
    void shouldLaunchOverdueItemImmediately() throws Exception {
        runQueue.save(TestJobs.hourly(job).build());
        clock.set(Instant.parse("2024-05-01T10:03:00Z"));

        assertThat(loop(1).runOnce()).isEqualTo(Outcome.LAUNCHED);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("moves on when another scheduler claims the item first")
    void shouldTolerateLostClaim() throws Exception {
        runQueue.save(TestJobs.hourly(job).build());
        RunQueueItem first = storage.queueItems().findFirstClaimable().orElseThrow();
        duringSleep = () -> storage.queueItems().claim(first.id(), clock.instant(), 999);

        assertThat(loop(1).runOnce()).isEqualTo(Outcome.CLAIM_LOST);
        assertThat(launched).isEmpty();
    }

    @Test
    @DisplayName("launches each scheduled time once across consecutive iterations")
    void shouldLaunchEachTimeOnce() throws Exception {
        runQueue.save(TestJobs.hourly(job).build());
        SchedulerLoop first = loop(1);
        SchedulerLoop second = loop(2);

        assertThat(first.runOnce()).isEqualTo(Outcome.LAUNCHED);
        assertThat(second.runOnce()).isEqualTo(Outcome.WAITING);

        assertThat(launched).hasSize(1);
        assertThat(storage.queueItems().findAll()).hasSize(3);
    }

    @Test
    @DisplayName("retries a queue lookup that fails once")
    void shouldRetryTransientQueueFailure() throws Exception {
        runQueue.save(TestJobs.hourly(job).build());
        RunQueueRepository flaky =
                mock(
                        RunQueueRepository.class,
                        AdditionalAnswers.delegatesTo(storage.queueItems()));
        doThrow(new IllegalStateException("connection reset"))
                .doAnswer(AdditionalAnswers.delegatesTo(storage.queueItems()))
                .when(flaky)
                .findFirstClaimable();
        SchedulerLoop loop =
                loop(
                        1,
                        flaky,
                        j -> {
                            launched.add(j);
                            return storage.runs().create(j, clock.instant());
                        });

        assertThat(loop.runOnce()).isEqualTo(Outcome.LAUNCHED);
        assertThat(launched).containsExactly(job);
    }

    @Test
    @DisplayName("retries a launch that fails once and starts one run")
    void shouldRetryTransientLaunchFailure() throws Exception {
        runQueue.save(TestJobs.hourly(job).build());
        int[] attempts = {0};
        SchedulerLoop loop =
                loop(
                        1,
                        storage.queueItems(),
                        j -> {
                            if (attempts[0]++ == 0) {
                                throw new IllegalStateException("connection reset");
                            }
                            launched.add(j);
                            return storage.runs().create(j, clock.instant());
                        });

        assertThat(loop.runOnce()).isEqualTo(Outcome.LAUNCHED);
        assertThat(attempts[0]).isEqualTo(2);
        assertThat(launched).containsExactly(job);
        assertThat(storage.runs().count()).isEqualTo(1);
    }
}
