package io.batchrun.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.batchrun.core.command.Job;
import io.batchrun.core.execution.JobLauncher;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.LogEntry;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@DisplayName("BatchrunFactory")
class BatchrunFactoryTest {

    private BatchrunEnvironment env;

    @AfterEach
    void tearDown() {
        if (env != null) {
            env.close();
        }
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("applies the configuration to the run queue and scheduler")
        void shouldApplyConfig() {
            env =
                    BatchrunFactory.builder()
                            .config(
                                    BatchrunConfig.builder()
                                            .gracePeriod(Duration.ofMinutes(2))
                                            .queueWindowSize(4)
                                            .pollInterval(Duration.ofSeconds(3))
                                            .build())
                            .build();

            assertThat(env.getRunQueue().getGracePeriod()).isEqualTo(Duration.ofMinutes(2));
            assertThat(env.getRunQueue().getWindowSize()).isEqualTo(4);
            assertThat(env.createSchedulerLoop(1).getPollInterval()).isEqualTo(Duration.ofSeconds(3));
        }

        @Test
        @DisplayName("wires a custom launcher with the run repository")
        void shouldWireCustomLauncher() {
            JobLauncher[] created = new JobLauncher[1];
            env =
                    BatchrunFactory.builder()
                            .launcher(
                                    runs -> {
                                        created[0] = job -> runs.create(job, Instant.EPOCH);
                                        return created[0];
                                    })
                            .build();

            assertThat(env.getLauncher()).isSameAs(created[0]);
        }

        @Test
        @DisplayName("uses the given storage")
        void shouldUseGivenStorage() {
            BatchrunStorage storage = BatchrunStorage.inMemory();

            env = BatchrunFactory.builder().storage(storage).build();

            assertThat(env.getCatalog()).isSameAs(storage.catalog());
            assertThat(env.getRuns()).isSameAs(storage.runs());
            assertThat(env.getQueueItems()).isSameAs(storage.queueItems());
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("launches runs in process without waiting for them")
    void shouldLaunchInProcess() throws Exception {
        env = BatchrunFactory.createEnvironment();
        Job job = TestJobs.shellJob(env.getCatalog(), "hello", "echo hello");

        JobRun run = env.getLauncher().launch(job);

        assertThat(run.startedAt()).isNotNull();
        JobRun finished = awaitFinished(run.id());
        assertThat(finished.exitCode()).isZero();
        assertThat(env.getCompactor().readLog(run.id()))
                .extracting(LogEntry::text)
                .containsExactly("hello\n");
    }

    private JobRun awaitFinished(long runId) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(20).toNanos();
        while (System.nanoTime() < deadline) {
            JobRun run = env.getRuns().findById(runId).orElseThrow();
            if (run.isFinished() && !env.getCompactor().readLog(runId).isEmpty()) {
                return run;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("run " + runId + " did not finish");
    }
}
