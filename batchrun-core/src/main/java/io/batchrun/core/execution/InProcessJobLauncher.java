package io.batchrun.core.execution;

import io.batchrun.core.command.Job;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.JobRunRepository;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/// {@link JobLauncher} that executes runs on a thread pool of the current process.
///
/// Used when there is no separate worker process, such as embedded use and tests.
/// Runs in flight are lost if the process exits.
public final class InProcessJobLauncher implements JobLauncher {

    private static final Logger logger = Logger.getLogger(InProcessJobLauncher.class.getName());

    private final JobRunRepository runs;
    private final JobRunExecutor executor;
    private final ExecutorService executorService;
    private final Clock clock;

    public InProcessJobLauncher(
            JobRunRepository runs,
            JobRunExecutor executor,
            ExecutorService executorService,
            Clock clock) {
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobRun launch(Job job) {
        JobRun run = runs.create(job, clock.instant());
        executorService.execute(() -> execute(run));
        return run;
    }

    private void execute(JobRun run) {
        try {
            executor.execute(run.id());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted while waiting for run " + run.id());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Run " + run.id() + " failed", e);
        }
    }
}
