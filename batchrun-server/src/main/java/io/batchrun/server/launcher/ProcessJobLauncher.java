package io.batchrun.server.launcher;

import io.batchrun.core.command.Job;
import io.batchrun.core.execution.JobLauncher;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogEntryKind;
import io.batchrun.core.run.LogStore;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/// Launches each run in a detached worker process running `execute-run <id>`.
///
/// The run row is created before the spawn so that the worker can find it. The
/// worker's own stdout and stderr are discarded; the child command's output reaches
/// the log store through the worker's collectors. {@link #launch(Job)} never waits
/// for the worker.
///
/// ### Contracts
/// - **Postcondition**: the returned run exists in the repository
/// - **Postcondition**: if the worker cannot be started, the run is stopped with
///   exit code {@link JobRun#SPAWN_FAILED} and carries one STDERR entry
///
/// The self command is resolved on each launch, not at construction, so a launcher
/// that never launches never derives it. A resolution failure counts as a failed spawn.
///
/// @implNote Thread-safe. Holds no mutable state.
///
/// @see io.batchrun.server.commands.ExecuteRunCommand
public class ProcessJobLauncher implements JobLauncher {

    private static final Logger LOG = Logger.getLogger(ProcessJobLauncher.class);

    static final String WORKER_COMMAND = "execute-run";

    private final JobRunRepository runs;
    private final LogStore logStore;
    private final Clock clock;
    private final Supplier<List<String>> selfCommand;

    public ProcessJobLauncher(
            JobRunRepository runs,
            LogStore logStore,
            Clock clock,
            Supplier<List<String>> selfCommand) {
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.selfCommand = Objects.requireNonNull(selfCommand, "selfCommand must not be null");
    }

    @Override
    public JobRun launch(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        JobRun run = runs.create(job, clock.instant());
        try {
            List<String> argv = workerCommand(run.id());
            Process worker =
                    new ProcessBuilder(argv)
                            .redirectInput(
                                    ProcessBuilder.Redirect.from(SelfInvocation.nullDevice()))
                            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                            .redirectError(ProcessBuilder.Redirect.DISCARD)
                            .start();
            LOG.infov("Launched {0} in worker process {1}", run, worker.pid());
        } catch (IOException | RuntimeException e) {
            LOG.warnv(e, "Could not start worker for {0}", run);
            recordSpawnFailure(run, e);
        }
        return run;
    }

    List<String> workerCommand(long runId) {
        List<String> prefix = selfCommand.get();
        if (prefix.isEmpty()) {
            throw new IllegalStateException("Self command is empty; set batchrun.self-command");
        }
        List<String> argv = new ArrayList<>(prefix);
        argv.add(WORKER_COMMAND);
        argv.add(Long.toString(runId));
        return argv;
    }

    private void recordSpawnFailure(JobRun run, Exception cause) {
        String reason = "Failed to start command: " + cause.getMessage() + "\n";
        logStore.append(
                new LogEntry(run.id(), LogEntryKind.STDERR, 1, 1, clock.instant(), reason));
        runs.markStopped(run.id(), clock.instant(), JobRun.SPAWN_FAILED);
    }
}
