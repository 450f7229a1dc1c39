package io.batchrun.core.execution;

import io.batchrun.core.command.CommandKind;
import io.batchrun.core.command.Job;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogEntryKind;
import io.batchrun.core.run.LogStore;
import io.batchrun.core.util.Retry;
import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Executes one stored run: spawns the job's command, captures its output and records
/// the result.
///
/// This is the body of a worker process. The steps are:
/// 1. render the argv of the run's job
/// 2. start the child with stdin from the null device and both outputs piped
/// 3. record the child's pid
/// 4. collect stdout and stderr on two threads
/// 5. wait for the child and record stop time and exit code
/// 6. join the collectors
///
/// Run bookkeeping goes through the {@link Retry} policy like the log writes do, so a
/// short storage outage does not leave a finished run without its exit code.
///
/// ### Contracts
/// - **Postcondition**: the run is finished when {@link #execute(long)} returns normally
/// - **Postcondition**: a command that cannot start yields exit code
///   {@link JobRun#SPAWN_FAILED} and one {@link LogEntryKind#STDERR} entry with the reason
///
/// @see JobLauncher
public class JobRunExecutor {

    private static final Logger logger = Logger.getLogger(JobRunExecutor.class.getName());

    private static final ProcessBuilder.Redirect NULL_INPUT =
            ProcessBuilder.Redirect.from(
                    new File(
                            System.getProperty("os.name").startsWith("Windows")
                                    ? "NUL"
                                    : "/dev/null"));

    private final JobRunRepository runs;
    private final JobCatalog catalog;
    private final LogStore logStore;
    private final Clock clock;
    private final Retry retry;
    private final int chunkSize;
    private final Supplier<List<String>> selfCommand;

    /// @param runs run storage, not null
    /// @param catalog job lookup, not null
    /// @param logStore destination of the captured output, not null
    /// @param clock source of timestamps, not null
    /// @param retry retry policy for storage calls, not null
    /// @param chunkSize maximum bytes per read, positive
    /// @param selfCommand resolves the argv prefix of managed commands, not null
    public JobRunExecutor(
            JobRunRepository runs,
            JobCatalog catalog,
            LogStore logStore,
            Clock clock,
            Retry retry,
            int chunkSize,
            Supplier<List<String>> selfCommand) {
        this.runs = Objects.requireNonNull(runs, "runs must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.chunkSize = chunkSize;
        this.selfCommand = Objects.requireNonNull(selfCommand, "selfCommand must not be null");
    }

    /// Runs the command of a stored run to completion.
    ///
    /// @param runId the run to execute
    /// @return the child's exit code, or {@link JobRun#SPAWN_FAILED}
    /// @throws IllegalArgumentException if the run does not exist
    /// @throws IllegalStateException if the run's job does not exist
    /// @throws InterruptedException if interrupted while waiting for the child
    public int execute(long runId) throws InterruptedException {
        JobRun run =
                retry.call("look up run " + runId, () -> runs.findById(runId))
                        .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        Job job =
                catalog.findJob(run.jobId())
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Job of run " + runId + " is gone"));

        Process process;
        try {
            List<String> prefix =
                    job.command().kind() == CommandKind.MANAGED ? selfCommand.get() : List.of();
            List<String> argv = job.commandLine(prefix);
            logger.info("Starting run " + runId + ": " + String.join(" ", argv));
            process = new ProcessBuilder(argv).redirectInput(NULL_INPUT).start();
        } catch (IOException | RuntimeException e) {
            return recordSpawnFailure(run, e);
        }

        int pid = (int) process.pid();
        retry.run("record pid of run " + runId, () -> runs.updatePid(runId, pid));

        Thread stdout = startCollector(run, LogEntryKind.STDOUT, process);
        Thread stderr = startCollector(run, LogEntryKind.STDERR, process);

        int exitCode = process.waitFor();
        Instant stoppedAt = clock.instant();
        retry.run(
                "record exit of run " + runId,
                () -> runs.markStopped(runId, stoppedAt, exitCode));
        logger.info("Run " + runId + " exited with code " + exitCode);

        stdout.join();
        stderr.join();
        return exitCode;
    }

    private Thread startCollector(JobRun run, LogEntryKind kind, Process process) {
        OutputCollector collector =
                new OutputCollector(
                        run.id(),
                        kind,
                        kind == LogEntryKind.STDOUT
                                ? process.getInputStream()
                                : process.getErrorStream(),
                        logStore,
                        clock,
                        retry,
                        chunkSize);
        Thread thread = new Thread(collector, "run-" + run.id() + "-" + kind.name().toLowerCase());
        thread.start();
        return thread;
    }

    private int recordSpawnFailure(JobRun run, Exception cause) {
        logger.log(Level.WARNING, "Could not start run " + run.id(), cause);
        String reason = "Failed to start command: " + cause.getMessage() + "\n";
        Instant now = clock.instant();
        LogEntry entry = new LogEntry(run.id(), LogEntryKind.STDERR, 1, 1, now, reason);
        retry.run("record spawn failure of run " + run.id(), () -> logStore.append(entry));
        retry.run(
                "record exit of run " + run.id(),
                () -> runs.markStopped(run.id(), now, JobRun.SPAWN_FAILED));
        return JobRun.SPAWN_FAILED;
    }
}
