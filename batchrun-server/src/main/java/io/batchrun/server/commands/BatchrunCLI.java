package io.batchrun.server.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the batch-run application.
///
/// Registers all subcommands:
/// - `scheduler` - Run the scheduler loop until the process is stopped
/// - `execute-run` - Worker entrypoint that executes one run
/// - `compact-log` - Compact the logs of given runs
/// - `log-rotate` - Apply retention policies to all runs
/// - `drop-old-entries` - Delete runs older than N days before the newest run
/// - `list-runs` - List recent runs
/// - `show-log` - Print the log of one run
/// - `list-queue` - List queued runs
/// - `refresh-queue` - Regenerate the run queue of every scheduled job
/// - `load-definitions` - Load commands, jobs and schedules from a JSON file
@TopCommand
@Command(
        name = "batchrun",
        description = "Batch job scheduler and runner",
        mixinStandardHelpOptions = true,
        subcommands = {
            SchedulerCommand.class,
            ExecuteRunCommand.class,
            CompactLogCommand.class,
            LogRotateCommand.class,
            DropOldEntriesCommand.class,
            ListRunsCommand.class,
            ShowLogCommand.class,
            ListQueueCommand.class,
            RefreshQueueCommand.class,
            LoadDefinitionsCommand.class
        })
public class BatchrunCLI {}
