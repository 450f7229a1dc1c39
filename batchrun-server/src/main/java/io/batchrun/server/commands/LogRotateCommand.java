package io.batchrun.server.commands;

import io.batchrun.core.cleaning.CleanAction;
import io.batchrun.core.cleaning.CleaningReport;
import io.batchrun.core.cleaning.HistoryCleaner;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Applies every job's retention policy: compacts, drops logs of, or deletes old runs.
///
/// ### Usage
/// ```
/// batchrun log-rotate [--dry-run]
/// ```
@Command(name = "log-rotate", description = "Apply retention policies to job runs")
public class LogRotateCommand extends BatchrunCommand {

    @Option(names = "--dry-run", description = "Only report what would be done")
    boolean dryRun;

    @Inject HistoryCleaner cleaner;

    @Override
    protected int execute() {
        CleaningReport report = cleaner.clean(dryRun);
        for (CleanAction action : CleanAction.values()) {
            System.out.printf(
                    "%-13s %d job runs%n", action, report.plan().get(action).size());
        }
        if (!dryRun) {
            System.out.printf(
                    "Deleted %d job runs, %d compact logs and %d log entries%n",
                    report.deleted().runs(),
                    report.deleted().compactLogs(),
                    report.deleted().logEntries());
        }
        return EXIT_OK;
    }
}
