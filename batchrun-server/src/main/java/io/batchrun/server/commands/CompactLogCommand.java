package io.batchrun.server.commands;

import io.batchrun.core.compactor.LogCompactor;
import jakarta.inject.Inject;
import java.util.List;
import java.util.OptionalLong;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Compacts the fine-grained log entries of one or more runs.
///
/// Every id is processed even if an earlier one is unknown; the exit code is `1` if
/// any id was unknown.
///
/// ### Usage
/// ```
/// batchrun compact-log [--dry-run] <run-id>...
/// ```
@Command(name = "compact-log", description = "Compact the logs of job runs")
public class CompactLogCommand extends BatchrunCommand {

    @Parameters(arity = "1..*", paramLabel = "RUN_ID", description = "Job run ids")
    List<Long> runIds;

    @Option(names = "--dry-run", description = "Only report what would be compacted")
    boolean dryRun;

    @Inject LogCompactor compactor;

    @Override
    protected int execute() {
        int status = EXIT_OK;
        for (long runId : runIds) {
            OptionalLong compacted = compactor.compact(runId, dryRun);
            if (compacted.isEmpty()) {
                System.err.println("Unknown job run: " + runId);
                status = EXIT_FAILURE;
            } else if (dryRun) {
                System.out.printf(
                        "Job run %d: would compact %d log entries%n",
                        runId, compacted.getAsLong());
            } else {
                System.out.printf(
                        "Job run %d: compacted %d log entries%n", runId, compacted.getAsLong());
            }
        }
        return status;
    }
}
