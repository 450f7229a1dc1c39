package io.batchrun.server.commands;

import io.batchrun.core.compactor.LogCompactor;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogEntryKind;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Prints the output of one run, whether its log is still fine-grained or compacted.
///
/// Output that the child wrote to stderr is printed on stderr.
///
/// ### Usage
/// ```
/// batchrun show-log <run-id>
/// ```
@Command(name = "show-log", description = "Print the log of a job run")
public class ShowLogCommand extends BatchrunCommand {

    @Parameters(index = "0", description = "Job run id")
    long runId;

    @Inject JobRunRepository runs;

    @Inject LogCompactor compactor;

    @Override
    protected int execute() {
        Optional<JobRun> run = runs.findById(runId);
        if (run.isEmpty()) {
            System.err.println("Unknown job run: " + runId);
            return EXIT_FAILURE;
        }
        List<LogEntry> entries = compactor.readLog(runId);
        for (LogEntry entry : entries) {
            if (entry.kind() == LogEntryKind.STDERR) {
                System.err.print(entry.text());
            } else {
                System.out.print(entry.text());
            }
        }
        System.out.flush();
        System.err.flush();
        return EXIT_OK;
    }
}
