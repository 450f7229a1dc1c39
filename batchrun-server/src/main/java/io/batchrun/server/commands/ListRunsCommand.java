package io.batchrun.server.commands;

import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.JobRunRepository;
import jakarta.inject.Inject;
import java.util.List;
import java.util.OptionalInt;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Lists the most recently started runs, newest first.
///
/// ### Usage
/// ```
/// batchrun list-runs
/// batchrun list-runs --limit 50 --exit-code 1
/// ```
@Command(name = "list-runs", description = "List recent job runs")
public class ListRunsCommand extends BatchrunCommand {

    @Option(
            names = "--limit",
            defaultValue = "20",
            description = "Maximum number of runs (default: ${DEFAULT-VALUE})")
    int limit;

    @Option(names = "--exit-code", description = "Only runs that exited with this code")
    Integer exitCode;

    @Inject JobRunRepository runs;

    @Override
    protected int execute() {
        if (limit < 1) {
            throw new IllegalArgumentException("--limit must be positive: " + limit);
        }
        List<JobRun> recent =
                runs.findRecent(
                        limit, exitCode == null ? OptionalInt.empty() : OptionalInt.of(exitCode));
        if (recent.isEmpty()) {
            System.out.println("No job runs found.");
            return EXIT_OK;
        }

        System.out.printf(
                "%-8s %-30s %-8s %-27s %-27s %s%n",
                "ID", "JOB", "PID", "STARTED", "STOPPED", "EXIT");
        System.out.println("-".repeat(110));
        for (JobRun run : recent) {
            System.out.printf(
                    "%-8d %-30s %-8s %-27s %-27s %s%n",
                    run.id(),
                    run.jobName(),
                    orDash(run.pid()),
                    run.startedAt(),
                    orDash(run.stoppedAt()),
                    orDash(run.exitCode()));
        }
        return EXIT_OK;
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }
}
