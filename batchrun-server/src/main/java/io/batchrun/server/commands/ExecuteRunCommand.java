package io.batchrun.server.commands;

import io.batchrun.core.BatchrunEnvironment;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Worker entrypoint: executes the command of one run and collects its output.
///
/// Started by the process launcher, not normally by hand. Exits with the child's exit
/// code, or `-1` converted by the OS (255) when the child could not be started.
///
/// ### Usage
/// ```
/// batchrun execute-run <run-id>
/// ```
@Command(name = "execute-run", description = "Execute one job run (worker entrypoint)")
public class ExecuteRunCommand extends BatchrunCommand {

    @Parameters(index = "0", description = "Job run id")
    long runId;

    @Inject BatchrunEnvironment environment;

    @Override
    protected int execute() throws InterruptedException {
        return environment.getExecutor().execute(runId);
    }
}
