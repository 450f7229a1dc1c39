package io.batchrun.server.commands;

import io.batchrun.core.cleaning.RunPruner;
import jakarta.inject.Inject;
import java.util.OptionalLong;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// Deletes runs that started more than N days before the newest run.
///
/// The cut-off is relative to the newest run, not to the current time, so a database
/// that has been idle keeps its last N days of history.
///
/// ### Usage
/// ```
/// batchrun drop-old-entries [days]
/// ```
@Command(name = "drop-old-entries", description = "Delete job runs older than N days")
public class DropOldEntriesCommand extends BatchrunCommand {

    @Parameters(
            index = "0",
            arity = "0..1",
            defaultValue = "" + RunPruner.DEFAULT_RETAIN_DAYS,
            description = "Days of history to keep (default: ${DEFAULT-VALUE})")
    int days;

    @Inject RunPruner pruner;

    @Override
    protected int execute() {
        OptionalLong deleted = pruner.prune(days);
        if (deleted.isEmpty()) {
            System.out.println("No job runs saved");
        } else {
            System.out.printf("Deleted %d job runs%n", deleted.getAsLong());
        }
        return EXIT_OK;
    }
}
