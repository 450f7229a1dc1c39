package io.batchrun.server.commands;

import io.batchrun.core.queue.RunQueue;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;

/// Drops expired queue items and regenerates the queue window of every scheduled job.
///
/// The scheduler does the same on start-up. Use this after editing schedules directly
/// in the database.
@Command(name = "refresh-queue", description = "Regenerate the run queue")
public class RefreshQueueCommand extends BatchrunCommand {

    @Inject RunQueue runQueue;

    @Override
    protected int execute() {
        runQueue.refreshAll();
        System.out.println("Run queue refreshed");
        return EXIT_OK;
    }
}
