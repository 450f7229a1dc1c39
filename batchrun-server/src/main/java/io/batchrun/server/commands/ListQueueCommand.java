package io.batchrun.server.commands;

import io.batchrun.core.BatchrunEnvironment;
import io.batchrun.core.queue.RunQueueItem;
import io.batchrun.core.schedule.ScheduledJob;
import jakarta.inject.Inject;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import picocli.CommandLine.Command;

/// Lists queued runs in run-time order.
///
/// ### Usage
/// ```
/// batchrun list-queue
/// ```
@Command(name = "list-queue", description = "List queued job runs")
public class ListQueueCommand extends BatchrunCommand {

    @Inject BatchrunEnvironment environment;

    @Override
    protected int execute() {
        List<RunQueueItem> items = environment.getQueueItems().findAll();
        if (items.isEmpty()) {
            System.out.println("Run queue is empty.");
            return EXIT_OK;
        }

        Map<Long, String> names = new HashMap<>();
        for (ScheduledJob scheduledJob : environment.getScheduledJobs().findAll()) {
            names.put(scheduledJob.id(), scheduledJob.name());
        }

        System.out.printf("%-8s %-30s %-22s %s%n", "ID", "SCHEDULED JOB", "RUN AT", "ASSIGNED");
        System.out.println("-".repeat(80));
        for (RunQueueItem item : items) {
            String assigned =
                    item.assignedAt() == null
                            ? "-"
                            : item.assignedAt() + " (pid " + item.assigneePid() + ")";
            System.out.printf(
                    "%-8d %-30s %-22s %s%n",
                    item.id(),
                    names.getOrDefault(item.scheduledJobId(), "#" + item.scheduledJobId()),
                    item.runAt(),
                    assigned);
        }
        return EXIT_OK;
    }
}
