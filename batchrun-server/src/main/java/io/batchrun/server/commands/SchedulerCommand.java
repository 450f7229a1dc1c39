package io.batchrun.server.commands;

import io.batchrun.core.BatchrunEnvironment;
import io.batchrun.core.scheduler.SchedulerLoop;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;

/// Runs the scheduler loop in the foreground.
///
/// Several schedulers may run against the same database; each queued run is claimed by
/// exactly one of them. The loop stops when the JVM shuts down.
///
/// ### Usage
/// ```
/// batchrun scheduler
/// ```
@Command(name = "scheduler", description = "Run the scheduler loop")
public class SchedulerCommand extends BatchrunCommand {

    private static final Logger LOG = Logger.getLogger(SchedulerCommand.class);

    @Inject BatchrunEnvironment environment;

    @Override
    protected int execute() throws InterruptedException {
        int pid = (int) ProcessHandle.current().pid();
        SchedulerLoop loop = environment.createSchedulerLoop(pid);
        Thread main = Thread.currentThread();
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    LOG.infov("Stopping scheduler {0}", pid);
                                    loop.stop();
                                    main.interrupt();
                                },
                                "scheduler-shutdown"));
        loop.run();
        return EXIT_OK;
    }
}
