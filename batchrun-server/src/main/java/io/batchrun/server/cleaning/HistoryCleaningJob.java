package io.batchrun.server.cleaning;

import io.batchrun.core.cleaning.CleaningReport;
import io.batchrun.core.cleaning.HistoryCleaner;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/// Optional in-process retention clean, for deployments without an external cron
/// entry for `log-rotate`.
///
/// Disabled by default. Only fires while the application is running, in practice while
/// the `scheduler` command is active.
///
/// ### Configuration
/// | Property                    | Default | Description                             |
/// |-----------------------------|---------|-----------------------------------------|
/// | `batchrun.cleaner.interval` | `off`   | How often to apply retention policies   |
///
/// @see HistoryCleaner#clean(boolean)
@ApplicationScoped
public class HistoryCleaningJob {

    private static final Logger LOG = Logger.getLogger(HistoryCleaningJob.class);

    private final HistoryCleaner cleaner;

    @Inject
    public HistoryCleaningJob(HistoryCleaner cleaner) {
        this.cleaner = cleaner;
    }

    @Scheduled(
            every = "${batchrun.cleaner.interval:off}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        try {
            CleaningReport report = cleaner.clean(false);
            LOG.debugv(
                    "Periodic clean deleted {0} job runs and {1} log entries",
                    report.deleted().runs(),
                    report.deleted().logEntries());
        } catch (RuntimeException e) {
            LOG.errorv(e, "Periodic clean failed: {0}", e.getMessage());
        }
    }
}
