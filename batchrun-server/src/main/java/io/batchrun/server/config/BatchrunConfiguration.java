package io.batchrun.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.batchrun.core.BatchrunEnvironment;
import io.batchrun.core.cleaning.HistoryCleaner;
import io.batchrun.core.cleaning.RunPruner;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.compactor.LogCompactor;
import io.batchrun.core.queue.RunQueue;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.serialization.BatchrunSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server beans.
///
/// The environment itself is produced by {@link BatchrunEnvironmentProducer}. This class
/// produces the shared {@link ObjectMapper} and delegating producers that expose
/// environment components for direct injection into commands and jobs.
@ApplicationScoped
public class BatchrunConfiguration {

    // ========== Utility Beans ==========

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return BatchrunSerializer.createMapper();
    }

    // ========== BatchrunEnvironment Component Delegates ==========

    @Produces
    @Singleton
    public JobCatalog jobCatalog(BatchrunEnvironment env) {
        return env.getCatalog();
    }

    @Produces
    @Singleton
    public JobRunRepository jobRunRepository(BatchrunEnvironment env) {
        return env.getRuns();
    }

    @Produces
    @Singleton
    public RunQueue runQueue(BatchrunEnvironment env) {
        return env.getRunQueue();
    }

    @Produces
    @Singleton
    public LogCompactor logCompactor(BatchrunEnvironment env) {
        return env.getCompactor();
    }

    /// Produces the retention-policy cleaner used by `log-rotate` and the periodic tick.
    ///
    /// @param env the initialized environment, not null
    /// @return the history cleaner, never null
    @Produces
    @Singleton
    public HistoryCleaner historyCleaner(BatchrunEnvironment env) {
        return env.getCleaner();
    }

    @Produces
    @Singleton
    public RunPruner runPruner(BatchrunEnvironment env) {
        return env.getPruner();
    }
}
