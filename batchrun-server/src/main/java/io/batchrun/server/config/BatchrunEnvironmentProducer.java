package io.batchrun.server.config;

import io.batchrun.core.BatchrunConfig;
import io.batchrun.core.BatchrunEnvironment;
import io.batchrun.core.BatchrunFactory;
import io.batchrun.core.BatchrunStorage;
import io.batchrun.server.launcher.ProcessJobLauncher;
import io.batchrun.server.launcher.SelfInvocation;
import io.batchrun.server.persistence.JdbcStorage;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the batch-run environment.
///
/// Reads the `batchrun.*` settings into a {@link BatchrunConfig} and wires storage and
/// launcher through {@link BatchrunFactory}. With an active datasource, runs are stored
/// in PostgreSQL and launched as detached worker processes. Without one, storage is
/// in-memory and runs execute on threads of this process, since a worker process could
/// not see the in-memory state.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `batchrun.scheduler.poll-interval` | Duration | `10s` | Longest scheduler sleep |
/// | `batchrun.queue.grace-period` | Duration | `5m` | How late a queued run may still start |
/// | `batchrun.queue.window-size` | int | `10` | Queued runs kept per scheduled job |
/// | `batchrun.cleaner.batch-size` | int | `10` | Runs deleted per statement batch |
/// | `batchrun.collector.chunk-size` | int | `4096` | Bytes read per output chunk |
/// | `batchrun.collector.max-write-attempts` | int | `5` | Attempts per log entry write |
/// | `batchrun.collector.retry-backoff` | Duration | `200ms` | First retry back-off |
/// | `batchrun.self-command` | list | derived | Argv prefix that re-invokes this application |
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see BatchrunEnvironment
/// @see BatchrunFactory
@ApplicationScoped
public class BatchrunEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(BatchrunEnvironmentProducer.class);

    private BatchrunEnvironment environment;

    @Inject Config config;

    @Inject Instance<DataSource> dataSourceInstance;

    /// Produces the batch-run environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public BatchrunEnvironment batchrunEnvironment() {
        BatchrunConfig batchrunConfig = readConfig();
        BatchrunFactory.Builder factoryBuilder = BatchrunFactory.builder().config(batchrunConfig);

        boolean dsActive =
                config.getOptionalValue("quarkus.datasource.active", Boolean.class).orElse(true);

        if (dsActive && dataSourceInstance.isResolvable()) {
            BatchrunStorage storage = JdbcStorage.create(dataSourceInstance.get());
            factoryBuilder
                    .storage(storage)
                    .launcher(
                            runs ->
                                    new ProcessJobLauncher(
                                            runs,
                                            storage.logStore(),
                                            Clock.systemUTC(),
                                            batchrunConfig::getSelfCommand));
            LOG.info("Using JDBC persistence (PostgreSQL)");
        } else {
            LOG.info("Using in-memory persistence; runs execute in-process");
        }

        environment = factoryBuilder.build();
        return environment;
    }

    BatchrunConfig readConfig() {
        BatchrunConfig.Builder builder = BatchrunConfig.builder();
        duration("batchrun.scheduler.poll-interval").ifPresent(builder::pollInterval);
        duration("batchrun.queue.grace-period").ifPresent(builder::gracePeriod);
        integer("batchrun.queue.window-size").ifPresent(builder::queueWindowSize);
        integer("batchrun.cleaner.batch-size").ifPresent(builder::cleanerBatchSize);
        integer("batchrun.collector.chunk-size").ifPresent(builder::chunkSize);
        integer("batchrun.collector.max-write-attempts").ifPresent(builder::maxWriteAttempts);
        duration("batchrun.collector.retry-backoff").ifPresent(builder::retryBackoff);
        builder.selfCommandResolver(
                SelfInvocation.lazy(
                        config.getOptionalValues("batchrun.self-command", String.class)));
        return builder.build();
    }

    private Optional<Duration> duration(String key) {
        return config.getOptionalValue(key, Duration.class);
    }

    private Optional<Integer> integer(String key) {
        return config.getOptionalValue(key, Integer.class);
    }

    /// Cleanup callback invoked when the application shuts down.
    ///
    /// Closes the environment to release the in-process worker pool, if any.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
            LOG.info("BatchrunEnvironment closed");
        }
    }
}
