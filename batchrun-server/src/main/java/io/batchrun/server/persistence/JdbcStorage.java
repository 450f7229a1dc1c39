package io.batchrun.server.persistence;

import io.batchrun.core.BatchrunStorage;
import io.batchrun.core.command.JobCatalog;
import java.util.Objects;
import javax.sql.DataSource;

/// Assembles a {@link BatchrunStorage} backed by PostgreSQL.
///
/// All repositories share one {@link DataSource}; the scheduled-job repository resolves
/// its jobs through the JDBC catalog.
public final class JdbcStorage {

    private JdbcStorage() {}

    /// @param dataSource pooled datasource with the `batchrun` schema migrated, not null
    /// @return storage whose repositories all read and write through `dataSource`, never null
    public static BatchrunStorage create(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        JobCatalog catalog = new JdbcJobCatalog(dataSource);
        return new BatchrunStorage(
                catalog,
                new JdbcScheduledJobRepository(dataSource, catalog),
                new JdbcJobRunRepository(dataSource),
                new JdbcLogStore(dataSource),
                new JdbcRunQueueRepository(dataSource));
    }
}
