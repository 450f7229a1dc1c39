package io.batchrun.server.persistence;

import io.batchrun.core.command.CommandKind;
import io.batchrun.core.command.Job;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.command.JobCommand;
import io.batchrun.core.command.ParameterSpec;
import io.batchrun.core.command.ParameterType;
import io.batchrun.core.command.RetentionPolicy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/// Shared Testcontainers setup for JDBC repository tests.
///
/// Starts a PostgreSQL container per test class, runs Flyway migrations,
/// and provides a shared {@link DataSource} to subclasses. Skipped without Docker.
///
/// @implNote Package-private. Not part of the public API.
@Testcontainers(disabledWithoutDocker = true)
abstract class JdbcRepositoryTestBase {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    static DataSource dataSource;

    /// Initializes the PostgreSQL DataSource and runs Flyway migrations.
    ///
    /// @apiNote **Side effects**: creates `batchrun` schema and all tables
    @BeforeAll
    static void initPostgres() {
        PGSimpleDataSource ds = new PGSimpleDataSource();
        ds.setUrl(POSTGRES.getJdbcUrl());
        ds.setUser(POSTGRES.getUsername());
        ds.setPassword(POSTGRES.getPassword());
        dataSource = ds;

        Flyway.configure()
                .dataSource(dataSource)
                .schemas("batchrun")
                .locations("classpath:db/migration")
                .cleanDisabled(false)
                .load()
                .migrate();
    }

    /// Empties every table except the migrated default retention policy.
    static void truncateAll() throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {
            st.execute(
                    """
                    TRUNCATE batchrun.run_queue_items, batchrun.log_entries,
                             batchrun.job_run_logs, batchrun.job_runs,
                             batchrun.scheduled_jobs, batchrun.timezones,
                             batchrun.jobs, batchrun.commands
                    RESTART IDENTITY CASCADE
                    """);
            st.execute("DELETE FROM batchrun.retention_policies WHERE identifier <> 'default'");
        }
    }

    /// Stores a `sh -c <script>` job under the default retention policy.
    static Job storeShellJob(JobCatalog catalog, String name, String script) {
        return storeShellJob(catalog, name, script, RetentionPolicy.DEFAULT);
    }

    static Job storeShellJob(
            JobCatalog catalog, String name, String script, RetentionPolicy policy) {
        JobCommand sh =
                catalog.saveCommand(
                        new JobCommand(
                                0,
                                CommandKind.EXECUTABLE,
                                "sh",
                                Map.of("script", ParameterSpec.required(ParameterType.STRING)),
                                "-c {script}"));
        catalog.saveRetentionPolicy(policy);
        return catalog.saveJob(new Job(0, name, "", sh, Map.of("script", script), policy));
    }
}
