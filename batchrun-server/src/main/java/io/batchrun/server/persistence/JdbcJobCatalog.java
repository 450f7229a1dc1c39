package io.batchrun.server.persistence;

import static io.batchrun.server.persistence.JdbcSupport.getSeconds;
import static io.batchrun.server.persistence.JdbcSupport.setSeconds;

import io.batchrun.core.command.CommandKind;
import io.batchrun.core.command.Job;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.command.JobCommand;
import io.batchrun.core.command.RetentionPolicy;
import io.batchrun.serialization.BatchrunSerializer;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed catalog of commands, retention policies and jobs.
///
/// Parameter schemas and argument mappings are JSONB columns written through
/// {@link BatchrunSerializer}. Every save is an upsert on the natural key (command and
/// job name, policy identifier) that keeps the surrogate id.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_schema` has run
/// - **Precondition**: a job's command and retention policy are stored before the job
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection via {@link JdbcSupport}.
public class JdbcJobCatalog implements JobCatalog {

    // --- SQL constants ---

    private static final String SQL_SAVE_COMMAND =
            """
            INSERT INTO batchrun.commands (kind, name, parameters, parameter_format)
            VALUES (?, ?, ?::jsonb, ?)
            ON CONFLICT (name)
            DO UPDATE SET
                kind             = EXCLUDED.kind,
                parameters       = EXCLUDED.parameters,
                parameter_format = EXCLUDED.parameter_format
            RETURNING id
            """;

    private static final String SQL_FIND_COMMAND =
            """
            SELECT id, kind, name, parameters, parameter_format
            FROM batchrun.commands
            WHERE name = ?
            """;

    private static final String SQL_SAVE_POLICY =
            """
            INSERT INTO batchrun.retention_policies
                (identifier, compact_delay, delete_logs_delay, delete_run_delay)
            VALUES (?, make_interval(secs => ?), make_interval(secs => ?), make_interval(secs => ?))
            ON CONFLICT (identifier)
            DO UPDATE SET
                compact_delay     = EXCLUDED.compact_delay,
                delete_logs_delay = EXCLUDED.delete_logs_delay,
                delete_run_delay  = EXCLUDED.delete_run_delay
            """;

    private static final String SQL_FIND_POLICY =
            """
            SELECT identifier,
                   EXTRACT(EPOCH FROM compact_delay) AS compact_delay,
                   EXTRACT(EPOCH FROM delete_logs_delay) AS delete_logs_delay,
                   EXTRACT(EPOCH FROM delete_run_delay) AS delete_run_delay
            FROM batchrun.retention_policies
            WHERE identifier = ?
            """;

    private static final String SQL_SAVE_JOB =
            """
            INSERT INTO batchrun.jobs (name, comment, command_id, arguments, retention_policy)
            VALUES (?, ?, (SELECT id FROM batchrun.commands WHERE name = ?), ?::jsonb, ?)
            ON CONFLICT (name)
            DO UPDATE SET
                comment          = EXCLUDED.comment,
                command_id       = EXCLUDED.command_id,
                arguments        = EXCLUDED.arguments,
                retention_policy = EXCLUDED.retention_policy
            RETURNING id
            """;

    private static final String SQL_SELECT_JOBS =
            """
            SELECT j.id, j.name, j.comment, j.arguments,
                   c.id AS command_id, c.kind, c.name AS command_name,
                   c.parameters, c.parameter_format,
                   p.identifier,
                   EXTRACT(EPOCH FROM p.compact_delay) AS compact_delay,
                   EXTRACT(EPOCH FROM p.delete_logs_delay) AS delete_logs_delay,
                   EXTRACT(EPOCH FROM p.delete_run_delay) AS delete_run_delay
            FROM batchrun.jobs j
            JOIN batchrun.commands c ON c.id = j.command_id
            JOIN batchrun.retention_policies p ON p.identifier = j.retention_policy
            """;

    private static final String SQL_FIND_JOB = SQL_SELECT_JOBS + "WHERE j.id = ?";

    private static final String SQL_FIND_JOB_BY_NAME = SQL_SELECT_JOBS + "WHERE j.name = ?";

    private static final String SQL_FIND_ALL_JOBS = SQL_SELECT_JOBS + "ORDER BY j.id";

    // --- Fields ---

    private final JdbcSupport jdbc;

    /// Creates a catalog backed by the given data source.
    ///
    /// @param dataSource the JDBC connection pool, not null
    public JdbcJobCatalog(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public JobCommand saveCommand(JobCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        long id =
                jdbc.queryOne(
                                SQL_SAVE_COMMAND,
                                ps -> {
                                    ps.setString(1, command.kind().value());
                                    ps.setString(2, command.name());
                                    String parameters =
                                            BatchrunSerializer.parametersToJson(
                                                    command.parameters());
                                    ps.setString(3, parameters);
                                    ps.setString(4, command.parameterFormat());
                                },
                                rs -> rs.getLong("id"),
                                "Failed to save command: " + command.name())
                        .orElseThrow();
        return command.withId(id);
    }

    @Override
    public Optional<JobCommand> findCommand(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return jdbc.queryOne(
                SQL_FIND_COMMAND,
                ps -> ps.setString(1, name),
                rs ->
                        new JobCommand(
                                rs.getLong("id"),
                                CommandKind.fromValue(rs.getString("kind")),
                                rs.getString("name"),
                                BatchrunSerializer.parametersFromJson(rs.getString("parameters")),
                                rs.getString("parameter_format")),
                "Failed to find command: " + name);
    }

    @Override
    public void saveRetentionPolicy(RetentionPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        jdbc.update(
                SQL_SAVE_POLICY,
                ps -> {
                    ps.setString(1, policy.identifier());
                    setSeconds(ps, 2, policy.compactDelay());
                    setSeconds(ps, 3, policy.deleteLogsDelay());
                    setSeconds(ps, 4, policy.deleteRunDelay());
                },
                "Failed to save retention policy: " + policy.identifier());
    }

    @Override
    public Optional<RetentionPolicy> findRetentionPolicy(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        return jdbc.queryOne(
                SQL_FIND_POLICY,
                ps -> ps.setString(1, identifier),
                JdbcJobCatalog::mapPolicy,
                "Failed to find retention policy: " + identifier);
    }

    @Override
    public Job saveJob(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        long id =
                jdbc.queryOne(
                                SQL_SAVE_JOB,
                                ps -> {
                                    ps.setString(1, job.name());
                                    ps.setString(2, job.comment());
                                    ps.setString(3, job.command().name());
                                    ps.setString(
                                            4, BatchrunSerializer.argumentsToJson(job.arguments()));
                                    ps.setString(5, job.retentionPolicy().identifier());
                                },
                                rs -> rs.getLong("id"),
                                "Failed to save job: " + job.name())
                        .orElseThrow();
        return job.withId(id);
    }

    @Override
    public Optional<Job> findJob(long jobId) {
        return jdbc.queryOne(
                SQL_FIND_JOB,
                ps -> ps.setLong(1, jobId),
                JdbcJobCatalog::mapJob,
                "Failed to find job: " + jobId);
    }

    @Override
    public Optional<Job> findJobByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return jdbc.queryOne(
                SQL_FIND_JOB_BY_NAME,
                ps -> ps.setString(1, name),
                JdbcJobCatalog::mapJob,
                "Failed to find job: " + name);
    }

    @Override
    public List<Job> findAllJobs() {
        return jdbc.queryList(
                SQL_FIND_ALL_JOBS,
                JdbcSupport.NO_PARAMETERS,
                JdbcJobCatalog::mapJob,
                "Failed to list jobs");
    }

    // --- Mapping ---

    private static RetentionPolicy mapPolicy(ResultSet rs) throws SQLException {
        return new RetentionPolicy(
                rs.getString("identifier"),
                getSeconds(rs, "compact_delay"),
                getSeconds(rs, "delete_logs_delay"),
                getSeconds(rs, "delete_run_delay"));
    }

    private static Job mapJob(ResultSet rs) throws SQLException {
        JobCommand command =
                new JobCommand(
                        rs.getLong("command_id"),
                        CommandKind.fromValue(rs.getString("kind")),
                        rs.getString("command_name"),
                        BatchrunSerializer.parametersFromJson(rs.getString("parameters")),
                        rs.getString("parameter_format"));
        return new Job(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("comment"),
                command,
                BatchrunSerializer.argumentsFromJson(rs.getString("arguments")),
                mapPolicy(rs));
    }
}
