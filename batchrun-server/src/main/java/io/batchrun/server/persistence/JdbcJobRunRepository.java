package io.batchrun.server.persistence;

import static io.batchrun.server.persistence.JdbcSupport.getInstant;
import static io.batchrun.server.persistence.JdbcSupport.getNullableInt;
import static io.batchrun.server.persistence.JdbcSupport.getSeconds;
import static io.batchrun.server.persistence.JdbcSupport.setInstant;

import io.batchrun.core.command.Job;
import io.batchrun.core.command.RetentionPolicy;
import io.batchrun.core.run.DeletionCounts;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.JobRunRepository;
import io.batchrun.core.run.RunRetention;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import javax.sql.DataSource;

/// PostgreSQL-backed run history.
///
/// Run deletions remove log entries, then compact logs, then the runs, all in one
/// transaction per call.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_schema` has run
/// - **Invariant**: `stopped_at` and `exit_code` are written together by {@link #markStopped}
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection via {@link JdbcSupport}.
public class JdbcJobRunRepository implements JobRunRepository {

    // --- SQL constants ---

    private static final String SQL_CREATE =
            "INSERT INTO batchrun.job_runs (job_id, started_at) VALUES (?, ?) RETURNING id";

    private static final String SQL_SELECT =
            """
            SELECT r.id, r.job_id, j.name AS job_name, r.pid,
                   r.started_at, r.stopped_at, r.exit_code
            FROM batchrun.job_runs r
            JOIN batchrun.jobs j ON j.id = r.job_id
            """;

    private static final String SQL_FIND_BY_ID = SQL_SELECT + "WHERE r.id = ?";

    private static final String SQL_FIND_RECENT =
            SQL_SELECT + "ORDER BY r.started_at DESC, r.id DESC LIMIT ?";

    private static final String SQL_FIND_RECENT_BY_EXIT_CODE =
            SQL_SELECT + "WHERE r.exit_code = ? ORDER BY r.started_at DESC, r.id DESC LIMIT ?";

    private static final String SQL_UPDATE_PID =
            "UPDATE batchrun.job_runs SET pid = ? WHERE id = ?";

    private static final String SQL_MARK_STOPPED =
            "UPDATE batchrun.job_runs SET stopped_at = ?, exit_code = ? WHERE id = ?";

    private static final String SQL_LATEST_STARTED_AT =
            "SELECT MAX(started_at) AS latest FROM batchrun.job_runs";

    private static final String SQL_COUNT = "SELECT COUNT(*) AS total FROM batchrun.job_runs";

    private static final String SQL_DELETE_ENTRIES_BEFORE =
            """
            DELETE FROM batchrun.log_entries
            WHERE run_id IN (SELECT id FROM batchrun.job_runs WHERE started_at < ?)
            """;

    private static final String SQL_DELETE_LOGS_BEFORE =
            """
            DELETE FROM batchrun.job_run_logs
            WHERE run_id IN (SELECT id FROM batchrun.job_runs WHERE started_at < ?)
            """;

    private static final String SQL_DELETE_RUNS_BEFORE =
            "DELETE FROM batchrun.job_runs WHERE started_at < ?";

    private static final String SQL_RETENTION_CANDIDATES =
            """
            SELECT r.id, r.started_at,
                   p.identifier,
                   EXTRACT(EPOCH FROM p.compact_delay) AS compact_delay,
                   EXTRACT(EPOCH FROM p.delete_logs_delay) AS delete_logs_delay,
                   EXTRACT(EPOCH FROM p.delete_run_delay) AS delete_run_delay,
                   EXISTS (SELECT 1 FROM batchrun.log_entries e WHERE e.run_id = r.id)
                       AS has_log_entries,
                   EXISTS (SELECT 1 FROM batchrun.job_run_logs l WHERE l.run_id = r.id)
                       AS has_compact_log
            FROM batchrun.job_runs r
            JOIN batchrun.jobs j ON j.id = r.job_id
            JOIN batchrun.retention_policies p ON p.identifier = j.retention_policy
            WHERE r.started_at + p.compact_delay <= ?
            ORDER BY r.id
            """;

    private static final String SQL_DELETE_ENTRIES =
            "DELETE FROM batchrun.log_entries WHERE run_id = ?";

    private static final String SQL_DELETE_LOG =
            "DELETE FROM batchrun.job_run_logs WHERE run_id = ?";

    private static final String SQL_DELETE_RUN = "DELETE FROM batchrun.job_runs WHERE id = ?";

    // --- Fields ---

    private final JdbcSupport jdbc;

    public JdbcJobRunRepository(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public JobRun create(Job job, Instant startedAt) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        long id =
                jdbc.queryOne(
                                SQL_CREATE,
                                ps -> {
                                    ps.setLong(1, job.id());
                                    setInstant(ps, 2, startedAt);
                                },
                                rs -> rs.getLong("id"),
                                "Failed to create run of job: " + job.name())
                        .orElseThrow();
        return new JobRun(id, job.id(), job.name(), null, startedAt, null, null);
    }

    @Override
    public Optional<JobRun> findById(long runId) {
        return jdbc.queryOne(
                SQL_FIND_BY_ID,
                ps -> ps.setLong(1, runId),
                JdbcJobRunRepository::mapRun,
                "Failed to find run: " + runId);
    }

    @Override
    public void updatePid(long runId, int pid) {
        jdbc.update(
                SQL_UPDATE_PID,
                ps -> {
                    ps.setInt(1, pid);
                    ps.setLong(2, runId);
                },
                "Failed to update pid of run: " + runId);
    }

    @Override
    public void markStopped(long runId, Instant stoppedAt, int exitCode) {
        Objects.requireNonNull(stoppedAt, "stoppedAt must not be null");
        jdbc.update(
                SQL_MARK_STOPPED,
                ps -> {
                    setInstant(ps, 1, stoppedAt);
                    ps.setInt(2, exitCode);
                    ps.setLong(3, runId);
                },
                "Failed to mark run stopped: " + runId);
    }

    @Override
    public List<JobRun> findRecent(int limit, OptionalInt exitCode) {
        if (exitCode.isPresent()) {
            return jdbc.queryList(
                    SQL_FIND_RECENT_BY_EXIT_CODE,
                    ps -> {
                        ps.setInt(1, exitCode.getAsInt());
                        ps.setInt(2, limit);
                    },
                    JdbcJobRunRepository::mapRun,
                    "Failed to list runs");
        }
        return jdbc.queryList(
                SQL_FIND_RECENT,
                ps -> ps.setInt(1, limit),
                JdbcJobRunRepository::mapRun,
                "Failed to list runs");
    }

    @Override
    public Optional<Instant> latestStartedAt() {
        return jdbc.queryOne(
                        SQL_LATEST_STARTED_AT,
                        JdbcSupport.NO_PARAMETERS,
                        rs -> Optional.ofNullable(getInstant(rs, "latest")),
                        "Failed to find latest run")
                .flatMap(latest -> latest);
    }

    @Override
    public long count() {
        return jdbc.queryOne(
                        SQL_COUNT,
                        JdbcSupport.NO_PARAMETERS,
                        rs -> rs.getLong("total"),
                        "Failed to count runs")
                .orElse(0L);
    }

    @Override
    public long deleteStartedBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        return jdbc.inTransaction(
                tx -> {
                    tx.update(SQL_DELETE_ENTRIES_BEFORE, ps -> setInstant(ps, 1, cutoff));
                    tx.update(SQL_DELETE_LOGS_BEFORE, ps -> setInstant(ps, 1, cutoff));
                    return (long)
                            tx.update(SQL_DELETE_RUNS_BEFORE, ps -> setInstant(ps, 1, cutoff));
                },
                "Failed to delete runs started before " + cutoff);
    }

    @Override
    public List<RunRetention> findRetentionCandidates(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return jdbc.queryList(
                SQL_RETENTION_CANDIDATES,
                ps -> setInstant(ps, 1, now),
                rs ->
                        new RunRetention(
                                rs.getLong("id"),
                                getInstant(rs, "started_at"),
                                new RetentionPolicy(
                                        rs.getString("identifier"),
                                        getSeconds(rs, "compact_delay"),
                                        getSeconds(rs, "delete_logs_delay"),
                                        getSeconds(rs, "delete_run_delay")),
                                rs.getBoolean("has_log_entries"),
                                rs.getBoolean("has_compact_log")),
                "Failed to find retention candidates");
    }

    @Override
    public DeletionCounts deleteWithLogs(Collection<Long> runIds) {
        Objects.requireNonNull(runIds, "runIds must not be null");
        if (runIds.isEmpty()) {
            return DeletionCounts.NONE;
        }
        return jdbc.inTransaction(
                tx -> {
                    long entries = 0;
                    long logs = 0;
                    long runs = 0;
                    for (long runId : runIds) {
                        entries += tx.update(SQL_DELETE_ENTRIES, ps -> ps.setLong(1, runId));
                        logs += tx.update(SQL_DELETE_LOG, ps -> ps.setLong(1, runId));
                        runs += tx.update(SQL_DELETE_RUN, ps -> ps.setLong(1, runId));
                    }
                    return new DeletionCounts(runs, logs, entries);
                },
                "Failed to delete runs " + runIds);
    }

    private static JobRun mapRun(ResultSet rs) throws SQLException {
        return new JobRun(
                rs.getLong("id"),
                rs.getLong("job_id"),
                rs.getString("job_name"),
                getNullableInt(rs, "pid"),
                getInstant(rs, "started_at"),
                getInstant(rs, "stopped_at"),
                getNullableInt(rs, "exit_code"));
    }
}
