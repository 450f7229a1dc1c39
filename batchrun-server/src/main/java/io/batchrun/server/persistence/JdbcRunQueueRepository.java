package io.batchrun.server.persistence;

import static io.batchrun.server.persistence.JdbcSupport.getInstant;
import static io.batchrun.server.persistence.JdbcSupport.getNullableInt;
import static io.batchrun.server.persistence.JdbcSupport.setInstant;

import io.batchrun.core.queue.RunQueueItem;
import io.batchrun.core.queue.RunQueueRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed run queue.
///
/// ### Claiming
/// {@link #claim(long, Instant, int)} locks the item row with `FOR UPDATE SKIP LOCKED`
/// and assigns it in the same transaction. A competing scheduler that reaches the row
/// while it is locked skips it and sees no item, so at most one claim succeeds. The lock
/// is released at commit, before any process is spawned.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_schema` has run
/// - **Invariant**: `(scheduled_job_id, run_at)` is unique
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection via {@link JdbcSupport}.
public class JdbcRunQueueRepository implements RunQueueRepository {

    // --- SQL constants ---

    private static final String SQL_INSERT_IF_MISSING =
            """
            INSERT INTO batchrun.run_queue_items (scheduled_job_id, run_at)
            VALUES (?, ?)
            ON CONFLICT (scheduled_job_id, run_at) DO NOTHING
            """;

    private static final String SQL_SELECT =
            """
            SELECT q.id, q.scheduled_job_id, q.run_at, q.assigned_at, q.assignee_pid
            FROM batchrun.run_queue_items q
            """;

    private static final String SQL_FIND_BY_KEY =
            SQL_SELECT + "WHERE q.scheduled_job_id = ? AND q.run_at = ?";

    private static final String SQL_DELETE_EXCEPT =
            """
            DELETE FROM batchrun.run_queue_items
            WHERE scheduled_job_id = ? AND NOT (id = ANY (?))
            """;

    private static final String SQL_DELETE_EXPIRED =
            "DELETE FROM batchrun.run_queue_items WHERE assigned_at IS NULL AND run_at < ?";

    private static final String SQL_FIND_FIRST_CLAIMABLE =
            SQL_SELECT
                    + """
                    JOIN batchrun.scheduled_jobs s ON s.id = q.scheduled_job_id
                    WHERE q.assigned_at IS NULL AND s.enabled
                    ORDER BY q.run_at, q.id
                    LIMIT 1
                    """;

    private static final String SQL_LOCK_CLAIMABLE =
            """
            SELECT q.id
            FROM batchrun.run_queue_items q
            JOIN batchrun.scheduled_jobs s ON s.id = q.scheduled_job_id
            WHERE q.id = ? AND q.assigned_at IS NULL AND s.enabled
            FOR UPDATE OF q SKIP LOCKED
            """;

    private static final String SQL_ASSIGN =
            "UPDATE batchrun.run_queue_items SET assigned_at = ?, assignee_pid = ? WHERE id = ?";

    private static final String SQL_FIND_ALL = SQL_SELECT + "ORDER BY q.run_at, q.id";

    private static final String SQL_NEXT_RUN_AT =
            """
            SELECT MIN(run_at) AS next_run_at
            FROM batchrun.run_queue_items
            WHERE scheduled_job_id = ? AND assigned_at IS NULL
            """;

    // --- Fields ---

    private final JdbcSupport jdbc;

    public JdbcRunQueueRepository(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public RunQueueItem getOrCreate(long scheduledJobId, Instant runAt) {
        Objects.requireNonNull(runAt, "runAt must not be null");
        return jdbc.inTransaction(
                tx -> {
                    tx.update(
                            SQL_INSERT_IF_MISSING,
                            ps -> {
                                ps.setLong(1, scheduledJobId);
                                setInstant(ps, 2, runAt);
                            });
                    return tx.queryOne(
                                    SQL_FIND_BY_KEY,
                                    ps -> {
                                        ps.setLong(1, scheduledJobId);
                                        setInstant(ps, 2, runAt);
                                    },
                                    JdbcRunQueueRepository::mapItem)
                            .orElseThrow();
                },
                "Failed to create queue item for scheduled job: " + scheduledJobId);
    }

    @Override
    public int deleteForScheduledJobExcept(long scheduledJobId, Collection<Long> keepIds) {
        Objects.requireNonNull(keepIds, "keepIds must not be null");
        Long[] keep = keepIds.toArray(new Long[0]);
        return jdbc.update(
                SQL_DELETE_EXCEPT,
                ps -> {
                    ps.setLong(1, scheduledJobId);
                    ps.setArray(2, ps.getConnection().createArrayOf("bigint", keep));
                },
                "Failed to delete queue items of scheduled job: " + scheduledJobId);
    }

    @Override
    public int deleteExpired(Instant limit) {
        Objects.requireNonNull(limit, "limit must not be null");
        return jdbc.update(
                SQL_DELETE_EXPIRED,
                ps -> setInstant(ps, 1, limit),
                "Failed to delete expired queue items");
    }

    @Override
    public Optional<RunQueueItem> findFirstClaimable() {
        return jdbc.queryOne(
                SQL_FIND_FIRST_CLAIMABLE,
                JdbcSupport.NO_PARAMETERS,
                JdbcRunQueueRepository::mapItem,
                "Failed to find claimable queue item");
    }

    @Override
    public boolean claim(long itemId, Instant now, int pid) {
        Objects.requireNonNull(now, "now must not be null");
        return jdbc.inTransaction(
                tx -> {
                    boolean locked =
                            tx.queryOne(
                                            SQL_LOCK_CLAIMABLE,
                                            ps -> ps.setLong(1, itemId),
                                            rs -> rs.getLong("id"))
                                    .isPresent();
                    if (!locked) {
                        return false;
                    }
                    tx.update(
                            SQL_ASSIGN,
                            ps -> {
                                setInstant(ps, 1, now);
                                ps.setInt(2, pid);
                                ps.setLong(3, itemId);
                            });
                    return true;
                },
                "Failed to claim queue item: " + itemId);
    }

    @Override
    public List<RunQueueItem> findAll() {
        return jdbc.queryList(
                SQL_FIND_ALL,
                JdbcSupport.NO_PARAMETERS,
                JdbcRunQueueRepository::mapItem,
                "Failed to list queue items");
    }

    @Override
    public Optional<Instant> findNextRunAt(long scheduledJobId) {
        return jdbc.queryOne(
                        SQL_NEXT_RUN_AT,
                        ps -> ps.setLong(1, scheduledJobId),
                        rs -> Optional.ofNullable(getInstant(rs, "next_run_at")),
                        "Failed to find next run of scheduled job: " + scheduledJobId)
                .flatMap(next -> next);
    }

    private static RunQueueItem mapItem(ResultSet rs) throws SQLException {
        return new RunQueueItem(
                rs.getLong("id"),
                rs.getLong("scheduled_job_id"),
                getInstant(rs, "run_at"),
                getInstant(rs, "assigned_at"),
                getNullableInt(rs, "assignee_pid"));
    }
}
