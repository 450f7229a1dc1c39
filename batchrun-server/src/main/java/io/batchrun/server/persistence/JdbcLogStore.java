package io.batchrun.server.persistence;

import static io.batchrun.server.persistence.JdbcSupport.getInstant;
import static io.batchrun.server.persistence.JdbcSupport.setInstant;

import io.batchrun.core.compactor.CompactLog;
import io.batchrun.core.run.DeletionCounts;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.LogEntry;
import io.batchrun.core.run.LogEntryKind;
import io.batchrun.core.run.LogStore;
import io.batchrun.serialization.BatchrunSerializer;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed store of fine-grained log entries and compact logs.
///
/// ### Compaction
/// {@link #compact(JobRun)} runs in one transaction: it reads the entries, inserts the
/// compact log unless the run already has one, and deletes the entries it read. Entries
/// appended while the transaction runs have higher ids and survive for the next pass.
/// When the run already has a compact log, all of its entries are deleted.
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection via {@link JdbcSupport}.
public class JdbcLogStore implements LogStore {

    // --- SQL constants ---

    private static final String SQL_APPEND =
            """
            INSERT INTO batchrun.log_entries (run_id, kind, line_number, number, time, text)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_FIND_ENTRIES =
            """
            SELECT id, run_id, kind, line_number, number, time, text
            FROM batchrun.log_entries
            WHERE run_id = ?
            ORDER BY time, id
            """;

    private static final String SQL_COUNT_ENTRIES =
            "SELECT COUNT(*) AS total FROM batchrun.log_entries WHERE run_id = ?";

    private static final String SQL_FIND_LOG =
            """
            SELECT content, entry_data, first_timestamp, last_timestamp, entry_count, error_count
            FROM batchrun.job_run_logs
            WHERE run_id = ?
            """;

    private static final String SQL_LOCK_LOG =
            "SELECT run_id FROM batchrun.job_run_logs WHERE run_id = ? FOR UPDATE";

    private static final String SQL_INSERT_LOG =
            """
            INSERT INTO batchrun.job_run_logs
                (run_id, content, entry_data, first_timestamp, last_timestamp,
                 entry_count, error_count)
            VALUES (?, ?, ?::jsonb, ?, ?, ?, ?)
            ON CONFLICT (run_id) DO NOTHING
            """;

    private static final String SQL_DELETE_ENTRIES_UP_TO =
            "DELETE FROM batchrun.log_entries WHERE run_id = ? AND id <= ?";

    private static final String SQL_DELETE_ENTRIES =
            "DELETE FROM batchrun.log_entries WHERE run_id = ?";

    private static final String SQL_DELETE_LOG =
            "DELETE FROM batchrun.job_run_logs WHERE run_id = ?";

    // --- Fields ---

    private final JdbcSupport jdbc;

    public JdbcLogStore(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public void append(LogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        jdbc.update(
                SQL_APPEND,
                ps -> {
                    ps.setLong(1, entry.runId());
                    ps.setShort(2, (short) entry.kind().code());
                    ps.setInt(3, entry.lineNumber());
                    ps.setInt(4, entry.number());
                    setInstant(ps, 5, entry.time());
                    // PostgreSQL text cannot hold NUL
                    ps.setString(6, entry.text().replace('\u0000', '\uFFFD'));
                },
                "Failed to append log entry of run: " + entry.runId());
    }

    @Override
    public List<LogEntry> findEntries(long runId) {
        return jdbc.queryList(
                SQL_FIND_ENTRIES,
                ps -> ps.setLong(1, runId),
                rs -> mapEntry(rs).entry(),
                "Failed to read log entries of run: " + runId);
    }

    @Override
    public long countEntries(long runId) {
        return jdbc.queryOne(
                        SQL_COUNT_ENTRIES,
                        ps -> ps.setLong(1, runId),
                        rs -> rs.getLong("total"),
                        "Failed to count log entries of run: " + runId)
                .orElse(0L);
    }

    @Override
    public Optional<CompactLog> findCompactLog(long runId) {
        return jdbc.queryOne(
                SQL_FIND_LOG,
                ps -> ps.setLong(1, runId),
                rs ->
                        new CompactLog(
                                rs.getString("content"),
                                BatchrunSerializer.entryDataFromJson(rs.getString("entry_data")),
                                getInstant(rs, "first_timestamp"),
                                getInstant(rs, "last_timestamp"),
                                rs.getInt("entry_count"),
                                rs.getInt("error_count")),
                "Failed to read compact log of run: " + runId);
    }

    @Override
    public long compact(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        long runId = run.id();
        return jdbc.inTransaction(
                tx -> {
                    boolean exists =
                            tx.queryOne(SQL_LOCK_LOG, ps -> ps.setLong(1, runId), rs -> true)
                                    .isPresent();
                    if (exists) {
                        return (long) tx.update(SQL_DELETE_ENTRIES, ps -> ps.setLong(1, runId));
                    }

                    List<StoredEntry> stored =
                            tx.queryList(
                                    SQL_FIND_ENTRIES,
                                    ps -> ps.setLong(1, runId),
                                    JdbcLogStore::mapEntry);
                    List<LogEntry> entries = stored.stream().map(StoredEntry::entry).toList();
                    CompactLog log = CompactLog.forRun(run, entries);
                    tx.update(
                            SQL_INSERT_LOG,
                            ps -> {
                                ps.setLong(1, runId);
                                ps.setString(2, log.content());
                                ps.setString(
                                        3, BatchrunSerializer.entryDataToJson(log.entryData()));
                                setInstant(ps, 4, log.firstTimestamp());
                                setInstant(ps, 5, log.lastTimestamp());
                                ps.setInt(6, log.entryCount());
                                ps.setInt(7, log.errorCount());
                            });
                    if (stored.isEmpty()) {
                        return 0L;
                    }
                    long maxId = stored.stream().mapToLong(StoredEntry::id).max().orElseThrow();
                    return (long)
                            tx.update(
                                    SQL_DELETE_ENTRIES_UP_TO,
                                    ps -> {
                                        ps.setLong(1, runId);
                                        ps.setLong(2, maxId);
                                    });
                },
                "Failed to compact log of run: " + runId);
    }

    @Override
    public DeletionCounts deleteLogs(long runId) {
        return jdbc.inTransaction(
                tx -> {
                    long entries = tx.update(SQL_DELETE_ENTRIES, ps -> ps.setLong(1, runId));
                    long logs = tx.update(SQL_DELETE_LOG, ps -> ps.setLong(1, runId));
                    return new DeletionCounts(0, logs, entries);
                },
                "Failed to delete logs of run: " + runId);
    }

    private static StoredEntry mapEntry(ResultSet rs) throws SQLException {
        return new StoredEntry(
                rs.getLong("id"),
                new LogEntry(
                        rs.getLong("run_id"),
                        LogEntryKind.fromCode(rs.getShort("kind")),
                        rs.getInt("line_number"),
                        rs.getInt("number"),
                        getInstant(rs, "time"),
                        rs.getString("text")));
    }

    private record StoredEntry(long id, LogEntry entry) {}
}
