package io.batchrun.server.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Connection handling shared by the batchrun JDBC repositories.
///
/// Each repository call borrows a pooled connection, runs its statement and turns any
/// {@link SQLException} into a {@link PersistenceException} carrying the caller's
/// context. SQL is always a {@code static final} constant and parameters are always bound through
/// a {@link StatementPreparer}, so SQL is never assembled from values.
///
/// Single statements run on their own pooled connection in auto-commit mode.
/// {@link #inTransaction} hands a {@link Transaction} to a callback and commits when the
/// callback returns, rolling back on any exception.
///
/// Timestamps travel as `timestamptz` through {@link OffsetDateTime} in UTC; intervals
/// travel as seconds.
///
/// @implNote Thread-safe. Holds no state besides the pool.
final class JdbcSupport {

    static final StatementPreparer NO_PARAMETERS = ps -> {};

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Runs a data-changing statement in auto-commit mode.
    ///
    /// @return the update count
    /// @throws PersistenceException with `errorContext` as message when the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            return new Transaction(conn).update(sql, preparer);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Maps the first row of a query, if there is one. Further rows are ignored.
    ///
    /// @throws PersistenceException with `errorContext` as message when the query fails
    <T> Optional<T> queryOne(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            return new Transaction(conn).queryOne(sql, preparer, mapper);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Maps every row of a query in result order.
    ///
    /// @throws PersistenceException with `errorContext` as message when the query fails
    <T> List<T> queryList(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            return new Transaction(conn).queryList(sql, preparer, mapper);
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Runs `work` in one database transaction.
    ///
    /// @param <T> the result type
    /// @param work the statements to run, not null
    /// @param errorContext message prefix for {@link PersistenceException}, not null
    /// @return the callback's result
    /// @throws PersistenceException if any statement or the commit fails
    <T> T inTransaction(TransactionCallback<T> work, String errorContext) {
        try (var conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.execute(new Transaction(conn));
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    static void setInstant(PreparedStatement ps, int index, Instant instant)
            throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, instant.atOffset(ZoneOffset.UTC));
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    static void setNullableInt(PreparedStatement ps, int index, Integer value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /// Seconds of an interval column selected as `EXTRACT(EPOCH FROM column)`.
    static Duration getSeconds(ResultSet rs, String column) throws SQLException {
        return Duration.ofMillis(rs.getBigDecimal(column).movePointRight(3).longValue());
    }

    /// Binds a duration for `make_interval(secs => ?)`.
    static void setSeconds(PreparedStatement ps, int index, Duration duration)
            throws SQLException {
        ps.setDouble(index, duration.toMillis() / 1000.0);
    }

    /// Statements sharing one connection.
    static final class Transaction {

        private final Connection conn;

        private Transaction(Connection conn) {
            this.conn = conn;
        }

        int update(String sql, StatementPreparer preparer) throws SQLException {
            try (var ps = conn.prepareStatement(sql)) {
                preparer.prepare(ps);
                return ps.executeUpdate();
            }
        }

        <T> Optional<T> queryOne(String sql, StatementPreparer preparer, RowMapper<T> mapper)
                throws SQLException {
            try (var ps = conn.prepareStatement(sql)) {
                preparer.prepare(ps);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
                }
            }
        }

        <T> List<T> queryList(String sql, StatementPreparer preparer, RowMapper<T> mapper)
                throws SQLException {
            try (var ps = conn.prepareStatement(sql)) {
                preparer.prepare(ps);
                try (var rs = ps.executeQuery()) {
                    List<T> rows = new ArrayList<>();
                    while (rs.next()) {
                        rows.add(mapper.map(rs));
                    }
                    return rows;
                }
            }
        }
    }

    /// Sets the `?` placeholders of a statement.
    ///
    /// {@snippet :
    /// StatementPreparer binder = ps -> {
    ///     ps.setLong(1, runId);
    ///     ps.setInt(2, pid);
    /// };
    /// }
    @FunctionalInterface
    interface StatementPreparer {

        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Reads the row the cursor is on.
    @FunctionalInterface
    interface RowMapper<T> {

        T map(ResultSet rs) throws SQLException;
    }

    /// Body of a transaction.
    ///
    /// @param <T> the result type
    @FunctionalInterface
    interface TransactionCallback<T> {

        T execute(Transaction tx) throws SQLException;
    }
}
