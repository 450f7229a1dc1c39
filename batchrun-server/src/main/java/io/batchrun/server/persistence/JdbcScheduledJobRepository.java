package io.batchrun.server.persistence;

import io.batchrun.core.command.Job;
import io.batchrun.core.command.JobCatalog;
import io.batchrun.core.schedule.ScheduledJob;
import io.batchrun.core.schedule.ScheduledJobRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed scheduled job repository.
///
/// Time zone names live in their own table and are created on first use. Deleting a
/// scheduled job cascades to its run queue items.
///
/// @implNote Rows are read first and their jobs resolved afterwards through the
/// {@link JobCatalog}, so no connection is held while another is acquired.
public class JdbcScheduledJobRepository implements ScheduledJobRepository {

    // --- SQL constants ---

    private static final String SQL_ENSURE_TIMEZONE =
            "INSERT INTO batchrun.timezones (name) VALUES (?) ON CONFLICT (name) DO NOTHING";

    private static final String SQL_SAVE =
            """
            INSERT INTO batchrun.scheduled_jobs
                (name, job_id, enabled, timezone_id,
                 years, months, days_of_month, weekdays, hours, minutes, comment)
            VALUES (?, ?, ?, (SELECT id FROM batchrun.timezones WHERE name = ?),
                    ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (name)
            DO UPDATE SET
                job_id        = EXCLUDED.job_id,
                enabled       = EXCLUDED.enabled,
                timezone_id   = EXCLUDED.timezone_id,
                years         = EXCLUDED.years,
                months        = EXCLUDED.months,
                days_of_month = EXCLUDED.days_of_month,
                weekdays      = EXCLUDED.weekdays,
                hours         = EXCLUDED.hours,
                minutes       = EXCLUDED.minutes,
                comment       = EXCLUDED.comment
            RETURNING id
            """;

    private static final String SQL_SELECT =
            """
            SELECT s.id, s.name, s.job_id, s.enabled, t.name AS timezone,
                   s.years, s.months, s.days_of_month, s.weekdays, s.hours, s.minutes, s.comment
            FROM batchrun.scheduled_jobs s
            JOIN batchrun.timezones t ON t.id = s.timezone_id
            """;

    private static final String SQL_FIND_BY_ID = SQL_SELECT + "WHERE s.id = ?";

    private static final String SQL_FIND_BY_NAME = SQL_SELECT + "WHERE s.name = ?";

    private static final String SQL_FIND_ALL = SQL_SELECT + "ORDER BY s.id";

    private static final String SQL_DELETE = "DELETE FROM batchrun.scheduled_jobs WHERE id = ?";

    // --- Fields ---

    private final JdbcSupport jdbc;
    private final JobCatalog catalog;

    public JdbcScheduledJobRepository(DataSource dataSource, JobCatalog catalog) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    @Override
    public ScheduledJob save(ScheduledJob scheduledJob) {
        Objects.requireNonNull(scheduledJob, "scheduledJob must not be null");
        long id =
                jdbc.inTransaction(
                        tx -> {
                            tx.update(
                                    SQL_ENSURE_TIMEZONE,
                                    ps -> ps.setString(1, scheduledJob.timezone()));
                            return tx.queryOne(
                                            SQL_SAVE,
                                            ps -> {
                                                ps.setString(1, scheduledJob.name());
                                                ps.setLong(2, scheduledJob.job().id());
                                                ps.setBoolean(3, scheduledJob.enabled());
                                                ps.setString(4, scheduledJob.timezone());
                                                ps.setString(5, scheduledJob.years());
                                                ps.setString(6, scheduledJob.months());
                                                ps.setString(7, scheduledJob.daysOfMonth());
                                                ps.setString(8, scheduledJob.weekdays());
                                                ps.setString(9, scheduledJob.hours());
                                                ps.setString(10, scheduledJob.minutes());
                                                ps.setString(11, scheduledJob.comment());
                                            },
                                            rs -> rs.getLong("id"))
                                    .orElseThrow();
                        },
                        "Failed to save scheduled job: " + scheduledJob.name());
        return scheduledJob.withId(id);
    }

    @Override
    public Optional<ScheduledJob> findById(long id) {
        return jdbc.queryOne(
                        SQL_FIND_BY_ID,
                        ps -> ps.setLong(1, id),
                        Row::map,
                        "Failed to find scheduled job: " + id)
                .map(this::resolve);
    }

    @Override
    public Optional<ScheduledJob> findByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return jdbc.queryOne(
                        SQL_FIND_BY_NAME,
                        ps -> ps.setString(1, name),
                        Row::map,
                        "Failed to find scheduled job: " + name)
                .map(this::resolve);
    }

    @Override
    public List<ScheduledJob> findAll() {
        List<Row> rows =
                jdbc.queryList(
                        SQL_FIND_ALL,
                        JdbcSupport.NO_PARAMETERS,
                        Row::map,
                        "Failed to list scheduled jobs");
        List<ScheduledJob> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            result.add(resolve(row));
        }
        return result;
    }

    @Override
    public boolean delete(long id) {
        int deleted =
                jdbc.update(
                        SQL_DELETE,
                        ps -> ps.setLong(1, id),
                        "Failed to delete scheduled job: " + id);
        return deleted > 0;
    }

    private ScheduledJob resolve(Row row) {
        Job job =
                catalog.findJob(row.jobId())
                        .orElseThrow(
                                () ->
                                        new PersistenceException(
                                                "Job " + row.jobId() + " of scheduled job "
                                                        + row.name() + " not found",
                                                null));
        return new ScheduledJob(
                row.id(),
                row.name(),
                job,
                row.enabled(),
                row.timezone(),
                row.years(),
                row.months(),
                row.daysOfMonth(),
                row.weekdays(),
                row.hours(),
                row.minutes(),
                row.comment());
    }

    private record Row(
            long id,
            String name,
            long jobId,
            boolean enabled,
            String timezone,
            String years,
            String months,
            String daysOfMonth,
            String weekdays,
            String hours,
            String minutes,
            String comment) {

        static Row map(ResultSet rs) throws SQLException {
            return new Row(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getLong("job_id"),
                    rs.getBoolean("enabled"),
                    rs.getString("timezone"),
                    rs.getString("years"),
                    rs.getString("months"),
                    rs.getString("days_of_month"),
                    rs.getString("weekdays"),
                    rs.getString("hours"),
                    rs.getString("minutes"),
                    rs.getString("comment"));
        }
    }
}
