package pfl.dal.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EJobStatus;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Print job records. A printer has at most one record with {@code ended_at} unset: opening a job
 * first closes any stale open record, and closing a linked job moves its schedule row in the
 * same transaction.
 * @since 15/01/2026
 */
public class PrintJobRepository extends AbstractJdbcRepository {
    private static final Logger logger = LoggerFactory.getLogger(PrintJobRepository.class);

    public static final String REASON_SUPERSEDED = "superseded";

    private static final String SELECT_COLUMNS = """
            SELECT id, printer_id, job_name, started_at, ended_at, status, scheduled_job_id,
                   total_layers, progress_percent, error_code, duration_seconds
            FROM print_jobs
            """;

    private static final String CLOSE_SQL = """
            UPDATE print_jobs SET ended_at = ?, status = ?, error_code = ?, duration_seconds = ?,
                   progress_percent = COALESCE(?, progress_percent)
            WHERE id = ? AND ended_at IS NULL
            """;

    private final ScheduledJobRepository scheduledJobRepository;

    @Inject
    public PrintJobRepository(DataSource dataSource, ScheduledJobRepository scheduledJobRepository) {
        super(dataSource);
        this.scheduledJobRepository = scheduledJobRepository;
    }

    /**
     * Open a running job. Stale open records of the printer are closed as cancelled first and a
     * linked schedule row moves to printing, all in one transaction.
     */
    public PrintJobRecord openJob(String printerId, String jobName, Integer totalLayers, Long scheduledJobId, long startedAt) {
        return inTransaction("open job on " + printerId, connection -> {
            for (PrintJobRecord stale : findOpen(connection, printerId)) {
                close(connection, stale, EJobStatus.CANCELLED, startedAt, REASON_SUPERSEDED, null);
                logger.warn("[{}] Closed stale open job {} ('{}') before starting a new one", printerId, stale.id(), stale.jobName());
            }

            long id;
            try (PreparedStatement statement = connection.prepareStatement("""
                    INSERT INTO print_jobs (printer_id, job_name, started_at, status, scheduled_job_id, total_layers, progress_percent)
                    VALUES (?, ?, ?, ?, ?, ?, 0)
                    """, new String[]{"id"})) {
                statement.setString(1, printerId);
                statement.setString(2, jobName);
                statement.setTimestamp(3, timestamp(startedAt));
                statement.setString(4, EJobStatus.RUNNING.dbValue());
                setNullableLong(statement, 5, scheduledJobId);
                setNullableInt(statement, 6, totalLayers);
                statement.executeUpdate();
                id = generatedId(statement);
            }

            if (scheduledJobId != null) {
                scheduledJobRepository.updateStatus(connection, scheduledJobId, ScheduledJobRepository.STATUS_PRINTING, startedAt);
            }
            return new PrintJobRecord(id, printerId, jobName, startedAt, null, EJobStatus.RUNNING,
                    scheduledJobId, totalLayers, 0.0, null, null);
        });
    }

    /**
     * Close the open job of a printer and move its linked schedule row. Nothing is written when
     * the printer has no open job.
     *
     * @param progressPercent last known progress, null keeps the stored value
     * @return the closed record, empty when there was no open job
     */
    public Optional<PrintJobRecord> closeOpenJob(String printerId, EJobStatus status, long endedAt,
                                                 String errorCode, Double progressPercent) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Cannot close a job as " + status);
        }
        return inTransaction("close job on " + printerId, connection -> {
            List<PrintJobRecord> open = findOpen(connection, printerId);
            if (open.isEmpty()) {
                return Optional.empty();
            }
            PrintJobRecord closed = null;
            for (PrintJobRecord record : open) {
                closed = close(connection, record, status, endedAt, errorCode, progressPercent);
            }
            return Optional.of(closed);
        });
    }

    private PrintJobRecord close(Connection connection, PrintJobRecord record, EJobStatus status, long endedAt,
                                 String errorCode, Double progressPercent) throws SQLException {
        long durationSeconds = Math.max(0, (endedAt - record.startedAt()) / 1000);
        try (PreparedStatement statement = connection.prepareStatement(CLOSE_SQL)) {
            statement.setTimestamp(1, timestamp(endedAt));
            statement.setString(2, status.dbValue());
            statement.setString(3, errorCode);
            statement.setLong(4, durationSeconds);
            if (progressPercent == null) {
                statement.setNull(5, Types.DOUBLE);
            } else {
                statement.setDouble(5, progressPercent);
            }
            statement.setLong(6, record.id());
            statement.executeUpdate();
        }

        if (record.isLinked()) {
            scheduledJobRepository.updateStatus(connection, record.scheduledJobId(), scheduleStatusFor(status), endedAt);
        }
        return new PrintJobRecord(record.id(), record.printerId(), record.jobName(), record.startedAt(), endedAt,
                status, record.scheduledJobId(), record.totalLayers(),
                progressPercent != null ? progressPercent : record.progressPercent(), errorCode, durationSeconds);
    }

    /**
     * Cancelled prints hand the scheduled job back to the queue
     */
    static String scheduleStatusFor(EJobStatus status) {
        return switch (status) {
            case COMPLETED -> ScheduledJobRepository.STATUS_COMPLETED;
            case FAILED -> ScheduledJobRepository.STATUS_FAILED;
            case CANCELLED -> ScheduledJobRepository.STATUS_SCHEDULED;
            case RUNNING -> throw new IllegalArgumentException("No schedule status for " + status);
        };
    }

    public void updateProgress(long jobId, double progressPercent, int currentLayer) {
        withConnection("update progress of job " + jobId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE print_jobs SET progress_percent = ?, current_layer = ? WHERE id = ? AND ended_at IS NULL")) {
                statement.setDouble(1, progressPercent);
                statement.setInt(2, currentLayer);
                statement.setLong(3, jobId);
                return statement.executeUpdate();
            }
        });
    }

    public Optional<PrintJobRecord> findOpenJob(String printerId) {
        return withConnection("load open job of " + printerId, connection -> {
            List<PrintJobRecord> open = findOpen(connection, printerId);
            return open.isEmpty() ? Optional.empty() : Optional.of(open.get(open.size() - 1));
        });
    }

    public Optional<PrintJobRecord> findById(long jobId) {
        return withConnection("load job " + jobId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
                statement.setLong(1, jobId);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public int countOpenJobs(String printerId) {
        return withConnection("count open jobs of " + printerId, connection -> findOpen(connection, printerId).size());
    }

    private List<PrintJobRecord> findOpen(Connection connection, String printerId) throws SQLException {
        List<PrintJobRecord> records = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(
                SELECT_COLUMNS + " WHERE printer_id = ? AND ended_at IS NULL ORDER BY id")) {
            statement.setString(1, printerId);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    records.add(map(rs));
                }
            }
        }
        return records;
    }

    private static PrintJobRecord map(ResultSet rs) throws SQLException {
        long endedAt = millis(rs, "ended_at");
        double progress = rs.getDouble("progress_percent");
        Double progressPercent = rs.wasNull() ? null : progress;
        return new PrintJobRecord(
                rs.getLong("id"),
                rs.getString("printer_id"),
                rs.getString("job_name"),
                millis(rs, "started_at"),
                endedAt == 0 ? null : endedAt,
                EJobStatus.fromDbValue(rs.getString("status")),
                nullableLong(rs, "scheduled_job_id"),
                nullableInt(rs, "total_layers"),
                progressPercent,
                rs.getString("error_code"),
                nullableLong(rs, "duration_seconds"));
    }
}
