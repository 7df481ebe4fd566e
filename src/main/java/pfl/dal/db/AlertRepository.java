package pfl.dal.db;

import pfl.common.ESeverity;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * @since 16/01/2026
 */
public class AlertRepository extends AbstractJdbcRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, user_id, alert_type, severity, title, message, printer_id, job_id, metadata,
                   quiet_suppressed, is_read, created_at
            FROM alerts
            """;

    @Inject
    public AlertRepository(DataSource dataSource) {
        super(dataSource);
    }

    /**
     * True when an alert with the same type, printer and title was stored at or after {@code since}.
     * A null printer only matches alerts without a printer.
     */
    public boolean existsSince(String alertType, String printerId, String title, long since) {
        String sql = printerId == null
                ? "SELECT 1 FROM alerts WHERE alert_type = ? AND title = ? AND created_at >= ? AND printer_id IS NULL"
                : "SELECT 1 FROM alerts WHERE alert_type = ? AND title = ? AND created_at >= ? AND printer_id = ?";
        return withConnection("check duplicate alert", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, alertType);
                statement.setString(2, title);
                statement.setTimestamp(3, timestamp(since));
                if (printerId != null) {
                    statement.setString(4, printerId);
                }
                statement.setMaxRows(1);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    /**
     * Store all records of one dispatch. Either all of them are stored or none.
     */
    public List<AlertRecord> insertAll(List<AlertRecord> records) {
        return inTransaction("store alerts", connection -> {
            List<AlertRecord> stored = new ArrayList<>(records.size());
            try (PreparedStatement statement = connection.prepareStatement("""
                    INSERT INTO alerts (user_id, alert_type, severity, title, message, printer_id, job_id, metadata,
                                        quiet_suppressed, is_read, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, new String[]{"id"})) {
                for (AlertRecord record : records) {
                    setNullableLong(statement, 1, record.userId());
                    statement.setString(2, record.alertType());
                    statement.setString(3, record.severity().dbValue());
                    statement.setString(4, record.title());
                    statement.setString(5, record.message());
                    statement.setString(6, record.printerId());
                    setNullableLong(statement, 7, record.jobId());
                    statement.setString(8, record.metadata());
                    statement.setBoolean(9, record.quietSuppressed());
                    statement.setBoolean(10, record.read());
                    statement.setTimestamp(11, timestamp(record.createdAt()));
                    statement.executeUpdate();
                    stored.add(record.withId(generatedId(statement)));
                }
            }
            return stored;
        });
    }

    /**
     * Newest first. Includes alerts addressed to everyone.
     */
    public List<AlertRecord> findForUser(Long userId, int limit) {
        String sql = userId == null
                ? SELECT_COLUMNS + " ORDER BY created_at DESC, id DESC"
                : SELECT_COLUMNS + " WHERE user_id = ? OR user_id IS NULL ORDER BY created_at DESC, id DESC";
        return withConnection("load alerts", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                if (userId != null) {
                    statement.setLong(1, userId);
                }
                statement.setMaxRows(limit);
                return readAll(statement);
            }
        });
    }

    /**
     * Alerts whose external delivery was held back by quiet hours, oldest first
     */
    public List<AlertRecord> findQuietSuppressed(long from, long to) {
        return withConnection("load quiet-hours digest", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    SELECT_COLUMNS + " WHERE quiet_suppressed = TRUE AND created_at >= ? AND created_at < ? ORDER BY created_at, id")) {
                statement.setTimestamp(1, timestamp(from));
                statement.setTimestamp(2, timestamp(to));
                return readAll(statement);
            }
        });
    }

    public int countByType(String alertType) {
        return withConnection("count alerts", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM alerts WHERE alert_type = ?")) {
                statement.setString(1, alertType);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    private static List<AlertRecord> readAll(PreparedStatement statement) throws SQLException {
        List<AlertRecord> records = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                records.add(new AlertRecord(
                        rs.getLong("id"),
                        nullableLong(rs, "user_id"),
                        rs.getString("alert_type"),
                        ESeverity.fromDbValue(rs.getString("severity")),
                        rs.getString("title"),
                        rs.getString("message"),
                        rs.getString("printer_id"),
                        nullableLong(rs, "job_id"),
                        rs.getString("metadata"),
                        rs.getBoolean("quiet_suppressed"),
                        rs.getBoolean("is_read"),
                        millis(rs, "created_at")));
            }
        }
        return records;
    }
}
