package pfl.dal.db;

import pfl.domain.lifecycle.IScheduleProvider;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the scheduler's job table plus the status mutations done when a print is
 * linked or closed. Mutations take the caller's connection so they join its transaction.
 * @since 15/01/2026
 */
public class ScheduledJobRepository extends AbstractJdbcRepository implements IScheduleProvider {
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_SCHEDULED = "scheduled";
    public static final String STATUS_PRINTING = "printing";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    private static final int MAX_CANDIDATES = 10;

    @Inject
    public ScheduledJobRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    public List<ScheduledJobCandidate> findPendingCandidates(String printerId) {
        return withConnection("load schedule candidates for " + printerId, connection -> {
            List<ScheduledJobCandidate> candidates = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT id, printer_id, item_name, model_name, filename, layer_count
                    FROM scheduled_jobs
                    WHERE printer_id = ? AND status IN (?, ?)
                    ORDER BY scheduled_start, id
                    """)) {
                statement.setString(1, printerId);
                statement.setString(2, STATUS_SCHEDULED);
                statement.setString(3, STATUS_PENDING);
                statement.setMaxRows(MAX_CANDIDATES);
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(new ScheduledJobCandidate(
                                rs.getLong("id"),
                                rs.getString("printer_id"),
                                rs.getString("item_name"),
                                rs.getString("model_name"),
                                rs.getString("filename"),
                                nullableInt(rs, "layer_count")));
                    }
                }
            }
            return candidates;
        });
    }

    public String findStatus(long scheduledJobId) {
        return withConnection("load schedule status " + scheduledJobId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT status FROM scheduled_jobs WHERE id = ?")) {
                statement.setLong(1, scheduledJobId);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? rs.getString("status") : null;
                }
            }
        });
    }

    /**
     * Insert a scheduled job. Used when seeding and by tests; the scheduler owns this table.
     */
    public long insert(String printerId, String itemName, String modelName, String filename, Integer layerCount, long scheduledStart) {
        return withConnection("insert scheduled job", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    INSERT INTO scheduled_jobs (printer_id, item_name, model_name, filename, layer_count, status, scheduled_start, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """, new String[]{"id"})) {
                statement.setString(1, printerId);
                statement.setString(2, itemName);
                statement.setString(3, modelName);
                statement.setString(4, filename);
                setNullableInt(statement, 5, layerCount);
                statement.setString(6, STATUS_SCHEDULED);
                statement.setTimestamp(7, timestamp(scheduledStart));
                statement.setTimestamp(8, timestamp(scheduledStart));
                statement.executeUpdate();
                return generatedId(statement);
            }
        });
    }

    void updateStatus(Connection connection, long scheduledJobId, String status, long at) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE scheduled_jobs SET status = ?, updated_at = ? WHERE id = ?")) {
            statement.setString(1, status);
            statement.setTimestamp(2, timestamp(at));
            statement.setLong(3, scheduledJobId);
            statement.executeUpdate();
        }
    }
}
