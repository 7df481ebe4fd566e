package pfl.dal.db;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only relay table polled by other processes with "id greater than last seen"
 * @since 16/01/2026
 */
public class EventRelayRepository extends AbstractJdbcRepository {

    @Inject
    public EventRelayRepository(DataSource dataSource) {
        super(dataSource);
    }

    public long append(String eventType, String payload, long createdAt) {
        return withConnection("append relay event", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO event_relay (event_type, payload, created_at) VALUES (?, ?, ?)", new String[]{"id"})) {
                statement.setString(1, eventType);
                statement.setString(2, payload);
                statement.setTimestamp(3, timestamp(createdAt));
                statement.executeUpdate();
                return generatedId(statement);
            }
        });
    }

    public List<RelayEntry> readSince(long lastSeenId, int limit) {
        return withConnection("read relay events", connection -> {
            List<RelayEntry> entries = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT id, event_type, payload, created_at FROM event_relay WHERE id > ? ORDER BY id")) {
                statement.setLong(1, lastSeenId);
                statement.setMaxRows(limit);
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        entries.add(new RelayEntry(rs.getLong("id"), rs.getString("event_type"),
                                rs.getString("payload"), millis(rs, "created_at")));
                    }
                }
            }
            return entries;
        });
    }

    /**
     * @return number of rows removed
     */
    public int deleteOlderThan(long cutoff) {
        return withConnection("prune relay events", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM event_relay WHERE created_at < ?")) {
                statement.setTimestamp(1, timestamp(cutoff));
                return statement.executeUpdate();
            }
        });
    }
}
