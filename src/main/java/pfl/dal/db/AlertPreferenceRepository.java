package pfl.dal.db;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Users and their per-alert-type channel preferences
 * @since 16/01/2026
 */
public class AlertPreferenceRepository extends AbstractJdbcRepository {

    @Inject
    public AlertPreferenceRepository(DataSource dataSource) {
        super(dataSource);
    }

    public List<UserAccount> findActiveUsers() {
        return withConnection("load active users", connection -> {
            List<UserAccount> users = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT id, username, email FROM users WHERE is_active = TRUE ORDER BY id");
                 ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    users.add(new UserAccount(rs.getLong("id"), rs.getString("username"), rs.getString("email")));
                }
            }
            return users;
        });
    }

    /**
     * Preferences of active users for one alert type
     */
    public List<AlertPreference> findForType(String alertType) {
        return withConnection("load alert preferences", connection -> {
            List<AlertPreference> preferences = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT p.user_id, p.alert_type, p.in_app, p.email, p.push
                    FROM alert_preferences p
                    JOIN users u ON u.id = p.user_id
                    WHERE p.alert_type = ? AND u.is_active = TRUE
                    ORDER BY p.user_id
                    """)) {
                statement.setString(1, alertType);
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        preferences.add(new AlertPreference(
                                rs.getLong("user_id"),
                                rs.getString("alert_type"),
                                rs.getBoolean("in_app"),
                                rs.getBoolean("email"),
                                rs.getBoolean("push")));
                    }
                }
            }
            return preferences;
        });
    }

    public long insertUser(String username, String email) {
        return withConnection("insert user", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO users (username, email, is_active) VALUES (?, ?, TRUE)", new String[]{"id"})) {
                statement.setString(1, username);
                statement.setString(2, email);
                statement.executeUpdate();
                return generatedId(statement);
            }
        });
    }

    public void savePreference(AlertPreference preference) {
        inTransaction("save alert preference", connection -> {
            try (PreparedStatement delete = connection.prepareStatement(
                    "DELETE FROM alert_preferences WHERE user_id = ? AND alert_type = ?")) {
                delete.setLong(1, preference.userId());
                delete.setString(2, preference.alertType());
                delete.executeUpdate();
            }
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO alert_preferences (user_id, alert_type, in_app, email, push) VALUES (?, ?, ?, ?, ?)")) {
                insert.setLong(1, preference.userId());
                insert.setString(2, preference.alertType());
                insert.setBoolean(3, preference.inApp());
                insert.setBoolean(4, preference.email());
                insert.setBoolean(5, preference.push());
                return insert.executeUpdate();
            }
        });
    }
}
