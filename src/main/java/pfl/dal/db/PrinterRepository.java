package pfl.dal.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EPrinterState;
import pfl.common.EProtocolKind;
import pfl.dal.PrinterConfig;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Printer registry rows. Rows belong to the management side; the monitor only writes liveness,
 * last error and care counters.
 * @since 15/01/2026
 */
public class PrinterRepository extends AbstractJdbcRepository {
    private static final Logger logger = LoggerFactory.getLogger(PrinterRepository.class);

    private static final String SELECT_COLUMNS =
            "SELECT id, name, protocol, host, port, serial, access_code, api_key, enabled FROM printers";

    private static final String UPDATE_CONNECTION_SQL = """
            UPDATE printers SET name = ?, protocol = ?, host = ?, port = ?, serial = ?, access_code = ?, api_key = ?, enabled = ?
            WHERE id = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO printers (name, protocol, host, port, serial, access_code, api_key, enabled, id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    @Inject
    public PrinterRepository(DataSource dataSource) {
        super(dataSource);
    }

    /**
     * Insert or refresh a printer listed in the configuration file
     */
    public void seed(PrinterConfig config) {
        withConnection("seed printer " + config.id(), connection -> {
            try (PreparedStatement update = connection.prepareStatement(UPDATE_CONNECTION_SQL)) {
                bindConfig(update, config);
                if (update.executeUpdate() > 0) {
                    return null;
                }
            }
            try (PreparedStatement insert = connection.prepareStatement(INSERT_SQL)) {
                bindConfig(insert, config);
                insert.executeUpdate();
            }
            logger.info("Registered printer {} ({})", config.getDisplayName(), config.protocol());
            return null;
        });
    }

    private static void bindConfig(PreparedStatement statement, PrinterConfig config) throws SQLException {
        statement.setString(1, config.getDisplayName());
        statement.setString(2, config.protocol().name().toLowerCase(Locale.ROOT));
        statement.setString(3, config.host());
        statement.setInt(4, config.port());
        statement.setString(5, config.serial());
        statement.setString(6, config.accessCode());
        statement.setString(7, config.apiKey());
        statement.setBoolean(8, config.enabled());
        statement.setString(9, config.id());
    }

    /**
     * Enabled printers. Rows that cannot be turned into a valid configuration are skipped with a warning.
     */
    public List<PrinterConfig> findEnabled() {
        return withConnection("load enabled printers", connection -> {
            List<PrinterConfig> printers = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(SELECT_COLUMNS + " WHERE enabled = TRUE ORDER BY id");
                 ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    PrinterConfig config = mapConfig(rs);
                    if (config != null) {
                        printers.add(config);
                    }
                }
            }
            return printers;
        });
    }

    public Optional<PrinterConfig> findById(String printerId) {
        return withConnection("load printer " + printerId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
                statement.setString(1, printerId);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? Optional.ofNullable(mapConfig(rs)) : Optional.empty();
                }
            }
        });
    }

    private static PrinterConfig mapConfig(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        EProtocolKind protocol;
        try {
            protocol = EProtocolKind.parse(rs.getString("protocol"));
        } catch (IllegalArgumentException e) {
            logger.warn("Printer {} has unsupported protocol '{}', skipped", id, rs.getString("protocol"));
            return null;
        }
        return new PrinterConfig(
                id,
                rs.getString("name"),
                protocol,
                rs.getString("host"),
                rs.getInt("port"),
                rs.getString("serial"),
                rs.getString("access_code"),
                rs.getString("api_key"),
                rs.getBoolean("enabled"));
    }

    public void updateHeartbeat(String printerId, EPrinterState state, long seenAt) {
        withConnection("update heartbeat of " + printerId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE printers SET last_seen = ?, last_state = ? WHERE id = ?")) {
                statement.setTimestamp(1, timestamp(seenAt));
                statement.setString(2, state.name().toLowerCase(Locale.ROOT));
                statement.setString(3, printerId);
                return statement.executeUpdate();
            }
        });
    }

    public void recordError(String printerId, String errorCode, String errorMessage, long at) {
        withConnection("record error of " + printerId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE printers SET last_error_code = ?, last_error_message = ?, last_error_at = ? WHERE id = ?")) {
                statement.setString(1, errorCode);
                statement.setString(2, errorMessage);
                statement.setTimestamp(3, timestamp(at));
                statement.setString(4, printerId);
                return statement.executeUpdate();
            }
        });
    }

    public void clearError(String printerId) {
        withConnection("clear error of " + printerId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE printers SET last_error_code = NULL, last_error_message = NULL, last_error_at = NULL WHERE id = ?")) {
                statement.setString(1, printerId);
                return statement.executeUpdate();
            }
        });
    }

    /**
     * Add one finished print and its hours to the lifetime and since-maintenance counters
     */
    public void addCompletedPrint(String printerId, double hours) {
        withConnection("update care counters of " + printerId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    UPDATE printers SET
                        total_print_hours = total_print_hours + ?,
                        total_print_count = total_print_count + 1,
                        hours_since_maintenance = hours_since_maintenance + ?,
                        prints_since_maintenance = prints_since_maintenance + 1
                    WHERE id = ?
                    """)) {
                statement.setDouble(1, hours);
                statement.setDouble(2, hours);
                statement.setString(3, printerId);
                return statement.executeUpdate();
            }
        });
    }

    public Optional<CareCounters> findCareCounters(String printerId) {
        return withConnection("load care counters of " + printerId, connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT total_print_hours, total_print_count, hours_since_maintenance, prints_since_maintenance
                    FROM printers WHERE id = ?
                    """)) {
                statement.setString(1, printerId);
                try (ResultSet rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new CareCounters(printerId,
                            rs.getDouble("total_print_hours"),
                            rs.getInt("total_print_count"),
                            rs.getDouble("hours_since_maintenance"),
                            rs.getInt("prints_since_maintenance")));
                }
            }
        });
    }
}
