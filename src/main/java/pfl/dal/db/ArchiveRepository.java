package pfl.dal.db;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * @since 16/01/2026
 */
public class ArchiveRepository extends AbstractJdbcRepository {

    @Inject
    public ArchiveRepository(DataSource dataSource) {
        super(dataSource);
    }

    public long insert(PrintArchive archive) {
        return withConnection("archive print " + archive.printJobId(), connection -> {
            try (PreparedStatement statement = connection.prepareStatement("""
                    INSERT INTO print_archives (print_job_id, printer_id, print_name, status, started_at, ended_at,
                                                duration_seconds, error_code, scheduled_job_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, new String[]{"id"})) {
                setNullableLong(statement, 1, archive.printJobId());
                statement.setString(2, archive.printerId());
                statement.setString(3, archive.printName());
                statement.setString(4, archive.status());
                statement.setTimestamp(5, timestamp(archive.startedAt()));
                statement.setTimestamp(6, timestamp(archive.endedAt()));
                statement.setLong(7, archive.durationSeconds());
                statement.setString(8, archive.errorCode());
                setNullableLong(statement, 9, archive.scheduledJobId());
                statement.setTimestamp(10, timestamp(archive.createdAt()));
                statement.executeUpdate();
                return generatedId(statement);
            }
        });
    }

    public List<PrintArchive> findByPrinter(String printerId) {
        return withConnection("load archive of " + printerId, connection -> {
            List<PrintArchive> archives = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement("""
                    SELECT id, print_job_id, printer_id, print_name, status, started_at, ended_at, duration_seconds,
                           error_code, scheduled_job_id, created_at
                    FROM print_archives WHERE printer_id = ? ORDER BY id
                    """)) {
                statement.setString(1, printerId);
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        archives.add(new PrintArchive(
                                rs.getLong("id"),
                                nullableLong(rs, "print_job_id"),
                                rs.getString("printer_id"),
                                rs.getString("print_name"),
                                rs.getString("status"),
                                millis(rs, "started_at"),
                                millis(rs, "ended_at"),
                                rs.getLong("duration_seconds"),
                                rs.getString("error_code"),
                                nullableLong(rs, "scheduled_job_id"),
                                millis(rs, "created_at")));
                    }
                }
            }
            return archives;
        });
    }
}
