package pfl.dal.db;

/**
 * Immutable history row written when a print ends
 * @since 16/01/2026
 */
public record PrintArchive(
        Long id,
        Long printJobId,
        String printerId,
        String printName,
        String status,
        long startedAt,
        long endedAt,
        long durationSeconds,
        String errorCode,
        Long scheduledJobId,
        long createdAt) {
}
