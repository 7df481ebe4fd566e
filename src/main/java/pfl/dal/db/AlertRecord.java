package pfl.dal.db;

import pfl.common.ESeverity;

/**
 * Persisted in-app alert. {@code userId} is null for a record addressed to everyone.
 * @since 16/01/2026
 */
public record AlertRecord(
        Long id,
        Long userId,
        String alertType,
        ESeverity severity,
        String title,
        String message,
        String printerId,
        Long jobId,
        String metadata,
        boolean quietSuppressed,
        boolean read,
        long createdAt) {

    public AlertRecord withId(long newId) {
        return new AlertRecord(newId, userId, alertType, severity, title, message, printerId, jobId,
                metadata, quietSuppressed, read, createdAt);
    }
}
