package pfl.dal.db;

/**
 * @since 16/01/2026
 */
public record RelayEntry(long id, String eventType, String payload, long createdAt) {
}
