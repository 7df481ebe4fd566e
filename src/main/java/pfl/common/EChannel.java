package pfl.common;

/**
 * Notification channels an alert can be routed to
 * @since 14/01/2026
 */
public enum EChannel {
    IN_APP,
    EMAIL,
    PUSH,
    WEBHOOK
}
