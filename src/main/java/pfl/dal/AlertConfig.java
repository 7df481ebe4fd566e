package pfl.dal;

import org.joda.time.LocalTime;

/**
 * Alert dispatch settings: dedup window, quiet hours and delivery pool
 * @since 14/01/2026
 */
public record AlertConfig(
        long dedupWindowMs,
        boolean quietHoursEnabled,
        LocalTime quietStart,
        LocalTime quietEnd,
        int deliveryThreads,
        int webhookTimeoutMs) {

    public static AlertConfig defaults() {
        return new AlertConfig(5 * 60_000L, false, new LocalTime(22, 0), new LocalTime(7, 0), 4, 10_000);
    }

    public void validate() throws ConfigurationException {
        if (dedupWindowMs < 0) {
            throw new ConfigurationException("Alert dedup window cannot be negative");
        }
        if (quietHoursEnabled && (quietStart == null || quietEnd == null)) {
            throw new ConfigurationException("Quiet hours need both start and end");
        }
        if (deliveryThreads < 1) {
            throw new ConfigurationException("Alert delivery needs at least one thread");
        }
        if (webhookTimeoutMs < 100) {
            throw new ConfigurationException("Webhook timeout must be at least 100ms");
        }
    }
}
