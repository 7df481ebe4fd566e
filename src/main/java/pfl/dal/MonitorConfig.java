package pfl.dal;

import pfl.common.EProtocolKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Timing of the connection supervisor and the ingestion pipeline
 * @since 13/01/2026
 */
public record MonitorConfig(
        long healthCheckIntervalMs,
        long discoveryIntervalMs,
        long reconnectDelayMs,
        long settleTimeMs,
        long pollIntervalMs,
        int maxPollFailures,
        long heartbeatWriteIntervalMs,
        double progressMinDeltaPercent,
        long progressMinIntervalMs,
        Map<EProtocolKind, Long> stalenessThresholdsMs) {

    public static MonitorConfig defaults() {
        Map<EProtocolKind, Long> staleness = new EnumMap<>(EProtocolKind.class);
        for (EProtocolKind kind : EProtocolKind.values()) {
            staleness.put(kind, kind.getDefaultStalenessMs());
        }
        return new MonitorConfig(30_000, 60_000, 10_000, 1_000, 5_000, 3, 10_000, 1.0, 5_000, staleness);
    }

    public long stalenessThresholdMs(EProtocolKind kind) {
        Long value = stalenessThresholdsMs.get(kind);
        return value != null ? value : kind.getDefaultStalenessMs();
    }

    public void validate() throws ConfigurationException {
        if (healthCheckIntervalMs < 1000) {
            throw new ConfigurationException("Health check interval must be at least 1000ms");
        }
        if (discoveryIntervalMs < 1000) {
            throw new ConfigurationException("Printer discovery interval must be at least 1000ms");
        }
        if (reconnectDelayMs < 0 || settleTimeMs < 0) {
            throw new ConfigurationException("Reconnect delay and settle time cannot be negative");
        }
        if (pollIntervalMs < 500) {
            throw new ConfigurationException("Poll interval must be at least 500ms");
        }
        if (maxPollFailures < 1) {
            throw new ConfigurationException("Max poll failures must be at least 1");
        }
        if (progressMinDeltaPercent <= 0) {
            throw new ConfigurationException("Progress delta must be positive");
        }
        for (Map.Entry<EProtocolKind, Long> entry : stalenessThresholdsMs.entrySet()) {
            if (entry.getValue() < pollIntervalMs) {
                throw new ConfigurationException("Staleness threshold for " + entry.getKey() + " is shorter than the poll interval");
            }
        }
    }
}
