package pfl.domain.api;

import java.util.Map;

/**
 * Body of {@code GET /api/health}
 * @since 22/01/2026
 */
public class HealthCheckResponse {
    private final boolean healthy;
    private final boolean monitoring;
    private final int printers;
    private final int online;
    private final Map<String, Long> byState;
    private final Map<String, String> services;

    public HealthCheckResponse(boolean healthy, boolean monitoring, int printers, int online,
                               Map<String, Long> byState, Map<String, String> services) {
        this.healthy = healthy;
        this.monitoring = monitoring;
        this.printers = printers;
        this.online = online;
        this.byState = byState;
        this.services = services;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    public int getPrinters() {
        return printers;
    }

    public int getOnline() {
        return online;
    }

    public Map<String, Long> getByState() {
        return byState;
    }

    public Map<String, String> getServices() {
        return services;
    }
}
