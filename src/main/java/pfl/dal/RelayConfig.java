package pfl.dal;

/**
 * Cross-process event relay table retention
 * @since 15/01/2026
 */
public record RelayConfig(long ttlMs, long pruneIntervalMs) {

    public static RelayConfig defaults() {
        return new RelayConfig(60_000, 30_000);
    }

    public void validate() throws ConfigurationException {
        if (ttlMs < 1000) {
            throw new ConfigurationException("Relay TTL must be at least 1000ms");
        }
        if (pruneIntervalMs < 0) {
            throw new ConfigurationException("Relay prune interval cannot be negative");
        }
    }
}
