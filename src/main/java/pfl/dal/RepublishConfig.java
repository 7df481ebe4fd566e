package pfl.dal;

/**
 * External MQTT broker used to republish telemetry, job events and alerts
 * @since 16/01/2026
 */
public record RepublishConfig(boolean enabled, String host, int port, String username, String password,
                              String topicPrefix, boolean useTls) {

    public static RepublishConfig disabled() {
        return new RepublishConfig(false, null, 1883, null, null, "printfleet", false);
    }

    public String getServerUri() {
        return (useTls ? "ssl://" : "tcp://") + host + ":" + port;
    }

    @Override
    public String toString() {
        return String.format("RepublishConfiguration{enabled=%s, host='%s', port=%d, prefix='%s', tls=%s}",
                enabled, host, port, topicPrefix, useTls);
    }

    public void validate() throws ConfigurationException {
        if (!enabled) {
            return;
        }
        if (host == null || host.trim().isEmpty()) {
            throw new ConfigurationException("Republish host cannot be empty when republish is enabled");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Republish port must be between 1 and 65535");
        }
        if (topicPrefix == null || topicPrefix.trim().isEmpty()) {
            throw new ConfigurationException("Republish topic prefix cannot be empty");
        }
    }
}
