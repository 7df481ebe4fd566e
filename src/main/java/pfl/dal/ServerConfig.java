package pfl.dal;

/**
 * Web server and process settings
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 26/09/2025
 */
public record ServerConfig(int port, String host, int threadPoolSize, StartupMode startupMode) {
    public ServerConfig(int port, String host, int threadPoolSize) {
        this(port, host, threadPoolSize, StartupMode.LENIENT);
    }

    @Override
    public String toString() {
        return String.format("ServerConfiguration{port=%d, host='%s', threads=%d, startupMode=%s}",
                port, host, threadPoolSize, startupMode);
    }

    public void validate() throws ConfigurationException {
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Server port must be between 1 and 65535");
        }
        if (host == null || host.trim().isEmpty()) {
            throw new ConfigurationException("Server host cannot be empty");
        }
        if (threadPoolSize < 2) {
            throw new ConfigurationException("Thread pool must have at least 2 threads");
        }
        if (startupMode == null) {
            throw new ConfigurationException("Startup mode cannot be null");
        }
    }
}
