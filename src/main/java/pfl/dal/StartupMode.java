package pfl.dal;

/**
 * How strictly startup enforces service initialization
 * @author Martin Sustik <sustik@herman.cz>
 * @since 10/10/2025
 */
public enum StartupMode {
    /**
     * Database, monitor and notification services must all come up.
     * Use in production where a half-started fleet monitor is worse than none.
     */
    STRICT("All services must initialize"),

    /**
     * At least one service must come up. Printers that are unreachable at startup are retried
     * by the health sweep anyway.
     */
    LENIENT("At least one service must initialize"),

    /**
     * Always start, the web API reports what is down
     */
    PERMISSIVE("Application starts regardless of service status");

    private final String description;

    StartupMode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return name() + ": " + description;
    }
}
