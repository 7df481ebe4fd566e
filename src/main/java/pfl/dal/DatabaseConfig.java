package pfl.dal;

/**
 * JDBC connection settings for the shared pool
 * @since 13/01/2026
 */
public record DatabaseConfig(String url, String username, String password, int poolSize) {

    @Override
    public String toString() {
        return String.format("DatabaseConfiguration{url='%s', user='%s', poolSize=%d}", url, username, poolSize);
    }

    public void validate() throws ConfigurationException {
        if (url == null || !url.startsWith("jdbc:")) {
            throw new ConfigurationException("Database url must be a JDBC url");
        }
        if (poolSize < 1) {
            throw new ConfigurationException("Database pool size must be at least 1");
        }
    }
}
