package pfl.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loads configuration with priority:
 * 1. System Properties
 * 2. Environment Variables (dots become underscores, upper case)
 * 3. External config/application.properties (next to the JAR or via -Dconfig.dir)
 * 4. Classpath application.properties
 *
 * <pre>-Dconfig.dir=/etc/printfleet</pre>
 *
 * @author Martin Sustik <sustik@herman.cz>
 * @since 26/09/2025
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_FILE = "application.properties";

    private static final String[] EXTERNAL_CONFIG_PATHS = {
            "config/application.properties",
            "../config/application.properties"
    };

    private final String configFile;
    private final Properties properties;

    public ConfigurationLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    public ConfigurationLoader(String configFile) {
        this.configFile = configFile;
        this.properties = loadProperties(configFile);
    }

    /**
     * Absolute file wins outright. Otherwise the external file is layered over the classpath defaults.
     */
    private Properties loadProperties(String configFile) {
        Properties props = new Properties();

        Path configPath = Paths.get(configFile);
        if (configPath.isAbsolute() && Files.isRegularFile(configPath)) {
            if (loadInto(props, configPath)) {
                logger.info("Loaded configuration from absolute path: {}", configPath);
                return props;
            }
        }

        Properties externalProps = loadFromExternalLocations();
        props.putAll(externalProps);

        Properties classpathProps = loadFromClasspath(configFile);
        for (String key : classpathProps.stringPropertyNames()) {
            props.putIfAbsent(key, classpathProps.getProperty(key));
        }

        if (!externalProps.isEmpty()) {
            logger.info("Loaded external configuration ({} keys), classpath values used as defaults", externalProps.size());
        } else if (!classpathProps.isEmpty()) {
            logger.info("Loaded configuration from classpath '{}'", configFile);
        } else {
            logger.warn("No configuration file found, using built-in defaults only");
        }
        return props;
    }

    private Properties loadFromExternalLocations() {
        Properties props = new Properties();

        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            Path explicit = Paths.get(configDir, DEFAULT_CONFIG_FILE).normalize();
            if (Files.isRegularFile(explicit) && loadInto(props, explicit)) {
                logger.info("Loaded external configuration from explicit config directory: {}", explicit.toAbsolutePath());
                return props;
            }
            logger.warn("Config directory specified but file not found: {}", explicit.toAbsolutePath());
        }

        String jarDir = getJarDirectory();
        String separator = System.getProperty("file.separator");
        if (jarDir.contains("target" + separator + "classes") || jarDir.contains("target" + separator + "test-classes")) {
            logger.debug("Running from a build directory, skipping external config auto-detection");
            return props;
        }

        for (String relativePath : EXTERNAL_CONFIG_PATHS) {
            Path candidate = Paths.get(jarDir, relativePath).normalize();
            if (Files.isRegularFile(candidate) && loadInto(props, candidate)) {
                logger.info("Loaded external configuration from: {}", candidate.toAbsolutePath());
                return props;
            }
            logger.trace("External config not found at: {}", candidate.toAbsolutePath());
        }
        return props;
    }

    private boolean loadInto(Properties props, Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            props.load(input);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to load configuration from '{}': {}", path, e.getMessage());
            return false;
        }
    }

    private Properties loadFromClasspath(String configFile) {
        Properties props = new Properties();
        String[] locations = {configFile, "config/" + configFile};

        for (String location : locations) {
            try (InputStream input = getClass().getClassLoader().getResourceAsStream(location)) {
                if (input != null) {
                    props.load(input);
                    logger.debug("Loaded classpath configuration from '{}'", location);
                    return props;
                }
            } catch (IOException e) {
                logger.debug("Error loading configuration from classpath '{}': {}", location, e.getMessage());
            }
        }
        return props;
    }

    private String getJarDirectory() {
        try {
            Path path = Paths.get(getClass().getProtectionDomain().getCodeSource().getLocation().toURI());
            if (path.toString().endsWith(".jar")) {
                return path.getParent().toString();
            }
            return path.toString();
        } catch (Exception e) {
            logger.warn("Could not determine JAR directory: {}", e.getMessage());
            return System.getProperty("user.dir");
        }
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from System Properties", key);
            return value;
        }

        String envKey = key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from Environment Variable '{}'", key, envKey);
            return value;
        }

        value = properties.getProperty(key);
        if (value != null) {
            return value;
        }

        logger.debug("Property '{}' not found, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid decimal value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public String getRequiredString(String key) throws ConfigurationException {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Required property '" + key + "' is not configured");
        }
        return value;
    }

    /**
     * Distinct indexes of list-style keys, e.g. {@code printers.0.host, printers.1.host -> [0, 1]}.
     * File properties and system properties are both scanned.
     */
    public Set<Integer> getIndexes(String prefix) {
        Set<Integer> indexes = new TreeSet<>();
        String keyPrefix = prefix + ".";
        Set<String> names = new TreeSet<>(properties.stringPropertyNames());
        names.addAll(System.getProperties().stringPropertyNames());

        for (String name : names) {
            if (!name.startsWith(keyPrefix)) {
                continue;
            }
            String rest = name.substring(keyPrefix.length());
            int dot = rest.indexOf('.');
            if (dot <= 0) {
                continue;
            }
            try {
                indexes.add(Integer.parseInt(rest.substring(0, dot)));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring property '{}': '{}' is not a list index", name, rest.substring(0, dot));
            }
        }
        return indexes;
    }

    public void reload() {
        Properties newProps = loadProperties(configFile);
        properties.clear();
        properties.putAll(newProps);
        logger.info("Configuration reloaded");
    }
}
