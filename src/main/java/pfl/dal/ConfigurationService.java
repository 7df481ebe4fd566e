package pfl.dal;

import org.joda.time.LocalTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EProtocolKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Main configuration service - entry point for all configuration needs
 * @author Martin Sustik <sustik@herman.cz>
 * @since 26/09/2025
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationLoader loader;
    private ServerConfig serverConfig;
    private DatabaseConfig databaseConfig;
    private MonitorConfig monitorConfig;
    private AlertConfig alertConfig;
    private RelayConfig relayConfig;
    private RepublishConfig republishConfig;
    private List<PrinterConfig> printerConfigs;

    public ConfigurationService() throws ConfigurationException {
        this(new ConfigurationLoader());
    }

    public ConfigurationService(ConfigurationLoader loader) throws ConfigurationException {
        this.loader = loader;
        loadAll();
    }

    private void loadAll() throws ConfigurationException {
        this.serverConfig = loadServerConfiguration();
        this.databaseConfig = loadDatabaseConfiguration();
        this.monitorConfig = loadMonitorConfiguration();
        this.alertConfig = loadAlertConfiguration();
        this.relayConfig = loadRelayConfiguration();
        this.republishConfig = loadRepublishConfiguration();
        this.printerConfigs = loadPrinterConfigurations();
    }

    private ServerConfig loadServerConfiguration() throws ConfigurationException {
        int port = loader.getInt("server.port", 8090);
        String host = loader.getString("server.host", "0.0.0.0");
        int threadPoolSize = loader.getInt("server.thread.pool", 4);

        String modeStr = loader.getString("server.startup.mode", "LENIENT");
        StartupMode startupMode;
        try {
            startupMode = StartupMode.valueOf(modeStr.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid startup mode '{}', using LENIENT", modeStr);
            startupMode = StartupMode.LENIENT;
        }

        ServerConfig config = new ServerConfig(port, host, threadPoolSize, startupMode);
        config.validate();
        return config;
    }

    private DatabaseConfig loadDatabaseConfiguration() throws ConfigurationException {
        DatabaseConfig config = new DatabaseConfig(
                loader.getString("db.url", "jdbc:h2:./data/printfleet;MODE=PostgreSQL;DATABASE_TO_UPPER=false"),
                loader.getString("db.user", "sa"),
                loader.getString("db.password", ""),
                loader.getInt("db.pool.size", 8));
        config.validate();
        return config;
    }

    private MonitorConfig loadMonitorConfiguration() throws ConfigurationException {
        MonitorConfig defaults = MonitorConfig.defaults();

        Map<EProtocolKind, Long> staleness = new EnumMap<>(EProtocolKind.class);
        for (EProtocolKind kind : EProtocolKind.values()) {
            String key = "monitor.staleness." + kind.name().toLowerCase(Locale.ROOT) + ".ms";
            staleness.put(kind, loader.getLong(key, kind.getDefaultStalenessMs()));
        }

        MonitorConfig config = new MonitorConfig(
                loader.getLong("monitor.health.interval.ms", defaults.healthCheckIntervalMs()),
                loader.getLong("monitor.discovery.interval.ms", defaults.discoveryIntervalMs()),
                loader.getLong("monitor.reconnect.delay.ms", defaults.reconnectDelayMs()),
                loader.getLong("monitor.settle.ms", defaults.settleTimeMs()),
                loader.getLong("monitor.poll.interval.ms", defaults.pollIntervalMs()),
                loader.getInt("monitor.poll.max-failures", defaults.maxPollFailures()),
                loader.getLong("monitor.heartbeat.write.interval.ms", defaults.heartbeatWriteIntervalMs()),
                loader.getDouble("lifecycle.progress.min-delta", defaults.progressMinDeltaPercent()),
                loader.getLong("lifecycle.progress.min-interval.ms", defaults.progressMinIntervalMs()),
                staleness);
        config.validate();
        return config;
    }

    private AlertConfig loadAlertConfiguration() throws ConfigurationException {
        AlertConfig defaults = AlertConfig.defaults();
        AlertConfig config = new AlertConfig(
                loader.getLong("alerts.dedup.window.ms", defaults.dedupWindowMs()),
                loader.getBoolean("alerts.quiet.enabled", defaults.quietHoursEnabled()),
                parseTime("alerts.quiet.start", defaults.quietStart()),
                parseTime("alerts.quiet.end", defaults.quietEnd()),
                loader.getInt("alerts.delivery.threads", defaults.deliveryThreads()),
                loader.getInt("alerts.webhook.timeout.ms", defaults.webhookTimeoutMs()));
        config.validate();
        return config;
    }

    private LocalTime parseTime(String key, LocalTime defaultValue) throws ConfigurationException {
        String value = loader.getString(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid time '" + value + "' for '" + key + "', expected HH:mm", e);
        }
    }

    private RelayConfig loadRelayConfiguration() throws ConfigurationException {
        RelayConfig defaults = RelayConfig.defaults();
        RelayConfig config = new RelayConfig(
                loader.getLong("relay.ttl.ms", defaults.ttlMs()),
                loader.getLong("relay.prune.interval.ms", defaults.pruneIntervalMs()));
        config.validate();
        return config;
    }

    private RepublishConfig loadRepublishConfiguration() throws ConfigurationException {
        RepublishConfig config = new RepublishConfig(
                loader.getBoolean("republish.enabled", false),
                loader.getString("republish.host", null),
                loader.getInt("republish.port", 1883),
                loader.getString("republish.user", null),
                loader.getString("republish.password", null),
                loader.getString("republish.topic.prefix", "printfleet"),
                loader.getBoolean("republish.tls", false));
        config.validate();
        return config;
    }

    /**
     * Printers listed as {@code printers.<n>.*}. They are seeded into the printer table at startup;
     * printers added later directly to the table are picked up by the discovery sweep.
     */
    private List<PrinterConfig> loadPrinterConfigurations() throws ConfigurationException {
        List<PrinterConfig> configs = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int index : loader.getIndexes("printers")) {
            String prefix = "printers." + index + ".";
            String protocolStr = loader.getRequiredString(prefix + "protocol");
            EProtocolKind protocol;
            try {
                protocol = EProtocolKind.parse(protocolStr);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unsupported protocol '" + protocolStr + "' for " + prefix + "protocol", e);
            }

            String id = loader.getString(prefix + "id", "printer-" + index);
            PrinterConfig config = new PrinterConfig(
                    id,
                    loader.getString(prefix + "name", id),
                    protocol,
                    loader.getString(prefix + "host", null),
                    loader.getInt(prefix + "port", protocol.getDefaultPort()),
                    loader.getString(prefix + "serial", null),
                    loader.getString(prefix + "access-code", null),
                    loader.getString(prefix + "api-key", null),
                    loader.getBoolean(prefix + "enabled", true));
            config.validate();

            if (!ids.add(config.id())) {
                throw new ConfigurationException("Duplicate printer id '" + config.id() + "'");
            }
            configs.add(config);
            logger.info("Configured {} printer: {} at {}:{}", protocol, config.getDisplayName(), config.host(), config.port());
        }
        return Collections.unmodifiableList(configs);
    }

    /**
     * Location of the print-stopping error list, null for the bundled one
     */
    public String getStoppingErrorsFile() {
        return loader.getString("lifecycle.stopping-errors.file", null);
    }

    public ServerConfig getServerConfiguration() {
        return serverConfig;
    }

    public DatabaseConfig getDatabaseConfiguration() {
        return databaseConfig;
    }

    public MonitorConfig getMonitorConfiguration() {
        return monitorConfig;
    }

    public AlertConfig getAlertConfiguration() {
        return alertConfig;
    }

    public RelayConfig getRelayConfiguration() {
        return relayConfig;
    }

    public RepublishConfig getRepublishConfiguration() {
        return republishConfig;
    }

    public List<PrinterConfig> getPrinterConfigurations() {
        return printerConfigs;
    }

    public void reload() throws ConfigurationException {
        logger.info("Reloading configuration...");
        loader.reload();
        loadAll();

        logger.info("Configuration reloaded successfully");
        logger.info("Server: {}", serverConfig);
        logger.info("Database: {}", databaseConfig);
        logger.info("Printers: {}", printerConfigs.size());
    }
}
