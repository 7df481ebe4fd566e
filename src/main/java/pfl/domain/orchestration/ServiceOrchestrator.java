package pfl.domain.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.dal.PrinterConfig;
import pfl.dal.StartupMode;
import pfl.dal.db.PrinterRepository;
import pfl.dal.db.SchemaInitializer;
import pfl.dal.db.WebhookRepository;
import pfl.domain.ServiceInitializationResult;
import pfl.domain.StartupException;
import pfl.domain.alert.AlertDispatcher;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;
import pfl.domain.monitor.FleetMonitorService;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Orchestrates service initialization and monitoring
 * @author Martin Sustik <sustik@herman.cz>
 * @since 19/11/2025
 */
public class ServiceOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ServiceOrchestrator.class);

    private final SchemaInitializer schemaInitializer;
    private final PrinterRepository printerRepository;
    private final List<PrinterConfig> configuredPrinters;
    private final WebhookRepository webhookRepository;
    private final AlertDispatcher alertDispatcher;
    private final IEventBus eventBus;
    private final Collection<IEventConsumer> consumers;
    private final FleetMonitorService fleetMonitor;

    private final Map<String, ServiceInitializationResult> initializationResults = new LinkedHashMap<>();

    public ServiceOrchestrator(
            SchemaInitializer schemaInitializer,
            PrinterRepository printerRepository,
            List<PrinterConfig> configuredPrinters,
            WebhookRepository webhookRepository,
            AlertDispatcher alertDispatcher,
            IEventBus eventBus,
            Collection<IEventConsumer> consumers,
            FleetMonitorService fleetMonitor) {
        this.schemaInitializer = schemaInitializer;
        this.printerRepository = printerRepository;
        this.configuredPrinters = configuredPrinters;
        this.webhookRepository = webhookRepository;
        this.alertDispatcher = alertDispatcher;
        this.eventBus = eventBus;
        this.consumers = consumers;
        this.fleetMonitor = fleetMonitor;
    }

    /**
     * Initialize all services and track results. Consumers and monitoring depend on the database,
     * they are reported failed without being attempted when it is down.
     * @return List of initialization results
     */
    public List<ServiceInitializationResult> initializeAllServices() {
        List<ServiceInitializationResult> results = new ArrayList<>();

        ServiceInitializationResult databaseResult = initializeDatabase();
        results.add(databaseResult);
        initializationResults.put("database", databaseResult);

        ServiceInitializationResult consumerResult = databaseResult.isSuccess()
                ? initializeEventConsumers()
                : ServiceInitializationResult.failure("Event consumers", "database unavailable", 0);
        results.add(consumerResult);
        initializationResults.put("consumers", consumerResult);

        ServiceInitializationResult alertResult = databaseResult.isSuccess()
                ? initializeNotifications()
                : ServiceInitializationResult.failure("Notifications", "database unavailable", 0);
        results.add(alertResult);
        initializationResults.put("alerts", alertResult);

        ServiceInitializationResult monitorResult = databaseResult.isSuccess()
                ? initializeFleetMonitor()
                : ServiceInitializationResult.failure("Fleet monitor", "database unavailable", 0);
        results.add(monitorResult);
        initializationResults.put("monitor", monitorResult);

        return results;
    }

    /**
     * Create the schema and seed the configured printers into the registry
     */
    private ServiceInitializationResult initializeDatabase() {
        logger.info("Initializing database...");
        long startTime = System.currentTimeMillis();

        try {
            schemaInitializer.initialize();
            for (PrinterConfig printer : configuredPrinters) {
                printerRepository.seed(printer);
            }
            long duration = System.currentTimeMillis() - startTime;
            logger.info("✓ Database initialized in {}ms, {} configured printer(s) seeded", duration, configuredPrinters.size());
            return ServiceInitializationResult.success("Database", configuredPrinters.size() + " printer(s) seeded", duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Database initialization failed after {}ms: {}", duration, e.getMessage());
            logger.debug("Database initialization error details", e);
            return ServiceInitializationResult.failure("Database", e, duration);
        }
    }

    private ServiceInitializationResult initializeEventConsumers() {
        logger.info("Registering event consumers...");
        long startTime = System.currentTimeMillis();

        try {
            for (IEventConsumer consumer : consumers) {
                consumer.register(eventBus);
            }
            long duration = System.currentTimeMillis() - startTime;
            logger.info("✓ {} event consumer(s) registered in {}ms", consumers.size(), duration);
            return ServiceInitializationResult.success("Event consumers", consumers.size() + " registered", duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Event consumer registration failed after {}ms: {}", duration, e.getMessage());
            logger.debug("Event consumer error details", e);
            return ServiceInitializationResult.failure("Event consumers", e, duration);
        }
    }

    private ServiceInitializationResult initializeNotifications() {
        logger.info("Initializing notifications...");
        long startTime = System.currentTimeMillis();

        try {
            int webhooks = webhookRepository.findEnabled().size();
            long duration = System.currentTimeMillis() - startTime;
            if (alertDispatcher.getQuietHours().isEnabled()) {
                logger.info("✓ Notifications initialized in {}ms ({} webhook(s), quiet hours on)", duration, webhooks);
            } else {
                logger.info("✓ Notifications initialized in {}ms ({} webhook(s))", duration, webhooks);
            }
            return ServiceInitializationResult.success("Notifications", webhooks + " webhook(s)", duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Notification initialization failed after {}ms: {}", duration, e.getMessage());
            logger.debug("Notification initialization error details", e);
            return ServiceInitializationResult.failure("Notifications", e, duration);
        }
    }

    private ServiceInitializationResult initializeFleetMonitor() {
        logger.info("Initializing fleet monitor...");
        long startTime = System.currentTimeMillis();

        try {
            int printers = printerRepository.findEnabled().size();
            long duration = System.currentTimeMillis() - startTime;
            if (printers == 0) {
                logger.warn("⚠ Fleet monitor initialized in {}ms with no enabled printers", duration);
            } else {
                logger.info("✓ Fleet monitor initialized in {}ms, {} enabled printer(s)", duration, printers);
            }
            return ServiceInitializationResult.success("Fleet monitor", printers + " enabled printer(s)", duration);

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("✗ Fleet monitor initialization failed after {}ms: {}", duration, e.getMessage());
            logger.debug("Fleet monitor initialization error details", e);
            return ServiceInitializationResult.failure("Fleet monitor", e, duration);
        }
    }

    /**
     * Evaluate if startup requirements are met based on mode
     * @throws StartupException if requirements not met
     */
    public void evaluateStartupRequirements(StartupMode mode, List<ServiceInitializationResult> results) throws StartupException {
        long successfulServices = results.stream().filter(ServiceInitializationResult::isSuccess).count();
        long totalServices = results.size();

        logger.info("Service initialization complete: {}/{} services successful", successfulServices, totalServices);

        switch (mode) {
            case STRICT:
                if (successfulServices != totalServices) {
                    String message = String.format(
                            "STRICT mode requires all services to initialize. Only %d/%d services initialized successfully.",
                            successfulServices, totalServices);
                    throw new StartupException(message, mode, results);
                }
                logger.info("✓ STRICT mode requirement met: all services initialized");
                break;

            case LENIENT:
                if (successfulServices == 0) {
                    throw new StartupException("LENIENT mode requires at least one service to initialize. All services failed to initialize.",
                            mode, results);
                }
                if (successfulServices < totalServices) {
                    logger.warn("⚠ LENIENT mode: {}/{} services initialized (some services unavailable)", successfulServices, totalServices);
                } else {
                    logger.info("✓ LENIENT mode requirement met: all services initialized");
                }
                break;

            case PERMISSIVE:
                if (successfulServices == 0) {
                    logger.warn("⚠ PERMISSIVE mode: No services initialized - running in degraded mode");
                } else if (successfulServices < totalServices) {
                    logger.info("⚠ PERMISSIVE mode: {}/{} services initialized", successfulServices, totalServices);
                } else {
                    logger.info("✓ PERMISSIVE mode: all services initialized");
                }
                break;
        }
    }

    /**
     * Start the fleet sweeps. Skipped when the registry cannot be read at all.
     */
    public void startMonitoring(ScheduledExecutorService executorService) {
        ServiceInitializationResult monitorResult = initializationResults.get("monitor");
        if (monitorResult == null || !monitorResult.isSuccess()) {
            logger.warn("Fleet monitoring not started (printer registry unavailable)");
            return;
        }
        fleetMonitor.startMonitoring(executorService);
    }

    public void logStartupSummary(List<ServiceInitializationResult> results, int serverPort, String serverHost) {
        logger.info("========================================");
        logger.info("Startup Complete - Application Status:");
        logger.info("========================================");

        for (ServiceInitializationResult result : results) {
            logger.info(result.toString());
        }

        logger.info("Web Server: RUNNING on {}:{}", serverHost, serverPort);
        logger.info("========================================");
    }

    public Map<String, ServiceInitializationResult> getInitializationResults() {
        return Collections.unmodifiableMap(initializationResults);
    }
}
