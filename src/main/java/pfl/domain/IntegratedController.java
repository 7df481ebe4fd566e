package pfl.domain;

import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import com.google.inject.name.Names;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.dal.PrinterConfig;
import pfl.dal.ServerConfig;
import pfl.dal.StartupMode;
import pfl.dal.db.AlertRepository;
import pfl.dal.db.EventRelayRepository;
import pfl.dal.db.PrinterRepository;
import pfl.dal.db.SchemaInitializer;
import pfl.dal.db.WebhookRepository;
import pfl.domain.alert.AlertDispatcher;
import pfl.domain.api.AlertController;
import pfl.domain.api.EventRelayController;
import pfl.domain.api.PrinterController;
import pfl.domain.consumer.MqttRepublisher;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;
import pfl.domain.monitor.FleetMonitorService;
import pfl.domain.orchestration.ServiceOrchestrator;
import pfl.domain.orchestration.ShutdownManager;
import pfl.domain.orchestration.WebServerManager;
import pfl.domain.printer.PrinterAdapterFactory;
import pfl.domain.printer.elegoo.ElegooDiscovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the fleet core together: registry and schema, bus consumers, printer supervision,
 * web API and shutdown
 * @author Martin Sustik <sustik@herman.cz>
 * @since 26/09/2025
 */
public class IntegratedController {
    private static final Logger logger = LoggerFactory.getLogger(IntegratedController.class);

    private final ServerConfig serverConfig;
    private final ScheduledExecutorService executorService;

    // Managers
    private final ServiceOrchestrator serviceOrchestrator;
    private final WebServerManager webServerManager;
    private final ShutdownManager shutdownManager;

    public IntegratedController(ServerConfig serverConfig, List<PrinterConfig> configuredPrinters, Injector injector) {
        this.serverConfig = serverConfig;
        this.executorService = injector.getInstance(ScheduledExecutorService.class);

        FleetMonitorService fleetMonitor = injector.getInstance(FleetMonitorService.class);
        PrinterRepository printerRepository = injector.getInstance(PrinterRepository.class);
        AlertDispatcher alertDispatcher = injector.getInstance(AlertDispatcher.class);
        Set<IEventConsumer> consumers = injector.getInstance(Key.get(new TypeLiteral<Set<IEventConsumer>>() {
        }));

        this.serviceOrchestrator = new ServiceOrchestrator(
                injector.getInstance(SchemaInitializer.class),
                printerRepository,
                configuredPrinters,
                injector.getInstance(WebhookRepository.class),
                alertDispatcher,
                injector.getInstance(IEventBus.class),
                consumers,
                fleetMonitor);

        this.webServerManager = new WebServerManager(
                serverConfig,
                new PrinterController(fleetMonitor, printerRepository, new ElegooDiscovery(), this::getInitializationResults),
                new EventRelayController(injector.getInstance(EventRelayRepository.class)),
                new AlertController(injector.getInstance(AlertRepository.class), alertDispatcher));

        this.shutdownManager = new ShutdownManager(
                webServerManager,
                fleetMonitor,
                executorService,
                injector.getInstance(Key.get(ExecutorService.class, Names.named(PrinterAdapterFactory.WORKER_POOL))),
                injector.getInstance(Key.get(ExecutorService.class, Names.named(AlertDispatcher.DELIVERY_POOL))),
                injector.getInstance(MqttRepublisher.class),
                injector.getInstance(HikariDataSource.class));

        logger.info("IntegratedController initialized with startup mode: {}", serverConfig.startupMode());
    }

    /**
     * Start the application with the startup mode from configuration
     * @throws StartupException if startup requirements are not met
     */
    public void start() throws StartupException {
        start(serverConfig.startupMode());
    }

    /**
     * Start the application with specified startup mode
     * @throws StartupException if startup requirements are not met
     */
    public void start(StartupMode mode) throws StartupException {
        logger.info("========================================");
        logger.info("Starting PrintFleet");
        logger.info("Startup Mode: {}", mode);
        logger.info("========================================");

        try {
            // Step 1: Schema, printer seeding, consumers, notification channels
            List<ServiceInitializationResult> results = serviceOrchestrator.initializeAllServices();

            // Step 2: Evaluate startup success based on mode
            serviceOrchestrator.evaluateStartupRequirements(mode, results);

            // Step 3: Connect printers
            serviceOrchestrator.startMonitoring(executorService);

            // Step 4: Start web server
            webServerManager.start();

            // Step 5: Register shutdown hook
            shutdownManager.registerShutdownHook();

            serviceOrchestrator.logStartupSummary(results, serverConfig.port(), serverConfig.host());

        } catch (StartupException e) {
            logger.error("Startup failed: {}", e.getMessage());
            shutdownManager.shutdown();
            throw e;
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            shutdownManager.shutdown();
            throw new StartupException("Unexpected startup failure: " + e.getMessage(), mode,
                    new ArrayList<>(serviceOrchestrator.getInitializationResults().values()));
        }
    }

    public void shutdown() {
        shutdownManager.shutdown();
    }

    public Map<String, ServiceInitializationResult> getInitializationResults() {
        return serviceOrchestrator.getInitializationResults();
    }
}
