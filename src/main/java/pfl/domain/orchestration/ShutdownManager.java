package pfl.domain.orchestration;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.domain.consumer.MqttRepublisher;
import pfl.domain.monitor.FleetMonitorService;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages graceful shutdown of the application.
 * Order: web server, printer connections, executors, republisher, connection pool.
 * @author Martin Sustik <sustik@herman.cz>
 * @since 19/11/2025
 */
public class ShutdownManager {
    private static final Logger logger = LoggerFactory.getLogger(ShutdownManager.class);

    private final WebServerManager webServerManager;
    private final FleetMonitorService fleetMonitor;
    private final ExecutorService scheduler;
    private final ExecutorService adapterWorkers;
    private final ExecutorService deliveryPool;
    private final MqttRepublisher republisher;
    private final HikariDataSource dataSource;

    private volatile boolean shutdownHookRegistered = false;
    private volatile boolean shutDown = false;

    public ShutdownManager(
            WebServerManager webServerManager,
            FleetMonitorService fleetMonitor,
            ExecutorService scheduler,
            ExecutorService adapterWorkers,
            ExecutorService deliveryPool,
            MqttRepublisher republisher,
            HikariDataSource dataSource) {
        this.webServerManager = webServerManager;
        this.fleetMonitor = fleetMonitor;
        this.scheduler = scheduler;
        this.adapterWorkers = adapterWorkers;
        this.deliveryPool = deliveryPool;
        this.republisher = republisher;
        this.dataSource = dataSource;
    }

    public void registerShutdownHook() {
        if (!shutdownHookRegistered) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown"));
            shutdownHookRegistered = true;
        }
    }

    /**
     * Graceful shutdown. Runs once, later calls return immediately.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        logger.info("Shutting down PrintFleet...");

        try {
            webServerManager.stop();
            fleetMonitor.stopMonitoring();

            terminate("scheduler", scheduler);
            terminate("adapter workers", adapterWorkers);
            // queued webhook deliveries get the same grace period
            terminate("alert delivery", deliveryPool);

            republisher.close();
            if (!dataSource.isClosed()) {
                dataSource.close();
            }

            logger.info("Application shut down successfully");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        }
    }

    private static void terminate(String name, ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Executor '{}' did not terminate in time, forcing shutdown", name);
                executor.shutdownNow();
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.error("Executor '{}' did not terminate", name);
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutDown() {
        return shutDown;
    }
}
