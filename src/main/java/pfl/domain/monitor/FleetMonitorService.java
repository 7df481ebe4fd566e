package pfl.domain.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.dal.MonitorConfig;
import pfl.dal.PrinterConfig;
import pfl.dal.db.PrinterRepository;
import pfl.dal.db.RepositoryException;
import pfl.domain.event.IEventBus;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IPrinterAdapter;
import pfl.domain.printer.IPrinterAdapterFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns one {@link ConnectionSupervisor} per enabled printer. A discovery sweep picks up printers
 * added to (or removed from) the registry; a health sweep lets every supervisor check its link.
 * @author Martin Sustik <sustik@herman.cz>
 * @since 25/09/2025
 */
@Singleton
public class FleetMonitorService {
    private static final Logger logger = LoggerFactory.getLogger(FleetMonitorService.class);

    private final PrinterRepository printerRepository;
    private final IPrinterAdapterFactory adapterFactory;
    private final StatusIngestionService ingestionService;
    private final MonitorConfig monitorConfig;
    private final IEventBus eventBus;
    private final Map<String, ConnectionSupervisor> supervisors = new ConcurrentHashMap<>();

    private ScheduledFuture<?> healthTask;
    private ScheduledFuture<?> discoveryTask;
    private boolean monitoring = false;         // guarded by synchronized start/stop

    @Inject
    public FleetMonitorService(PrinterRepository printerRepository, IPrinterAdapterFactory adapterFactory,
                               StatusIngestionService ingestionService, MonitorConfig monitorConfig, IEventBus eventBus) {
        this.printerRepository = printerRepository;
        this.adapterFactory = adapterFactory;
        this.ingestionService = ingestionService;
        this.monitorConfig = monitorConfig;
        this.eventBus = eventBus;
    }

    /**
     * Start both sweeps. The first discovery runs right away and connects every known printer.
     */
    public synchronized void startMonitoring(ScheduledExecutorService executor) {
        if (monitoring) {
            logger.warn("Fleet monitoring is already running");
            return;
        }
        logger.info("Starting fleet monitoring (health every {}ms, discovery every {}ms)",
                monitorConfig.healthCheckIntervalMs(), monitorConfig.discoveryIntervalMs());
        monitoring = true;

        discoveryTask = executor.scheduleWithFixedDelay(this::discoverPrinters,
                0, monitorConfig.discoveryIntervalMs(), TimeUnit.MILLISECONDS);
        healthTask = executor.scheduleWithFixedDelay(this::checkHealth,
                monitorConfig.healthCheckIntervalMs(), monitorConfig.healthCheckIntervalMs(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stopMonitoring() {
        if (!monitoring) {
            return;
        }
        logger.info("Stopping fleet monitoring");
        monitoring = false;

        if (discoveryTask != null) {
            discoveryTask.cancel(false);
            discoveryTask = null;
        }
        if (healthTask != null) {
            healthTask.cancel(false);
            healthTask = null;
        }
        for (ConnectionSupervisor supervisor : supervisors.values()) {
            supervisor.stop();
        }
        supervisors.clear();
        logger.info("Fleet monitoring stopped");
    }

    /**
     * Reconcile supervisors with the enabled printers in the registry
     */
    public void discoverPrinters() {
        List<PrinterConfig> enabled;
        try {
            enabled = printerRepository.findEnabled();
        } catch (RepositoryException e) {
            logger.error("Printer discovery failed: {}", e.getMessage());
            return;
        }

        Set<String> seen = new HashSet<>();
        for (PrinterConfig config : enabled) {
            seen.add(config.id());
            ConnectionSupervisor existing = supervisors.get(config.id());
            if (existing != null && !existing.getConfig().connectionDiffers(config)) {
                continue;
            }
            if (existing != null) {
                logger.info("[{}] Connection settings changed, restarting supervisor", config.id());
                existing.stop();
            } else {
                logger.info("[{}] New printer discovered: {} ({})", config.id(), config.getDisplayName(), config.protocol());
            }
            startSupervisor(config);
        }

        for (String printerId : new ArrayList<>(supervisors.keySet())) {
            if (!seen.contains(printerId)) {
                logger.info("[{}] Printer removed or disabled, stopping supervisor", printerId);
                ConnectionSupervisor removed = supervisors.remove(printerId);
                if (removed != null) {
                    removed.stop();
                }
                ingestionService.forget(printerId);
            }
        }
    }

    private void startSupervisor(PrinterConfig config) {
        ConnectionSupervisor supervisor = new ConnectionSupervisor(config, adapterFactory,
                ingestionService.listenerFor(config), monitorConfig, eventBus);
        supervisors.put(config.id(), supervisor);
        try {
            supervisor.start();
        } catch (RuntimeException e) {
            logger.error("[{}] Supervisor start failed, will retry on next health check", config.id(), e);
        }
    }

    /**
     * One health sweep over all supervisors. A failing supervisor does not stop the sweep.
     */
    public void checkHealth() {
        long now = System.currentTimeMillis();
        for (ConnectionSupervisor supervisor : supervisors.values()) {
            try {
                supervisor.checkHealth(now);
            } catch (RuntimeException e) {
                logger.error("[{}] Health check failed", supervisor.getConfig().id(), e);
            }
        }
    }

    /**
     * Never null: an unknown or not yet connected printer is reported OFFLINE
     */
    public CanonicalStatus getStatus(String printerId) {
        ConnectionSupervisor supervisor = supervisors.get(printerId);
        if (supervisor == null) {
            return CanonicalStatus.offline(printerId, "Printer is not monitored");
        }
        return supervisor.getStatus();
    }

    public List<CanonicalStatus> getAllStatuses() {
        List<CanonicalStatus> statuses = new ArrayList<>();
        for (ConnectionSupervisor supervisor : supervisors.values()) {
            statuses.add(supervisor.getStatus());
        }
        statuses.sort((a, b) -> a.getPrinterId().compareTo(b.getPrinterId()));
        return statuses;
    }

    public Optional<IPrinterAdapter> findAdapter(String printerId) {
        ConnectionSupervisor supervisor = supervisors.get(printerId);
        return supervisor == null ? Optional.empty() : Optional.ofNullable(supervisor.getAdapter());
    }

    public boolean isMonitored(String printerId) {
        return supervisors.containsKey(printerId);
    }

    public Collection<ConnectionSupervisor> getSupervisors() {
        return supervisors.values();
    }

    public synchronized boolean isMonitoring() {
        return monitoring;
    }
}
