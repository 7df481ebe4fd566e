package pfl.domain.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EPrinterState;
import pfl.common.EventTypes;
import pfl.dal.MonitorConfig;
import pfl.dal.PrinterConfig;
import pfl.dal.db.PrinterRepository;
import pfl.dal.db.RepositoryException;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.lifecycle.JobLifecycleService;
import pfl.domain.lifecycle.LifecycleSignal;
import pfl.domain.lifecycle.PrintStoppingErrorCatalog;
import pfl.domain.lifecycle.StateTransitionDetector;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IStatusListener;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single ingestion path for every status an adapter parses. Per printer it feeds the transition
 * detector, writes the heartbeat, tracks device errors and hands lifecycle signals on.
 * Calls for one printer are serialized, different printers run in parallel.
 *
 * @since 18/01/2026
 */
@Singleton
public class StatusIngestionService {
    private static final Logger logger = LoggerFactory.getLogger(StatusIngestionService.class);
    private static final String SOURCE = "monitor";

    private final PrinterRepository printerRepository;
    private final JobLifecycleService lifecycleService;
    private final PrintStoppingErrorCatalog stoppingErrors;
    private final MonitorConfig monitorConfig;
    private final IEventBus eventBus;
    private final Map<String, PrinterTracker> trackers = new ConcurrentHashMap<>();

    @Inject
    public StatusIngestionService(PrinterRepository printerRepository, JobLifecycleService lifecycleService,
                                  PrintStoppingErrorCatalog stoppingErrors, MonitorConfig monitorConfig, IEventBus eventBus) {
        this.printerRepository = printerRepository;
        this.lifecycleService = lifecycleService;
        this.stoppingErrors = stoppingErrors;
        this.monitorConfig = monitorConfig;
        this.eventBus = eventBus;
    }

    public IStatusListener listenerFor(PrinterConfig config) {
        return status -> ingest(config, status, System.currentTimeMillis());
    }

    public void ingest(PrinterConfig config, CanonicalStatus status, long now) {
        PrinterTracker tracker = trackers.computeIfAbsent(config.id(), id -> newTracker(id));
        synchronized (tracker) {
            EPrinterState previousState = tracker.lastState;
            boolean stateChanged = previousState != status.getState();
            tracker.lastState = status.getState();

            if (stateChanged) {
                publishStateChange(config, previousState, status);
            }
            trackError(config, tracker, status, now);
            writeHeartbeat(config, tracker, status, stateChanged, now);

            List<LifecycleSignal> signals = tracker.detector.observe(status, now);
            for (LifecycleSignal signal : signals) {
                lifecycleService.handle(signal, config.getDisplayName());
            }
        }
    }

    private PrinterTracker newTracker(String printerId) {
        StateTransitionDetector detector = new StateTransitionDetector(printerId, stoppingErrors,
                monitorConfig.progressMinDeltaPercent(), monitorConfig.progressMinIntervalMs());
        if (lifecycleService.hasOpenJob(printerId)) {
            logger.info("[{}] Continuing the job left open by the previous run", printerId);
            detector.restoreActiveJob();
        }
        return new PrinterTracker(detector);
    }

    private void publishStateChange(PrinterConfig config, EPrinterState previousState, CanonicalStatus status) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("printer_id", config.id());
        data.put("printer_name", config.getDisplayName());
        data.put("old_state", previousState == null ? null : previousState.name());
        data.put("new_state", status.getState().name());
        eventBus.publish(new Event(EventTypes.PRINTER_STATE_CHANGED, SOURCE, data));
    }

    private void trackError(PrinterConfig config, PrinterTracker tracker, CanonicalStatus status, long now) {
        String errorCode = status.getErrorCode();
        if (Objects.equals(errorCode, tracker.lastErrorCode)) {
            return;
        }
        tracker.lastErrorCode = errorCode;
        try {
            if (errorCode == null) {
                printerRepository.clearError(config.id());
                logger.info("[{}] Device error cleared", config.id());
                return;
            }
            printerRepository.recordError(config.id(), errorCode, status.getErrorMessage(), now);
        } catch (RepositoryException e) {
            logger.warn("[{}] Cannot store device error state: {}", config.id(), e.getMessage());
        }
        if (errorCode == null) {
            return;
        }

        logger.warn("[{}] Device error {}: {}", config.id(), errorCode, status.getErrorMessage());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("printer_id", config.id());
        data.put("printer_name", config.getDisplayName());
        data.put("error_code", errorCode);
        data.put("error_message", status.getErrorMessage());
        data.put("print_stopping", stoppingErrors.isPrintStopping(errorCode));
        eventBus.publish(new Event(EventTypes.PRINTER_ERROR, SOURCE, data, now));
    }

    private void writeHeartbeat(PrinterConfig config, PrinterTracker tracker, CanonicalStatus status,
                                boolean stateChanged, long now) {
        if (!stateChanged && now - tracker.lastHeartbeatWrite < monitorConfig.heartbeatWriteIntervalMs()) {
            return;
        }
        try {
            printerRepository.updateHeartbeat(config.id(), status.getState(), now);
            tracker.lastHeartbeatWrite = now;
        } catch (RepositoryException e) {
            logger.warn("[{}] Heartbeat write failed: {}", config.id(), e.getMessage());
        }
    }

    /**
     * Drop the per-printer state of a printer no longer monitored
     */
    public void forget(String printerId) {
        trackers.remove(printerId);
    }

    private static final class PrinterTracker {
        private final StateTransitionDetector detector;
        private EPrinterState lastState;
        private String lastErrorCode;
        private long lastHeartbeatWrite;

        private PrinterTracker(StateTransitionDetector detector) {
            this.detector = detector;
        }
    }
}
