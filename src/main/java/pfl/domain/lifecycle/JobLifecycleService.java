package pfl.domain.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EJobStatus;
import pfl.common.EventTypes;
import pfl.dal.db.PrintJobRecord;
import pfl.dal.db.PrintJobRepository;
import pfl.dal.db.RepositoryException;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.printer.CanonicalStatus;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persists lifecycle signals as print job records and publishes the matching {@code job.*} events.
 * Database failures are logged; the event is still published so consumers see the transition.
 * @since 15/01/2026
 */
@Singleton
public class JobLifecycleService {
    private static final Logger logger = LoggerFactory.getLogger(JobLifecycleService.class);
    private static final String SOURCE = "lifecycle";

    private final PrintJobRepository jobRepository;
    private final JobLinker jobLinker;
    private final IEventBus eventBus;
    private final Map<String, PrintJobRecord> openJobs = new ConcurrentHashMap<>();

    @Inject
    public JobLifecycleService(PrintJobRepository jobRepository, JobLinker jobLinker, IEventBus eventBus) {
        this.jobRepository = jobRepository;
        this.jobLinker = jobLinker;
        this.eventBus = eventBus;
    }

    /**
     * True when the printer has a running job record, e.g. one left open by a previous run
     */
    public boolean hasOpenJob(String printerId) {
        if (openJobs.containsKey(printerId)) {
            return true;
        }
        try {
            Optional<PrintJobRecord> open = jobRepository.findOpenJob(printerId);
            open.ifPresent(record -> openJobs.put(printerId, record));
            return open.isPresent();
        } catch (RepositoryException e) {
            logger.warn("[{}] Cannot check for an open job: {}", printerId, e.getMessage());
            return false;
        }
    }

    public Optional<PrintJobRecord> getOpenJob(String printerId) {
        return Optional.ofNullable(openJobs.get(printerId));
    }

    public void handle(LifecycleSignal signal, String printerName) {
        switch (signal.type()) {
            case EventTypes.JOB_STARTED -> onStarted(signal, printerName);
            case EventTypes.JOB_PROGRESS -> onProgress(signal, printerName);
            case EventTypes.JOB_PAUSED -> onPaused(signal, printerName);
            case EventTypes.JOB_COMPLETED -> onClosed(signal, printerName,
                    signal.success() ? EJobStatus.COMPLETED : EJobStatus.FAILED);
            case EventTypes.JOB_CANCELLED -> onClosed(signal, printerName, EJobStatus.CANCELLED);
            default -> logger.warn("[{}] Ignoring unknown lifecycle signal {}", signal.printerId(), signal.type());
        }
    }

    private void onStarted(LifecycleSignal signal, String printerName) {
        CanonicalStatus status = signal.status();
        String printerId = signal.printerId();
        String jobName = jobName(status);

        Optional<JobLink> link = jobLinker.link(printerId, status.getFilename(), status.getTotalLayers());
        Long scheduledJobId = link.map(JobLink::scheduledJobId).orElse(null);
        Integer totalLayers = status.getTotalLayers() > 0 ? status.getTotalLayers() : null;

        Map<String, Object> data = baseData(printerId, printerName);
        try {
            PrintJobRecord record = jobRepository.openJob(printerId, jobName, totalLayers, scheduledJobId, signal.detectedAt());
            openJobs.put(printerId, record);
            data.put("job_id", record.id());
        } catch (RepositoryException e) {
            openJobs.remove(printerId);
            logger.error("[{}] Failed to record job start of '{}'", printerId, jobName, e);
        }
        data.put("job_name", jobName);
        data.put("total_layers", status.getTotalLayers());
        if (scheduledJobId != null) {
            data.put("scheduled_job_id", scheduledJobId);
            data.put("link_strategy", link.get().strategy().name().toLowerCase(Locale.ROOT));
        }
        eventBus.publish(new Event(EventTypes.JOB_STARTED, SOURCE, data, signal.detectedAt()));
    }

    private void onProgress(LifecycleSignal signal, String printerName) {
        CanonicalStatus status = signal.status();
        PrintJobRecord open = openJobs.get(signal.printerId());
        Map<String, Object> data = baseData(signal.printerId(), printerName);
        if (open != null) {
            data.put("job_id", open.id());
            try {
                jobRepository.updateProgress(open.id(), status.getProgressPercent(), status.getCurrentLayer());
            } catch (RepositoryException e) {
                logger.warn("[{}] Failed to store progress of job {}: {}", signal.printerId(), open.id(), e.getMessage());
            }
        }
        data.put("progress_percent", status.getProgressPercent());
        data.put("current_layer", status.getCurrentLayer());
        data.put("total_layers", status.getTotalLayers());
        data.put("time_remaining_seconds", status.getTimeRemainingSeconds());
        eventBus.publish(new Event(EventTypes.JOB_PROGRESS, SOURCE, data, signal.detectedAt()));
    }

    private void onPaused(LifecycleSignal signal, String printerName) {
        PrintJobRecord open = openJobs.get(signal.printerId());
        Map<String, Object> data = baseData(signal.printerId(), printerName);
        if (open != null) {
            data.put("job_id", open.id());
            data.put("job_name", open.jobName());
        }
        data.put("progress_percent", signal.status().getProgressPercent());
        eventBus.publish(new Event(EventTypes.JOB_PAUSED, SOURCE, data, signal.detectedAt()));
    }

    private void onClosed(LifecycleSignal signal, String printerName, EJobStatus status) {
        String printerId = signal.printerId();
        CanonicalStatus snapshot = signal.status();
        Map<String, Object> data = baseData(printerId, printerName);

        PrintJobRecord cached = openJobs.remove(printerId);
        String jobName = cached != null ? cached.jobName() : jobName(snapshot);
        try {
            Optional<PrintJobRecord> closed = jobRepository.closeOpenJob(printerId, status, signal.detectedAt(),
                    signal.errorCode(), snapshot.getProgressPercent());
            if (closed.isPresent()) {
                PrintJobRecord record = closed.get();
                jobName = record.jobName();
                data.put("job_id", record.id());
                data.put("started_at", record.startedAt());
                data.put("duration_seconds", record.durationSeconds());
                if (record.isLinked()) {
                    data.put("scheduled_job_id", record.scheduledJobId());
                }
            } else {
                logger.warn("[{}] {} signal without an open job record", printerId, status);
            }
        } catch (RepositoryException e) {
            logger.error("[{}] Failed to close job '{}' as {}", printerId, jobName, status, e);
        }

        data.put("job_name", jobName);
        data.put("status", status.dbValue());
        data.put("ended_at", signal.detectedAt());
        data.put("progress_percent", snapshot.getProgressPercent());
        if (status != EJobStatus.CANCELLED) {
            data.put("success", signal.success());
        }
        if (signal.errorCode() != null) {
            data.put("error_code", signal.errorCode());
        }
        if (signal.errorMessage() != null) {
            data.put("error_message", signal.errorMessage());
        }
        String eventType = status == EJobStatus.CANCELLED ? EventTypes.JOB_CANCELLED : EventTypes.JOB_COMPLETED;
        eventBus.publish(new Event(eventType, SOURCE, data, signal.detectedAt()));
    }

    private static Map<String, Object> baseData(String printerId, String printerName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("printer_id", printerId);
        data.put("printer_name", printerName);
        return data;
    }

    private static String jobName(CanonicalStatus status) {
        return status.getFilename() != null ? status.getFilename() : "Unknown";
    }
}
