package pfl.domain.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EPrinterState;
import pfl.domain.printer.CanonicalStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the status stream of one printer into job lifecycle signals.
 * <p>
 * A job starts when PRINTING is seen with no job active. While a job is active FINISH completes it,
 * FAILED fails it and IDLE cancels it. Entering PAUSED signals a pause. OFFLINE and UNKNOWN keep the
 * job open, a print may continue while the link is down.
 * <p>
 * A listed print-stopping error code seen while the device still reports PRINTING or PAUSED fails
 * the job right away. Until the device leaves PRINTING/PAUSED afterwards no new job is started.
 * <p>
 * Not thread safe. The ingestion path owns one instance per printer and feeds it in order.
 *
 * @since 14/01/2026
 */
public class StateTransitionDetector {
    private static final Logger logger = LoggerFactory.getLogger(StateTransitionDetector.class);

    private final String printerId;
    private final PrintStoppingErrorCatalog stoppingErrors;
    private final double progressMinDeltaPercent;
    private final long progressMinIntervalMs;

    private ELifecycleState lastState;
    private boolean jobActive;
    private boolean awaitingDeviceFailure;
    private double lastProgressPercent = -1;
    private int lastProgressLayer = -1;
    private long lastProgressAt;

    public StateTransitionDetector(String printerId, PrintStoppingErrorCatalog stoppingErrors,
                                   double progressMinDeltaPercent, long progressMinIntervalMs) {
        this.printerId = printerId;
        this.stoppingErrors = stoppingErrors;
        this.progressMinDeltaPercent = progressMinDeltaPercent;
        this.progressMinIntervalMs = progressMinIntervalMs;
    }

    /**
     * Lifecycle state of one snapshot, ignoring history
     */
    public static ELifecycleState deriveState(CanonicalStatus status, PrintStoppingErrorCatalog stoppingErrors) {
        EPrinterState deviceState = status.getState();
        if (deviceState.isJobActive() && stoppingErrors.isPrintStopping(status.getErrorCode())) {
            return ELifecycleState.FAILED;
        }
        return switch (deviceState) {
            case PRINTING -> ELifecycleState.PRINTING;
            case PAUSED -> ELifecycleState.PAUSED;
            case IDLE -> switch (status.getJobOutcome()) {
                case FINISHED -> ELifecycleState.FINISH;
                case FAILED -> ELifecycleState.FAILED;
                case NONE -> ELifecycleState.IDLE;
            };
            case ERROR -> ELifecycleState.FAILED;
            case OFFLINE -> ELifecycleState.OFFLINE;
            case UNKNOWN -> ELifecycleState.UNKNOWN;
        };
    }

    /**
     * Feed the next snapshot.
     *
     * @return signals in emission order, empty for telemetry-only updates
     */
    public List<LifecycleSignal> observe(CanonicalStatus status, long now) {
        ELifecycleState state = deriveState(status, stoppingErrors);
        boolean stoppingError = state == ELifecycleState.FAILED && status.getState().isJobActive();

        if (awaitingDeviceFailure) {
            if (status.getState().isJobActive()) {
                state = ELifecycleState.FAILED;
            } else if (status.getState() != EPrinterState.OFFLINE && status.getState() != EPrinterState.UNKNOWN) {
                awaitingDeviceFailure = false;
            }
        }

        ELifecycleState previous = lastState;
        lastState = state;

        List<LifecycleSignal> signals = new ArrayList<>(2);
        switch (state) {
            case PRINTING -> {
                if (!jobActive) {
                    jobActive = true;
                    markProgress(status, now);
                    signals.add(LifecycleSignal.started(status, now));
                    logger.info("[{}] Print started: '{}' ({} -> PRINTING)", printerId, status.getFilename(), previous);
                } else if (shouldEmitProgress(status, now)) {
                    markProgress(status, now);
                    signals.add(LifecycleSignal.progress(status, now));
                }
            }
            case PAUSED -> {
                if (previous != ELifecycleState.PAUSED) {
                    signals.add(LifecycleSignal.paused(status, now));
                    logger.info("[{}] Print paused at {}%", printerId, status.getProgressPercent());
                }
            }
            case FINISH -> {
                if (jobActive) {
                    jobActive = false;
                    signals.add(LifecycleSignal.completed(status, now));
                    logger.info("[{}] Print finished: '{}'", printerId, status.getFilename());
                }
            }
            case FAILED -> {
                if (jobActive) {
                    jobActive = false;
                    String description = stoppingErrors.describe(status.getErrorCode());
                    String message = description != null ? description : status.getErrorMessage();
                    signals.add(LifecycleSignal.failed(status, status.getErrorCode(), message, now));
                    if (stoppingError) {
                        awaitingDeviceFailure = true;
                        logger.warn("[{}] Print-stopping error {} while device still reports {}, print failed",
                                printerId, status.getErrorCode(), status.getState());
                    } else {
                        logger.warn("[{}] Print failed: '{}' (error {})", printerId, status.getFilename(), status.getErrorCode());
                    }
                }
            }
            case IDLE -> {
                if (jobActive) {
                    jobActive = false;
                    signals.add(LifecycleSignal.cancelled(status, now));
                    logger.info("[{}] Print cancelled: '{}' ({} -> IDLE)", printerId, status.getFilename(), previous);
                }
            }
            case OFFLINE, UNKNOWN -> {
                // telemetry only, an open job stays open
            }
        }
        return signals.isEmpty() ? Collections.emptyList() : signals;
    }

    private boolean shouldEmitProgress(CanonicalStatus status, long now) {
        double progress = status.getProgressPercent();
        if (Math.abs(progress - lastProgressPercent) >= progressMinDeltaPercent) {
            return true;
        }
        boolean changed = progress != lastProgressPercent || status.getCurrentLayer() != lastProgressLayer;
        return changed && now - lastProgressAt >= progressMinIntervalMs;
    }

    private void markProgress(CanonicalStatus status, long now) {
        lastProgressPercent = status.getProgressPercent();
        lastProgressLayer = status.getCurrentLayer();
        lastProgressAt = now;
    }

    /**
     * Continue a job recorded before a restart, so the next PRINTING snapshot does not start it again
     */
    public void restoreActiveJob() {
        jobActive = true;
        lastState = ELifecycleState.PRINTING;
    }

    public ELifecycleState getLastState() {
        return lastState;
    }

    public boolean isJobActive() {
        return jobActive;
    }

    public String getPrinterId() {
        return printerId;
    }
}
