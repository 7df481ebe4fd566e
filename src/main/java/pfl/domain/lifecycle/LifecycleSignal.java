package pfl.domain.lifecycle;

import pfl.common.EventTypes;
import pfl.domain.printer.CanonicalStatus;

/**
 * Output of the state transition detector. {@code type} is one of the {@code job.*} event types.
 * @since 14/01/2026
 */
public record LifecycleSignal(
        String type,
        String printerId,
        CanonicalStatus status,
        boolean success,
        String errorCode,
        String errorMessage,
        long detectedAt) {

    public static LifecycleSignal started(CanonicalStatus status, long at) {
        return new LifecycleSignal(EventTypes.JOB_STARTED, status.getPrinterId(), status, false, null, null, at);
    }

    public static LifecycleSignal progress(CanonicalStatus status, long at) {
        return new LifecycleSignal(EventTypes.JOB_PROGRESS, status.getPrinterId(), status, false, null, null, at);
    }

    public static LifecycleSignal paused(CanonicalStatus status, long at) {
        return new LifecycleSignal(EventTypes.JOB_PAUSED, status.getPrinterId(), status, false, null, null, at);
    }

    public static LifecycleSignal completed(CanonicalStatus status, long at) {
        return new LifecycleSignal(EventTypes.JOB_COMPLETED, status.getPrinterId(), status, true, null, null, at);
    }

    public static LifecycleSignal failed(CanonicalStatus status, String errorCode, String errorMessage, long at) {
        return new LifecycleSignal(EventTypes.JOB_COMPLETED, status.getPrinterId(), status, false, errorCode, errorMessage, at);
    }

    public static LifecycleSignal cancelled(CanonicalStatus status, long at) {
        return new LifecycleSignal(EventTypes.JOB_CANCELLED, status.getPrinterId(), status, false, null, null, at);
    }

    public boolean isTerminal() {
        return EventTypes.JOB_COMPLETED.equals(type) || EventTypes.JOB_CANCELLED.equals(type);
    }
}
