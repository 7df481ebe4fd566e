package pfl.common;

/**
 * Event type names published on the in-process bus. Names follow the {@code domain.verb} form.
 * @since 12/01/2026
 */
public final class EventTypes {
    public static final String WILDCARD = "*";

    public static final String PRINTER_CONNECTED = "printer.connected";
    public static final String PRINTER_DISCONNECTED = "printer.disconnected";
    public static final String PRINTER_STATE_CHANGED = "printer.state_changed";
    public static final String PRINTER_ERROR = "printer.error";

    public static final String JOB_STARTED = "job.started";
    public static final String JOB_PROGRESS = "job.progress";
    public static final String JOB_PAUSED = "job.paused";
    public static final String JOB_COMPLETED = "job.completed";
    public static final String JOB_CANCELLED = "job.cancelled";

    public static final String ALERT_DISPATCHED = "alert.dispatched";

    private EventTypes() {
    }
}
