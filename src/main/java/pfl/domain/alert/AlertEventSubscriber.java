package pfl.domain.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.ESeverity;
import pfl.common.EventTypes;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Raises alerts from bus events: finished and failed prints, device errors and lost printers
 * @since 20/01/2026
 */
@Singleton
public class AlertEventSubscriber implements IEventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(AlertEventSubscriber.class);

    public static final String PRINT_COMPLETE = "print_complete";
    public static final String PRINT_FAILED = "print_failed";
    public static final String PRINTER_ERROR = "printer_error";
    public static final String PRINTER_OFFLINE = "printer_offline";

    private final AlertDispatcher dispatcher;

    @Inject
    public AlertEventSubscriber(AlertDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void register(IEventBus eventBus) {
        eventBus.subscribe(EventTypes.JOB_COMPLETED, this::onJobCompleted);
        eventBus.subscribe(EventTypes.PRINTER_ERROR, this::onPrinterError);
        eventBus.subscribe(EventTypes.PRINTER_DISCONNECTED, this::onPrinterDisconnected);
        logger.info("Alert subscriber registered");
    }

    void onJobCompleted(Event event) {
        String printer = printerName(event);
        String job = event.getString("job_name") == null ? "Unknown" : event.getString("job_name");
        if (event.getBoolean("success", true)) {
            dispatcher.dispatch(new AlertRequest(PRINT_COMPLETE, ESeverity.INFO,
                    "Print Complete: " + job + " (" + printer + ")",
                    "Job finished successfully on " + printer + ".",
                    event.getString("printer_id"), event.getLong("job_id"), null));
            return;
        }

        double progress = event.getDouble("progress_percent", 0);
        String errorCode = event.getString("error_code");
        StringBuilder message = new StringBuilder()
                .append("Job failed on ").append(printer)
                .append(String.format(Locale.ROOT, " at %.0f%% progress.", progress));
        if (errorCode != null) {
            message.append(" Error code: ").append(errorCode);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("progress_percent", progress);
        metadata.put("error_code", errorCode);
        dispatcher.dispatch(new AlertRequest(PRINT_FAILED, ESeverity.CRITICAL,
                "Print Failed: " + job + " (" + printer + ")", message.toString(),
                event.getString("printer_id"), event.getLong("job_id"), metadata));
    }

    void onPrinterError(Event event) {
        String printer = printerName(event);
        String code = event.getString("error_code");
        String description = event.getString("error_message");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_code", code);
        dispatcher.dispatch(new AlertRequest(PRINTER_ERROR, ESeverity.WARNING,
                "Printer Error: " + printer + " (" + code + ")",
                description != null ? description : "Printer reported error " + code + ".",
                event.getString("printer_id"), null, metadata));
    }

    void onPrinterDisconnected(Event event) {
        String printer = printerName(event);
        String lastError = event.getString("last_error");
        dispatcher.dispatch(new AlertRequest(PRINTER_OFFLINE, ESeverity.WARNING,
                "Printer Offline: " + printer,
                printer + " stopped responding." + (lastError != null ? " Last error: " + lastError : ""),
                event.getString("printer_id"), null, null));
    }

    private static String printerName(Event event) {
        String name = event.getString("printer_name");
        return name != null ? name : event.getString("printer_id");
    }
}
