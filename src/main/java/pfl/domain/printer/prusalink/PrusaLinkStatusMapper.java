package pfl.domain.printer.prusalink;

import com.google.gson.JsonObject;
import pfl.common.EJobOutcome;
import pfl.common.EPrinterState;
import pfl.domain.printer.CanonicalStatus;

import java.util.Locale;

import static pfl.domain.printer.JsonFields.decimal;
import static pfl.domain.printer.JsonFields.has;
import static pfl.domain.printer.JsonFields.integer;
import static pfl.domain.printer.JsonFields.bool;
import static pfl.domain.printer.JsonFields.object;
import static pfl.domain.printer.JsonFields.string;

/**
 * PrusaLink JSON to canonical status. The remaining time is taken from the printer as reported.
 * @since 13/01/2026
 */
public final class PrusaLinkStatusMapper {

    private PrusaLinkStatusMapper() {
    }

    /**
     * {@code GET /api/v1/status}, optionally enriched with {@code GET /api/v1/job} for the file name
     */
    public static CanonicalStatus fromV1(String printerId, JsonObject status, JsonObject jobDetails) {
        JsonObject printer = object(status, "printer");
        JsonObject job = object(status, "job");
        String deviceState = string(printer, "state", "IDLE").trim().toUpperCase(Locale.ROOT);

        CanonicalStatus.Builder builder = CanonicalStatus.builder(printerId)
                .bedTemp(decimal(printer, "temp_bed", 0))
                .bedTarget(decimal(printer, "target_bed", 0))
                .nozzleTemp(decimal(printer, "temp_nozzle", 0))
                .nozzleTarget(decimal(printer, "target_nozzle", 0))
                .rawPayload(status.toString());
        applyState(builder, deviceState);

        if (job != null) {
            builder.progressPercent(decimal(job, "progress", 0))
                    .timeRemainingSeconds(integer(job, "time_remaining", 0));
        }
        JsonObject file = object(jobDetails, "file");
        if (file != null) {
            builder.filename(string(file, "display_name", string(file, "name", null)));
        }
        return builder.build();
    }

    /**
     * Older firmware: {@code GET /api/printer} plus {@code GET /api/job}
     */
    public static CanonicalStatus fromLegacy(String printerId, JsonObject printer, JsonObject jobInfo) {
        JsonObject temperature = object(printer, "temperature");
        JsonObject tool = object(temperature, "tool0");
        JsonObject bed = object(temperature, "bed");
        JsonObject flags = object(object(printer, "state"), "flags");

        CanonicalStatus.Builder builder = CanonicalStatus.builder(printerId)
                .nozzleTemp(decimal(tool, "actual", 0))
                .nozzleTarget(decimal(tool, "target", 0))
                .bedTemp(decimal(bed, "actual", 0))
                .bedTarget(decimal(bed, "target", 0))
                .rawPayload(printer.toString());

        if (bool(flags, "printing", false)) {
            builder.state(EPrinterState.PRINTING);
        } else if (bool(flags, "paused", false) || bool(flags, "pausing", false)) {
            builder.state(EPrinterState.PAUSED);
        } else if (bool(flags, "error", false) || bool(flags, "closedOnError", false)) {
            builder.state(EPrinterState.ERROR);
        } else if (has(flags, "ready") || has(flags, "operational")) {
            builder.state(EPrinterState.IDLE);
        } else {
            builder.state(EPrinterState.UNKNOWN);
        }

        JsonObject progress = object(jobInfo, "progress");
        if (progress != null) {
            builder.progressPercent(decimal(progress, "completion", 0))
                    .timeRemainingSeconds(integer(progress, "printTimeLeft", 0));
        }
        JsonObject file = object(object(jobInfo, "job"), "file");
        if (file != null) {
            String display = string(file, "display", null);
            builder.filename(display != null && !display.isBlank() ? display : string(file, "name", null));
        }
        return builder.build();
    }

    /**
     * Job id from the v1 status, needed by the job commands
     */
    public static Long jobId(JsonObject status) {
        JsonObject job = object(status, "job");
        if (!has(job, "id")) {
            return null;
        }
        return (long) integer(job, "id", 0);
    }

    private static void applyState(CanonicalStatus.Builder builder, String deviceState) {
        switch (deviceState) {
            case "PRINTING" -> builder.state(EPrinterState.PRINTING);
            case "PAUSED", "ATTENTION" -> builder.state(EPrinterState.PAUSED);
            case "ERROR" -> builder.state(EPrinterState.ERROR);
            case "FINISHED" -> builder.state(EPrinterState.IDLE).jobOutcome(EJobOutcome.FINISHED);
            case "IDLE", "READY", "OPERATIONAL", "BUSY", "STOPPED" -> builder.state(EPrinterState.IDLE);
            default -> builder.state(EPrinterState.UNKNOWN);
        }
    }
}
