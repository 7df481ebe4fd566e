package pfl.domain.printer.moonraker;

import com.google.gson.JsonObject;
import pfl.common.EJobOutcome;
import pfl.common.EPrinterState;
import pfl.domain.printer.CanonicalStatus;

import java.util.Locale;

import static pfl.domain.printer.JsonFields.decimal;
import static pfl.domain.printer.JsonFields.integer;
import static pfl.domain.printer.JsonFields.object;
import static pfl.domain.printer.JsonFields.string;

/**
 * Moonraker {@code /printer/objects/query} answer to canonical status
 * @since 13/01/2026
 */
public final class MoonrakerStatusMapper {

    /**
     * Objects requested on every poll
     */
    public static final String QUERY = "/printer/objects/query?heater_bed&extruder&print_stats&virtual_sdcard&display_status";

    private MoonrakerStatusMapper() {
    }

    public static CanonicalStatus fromQuery(String printerId, JsonObject response) {
        JsonObject status = object(object(response, "result"), "status");
        if (status == null) {
            throw new IllegalStateException("Moonraker answer has no result.status");
        }
        JsonObject bed = object(status, "heater_bed");
        JsonObject extruder = object(status, "extruder");
        JsonObject printStats = object(status, "print_stats");
        JsonObject layers = object(printStats, "info");
        JsonObject sdcard = object(status, "virtual_sdcard");

        CanonicalStatus.Builder builder = CanonicalStatus.builder(printerId)
                .bedTemp(decimal(bed, "temperature", 0))
                .bedTarget(decimal(bed, "target", 0))
                .nozzleTemp(decimal(extruder, "temperature", 0))
                .nozzleTarget(decimal(extruder, "target", 0))
                .currentLayer(integer(layers, "current_layer", 0))
                .totalLayers(integer(layers, "total_layer", 0))
                .progressPercent(Math.round(decimal(sdcard, "progress", 0) * 1000) / 10.0)
                .filename(string(printStats, "filename", null))
                .rawPayload(status.toString());

        String state = string(printStats, "state", "standby").trim().toLowerCase(Locale.ROOT);
        switch (state) {
            case "printing" -> builder.state(EPrinterState.PRINTING);
            case "paused" -> builder.state(EPrinterState.PAUSED);
            case "error" -> {
                String message = string(printStats, "message", null);
                builder.state(EPrinterState.ERROR).errorCode("KLIPPER_ERROR").errorMessage(message);
            }
            case "complete" -> builder.state(EPrinterState.IDLE).jobOutcome(EJobOutcome.FINISHED);
            case "standby", "cancelled" -> builder.state(EPrinterState.IDLE);
            default -> builder.state(EPrinterState.UNKNOWN);
        }
        return builder.build();
    }
}
