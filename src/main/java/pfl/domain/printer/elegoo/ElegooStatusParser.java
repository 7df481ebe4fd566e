package pfl.domain.printer.elegoo;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import pfl.common.EJobOutcome;
import pfl.common.EPrinterState;
import pfl.domain.printer.CanonicalStatus;

import static pfl.domain.printer.JsonFields.decimal;
import static pfl.domain.printer.JsonFields.integer;
import static pfl.domain.printer.JsonFields.object;
import static pfl.domain.printer.JsonFields.string;

/**
 * SDCP status messages to canonical status. Every status message is a full snapshot, nothing is
 * carried over from the previous one.
 * @since 17/01/2026
 */
public final class ElegooStatusParser {
    static final int CURRENT_STATUS_PRINTING = 1;

    static final int PRINT_STATUS_PAUSED = 5;
    static final int PRINT_STATUS_PAUSING = 6;
    static final int PRINT_STATUS_STOPPING = 7;
    static final int PRINT_STATUS_PRINTING = 8;
    static final int PRINT_STATUS_COMPLETE = 16;

    private ElegooStatusParser() {
    }

    public static boolean isStatusTopic(JsonObject message) {
        return string(message, "Topic", "").startsWith("sdcp/status/");
    }

    public static String mainboardId(JsonObject message) {
        String id = string(message, "MainboardID", null);
        if (id == null) {
            id = string(object(message, "Data"), "MainboardID", null);
        }
        return id;
    }

    /**
     * @return the snapshot, or null when the message has no {@code Status} block
     */
    public static CanonicalStatus parse(String printerId, JsonObject message) {
        JsonObject status = object(message, "Status");
        if (status == null) {
            status = object(object(message, "Data"), "Status");
        }
        if (status == null) {
            return null;
        }

        int currentStatus = currentStatus(status);
        JsonObject printInfo = object(status, "PrintInfo");
        int printStatus = integer(printInfo, "Status", 0);

        CanonicalStatus.Builder builder = CanonicalStatus.builder(printerId)
                .bedTemp(decimal(status, "TempOfHotbed", 0))
                .bedTarget(decimal(status, "TempTargetHotbed", 0))
                .nozzleTemp(decimal(status, "TempOfNozzle", 0))
                .nozzleTarget(decimal(status, "TempTargetNozzle", 0))
                .rawPayload(message.toString());

        if (printInfo != null) {
            int currentTicks = integer(printInfo, "CurrentTicks", 0);
            int totalTicks = integer(printInfo, "TotalTicks", 0);
            builder.currentLayer(integer(printInfo, "CurrentLayer", 0))
                    .totalLayers(integer(printInfo, "TotalLayer", 0))
                    .progressPercent(decimal(printInfo, "Progress", 0))
                    .filename(string(printInfo, "Filename", null))
                    .timeRemainingSeconds(totalTicks > 0 && currentTicks > 0 ? Math.max(0, totalTicks - currentTicks) : 0);

            int errorNumber = integer(printInfo, "ErrorNumber", 0);
            if (errorNumber != 0) {
                builder.errorCode("SDCP_" + errorNumber).errorMessage("SDCP error " + errorNumber);
            }
        }

        if (printStatus == PRINT_STATUS_PRINTING || currentStatus == CURRENT_STATUS_PRINTING
                || printStatus == PRINT_STATUS_STOPPING) {
            builder.state(EPrinterState.PRINTING);
        } else if (printStatus == PRINT_STATUS_PAUSED || printStatus == PRINT_STATUS_PAUSING) {
            builder.state(EPrinterState.PAUSED);
        } else if (printStatus == PRINT_STATUS_COMPLETE) {
            builder.state(EPrinterState.IDLE).jobOutcome(EJobOutcome.FINISHED);
        } else {
            builder.state(EPrinterState.IDLE);
        }
        return builder.build();
    }

    /**
     * {@code CurrentStatus} is a list on current firmware and a plain number on older ones
     */
    private static int currentStatus(JsonObject status) {
        JsonElement element = status.get("CurrentStatus");
        if (element == null || element.isJsonNull()) {
            return 0;
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            return array.isEmpty() || !array.get(0).isJsonPrimitive() ? 0 : array.get(0).getAsInt();
        }
        return integer(status, "CurrentStatus", 0);
    }
}
