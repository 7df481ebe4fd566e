package pfl.domain.printer.bambu;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import pfl.common.EJobOutcome;
import pfl.common.EPrinterState;
import pfl.domain.printer.CanonicalStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static pfl.domain.printer.JsonFields.array;
import static pfl.domain.printer.JsonFields.decimal;
import static pfl.domain.printer.JsonFields.has;
import static pfl.domain.printer.JsonFields.integer;
import static pfl.domain.printer.JsonFields.longValue;
import static pfl.domain.printer.JsonFields.string;

/**
 * Running picture of a Bambu printer built from the {@code print} section of report messages.
 * The printer sends one full report after {@code pushall} and partial deltas afterwards; a field
 * missing from a delta keeps its previous value.
 * <p>
 * Not thread safe, owned by the MQTT callback thread of one adapter.
 *
 * @since 16/01/2026
 */
public class BambuReport {

    /**
     * One Health Management System entry
     */
    public record HmsEntry(long attr, long code) {

        public String formatted() {
            return String.format("%08X_%08X", attr, code);
        }

        /**
         * Severity level carried in the upper half of the code: 1 fatal, 2 serious, 3 common, 4 info
         */
        public String severity() {
            return switch ((int) ((code >>> 16) & 0xFFFF)) {
                case 1 -> "fatal";
                case 2 -> "serious";
                case 3 -> "common";
                default -> "info";
            };
        }
    }

    private String gcodeState;
    private Double percent;
    private Integer layer;
    private Integer totalLayers;
    private Integer remainingMinutes;
    private String gcodeFile;
    private String subtaskName;
    private Double bedTemp;
    private Double bedTarget;
    private Double nozzleTemp;
    private Double nozzleTarget;
    private long printError;
    private List<HmsEntry> hms = Collections.emptyList();
    private String lastPayload;

    /**
     * Apply a full report message ({@code {"print": {...}}}).
     * @return false when the message carries no {@code print} section, e.g. a command echo
     */
    public boolean merge(JsonObject message) {
        JsonElement printElement = message.get("print");
        if (printElement == null || !printElement.isJsonObject()) {
            return false;
        }
        JsonObject print = printElement.getAsJsonObject();
        lastPayload = message.toString();

        String state = string(print, "gcode_state", null);
        if (state != null) {
            gcodeState = state.trim().toUpperCase(Locale.ROOT);
        }
        if (has(print, "mc_percent")) {
            percent = decimal(print, "mc_percent", 0);
        }
        if (has(print, "layer_num")) {
            layer = integer(print, "layer_num", 0);
        }
        if (has(print, "total_layer_num")) {
            totalLayers = integer(print, "total_layer_num", 0);
        }
        if (has(print, "mc_remaining_time")) {
            remainingMinutes = integer(print, "mc_remaining_time", 0);
        }
        if (has(print, "gcode_file")) {
            gcodeFile = string(print, "gcode_file", null);
        }
        if (has(print, "subtask_name")) {
            subtaskName = string(print, "subtask_name", null);
        }
        if (has(print, "bed_temper")) {
            bedTemp = decimal(print, "bed_temper", 0);
        }
        if (has(print, "bed_target_temper")) {
            bedTarget = decimal(print, "bed_target_temper", 0);
        }
        if (has(print, "nozzle_temper")) {
            nozzleTemp = decimal(print, "nozzle_temper", 0);
        }
        if (has(print, "nozzle_target_temper")) {
            nozzleTarget = decimal(print, "nozzle_target_temper", 0);
        }
        if (has(print, "print_error")) {
            printError = longValue(print, "print_error", 0);
        }
        JsonArray hmsArray = array(print, "hms");
        if (hmsArray != null) {
            hms = parseHms(hmsArray);
        }
        return true;
    }

    private static List<HmsEntry> parseHms(JsonArray hmsArray) {
        List<HmsEntry> entries = new ArrayList<>(hmsArray.size());
        for (JsonElement element : hmsArray) {
            if (element.isJsonObject()) {
                JsonObject entry = element.getAsJsonObject();
                entries.add(new HmsEntry(longValue(entry, "attr", 0), longValue(entry, "code", 0)));
            }
        }
        return Collections.unmodifiableList(entries);
    }

    /**
     * {@code print_error} as {@code XXXX_YYYY}, null when the printer reports no error
     */
    public String formattedPrintError() {
        if (printError == 0) {
            return null;
        }
        return String.format("%04X_%04X", (printError >>> 16) & 0xFFFF, printError & 0xFFFF);
    }

    public List<HmsEntry> getHms() {
        return hms;
    }

    public String getGcodeState() {
        return gcodeState;
    }

    public CanonicalStatus toStatus(String printerId) {
        CanonicalStatus.Builder builder = CanonicalStatus.builder(printerId)
                .progressPercent(percent != null ? percent : 0)
                .currentLayer(layer != null ? layer : 0)
                .totalLayers(totalLayers != null ? totalLayers : 0)
                .timeRemainingSeconds(remainingMinutes != null ? remainingMinutes * 60 : 0)
                .bedTemp(bedTemp != null ? bedTemp : 0)
                .bedTarget(bedTarget != null ? bedTarget : 0)
                .nozzleTemp(nozzleTemp != null ? nozzleTemp : 0)
                .nozzleTarget(nozzleTarget != null ? nozzleTarget : 0)
                .filename(subtaskName != null && !subtaskName.isBlank() ? subtaskName : gcodeFile)
                .rawPayload(lastPayload);

        String state = gcodeState == null ? "" : gcodeState;
        switch (state) {
            case "IDLE" -> builder.state(EPrinterState.IDLE);
            case "RUNNING", "PREPARE", "SLICING" -> builder.state(EPrinterState.PRINTING);
            case "PAUSE" -> builder.state(EPrinterState.PAUSED);
            case "FINISH" -> builder.state(EPrinterState.IDLE).jobOutcome(EJobOutcome.FINISHED);
            case "FAILED" -> builder.state(EPrinterState.IDLE).jobOutcome(EJobOutcome.FAILED);
            default -> builder.state(EPrinterState.UNKNOWN);
        }

        String error = formattedPrintError();
        if (error != null) {
            builder.errorCode(error).errorMessage("Printer error " + error);
        } else if (!hms.isEmpty()) {
            HmsEntry first = hms.get(0);
            builder.errorCode("HMS_" + first.formatted())
                    .errorMessage("HMS " + first.severity() + " " + first.formatted()
                            + (hms.size() > 1 ? " (+" + (hms.size() - 1) + " more)" : ""));
        }
        return builder.build();
    }
}
