package pfl.domain.printer.moonraker;

import com.google.gson.JsonObject;
import pfl.common.EHeater;
import pfl.common.EProtocolKind;
import pfl.dal.PrinterConfig;
import pfl.domain.printer.AbstractPollingAdapter;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IStatusListener;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

import static pfl.domain.printer.JsonFields.bool;
import static pfl.domain.printer.JsonFields.object;

/**
 * Klipper printers through the Moonraker HTTP API
 * @since 13/01/2026
 */
public class MoonrakerAdapter extends AbstractPollingAdapter {

    public MoonrakerAdapter(PrinterConfig config, IStatusListener statusListener, HttpClient httpClient,
                            ExecutorService workerPool, long pollIntervalMs, int maxFailures) {
        super(config, statusListener, httpClient, workerPool, pollIntervalMs, maxFailures);
    }

    @Override
    public EProtocolKind getProtocolKind() {
        return EProtocolKind.MOONRAKER;
    }

    @Override
    protected String baseUrl() {
        return "http://" + config.host() + ":" + config.port();
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("X-Api-Key", config.apiKey());
        }
    }

    /**
     * Moonraker answers even when Klipper itself is down; such a printer counts as unreachable
     */
    @Override
    protected void probe() throws IOException, InterruptedException {
        JsonObject info = getJson("/server/info");
        if (!bool(object(info, "result"), "klippy_connected", false)) {
            throw new IOException("Klippy not connected");
        }
    }

    @Override
    protected CanonicalStatus fetchStatus() throws IOException, InterruptedException {
        return MoonrakerStatusMapper.fromQuery(getPrinterId(), getJson(MoonrakerStatusMapper.QUERY));
    }

    @Override
    public boolean pause() {
        return sendCommand("POST", "/printer/print/pause", null);
    }

    @Override
    public boolean resume() {
        return sendCommand("POST", "/printer/print/resume", null);
    }

    @Override
    public boolean cancel() {
        return sendCommand("POST", "/printer/print/cancel", null);
    }

    @Override
    public boolean setTemperature(EHeater heater, double target) {
        String gcode = String.format(Locale.ROOT, "%s S%.0f", heater == EHeater.BED ? "M140" : "M104", target);
        return sendCommand("POST", "/printer/gcode/script?script=" + URLEncoder.encode(gcode, StandardCharsets.UTF_8), null);
    }
}
