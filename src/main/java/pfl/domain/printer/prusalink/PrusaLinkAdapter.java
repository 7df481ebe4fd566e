package pfl.domain.printer.prusalink;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EProtocolKind;
import pfl.dal.PrinterConfig;
import pfl.domain.printer.AbstractPollingAdapter;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.HttpStatusException;
import pfl.domain.printer.IStatusListener;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.concurrent.ExecutorService;

/**
 * Prusa printers through PrusaLink. Uses the combined {@code /api/v1/status} call and falls back to
 * the two legacy calls when the firmware does not have it.
 * @since 13/01/2026
 */
public class PrusaLinkAdapter extends AbstractPollingAdapter {
    private static final Logger logger = LoggerFactory.getLogger(PrusaLinkAdapter.class);

    private volatile boolean v1Supported = true;
    private volatile Long currentJobId;

    public PrusaLinkAdapter(PrinterConfig config, IStatusListener statusListener, HttpClient httpClient,
                            ExecutorService workerPool, long pollIntervalMs, int maxFailures) {
        super(config, statusListener, httpClient, workerPool, pollIntervalMs, maxFailures);
    }

    @Override
    public EProtocolKind getProtocolKind() {
        return EProtocolKind.PRUSALINK;
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

    @Override
    protected void probe() throws IOException, InterruptedException {
        getJson("/api/version");
    }

    @Override
    protected CanonicalStatus fetchStatus() throws IOException, InterruptedException {
        if (v1Supported) {
            try {
                JsonObject status = getJson("/api/v1/status");
                currentJobId = PrusaLinkStatusMapper.jobId(status);
                JsonObject jobDetails = currentJobId != null ? getJson("/api/v1/job") : null;
                return PrusaLinkStatusMapper.fromV1(getPrinterId(), status, jobDetails);
            } catch (HttpStatusException e) {
                if (e.getStatusCode() != 404) {
                    throw e;
                }
                v1Supported = false;
                logger.info("[{}] /api/v1/status not available, using legacy endpoints", getPrinterId());
            }
        }
        JsonObject printer = getJson("/api/printer");
        JsonObject job = getJson("/api/job");
        return PrusaLinkStatusMapper.fromLegacy(getPrinterId(), printer, job);
    }

    @Override
    public boolean pause() {
        Long jobId = currentJobId;
        return jobId != null && sendCommand("PUT", "/api/v1/job/" + jobId + "/pause", null);
    }

    @Override
    public boolean resume() {
        Long jobId = currentJobId;
        return jobId != null && sendCommand("PUT", "/api/v1/job/" + jobId + "/resume", null);
    }

    @Override
    public boolean cancel() {
        Long jobId = currentJobId;
        return jobId != null && sendCommand("DELETE", "/api/v1/job/" + jobId, null);
    }
}
