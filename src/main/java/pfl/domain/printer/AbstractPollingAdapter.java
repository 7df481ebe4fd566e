package pfl.domain.printer;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.dal.PrinterConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Request/response printers. One worker per printer polls the device on a fixed interval and
 * publishes a full snapshot each time. After {@code maxFailures} consecutive failed polls the
 * adapter reports itself disconnected and the worker ends; the supervisor reconnects it.
 * @since 13/01/2026
 */
public abstract class AbstractPollingAdapter extends AbstractPrinterAdapter {
    private static final Logger logger = LoggerFactory.getLogger(AbstractPollingAdapter.class);
    protected static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    protected final HttpClient httpClient;
    private final ExecutorService workerPool;
    private final long pollIntervalMs;
    private final int maxFailures;

    private volatile StopSignal stopSignal;
    private int consecutiveFailures;

    protected AbstractPollingAdapter(PrinterConfig config, IStatusListener statusListener, HttpClient httpClient,
                                     ExecutorService workerPool, long pollIntervalMs, int maxFailures) {
        super(config, statusListener);
        this.httpClient = httpClient;
        this.workerPool = workerPool;
        this.pollIntervalMs = pollIntervalMs;
        this.maxFailures = maxFailures;
    }

    /**
     * Cheap request proving the device answers. Throws when it does not.
     */
    protected abstract void probe() throws IOException, InterruptedException;

    /**
     * Full snapshot from the device
     */
    protected abstract CanonicalStatus fetchStatus() throws IOException, InterruptedException;

    protected abstract String baseUrl();

    /**
     * Add authentication headers, if the device needs any
     */
    protected void authorize(HttpRequest.Builder builder) {
    }

    @Override
    public synchronized boolean connect() {
        if (isConnected() && stopSignal != null && !stopSignal.isStopped()) {
            return true;
        }
        try {
            probe();
        } catch (IOException e) {
            recordTransportError("Cannot reach " + getProtocolKind() + " at " + config.host(), e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }

        StopSignal signal = new StopSignal();
        stopSignal = signal;
        consecutiveFailures = 0;
        markConnected(true);
        pollOnce();

        try {
            workerPool.execute(() -> pollLoop(signal));
        } catch (RejectedExecutionException e) {
            recordTransportError("Poll worker rejected, executor is shut down", e);
            signal.stop();
            markConnected(false);
            return false;
        }
        return isConnected();
    }

    @Override
    public synchronized void disconnect() {
        StopSignal signal = stopSignal;
        if (signal != null) {
            signal.stop();
        }
        markConnected(false);
    }

    private void pollLoop(StopSignal signal) {
        Thread.currentThread().setName("poll-" + getPrinterId());
        logger.debug("[{}] Poll worker started, interval {}ms", getPrinterId(), pollIntervalMs);
        try {
            while (!signal.await(pollIntervalMs)) {
                if (!pollOnce()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("[{}] Poll worker stopped", getPrinterId());
    }

    /**
     * @return false when the adapter gave up and marked itself disconnected
     */
    private boolean pollOnce() {
        try {
            CanonicalStatus status = fetchStatus();
            consecutiveFailures = 0;
            publishStatus(status);
            return true;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            logger.warn("[{}] Unreadable status from {}, message dropped: {}", getPrinterId(), getProtocolKind(), e.getMessage());
            return true;
        } catch (IOException e) {
            consecutiveFailures++;
            recordTransportError("Poll failed (" + consecutiveFailures + "/" + maxFailures + ")", e);
            if (consecutiveFailures >= maxFailures) {
                markConnected(false);
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    protected JsonObject getJson(String path) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl() + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET();
        authorize(builder);
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new HttpStatusException(path, response.statusCode());
        }
        if (response.statusCode() == 204 || response.body() == null || response.body().isBlank()) {
            return new JsonObject();
        }
        JsonElement element = JsonParser.parseString(response.body());
        return element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
    }

    /**
     * Fire a command request. Never throws.
     * @return true on a 2xx answer
     */
    protected boolean sendCommand(String method, String path, String jsonBody) {
        HttpRequest.BodyPublisher body = jsonBody == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(jsonBody);
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl() + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .method(method, body);
        authorize(builder);
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 == 2) {
                logger.info("[{}] {} {} accepted", getPrinterId(), method, path);
                return true;
            }
            logger.warn("[{}] {} {} rejected with HTTP {}", getPrinterId(), method, path, response.statusCode());
            return false;
        } catch (IOException e) {
            recordTransportError(method + " " + path + " failed", e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
