package pfl.domain.printer.elegoo;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EProtocolKind;
import pfl.dal.PrinterConfig;
import pfl.domain.printer.AbstractPrinterAdapter;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IStatusListener;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Elegoo printers speaking SDCP over a WebSocket. The printer pushes a full status every few
 * seconds once the socket is open, so no polling is needed.
 * @since 17/01/2026
 */
public class ElegooSdcpAdapter extends AbstractPrinterAdapter {
    private static final Logger logger = LoggerFactory.getLogger(ElegooSdcpAdapter.class);
    private static final long CONNECT_TIMEOUT_MS = 5_000;
    private static final long SEND_TIMEOUT_MS = 5_000;

    static final int CMD_STATUS = 0;
    static final int CMD_PAUSE = 129;
    static final int CMD_STOP = 130;
    static final int CMD_RESUME = 131;

    private final HttpClient httpClient;
    private volatile String mainboardId;
    private WebSocket webSocket;

    public ElegooSdcpAdapter(PrinterConfig config, IStatusListener statusListener, HttpClient httpClient) {
        super(config, statusListener);
        this.httpClient = httpClient;
        this.mainboardId = config.serial();
    }

    @Override
    public EProtocolKind getProtocolKind() {
        return EProtocolKind.ELEGOO;
    }

    URI webSocketUri() {
        return URI.create("ws://" + config.host() + ":" + config.port() + "/websocket");
    }

    @Override
    public synchronized boolean connect() {
        if (webSocket != null && isConnected()) {
            return true;
        }
        closeSocket();
        try {
            webSocket = httpClient.newWebSocketBuilder()
                    .connectTimeout(Duration.ofMillis(CONNECT_TIMEOUT_MS))
                    .buildAsync(webSocketUri(), new SdcpListener())
                    .get(CONNECT_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            recordTransportError("SDCP connect to " + webSocketUri() + " failed", cause);
            markConnected(false);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        markConnected(true);
        logger.info("[{}] SDCP socket open to {}", getPrinterId(), webSocketUri());
        requestRefresh();
        return true;
    }

    @Override
    public synchronized void disconnect() {
        closeSocket();
        markConnected(false);
    }

    private void closeSocket() {
        WebSocket current = webSocket;
        webSocket = null;
        if (current != null && !current.isOutputClosed()) {
            current.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                    .exceptionally(e -> {
                        logger.debug("[{}] Close handshake failed: {}", getPrinterId(), e.getMessage());
                        current.abort();
                        return null;
                    });
        }
    }

    @Override
    public void requestRefresh() {
        sendCommand(CMD_STATUS);
    }

    @Override
    public boolean pause() {
        return sendCommand(CMD_PAUSE);
    }

    @Override
    public boolean resume() {
        return sendCommand(CMD_RESUME);
    }

    @Override
    public boolean cancel() {
        return sendCommand(CMD_STOP);
    }

    /**
     * SDCP request envelope addressed to the printer mainboard
     */
    static String requestEnvelope(int cmd, String mainboardId, long timestampSeconds) {
        String board = mainboardId == null ? "" : mainboardId;
        JsonObject data = new JsonObject();
        data.addProperty("Cmd", cmd);
        data.add("Data", new JsonObject());
        data.addProperty("RequestID", UUID.randomUUID().toString().replace("-", ""));
        data.addProperty("MainboardID", board);
        data.addProperty("TimeStamp", timestampSeconds);
        data.addProperty("From", 0);

        JsonObject envelope = new JsonObject();
        envelope.addProperty("Id", UUID.randomUUID().toString().replace("-", ""));
        envelope.add("Data", data);
        envelope.addProperty("Topic", "sdcp/request/" + board);
        return envelope.toString();
    }

    private synchronized boolean sendCommand(int cmd) {
        WebSocket current = webSocket;
        if (current == null || current.isOutputClosed()) {
            logger.warn("[{}] Cannot send SDCP command {}, socket not open", getPrinterId(), cmd);
            return false;
        }
        try {
            current.sendText(requestEnvelope(cmd, mainboardId, System.currentTimeMillis() / 1000), true)
                    .get(SEND_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            logger.debug("[{}] SDCP command {} sent", getPrinterId(), cmd);
            return true;
        } catch (ExecutionException | TimeoutException e) {
            recordTransportError("SDCP command " + cmd + " failed", e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Parse one complete text frame. Malformed or unrelated messages are dropped.
     */
    void handleMessage(String text) {
        JsonObject message;
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                return;
            }
            message = element.getAsJsonObject();
        } catch (JsonParseException e) {
            logger.warn("[{}] Malformed SDCP message dropped: {}", getPrinterId(), e.getMessage());
            return;
        }

        if (!ElegooStatusParser.isStatusTopic(message)) {
            logger.debug("[{}] SDCP message ignored: {}", getPrinterId(), text);
            return;
        }
        String board = ElegooStatusParser.mainboardId(message);
        if (board != null && !board.isBlank()) {
            mainboardId = board;
        }
        try {
            CanonicalStatus status = ElegooStatusParser.parse(getPrinterId(), message);
            if (status != null) {
                publishStatus(status);
            }
        } catch (IllegalStateException | NumberFormatException e) {
            logger.warn("[{}] Unreadable SDCP status dropped: {}", getPrinterId(), e.getMessage());
        }
    }

    public String getMainboardId() {
        return mainboardId;
    }

    private class SdcpListener implements WebSocket.Listener {
        private final StringBuilder frame = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket socket, CharSequence data, boolean last) {
            frame.append(data);
            if (last) {
                String text = frame.toString();
                frame.setLength(0);
                handleMessage(text);
            }
            socket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket socket, int statusCode, String reason) {
            recordTransportError("SDCP socket closed (" + statusCode + " " + reason + ")", null);
            markConnected(false);
            return null;
        }

        @Override
        public void onError(WebSocket socket, Throwable error) {
            recordTransportError("SDCP socket error", error);
            markConnected(false);
        }
    }
}
