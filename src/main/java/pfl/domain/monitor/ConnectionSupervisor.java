package pfl.domain.monitor;

import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EProtocolKind;
import pfl.common.EventTypes;
import pfl.dal.MonitorConfig;
import pfl.dal.PrinterConfig;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IPrinterAdapter;
import pfl.domain.printer.IPrinterAdapterFactory;
import pfl.domain.printer.IStatusListener;
import pfl.domain.printer.StopSignal;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Keeps one printer connected. The health sweep calls {@link #checkHealth(long)}; a dead or silent
 * transport is torn down, given the settle time and replaced by a fresh adapter. Attempts are
 * spaced by the reconnect delay. Failures are logged and retried on the next sweep.
 *
 * @since 18/01/2026
 */
public class ConnectionSupervisor {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionSupervisor.class);
    private static final String SOURCE = "monitor";

    private final PrinterConfig config;
    private final IPrinterAdapterFactory adapterFactory;
    private final IStatusListener statusListener;
    private final MonitorConfig monitorConfig;
    private final IEventBus eventBus;
    private final PrinterConnection connection;
    private final StopSignal stopSignal = new StopSignal();

    private Disposable connectionSubscription;

    public ConnectionSupervisor(PrinterConfig config, IPrinterAdapterFactory adapterFactory, IStatusListener statusListener,
                                MonitorConfig monitorConfig, IEventBus eventBus) {
        this.config = config;
        this.adapterFactory = adapterFactory;
        this.statusListener = statusListener;
        this.monitorConfig = monitorConfig;
        this.eventBus = eventBus;
        this.connection = new PrinterConnection(config.id(), config.protocol());
    }

    /**
     * First connection attempt. A failure leaves the printer OFFLINE until the next sweep.
     */
    public synchronized boolean start() {
        return connectFresh(System.currentTimeMillis());
    }

    /**
     * One health sweep step. Blocks for at most one teardown plus one connect.
     */
    public synchronized void checkHealth(long now) {
        if (stopSignal.isStopped()) {
            return;
        }
        IPrinterAdapter adapter = connection.getAdapter();
        if (adapter == null) {
            reconnect(now, "no transport");
            return;
        }

        if (!adapter.isConnected()) {
            onConnectionChange(false);
            reconnect(now, "transport disconnected");
            return;
        }

        connection.touch(adapter.getLastMessageAt());
        long silentFor = now - connection.getLastHeartbeat();
        long threshold = monitorConfig.stalenessThresholdMs(config.protocol());
        if (silentFor > threshold) {
            logger.warn("[{}] No data for {}s (threshold {}s), connection considered stale",
                    config.id(), silentFor / 1000, threshold / 1000);
            onConnectionChange(false);
            reconnect(now, "stale");
            return;
        }

        if (config.protocol().getTransportShape() == EProtocolKind.ETransportShape.PUSH_DELTA) {
            adapter.requestRefresh();
        }
    }

    private void reconnect(long now, String reason) {
        long sinceLastAttempt = now - connection.getLastAttemptAt();
        if (connection.getLastAttemptAt() > 0 && sinceLastAttempt < monitorConfig.reconnectDelayMs()) {
            logger.debug("[{}] Reconnect ({}) postponed, last attempt {}ms ago", config.id(), reason, sinceLastAttempt);
            return;
        }
        logger.info("[{}] Reconnecting {} printer ({})", config.id(), config.protocol(), reason);
        connection.incrementReconnects();
        teardown();
        if (!settle()) {
            return;
        }
        connectFresh(now);
    }

    /**
     * Wait for the device to drop the old session. False when stopped meanwhile.
     */
    private boolean settle() {
        if (monitorConfig.settleTimeMs() <= 0) {
            return !stopSignal.isStopped();
        }
        try {
            return !stopSignal.await(monitorConfig.settleTimeMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean connectFresh(long now) {
        if (stopSignal.isStopped()) {
            return false;
        }
        connection.markAttempt(now);
        IPrinterAdapter adapter = adapterFactory.create(config, statusListener);
        connection.setAdapter(adapter);
        connectionSubscription = adapter.getConnectionChanges().subscribe(this::onConnectionChange);

        boolean connected = adapter.connect();
        if (connected) {
            connection.touch(System.currentTimeMillis());
            onConnectionChange(true);
        } else {
            logger.warn("[{}] Connect to {}:{} failed, retrying on next health check", config.id(), config.host(), config.port());
        }
        return connected;
    }

    private void teardown() {
        if (connectionSubscription != null) {
            connectionSubscription.dispose();
            connectionSubscription = null;
        }
        IPrinterAdapter old = connection.getAdapter();
        if (old != null) {
            try {
                old.disconnect();
            } catch (RuntimeException e) {
                logger.warn("[{}] Error while closing old transport: {}", config.id(), e.getMessage());
            }
        }
        connection.setAdapter(null);
    }

    private void onConnectionChange(boolean nowConnected) {
        if (!connection.setConnected(nowConnected)) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("printer_id", config.id());
        data.put("printer_name", config.getDisplayName());
        data.put("protocol", config.protocol().name().toLowerCase(Locale.ROOT));
        if (nowConnected) {
            eventBus.publish(new Event(EventTypes.PRINTER_CONNECTED, SOURCE, data));
        } else {
            IPrinterAdapter adapter = connection.getAdapter();
            String lastError = adapter != null ? adapter.getStatus().getLastError() : null;
            if (lastError != null) {
                data.put("last_error", lastError);
            }
            eventBus.publish(new Event(EventTypes.PRINTER_DISCONNECTED, SOURCE, data));
        }
    }

    /**
     * Stop supervising and close the transport. The adapter worker exits after its current blocking call.
     * No {@code printer.disconnected} is published: the printer was not lost, monitoring of it ended.
     */
    public void stop() {
        // fire first so a sweep waiting in settle() wakes up and releases the lock
        stopSignal.stop();
        synchronized (this) {
            teardown();
            connection.setConnected(false);
        }
        logger.info("[{}] Supervisor stopped", config.id());
    }

    /**
     * Latest snapshot, OFFLINE when there is no adapter
     */
    public CanonicalStatus getStatus() {
        IPrinterAdapter adapter = connection.getAdapter();
        if (adapter == null) {
            return CanonicalStatus.offline(config.id(), "Not connected");
        }
        return adapter.getStatus();
    }

    /**
     * Current adapter, null between teardown and reconnect
     */
    public IPrinterAdapter getAdapter() {
        return connection.getAdapter();
    }

    public PrinterConfig getConfig() {
        return config;
    }

    public PrinterConnection getConnection() {
        return connection;
    }

    public boolean isStopped() {
        return stopSignal.isStopped();
    }
}
