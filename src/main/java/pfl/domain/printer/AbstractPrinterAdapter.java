package pfl.domain.printer;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EHeater;
import pfl.common.EPrinterState;
import pfl.dal.PrinterConfig;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared plumbing for adapters: the locked status snapshot, the listener hand-off and
 * connection change notifications
 * @since 12/01/2026
 */
public abstract class AbstractPrinterAdapter implements IPrinterAdapter {
    private static final Logger logger = LoggerFactory.getLogger(AbstractPrinterAdapter.class);

    protected final PrinterConfig config;
    private final IStatusListener statusListener;
    private final ReentrantLock statusLock = new ReentrantLock();
    private final Subject<Boolean> connectionChanges = PublishSubject.<Boolean>create().toSerialized();

    private CanonicalStatus status;
    private volatile boolean connected = false;
    private volatile long lastMessageAt = 0;
    private volatile String lastError;

    protected AbstractPrinterAdapter(PrinterConfig config, IStatusListener statusListener) {
        this.config = config;
        this.statusListener = statusListener;
        this.status = CanonicalStatus.offline(config.id(), null);
    }

    @Override
    public String getPrinterId() {
        return config.id();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public long getLastMessageAt() {
        return lastMessageAt;
    }

    @Override
    public CanonicalStatus getStatus() {
        statusLock.lock();
        try {
            if (!connected && status.getState() != EPrinterState.OFFLINE) {
                return status.asOffline(lastError);
            }
            return status;
        } finally {
            statusLock.unlock();
        }
    }

    @Override
    public Observable<Boolean> getConnectionChanges() {
        return connectionChanges.hide();
    }

    @Override
    public void requestRefresh() {
        // pull protocols refresh on every poll
    }

    @Override
    public boolean pause() {
        logger.warn("[{}] pause is not supported by {}", getPrinterId(), getProtocolKind());
        return false;
    }

    @Override
    public boolean resume() {
        logger.warn("[{}] resume is not supported by {}", getPrinterId(), getProtocolKind());
        return false;
    }

    @Override
    public boolean cancel() {
        logger.warn("[{}] cancel is not supported by {}", getPrinterId(), getProtocolKind());
        return false;
    }

    @Override
    public boolean setTemperature(EHeater heater, double target) {
        logger.warn("[{}] set temperature is not supported by {}", getPrinterId(), getProtocolKind());
        return false;
    }

    /**
     * Replace the snapshot and hand it to the listener. The listener runs outside the lock.
     */
    protected void publishStatus(CanonicalStatus newStatus) {
        statusLock.lock();
        try {
            status = newStatus;
            lastMessageAt = System.currentTimeMillis();
        } finally {
            statusLock.unlock();
        }

        try {
            statusListener.onStatusUpdate(newStatus);
        } catch (Exception e) {
            logger.error("[{}] Status listener failed", getPrinterId(), e);
        }
    }

    protected CanonicalStatus currentStatus() {
        statusLock.lock();
        try {
            return status;
        } finally {
            statusLock.unlock();
        }
    }

    protected void markConnected(boolean nowConnected) {
        boolean changed = connected != nowConnected;
        connected = nowConnected;
        if (nowConnected) {
            lastError = null;
        }
        if (changed) {
            logger.info("[{}] {} transport {}", getPrinterId(), getProtocolKind(), nowConnected ? "connected" : "disconnected");
            connectionChanges.onNext(nowConnected);
        }
    }

    protected void recordTransportError(String message, Throwable cause) {
        lastError = message;
        if (cause != null) {
            logger.warn("[{}] {}: {}", getPrinterId(), message, cause.getMessage());
            logger.debug("[{}] Transport error details", getPrinterId(), cause);
        } else {
            logger.warn("[{}] {}", getPrinterId(), message);
        }
    }

    protected String getLastError() {
        return lastError;
    }
}
