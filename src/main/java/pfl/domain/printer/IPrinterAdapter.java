package pfl.domain.printer;

import io.reactivex.rxjava3.core.Observable;
import pfl.common.EHeater;
import pfl.common.EProtocolKind;

/**
 * One printer, one wire protocol. Implementations never throw transport errors to the caller:
 * failures are logged, kept as {@code lastError} and reported through return values.
 * @since 12/01/2026
 */
public interface IPrinterAdapter {
    String getPrinterId();

    EProtocolKind getProtocolKind();

    /**
     * Open the transport.
     * @return true when the printer is reachable and status flow has started
     */
    boolean connect();

    /**
     * Close the transport and release its threads. Safe to call more than once.
     */
    void disconnect();

    boolean isConnected();

    /**
     * Latest snapshot. Never blocks on I/O and never returns null.
     */
    CanonicalStatus getStatus();

    /**
     * @return epoch millis of the last successfully parsed message, 0 if none yet
     */
    long getLastMessageAt();

    /**
     * Ask the device for a full status push. No-op for protocols that poll anyway.
     */
    void requestRefresh();

    /**
     * Emits true on connect and false on transport loss.
     */
    Observable<Boolean> getConnectionChanges();

    boolean pause();

    boolean resume();

    boolean cancel();

    boolean setTemperature(EHeater heater, double target);
}
