package pfl.domain.monitor;

import pfl.common.EProtocolKind;
import pfl.domain.printer.IPrinterAdapter;

/**
 * Mutable per-printer connection state owned by one {@link ConnectionSupervisor}. Every accessor
 * is synchronized; nothing outside the supervisor holds a reference.
 * @since 18/01/2026
 */
public class PrinterConnection {
    private final String printerId;
    private final EProtocolKind protocol;

    private IPrinterAdapter adapter;
    private long lastHeartbeat;
    private long lastAttemptAt;
    private boolean connected;
    private int reconnectCount;

    public PrinterConnection(String printerId, EProtocolKind protocol) {
        this.printerId = printerId;
        this.protocol = protocol;
    }

    public String getPrinterId() {
        return printerId;
    }

    public EProtocolKind getProtocol() {
        return protocol;
    }

    public synchronized IPrinterAdapter getAdapter() {
        return adapter;
    }

    public synchronized void setAdapter(IPrinterAdapter adapter) {
        this.adapter = adapter;
    }

    public synchronized long getLastHeartbeat() {
        return lastHeartbeat;
    }

    /**
     * Heartbeat only moves forward
     */
    public synchronized void touch(long at) {
        if (at > lastHeartbeat) {
            lastHeartbeat = at;
        }
    }

    public synchronized long getLastAttemptAt() {
        return lastAttemptAt;
    }

    public synchronized void markAttempt(long at) {
        lastAttemptAt = at;
    }

    public synchronized boolean isConnected() {
        return connected;
    }

    /**
     * @return true when the flag actually changed
     */
    public synchronized boolean setConnected(boolean nowConnected) {
        boolean changed = connected != nowConnected;
        connected = nowConnected;
        return changed;
    }

    public synchronized int getReconnectCount() {
        return reconnectCount;
    }

    public synchronized void incrementReconnects() {
        reconnectCount++;
    }

    @Override
    public synchronized String toString() {
        return String.format("PrinterConnection{printer=%s, protocol=%s, connected=%s, lastHeartbeat=%d, reconnects=%d}",
                printerId, protocol, connected, lastHeartbeat, reconnectCount);
    }
}
