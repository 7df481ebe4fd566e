package pfl.domain.monitor;

import pfl.common.EProtocolKind;
import pfl.dal.PrinterConfig;
import pfl.domain.printer.AbstractPrinterAdapter;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IStatusListener;

/**
 * In-memory adapter driven by the test: decides whether connect succeeds and emits snapshots on demand
 * @since 18/01/2026
 */
class FakePrinterAdapter extends AbstractPrinterAdapter {
    private final boolean connectSucceeds;
    int connectCalls;
    int disconnectCalls;
    int refreshCalls;

    FakePrinterAdapter(PrinterConfig config, IStatusListener statusListener, boolean connectSucceeds) {
        super(config, statusListener);
        this.connectSucceeds = connectSucceeds;
    }

    @Override
    public EProtocolKind getProtocolKind() {
        return config.protocol();
    }

    @Override
    public boolean connect() {
        connectCalls++;
        if (connectSucceeds) {
            markConnected(true);
        } else {
            recordTransportError("connection refused", null);
        }
        return connectSucceeds;
    }

    @Override
    public void disconnect() {
        disconnectCalls++;
        markConnected(false);
    }

    @Override
    public void requestRefresh() {
        refreshCalls++;
    }

    void emit(CanonicalStatus status) {
        publishStatus(status);
    }

    void drop(String reason) {
        recordTransportError(reason, null);
        markConnected(false);
    }
}
