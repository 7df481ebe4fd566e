package pfl.common;

/**
 * Protocol-agnostic printer state carried by {@link pfl.domain.printer.CanonicalStatus}
 * @since 12/01/2026
 */
public enum EPrinterState {
    IDLE,
    PRINTING,
    PAUSED,
    ERROR,
    OFFLINE,
    UNKNOWN;

    public boolean isJobActive() {
        return this == PRINTING || this == PAUSED;
    }
}
