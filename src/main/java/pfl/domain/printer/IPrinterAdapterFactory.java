package pfl.domain.printer;

import pfl.dal.PrinterConfig;

/**
 * Creates a fresh adapter for a printer. The supervisor asks for a new one on every reconnect.
 * @since 13/01/2026
 */
public interface IPrinterAdapterFactory {
    IPrinterAdapter create(PrinterConfig config, IStatusListener statusListener);
}
