package pfl.domain.printer;

import pfl.dal.MonitorConfig;
import pfl.dal.PrinterConfig;
import pfl.domain.printer.bambu.BambuMqttAdapter;
import pfl.domain.printer.elegoo.ElegooSdcpAdapter;
import pfl.domain.printer.moonraker.MoonrakerAdapter;
import pfl.domain.printer.prusalink.PrusaLinkAdapter;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;

/**
 * Picks the adapter by protocol kind. HTTP and WebSocket adapters share one client; polling
 * adapters share the worker pool.
 * @since 13/01/2026
 */
@Singleton
public class PrinterAdapterFactory implements IPrinterAdapterFactory {
    public static final String WORKER_POOL = "adapterWorkers";

    private final HttpClient httpClient;
    private final ExecutorService workerPool;
    private final MonitorConfig monitorConfig;

    @Inject
    public PrinterAdapterFactory(HttpClient httpClient, @Named(WORKER_POOL) ExecutorService workerPool, MonitorConfig monitorConfig) {
        this.httpClient = httpClient;
        this.workerPool = workerPool;
        this.monitorConfig = monitorConfig;
    }

    @Override
    public IPrinterAdapter create(PrinterConfig config, IStatusListener statusListener) {
        return switch (config.protocol()) {
            case BAMBU -> new BambuMqttAdapter(config, statusListener);
            case ELEGOO -> new ElegooSdcpAdapter(config, statusListener, httpClient);
            case PRUSALINK -> new PrusaLinkAdapter(config, statusListener, httpClient, workerPool,
                    monitorConfig.pollIntervalMs(), monitorConfig.maxPollFailures());
            case MOONRAKER -> new MoonrakerAdapter(config, statusListener, httpClient, workerPool,
                    monitorConfig.pollIntervalMs(), monitorConfig.maxPollFailures());
        };
    }
}
