package pfl.domain.api;

import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EHeater;
import pfl.common.EPrinterState;
import pfl.dal.db.PrinterRepository;
import pfl.domain.ServiceInitializationResult;
import pfl.domain.monitor.FleetMonitorService;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IPrinterAdapter;
import pfl.domain.printer.elegoo.DiscoveredPrinter;
import pfl.domain.printer.elegoo.ElegooDiscovery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;

/**
 * REST API Controller for fleet status and printer commands
 * @author Martin Sustik <sustik@herman.cz>
 * @since 25/09/2025
 */
public class PrinterController {
    private static final Logger logger = LoggerFactory.getLogger(PrinterController.class);
    static final long DEFAULT_DISCOVERY_WINDOW_MS = 3000;
    static final long MAX_DISCOVERY_WINDOW_MS = 10000;

    private final FleetMonitorService fleetMonitor;
    private final PrinterRepository printerRepository;
    private final ElegooDiscovery elegooDiscovery;
    private final Supplier<Map<String, ServiceInitializationResult>> initializationResults;

    public PrinterController(FleetMonitorService fleetMonitor, PrinterRepository printerRepository,
                             ElegooDiscovery elegooDiscovery,
                             Supplier<Map<String, ServiceInitializationResult>> initializationResults) {
        this.fleetMonitor = fleetMonitor;
        this.printerRepository = printerRepository;
        this.elegooDiscovery = elegooDiscovery;
        this.initializationResults = initializationResults;
    }

    /**
     * Register all REST API routes
     */
    public void registerRoutes() {
        path("/api", () -> {
            get("/health", this::healthCheck);
            path("/printers", () -> {
                get("", this::getAllStatuses);
                path("/{id}", () -> {
                    get("/status", this::getStatus);
                    post("/pause", ctx -> command(ctx, "pause", IPrinterAdapter::pause));
                    post("/resume", ctx -> command(ctx, "resume", IPrinterAdapter::resume));
                    post("/cancel", ctx -> command(ctx, "cancel", IPrinterAdapter::cancel));
                    post("/temperature", this::setTemperature);
                });
            });
            get("/discovery/elegoo", this::discoverElegoo);
        });
    }

    void healthCheck(Context ctx) {
        List<CanonicalStatus> statuses = fleetMonitor.getAllStatuses();

        Map<String, Long> byState = new TreeMap<>();
        int online = 0;
        for (CanonicalStatus status : statuses) {
            byState.merge(status.getState().name(), 1L, Long::sum);
            if (status.getState() != EPrinterState.OFFLINE) {
                online++;
            }
        }

        Map<String, String> services = new LinkedHashMap<>();
        boolean allServicesUp = true;
        for (ServiceInitializationResult result : initializationResults.get().values()) {
            services.put(result.getServiceName(), result.isSuccess() ? "UP" : "DOWN: " + result.getErrorMessage());
            allServicesUp &= result.isSuccess();
        }

        boolean healthy = fleetMonitor.isMonitoring() && allServicesUp;
        HealthCheckResponse health = new HealthCheckResponse(healthy, fleetMonitor.isMonitoring(),
                statuses.size(), online, byState, services);

        if (healthy) {
            ctx.json(ApiResponse.success("PrintFleet is healthy", health));
        } else {
            ctx.status(503).json(new ApiResponse<>(false, "PrintFleet is degraded", health));
        }
    }

    void getAllStatuses(Context ctx) {
        ctx.json(ApiResponse.success(fleetMonitor.getAllStatuses()));
    }

    /**
     * A registered printer always gets a snapshot, OFFLINE while it is not connected
     */
    void getStatus(Context ctx) {
        String printerId = ctx.pathParam("id");
        if (!fleetMonitor.isMonitored(printerId) && !isRegistered(printerId)) {
            ctx.status(404).json(ApiResponse.error("Unknown printer: " + printerId));
            return;
        }
        ctx.json(ApiResponse.success(fleetMonitor.getStatus(printerId)));
    }

    private boolean isRegistered(String printerId) {
        try {
            return printerRepository.findById(printerId).isPresent();
        } catch (RuntimeException e) {
            logger.warn("Cannot look up printer {}: {}", printerId, e.getMessage());
            // registry unavailable, still answer with the offline snapshot
            return true;
        }
    }

    void command(Context ctx, String name, Predicate<IPrinterAdapter> action) {
        String printerId = ctx.pathParam("id");
        Optional<IPrinterAdapter> adapter = connectedAdapter(ctx, printerId);
        if (adapter.isEmpty()) {
            return;
        }

        logger.info("[{}] {} requested", printerId, name);
        if (action.test(adapter.get())) {
            ctx.json(ApiResponse.success("Command '" + name + "' sent", printerId));
        } else {
            ctx.status(502).json(ApiResponse.error("Printer did not accept '" + name + "'"));
        }
    }

    void setTemperature(Context ctx) {
        String printerId = ctx.pathParam("id");
        EHeater heater;
        TemperatureRequest request;
        try {
            request = ctx.bodyAsClass(TemperatureRequest.class);
            if (request == null) {
                ctx.status(400).json(ApiResponse.error("Invalid temperature request"));
                return;
            }
            heater = request.validate();
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
            return;
        }

        Optional<IPrinterAdapter> adapter = connectedAdapter(ctx, printerId);
        if (adapter.isEmpty()) {
            return;
        }

        logger.info("[{}] {} target {} requested", printerId, heater, request.getTarget());
        if (adapter.get().setTemperature(heater, request.getTarget())) {
            ctx.json(ApiResponse.success("Temperature set", request));
        } else {
            ctx.status(502).json(ApiResponse.error("Printer did not accept the temperature"));
        }
    }

    private Optional<IPrinterAdapter> connectedAdapter(Context ctx, String printerId) {
        if (!fleetMonitor.isMonitored(printerId)) {
            ctx.status(404).json(ApiResponse.error("Printer is not monitored: " + printerId));
            return Optional.empty();
        }
        Optional<IPrinterAdapter> adapter = fleetMonitor.findAdapter(printerId).filter(IPrinterAdapter::isConnected);
        if (adapter.isEmpty()) {
            ctx.status(503).json(ApiResponse.error("Printer is not connected: " + printerId));
        }
        return adapter;
    }

    void discoverElegoo(Context ctx) {
        long windowMs = DEFAULT_DISCOVERY_WINDOW_MS;
        String param = ctx.queryParam("windowMs");
        if (param != null) {
            try {
                windowMs = Math.max(100, Math.min(MAX_DISCOVERY_WINDOW_MS, Long.parseLong(param)));
            } catch (NumberFormatException e) {
                ctx.status(400).json(ApiResponse.error("windowMs must be a number"));
                return;
            }
        }
        List<DiscoveredPrinter> found = elegooDiscovery.discover(windowMs);
        ctx.json(ApiResponse.success(found.size() + " printer(s) found", found));
    }
}
