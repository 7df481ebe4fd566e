package pfl.domain.api;

import io.javalin.http.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import pfl.common.EHeater;
import pfl.common.EPrinterState;
import pfl.dal.PrinterConfig;
import pfl.dal.db.PrinterRepository;
import pfl.domain.ServiceInitializationResult;
import pfl.domain.monitor.FleetMonitorService;
import pfl.domain.printer.CanonicalStatus;
import pfl.domain.printer.IPrinterAdapter;
import pfl.domain.printer.elegoo.ElegooDiscovery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for PrinterController
 * @author Martin Sustik <sustik@herman.cz>
 * @since 10/10/2025
 */
@ExtendWith(MockitoExtension.class)
class PrinterControllerTest {

    @Mock
    private FleetMonitorService fleetMonitor;
    @Mock
    private PrinterRepository printerRepository;
    @Mock
    private ElegooDiscovery elegooDiscovery;
    @Mock
    private IPrinterAdapter adapter;
    @Mock
    private Context ctx;

    private final Map<String, ServiceInitializationResult> results = new LinkedHashMap<>();
    private PrinterController controller;

    @BeforeEach
    void setUp() {
        controller = new PrinterController(fleetMonitor, printerRepository, elegooDiscovery, () -> results);
        lenient().when(ctx.status(anyInt())).thenReturn(ctx);
    }

    @Test
    @DisplayName("Should answer 404 for a printer that is neither monitored nor registered")
    void shouldRejectUnknownPrinter() {
        // Given
        when(ctx.pathParam("id")).thenReturn("ghost");
        when(printerRepository.findById("ghost")).thenReturn(Optional.empty());

        // When
        controller.getStatus(ctx);

        // Then
        verify(ctx).status(404);
        assertThat(lastResponse().getMessage()).isEqualTo("Unknown printer: ghost");
    }

    @Test
    @DisplayName("Should answer a registered but unmonitored printer with an OFFLINE snapshot")
    void shouldReturnOfflineSnapshotForRegisteredPrinter() {
        // Given
        when(ctx.pathParam("id")).thenReturn("mk4");
        when(printerRepository.findById("mk4"))
                .thenReturn(Optional.of(PrinterConfig.prusaLink("mk4", "MK4", "192.168.1.44", "key")));
        when(fleetMonitor.getStatus("mk4")).thenReturn(CanonicalStatus.offline("mk4", "Printer is not monitored"));

        // When
        controller.getStatus(ctx);

        // Then
        verify(ctx, never()).status(anyInt());
        CanonicalStatus status = (CanonicalStatus) lastResponse().getData();
        assertThat(status.getState()).isEqualTo(EPrinterState.OFFLINE);
    }

    @Test
    @DisplayName("Should not send a command to an unmonitored printer")
    void shouldRejectCommandForUnmonitoredPrinter() {
        // Given
        when(ctx.pathParam("id")).thenReturn("ghost");

        // When
        controller.command(ctx, "pause", IPrinterAdapter::pause);

        // Then
        verify(ctx).status(404);
        assertThat(lastResponse().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Should answer 503 when the printer is monitored but not connected")
    void shouldRejectCommandWhileDisconnected() {
        // Given
        when(ctx.pathParam("id")).thenReturn("x1c");
        when(fleetMonitor.isMonitored("x1c")).thenReturn(true);
        when(fleetMonitor.findAdapter("x1c")).thenReturn(Optional.of(adapter));
        when(adapter.isConnected()).thenReturn(false);

        // When
        controller.command(ctx, "pause", IPrinterAdapter::pause);

        // Then
        verify(ctx).status(503);
        verify(adapter, never()).pause();
        assertThat(lastResponse().getMessage()).isEqualTo("Printer is not connected: x1c");
    }

    @Test
    @DisplayName("Should send the command and report 502 when the printer refuses it")
    void shouldForwardCommand() {
        // Given
        when(ctx.pathParam("id")).thenReturn("x1c");
        when(fleetMonitor.isMonitored("x1c")).thenReturn(true);
        when(fleetMonitor.findAdapter("x1c")).thenReturn(Optional.of(adapter));
        when(adapter.isConnected()).thenReturn(true);
        when(adapter.pause()).thenReturn(true);
        when(adapter.cancel()).thenReturn(false);

        // When
        controller.command(ctx, "pause", IPrinterAdapter::pause);

        // Then
        assertThat(lastResponse().getMessage()).isEqualTo("Command 'pause' sent");

        // When
        controller.command(ctx, "cancel", IPrinterAdapter::cancel);

        // Then
        verify(ctx).status(502);
        assertThat(lastResponse().getMessage()).isEqualTo("Printer did not accept 'cancel'");
    }

    @Test
    @DisplayName("Should validate the temperature body before touching the printer")
    void shouldRejectInvalidTemperature() {
        // Given
        when(ctx.pathParam("id")).thenReturn("voron");
        when(ctx.bodyAsClass(TemperatureRequest.class)).thenReturn(new TemperatureRequest("BED", 500.0));

        // When
        controller.setTemperature(ctx);

        // Then
        verify(ctx).status(400);
        verify(adapter, never()).setTemperature(any(), anyDouble());
        assertThat(lastResponse().getMessage()).isEqualTo("Target must be between 0 and 350");
    }

    @Test
    @DisplayName("Should set the temperature on a connected printer")
    void shouldSetTemperature() {
        // Given
        when(ctx.pathParam("id")).thenReturn("voron");
        when(ctx.bodyAsClass(TemperatureRequest.class)).thenReturn(new TemperatureRequest("nozzle", 215.0));
        when(fleetMonitor.isMonitored("voron")).thenReturn(true);
        when(fleetMonitor.findAdapter("voron")).thenReturn(Optional.of(adapter));
        when(adapter.isConnected()).thenReturn(true);
        when(adapter.setTemperature(EHeater.NOZZLE, 215.0)).thenReturn(true);

        // When
        controller.setTemperature(ctx);

        // Then
        verify(adapter).setTemperature(EHeater.NOZZLE, 215.0);
        assertThat(lastResponse().getMessage()).isEqualTo("Temperature set");
    }

    @Test
    @DisplayName("Should report 503 while a service is down")
    void shouldReportDegradedHealth() {
        // Given
        results.put("database", ServiceInitializationResult.success("Database", 10));
        results.put("monitor", ServiceInitializationResult.failure("Fleet monitor", "database unavailable", 0));
        when(fleetMonitor.isMonitoring()).thenReturn(true);
        when(fleetMonitor.getAllStatuses()).thenReturn(List.of(
                CanonicalStatus.builder("x1c").state(EPrinterState.PRINTING).build(),
                CanonicalStatus.offline("mk4", "timeout")));

        // When
        controller.healthCheck(ctx);

        // Then
        verify(ctx).status(503);
        HealthCheckResponse health = (HealthCheckResponse) lastResponse().getData();
        assertThat(health.isHealthy()).isFalse();
        assertThat(health.getPrinters()).isEqualTo(2);
        assertThat(health.getOnline()).isEqualTo(1);
        assertThat(health.getByState()).containsEntry("PRINTING", 1L).containsEntry("OFFLINE", 1L);
        assertThat(health.getServices()).containsEntry("Fleet monitor", "DOWN: database unavailable");
    }

    @Test
    @DisplayName("Should report healthy when monitoring runs and every service is up")
    void shouldReportHealthy() {
        // Given
        results.put("database", ServiceInitializationResult.success("Database", 10));
        when(fleetMonitor.isMonitoring()).thenReturn(true);
        when(fleetMonitor.getAllStatuses()).thenReturn(List.of());

        // When
        controller.healthCheck(ctx);

        // Then
        verify(ctx, never()).status(anyInt());
        assertThat(lastResponse().getMessage()).isEqualTo("PrintFleet is healthy");
    }

    private ApiResponse<?> lastResponse() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(ctx, atLeastOnce()).json(captor.capture());
        return (ApiResponse<?>) captor.getValue();
    }
}
