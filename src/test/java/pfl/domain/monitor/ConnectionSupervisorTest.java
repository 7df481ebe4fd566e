package pfl.domain.monitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EPrinterState;
import pfl.common.EProtocolKind;
import pfl.common.EventTypes;
import pfl.dal.MonitorConfig;
import pfl.dal.PrinterConfig;
import pfl.domain.alert.AlertDispatcher;
import pfl.domain.alert.AlertEventSubscriber;
import pfl.domain.event.Event;
import pfl.domain.event.InMemoryEventBus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests for ConnectionSupervisor with a fake adapter
 * @since 18/01/2026
 */
class ConnectionSupervisorTest {

    private static final long RECONNECT_DELAY = 10_000;
    private static final long STALENESS = 30_000;

    private FakeAdapterFactory factory;
    private InMemoryEventBus bus;
    private List<String> events;
    private MonitorConfig monitorConfig;

    @BeforeEach
    void setUp() {
        factory = new FakeAdapterFactory();
        bus = new InMemoryEventBus();
        events = new ArrayList<>();
        bus.subscribe(EventTypes.WILDCARD, (Event event) -> events.add(event.getEventType()));
        Map<EProtocolKind, Long> staleness = new EnumMap<>(EProtocolKind.class);
        staleness.put(EProtocolKind.MOONRAKER, STALENESS);
        staleness.put(EProtocolKind.BAMBU, STALENESS);
        monitorConfig = new MonitorConfig(30_000, 60_000, RECONNECT_DELAY, 0, 5_000, 3, 10_000, 1.0, 5_000, staleness);
    }

    @Test
    @DisplayName("Should connect on start and announce it once")
    void shouldConnectOnStart() {
        // Given
        ConnectionSupervisor supervisor = supervisor(PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125));

        // When
        boolean connected = supervisor.start();

        // Then
        assertThat(connected).isTrue();
        assertThat(events).containsExactly(EventTypes.PRINTER_CONNECTED);
        assertThat(supervisor.getConnection().isConnected()).isTrue();
    }

    @Test
    @DisplayName("Should replace a dropped transport with a fresh adapter")
    void shouldReconnectAfterDrop() {
        // Given
        ConnectionSupervisor supervisor = supervisor(PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125));
        supervisor.start();
        FakePrinterAdapter first = factory.last();

        // When
        first.drop("socket closed");
        supervisor.checkHealth(System.currentTimeMillis() + RECONNECT_DELAY + 1);

        // Then
        assertThat(factory.created).hasSize(2);
        assertThat(first.disconnectCalls).isEqualTo(1);
        assertThat(supervisor.getAdapter()).isSameAs(factory.last());
        assertThat(events).containsExactly(EventTypes.PRINTER_CONNECTED, EventTypes.PRINTER_DISCONNECTED,
                EventTypes.PRINTER_CONNECTED);
        assertThat(supervisor.getConnection().getReconnectCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should space reconnect attempts by the reconnect delay")
    void shouldPostponeEarlyReconnect() {
        // Given
        factory.connectSucceeds = false;
        ConnectionSupervisor supervisor = supervisor(PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125));
        supervisor.start();

        // When
        supervisor.checkHealth(System.currentTimeMillis());

        // Then
        assertThat(factory.created).hasSize(1);
        assertThat(supervisor.getStatus().getState()).isEqualTo(EPrinterState.OFFLINE);
    }

    @Test
    @DisplayName("Should treat a silent transport as stale and reconnect it")
    void shouldReconnectStaleTransport() {
        // Given
        ConnectionSupervisor supervisor = supervisor(PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125));
        supervisor.start();

        // When
        supervisor.checkHealth(System.currentTimeMillis() + STALENESS + 1_000);

        // Then
        assertThat(factory.created).hasSize(2);
        assertThat(events).contains(EventTypes.PRINTER_DISCONNECTED);
    }

    @Test
    @DisplayName("Should ask push-delta printers for a full report on a healthy sweep")
    void shouldRefreshPushDeltaPrinter() {
        // Given
        ConnectionSupervisor supervisor = supervisor(
                PrinterConfig.bambu("x1c", "X1C", "192.168.1.45", "01S00C123456789", "12345678"));
        supervisor.start();

        // When
        supervisor.checkHealth(System.currentTimeMillis());

        // Then
        assertThat(factory.last().refreshCalls).isEqualTo(1);
        assertThat(factory.created).hasSize(1);
    }

    @Test
    @DisplayName("Should close the transport on stop and ignore later sweeps")
    void shouldStop() {
        // Given
        ConnectionSupervisor supervisor = supervisor(PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125));
        supervisor.start();
        FakePrinterAdapter adapter = factory.last();

        // When
        supervisor.stop();
        supervisor.checkHealth(System.currentTimeMillis() + RECONNECT_DELAY + 1);

        // Then
        assertThat(supervisor.isStopped()).isTrue();
        assertThat(adapter.disconnectCalls).isEqualTo(1);
        assertThat(factory.created).hasSize(1);
        assertThat(supervisor.getStatus().getState()).isEqualTo(EPrinterState.OFFLINE);
        assertThat(events).containsExactly(EventTypes.PRINTER_CONNECTED);
    }

    @Test
    @DisplayName("Should not raise an offline alert when monitoring of a printer ends")
    void shouldNotAlertOnStop() {
        // Given
        AlertDispatcher dispatcher = mock(AlertDispatcher.class);
        new AlertEventSubscriber(dispatcher).register(bus);
        ConnectionSupervisor supervisor = supervisor(PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125));
        supervisor.start();

        // When
        supervisor.stop();

        // Then
        assertThat(events).doesNotContain(EventTypes.PRINTER_DISCONNECTED);
        assertThat(supervisor.getConnection().isConnected()).isFalse();
        verifyNoInteractions(dispatcher);
    }

    private ConnectionSupervisor supervisor(PrinterConfig config) {
        return new ConnectionSupervisor(config, factory, status -> { }, monitorConfig, bus);
    }
}
