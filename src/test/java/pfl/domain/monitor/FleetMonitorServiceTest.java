package pfl.domain.monitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import pfl.common.EPrinterState;
import pfl.dal.MonitorConfig;
import pfl.dal.PrinterConfig;
import pfl.dal.db.PrinterRepository;
import pfl.dal.db.RepositoryException;
import pfl.domain.event.InMemoryEventBus;
import pfl.domain.printer.CanonicalStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for FleetMonitorService discovery and status lookups
 * @since 18/01/2026
 */
@ExtendWith(MockitoExtension.class)
class FleetMonitorServiceTest {

    private static final PrinterConfig VORON = PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125);
    private static final PrinterConfig MK4 = PrinterConfig.prusaLink("mk4", "MK4", "192.168.1.42", "key");

    @Mock
    private PrinterRepository printerRepository;
    @Mock
    private StatusIngestionService ingestionService;

    private FakeAdapterFactory factory;
    private FleetMonitorService monitor;

    @BeforeEach
    void setUp() {
        factory = new FakeAdapterFactory();
        lenient().when(ingestionService.listenerFor(any())).thenReturn(status -> { });
        monitor = new FleetMonitorService(printerRepository, factory, ingestionService, MonitorConfig.defaults(),
                new InMemoryEventBus());
    }

    @Test
    @DisplayName("Should start one supervisor per enabled printer")
    void shouldSuperviseEnabledPrinters() {
        // Given
        when(printerRepository.findEnabled()).thenReturn(List.of(VORON, MK4));

        // When
        monitor.discoverPrinters();
        monitor.discoverPrinters();

        // Then
        assertThat(monitor.isMonitored("voron")).isTrue();
        assertThat(monitor.isMonitored("mk4")).isTrue();
        assertThat(factory.created).hasSize(2);
        assertThat(monitor.getAllStatuses()).extracting(CanonicalStatus::getPrinterId).containsExactly("mk4", "voron");
        assertThat(monitor.findAdapter("voron")).isPresent();
    }

    @Test
    @DisplayName("Should stop the supervisor of a removed printer and forget its state")
    void shouldDropRemovedPrinter() {
        // Given
        when(printerRepository.findEnabled()).thenReturn(List.of(VORON, MK4), List.of(MK4));
        monitor.discoverPrinters();
        FakePrinterAdapter voronAdapter = (FakePrinterAdapter) monitor.findAdapter("voron").orElseThrow();

        // When
        monitor.discoverPrinters();

        // Then
        assertThat(monitor.isMonitored("voron")).isFalse();
        assertThat(voronAdapter.disconnectCalls).isEqualTo(1);
        verify(ingestionService).forget("voron");
    }

    @Test
    @DisplayName("Should restart a supervisor when the connection settings change")
    void shouldRestartOnChangedSettings() {
        // Given
        PrinterConfig moved = PrinterConfig.moonraker("voron", "Voron", "192.168.1.44", 7125);
        when(printerRepository.findEnabled()).thenReturn(List.of(VORON), List.of(moved));
        monitor.discoverPrinters();

        // When
        monitor.discoverPrinters();

        // Then
        assertThat(factory.createdFor("voron")).isEqualTo(2);
        assertThat(factory.created.get(0).disconnectCalls).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep supervising when the registry cannot be read")
    void shouldSurviveRegistryFailure() {
        // Given
        when(printerRepository.findEnabled()).thenReturn(List.of(VORON)).thenThrow(new RepositoryException("timeout"));
        monitor.discoverPrinters();

        // When
        monitor.discoverPrinters();

        // Then
        assertThat(monitor.isMonitored("voron")).isTrue();
    }

    @Test
    @DisplayName("Should report an unmonitored printer as OFFLINE instead of null")
    void shouldNeverReturnNullStatus() {
        // When
        CanonicalStatus status = monitor.getStatus("ghost");

        // Then
        assertThat(status).isNotNull();
        assertThat(status.getState()).isEqualTo(EPrinterState.OFFLINE);
        assertThat(status.getLastError()).isEqualTo("Printer is not monitored");
        assertThat(monitor.findAdapter("ghost")).isEmpty();
    }
}
