package pfl.dal.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EProtocolKind;
import pfl.dal.PrinterConfig;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for PrinterRepository against in-memory H2
 * @since 16/01/2026
 */
class PrinterRepositoryTest {

    private PrinterRepository printers;

    @BeforeEach
    void setUp() {
        printers = new PrinterRepository(TestDatabase.create());
    }

    @Test
    @DisplayName("Should seed configured printers and refresh them on the next seed")
    void shouldSeedAndRefresh() {
        // Given
        printers.seed(PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125));

        // When
        printers.seed(PrinterConfig.moonraker("voron", "Voron 2.4", "192.168.1.44", 7125));

        // Then
        List<PrinterConfig> enabled = printers.findEnabled();
        assertThat(enabled).hasSize(1);
        assertThat(enabled.get(0).host()).isEqualTo("192.168.1.44");
        assertThat(enabled.get(0).name()).isEqualTo("Voron 2.4");
    }

    @Test
    @DisplayName("Should leave disabled printers out of the enabled list")
    void shouldSkipDisabledPrinters() {
        // Given
        printers.seed(PrinterConfig.prusaLink("mk4", "MK4", "192.168.1.42", "key"));
        printers.seed(new PrinterConfig("old", "Old", EProtocolKind.ELEGOO, "192.168.1.50", 3030,
                null, null, null, false));

        // When
        List<PrinterConfig> enabled = printers.findEnabled();

        // Then
        assertThat(enabled).extracting(PrinterConfig::id).containsExactly("mk4");
        assertThat(printers.findById("old")).isPresent();
    }

    @Test
    @DisplayName("Should accumulate care counters per completed print")
    void shouldAccumulateCareCounters() {
        // Given
        printers.seed(PrinterConfig.prusaLink("mk4", "MK4", "192.168.1.42", "key"));

        // When
        printers.addCompletedPrint("mk4", 1.5);
        printers.addCompletedPrint("mk4", 0.25);

        // Then
        CareCounters counters = printers.findCareCounters("mk4").orElseThrow();
        assertThat(counters.totalPrintCount()).isEqualTo(2);
        assertThat(counters.totalPrintHours()).isCloseTo(1.75, within(0.0001));
        assertThat(counters.printsSinceMaintenance()).isEqualTo(2);
    }
}
