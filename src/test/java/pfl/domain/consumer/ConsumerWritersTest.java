package pfl.domain.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EJobStatus;
import pfl.common.EventTypes;
import pfl.dal.PrinterConfig;
import pfl.dal.RelayConfig;
import pfl.dal.db.ArchiveRepository;
import pfl.dal.db.CareCounters;
import pfl.dal.db.EventRelayRepository;
import pfl.dal.db.PrintArchive;
import pfl.dal.db.PrinterRepository;
import pfl.dal.db.RelayEntry;
import pfl.dal.db.TestDatabase;
import pfl.domain.event.Event;
import pfl.domain.event.InMemoryEventBus;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for the bus consumers that write to the database
 * @since 20/01/2026
 */
class ConsumerWritersTest {

    private static final long T0 = 1_767_000_000_000L;

    private DataSource dataSource;
    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create();
        bus = new InMemoryEventBus();
    }

    @Test
    @DisplayName("Should archive completed and cancelled prints")
    void shouldArchiveEndedPrints() {
        // Given
        ArchiveRepository archives = new ArchiveRepository(dataSource);
        new ArchiveWriter(archives).register(bus);

        // When
        bus.publish(ended(EventTypes.JOB_COMPLETED, EJobStatus.COMPLETED, true, 5400L));
        bus.publish(ended(EventTypes.JOB_CANCELLED, EJobStatus.CANCELLED, null, 600L));

        // Then
        List<PrintArchive> rows = archives.findByPrinter("p1");
        assertThat(rows).extracting(PrintArchive::status).containsExactlyInAnyOrder("completed", "cancelled");
        assertThat(rows).extracting(PrintArchive::printName).containsOnly("benchy.gcode");
    }

    @Test
    @DisplayName("Should count only successful prints in the care counters")
    void shouldAdvanceCareCounters() {
        // Given
        PrinterRepository printers = new PrinterRepository(dataSource);
        printers.seed(PrinterConfig.moonraker("p1", "Voron", "192.168.1.43", 7125));
        new CareCounterUpdater(printers).register(bus);

        // When
        bus.publish(ended(EventTypes.JOB_COMPLETED, EJobStatus.COMPLETED, true, 5400L));
        bus.publish(ended(EventTypes.JOB_COMPLETED, EJobStatus.FAILED, false, 1800L));

        // Then
        CareCounters counters = printers.findCareCounters("p1").orElseThrow();
        assertThat(counters.totalPrintCount()).isEqualTo(1);
        assertThat(counters.totalPrintHours()).isCloseTo(1.5, within(0.001));
    }

    @Test
    @DisplayName("Should relay every event type and prune rows past the TTL")
    void shouldRelayAndPrune() {
        // Given
        EventRelayRepository relay = new EventRelayRepository(dataSource);
        long now = System.currentTimeMillis();
        relay.append(EventTypes.JOB_PROGRESS, "{}", now - 120_000);
        EventRelayWriter writer = new EventRelayWriter(relay, new RelayConfig(60_000, 30_000));
        writer.register(bus);

        // When
        bus.publish(new Event(EventTypes.PRINTER_STATE_CHANGED, "monitor", Map.of("printer_id", "p1"), now));

        // Then
        List<RelayEntry> entries = relay.readSince(0, 10);
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).eventType()).isEqualTo(EventTypes.PRINTER_STATE_CHANGED);
        assertThat(entries.get(0).payload()).contains("\"event_type\":\"printer.state_changed\"").contains("\"printer_id\":\"p1\"");
    }

    @Test
    @DisplayName("Should prune at most once per interval")
    void shouldThrottlePrune() {
        // Given
        EventRelayRepository relay = new EventRelayRepository(dataSource);
        EventRelayWriter writer = new EventRelayWriter(relay, new RelayConfig(60_000, 30_000));
        long now = System.currentTimeMillis();
        writer.pruneIfDue(now);
        relay.append(EventTypes.JOB_PROGRESS, "{}", now - 120_000);

        // When
        writer.pruneIfDue(now + 10_000);

        // Then
        assertThat(relay.readSince(0, 10)).hasSize(1);

        // When
        writer.pruneIfDue(now + 40_000);

        // Then
        assertThat(relay.readSince(0, 10)).isEmpty();
    }

    private static Event ended(String type, EJobStatus status, Boolean success, long durationSeconds) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("printer_id", "p1");
        data.put("printer_name", "Voron");
        data.put("job_name", "benchy.gcode");
        data.put("status", status.dbValue());
        data.put("started_at", T0);
        data.put("ended_at", T0 + durationSeconds * 1000);
        data.put("duration_seconds", durationSeconds);
        if (success != null) {
            data.put("success", success);
        }
        return new Event(type, "lifecycle", data, T0 + durationSeconds * 1000);
    }
}
