package pfl.domain.monitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EJobOutcome;
import pfl.common.EPrinterState;
import pfl.common.EventTypes;
import pfl.dal.MonitorConfig;
import pfl.dal.PrinterConfig;
import pfl.dal.db.PrintJobRepository;
import pfl.dal.db.PrinterRepository;
import pfl.dal.db.ScheduledJobRepository;
import pfl.dal.db.TestDatabase;
import pfl.domain.event.Event;
import pfl.domain.event.InMemoryEventBus;
import pfl.domain.lifecycle.JobLifecycleService;
import pfl.domain.lifecycle.JobLinker;
import pfl.domain.lifecycle.PrintStoppingErrorCatalog;
import pfl.domain.printer.CanonicalStatus;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for StatusIngestionService against in-memory H2
 * @since 18/01/2026
 */
class StatusIngestionServiceTest {

    private static final long T0 = 1_767_000_000_000L;
    private static final PrinterConfig VORON = PrinterConfig.moonraker("voron", "Voron", "192.168.1.43", 7125);

    private PrinterRepository printers;
    private PrintJobRepository jobs;
    private ScheduledJobRepository scheduledJobs;
    private PrintStoppingErrorCatalog catalog;
    private InMemoryEventBus bus;
    private List<Event> published;
    private StatusIngestionService ingestion;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabase.create();
        printers = new PrinterRepository(dataSource);
        printers.seed(VORON);
        scheduledJobs = new ScheduledJobRepository(dataSource);
        jobs = new PrintJobRepository(dataSource, scheduledJobs);
        catalog = new PrintStoppingErrorCatalog(Map.of("0300_4006", "Nozzle is clogged."));
        bus = new InMemoryEventBus();
        published = new ArrayList<>();
        bus.subscribe(EventTypes.WILDCARD, published::add);
        ingestion = newIngestion();
    }

    @Test
    @DisplayName("Should publish the state change and start a job on the first PRINTING snapshot")
    void shouldStartJob() {
        // When
        ingestion.ingest(VORON, printing(0), T0);

        // Then
        assertThat(types()).containsExactly(EventTypes.PRINTER_STATE_CHANGED, EventTypes.JOB_STARTED);
        assertThat(published.get(0).getString("old_state")).isNull();
        assertThat(published.get(0).getString("new_state")).isEqualTo("PRINTING");
        assertThat(jobs.findOpenJob("voron")).isPresent();
    }

    @Test
    @DisplayName("Should run a print through to completion")
    void shouldCompleteJob() {
        // Given
        ingestion.ingest(VORON, printing(0), T0);

        // When
        ingestion.ingest(VORON, printing(50), T0 + 60_000);
        ingestion.ingest(VORON, CanonicalStatus.builder("voron").state(EPrinterState.IDLE)
                .jobOutcome(EJobOutcome.FINISHED).progressPercent(100).build(), T0 + 120_000);

        // Then
        assertThat(types()).containsExactly(EventTypes.PRINTER_STATE_CHANGED, EventTypes.JOB_STARTED,
                EventTypes.JOB_PROGRESS, EventTypes.PRINTER_STATE_CHANGED, EventTypes.JOB_COMPLETED);
        assertThat(jobs.findOpenJob("voron")).isEmpty();
    }

    @Test
    @DisplayName("Should publish a device error once until it changes")
    void shouldPublishErrorOnce() {
        // Given
        CanonicalStatus warning = CanonicalStatus.builder("voron").state(EPrinterState.IDLE)
                .errorCode("0700_8001").errorMessage("AMS slot empty").build();

        // When
        ingestion.ingest(VORON, warning, T0);
        ingestion.ingest(VORON, warning, T0 + 1_000);
        ingestion.ingest(VORON, CanonicalStatus.builder("voron").state(EPrinterState.IDLE).build(), T0 + 2_000);

        // Then
        List<Event> errors = published.stream().filter(e -> e.getEventType().equals(EventTypes.PRINTER_ERROR)).toList();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getString("error_code")).isEqualTo("0700_8001");
        assertThat(errors.get(0).getBoolean("print_stopping", true)).isFalse();
    }

    @Test
    @DisplayName("Should continue a job left open by a previous run without a new start")
    void shouldContinueOpenJobAfterRestart() {
        // Given
        jobs.openJob("voron", "overnight.gcode", null, null, T0 - 3_600_000);
        StatusIngestionService restarted = newIngestion();

        // When
        restarted.ingest(VORON, printing(80), T0);

        // Then
        assertThat(types()).doesNotContain(EventTypes.JOB_STARTED);
        assertThat(jobs.countOpenJobs("voron")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should announce the state again after the printer is forgotten")
    void shouldForgetPrinter() {
        // Given
        ingestion.ingest(VORON, printing(10), T0);
        published.clear();

        // When
        ingestion.forget("voron");
        ingestion.ingest(VORON, printing(10), T0 + 1_000);

        // Then
        assertThat(types()).containsExactly(EventTypes.PRINTER_STATE_CHANGED, EventTypes.JOB_PROGRESS);
    }

    private StatusIngestionService newIngestion() {
        JobLifecycleService lifecycle = new JobLifecycleService(jobs, new JobLinker(scheduledJobs), bus);
        return new StatusIngestionService(printers, lifecycle, catalog, MonitorConfig.defaults(), bus);
    }

    private static CanonicalStatus printing(double progress) {
        return CanonicalStatus.builder("voron").state(EPrinterState.PRINTING).filename("cube.gcode")
                .progressPercent(progress).build();
    }

    private List<String> types() {
        return published.stream().map(Event::getEventType).toList();
    }
}
