package pfl.domain.lifecycle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EJobOutcome;
import pfl.common.EJobStatus;
import pfl.common.EPrinterState;
import pfl.common.EventTypes;
import pfl.dal.db.PrintJobRecord;
import pfl.dal.db.PrintJobRepository;
import pfl.dal.db.ScheduledJobRepository;
import pfl.dal.db.TestDatabase;
import pfl.domain.event.Event;
import pfl.domain.event.InMemoryEventBus;
import pfl.domain.printer.CanonicalStatus;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for JobLifecycleService against in-memory H2
 * @since 15/01/2026
 */
class JobLifecycleServiceTest {

    private static final long T0 = 1_767_000_000_000L;

    private ScheduledJobRepository scheduledJobs;
    private PrintJobRepository jobs;
    private JobLifecycleService service;
    private List<Event> published;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabase.create();
        scheduledJobs = new ScheduledJobRepository(dataSource);
        jobs = new PrintJobRepository(dataSource, scheduledJobs);
        InMemoryEventBus bus = new InMemoryEventBus();
        published = new ArrayList<>();
        bus.subscribe(EventTypes.WILDCARD, published::add);
        service = new JobLifecycleService(jobs, new JobLinker(scheduledJobs), bus);
    }

    @Test
    @DisplayName("Should open a linked job on start and publish job.started")
    void shouldOpenLinkedJob() {
        // Given
        long scheduledId = scheduledJobs.insert("p1", "Bracket", null, null, 200, T0 - 60_000);
        CanonicalStatus status = printing("bracket.gcode", 0, 200);

        // When
        service.handle(LifecycleSignal.started(status, T0), "Workshop X1");

        // Then
        assertThat(service.hasOpenJob("p1")).isTrue();
        Event started = published.get(0);
        assertThat(started.getEventType()).isEqualTo(EventTypes.JOB_STARTED);
        assertThat(started.getString("printer_name")).isEqualTo("Workshop X1");
        assertThat(started.getString("job_name")).isEqualTo("bracket.gcode");
        assertThat(started.getLong("scheduled_job_id")).isEqualTo(scheduledId);
        assertThat(started.getString("link_strategy")).isEqualTo("name");
    }

    @Test
    @DisplayName("Should close the job as completed with its duration")
    void shouldCompleteJob() {
        // Given
        service.handle(LifecycleSignal.started(printing("benchy.gcode", 0, 0), T0), "Mini");

        // When
        CanonicalStatus done = CanonicalStatus.builder("p1").state(EPrinterState.IDLE)
                .jobOutcome(EJobOutcome.FINISHED).progressPercent(100).build();
        service.handle(LifecycleSignal.completed(done, T0 + 90_000), "Mini");

        // Then
        Event completed = published.get(published.size() - 1);
        assertThat(completed.getEventType()).isEqualTo(EventTypes.JOB_COMPLETED);
        assertThat(completed.getBoolean("success", false)).isTrue();
        assertThat(completed.getLong("duration_seconds")).isEqualTo(90L);
        assertThat(completed.getString("job_name")).isEqualTo("benchy.gcode");
        assertThat(completed.getString("status")).isEqualTo(EJobStatus.COMPLETED.dbValue());
        assertThat(jobs.findOpenJob("p1")).isEmpty();
        assertThat(service.getOpenJob("p1")).isEmpty();
    }

    @Test
    @DisplayName("Should carry the error code of a failed print")
    void shouldFailJob() {
        // Given
        service.handle(LifecycleSignal.started(printing("benchy.gcode", 0, 0), T0), "Mini");
        long jobId = service.getOpenJob("p1").orElseThrow().id();

        // When
        CanonicalStatus failing = printing("benchy.gcode", 42, 0);
        service.handle(LifecycleSignal.failed(failing, "0300_4006", "Nozzle is clogged.", T0 + 10_000), "Mini");

        // Then
        Event completed = published.get(published.size() - 1);
        assertThat(completed.getBoolean("success", true)).isFalse();
        assertThat(completed.getString("error_code")).isEqualTo("0300_4006");
        assertThat(completed.getString("error_message")).isEqualTo("Nozzle is clogged.");
        PrintJobRecord record = jobs.findById(jobId).orElseThrow();
        assertThat(record.status()).isEqualTo(EJobStatus.FAILED);
        assertThat(record.errorCode()).isEqualTo("0300_4006");
    }

    @Test
    @DisplayName("Should publish job.cancelled without a success flag")
    void shouldCancelJob() {
        // Given
        service.handle(LifecycleSignal.started(printing("benchy.gcode", 0, 0), T0), "Mini");

        // When
        CanonicalStatus idle = CanonicalStatus.builder("p1").state(EPrinterState.IDLE).build();
        service.handle(LifecycleSignal.cancelled(idle, T0 + 5_000), "Mini");

        // Then
        Event cancelled = published.get(published.size() - 1);
        assertThat(cancelled.getEventType()).isEqualTo(EventTypes.JOB_CANCELLED);
        assertThat(cancelled.getData()).doesNotContainKey("success");
        assertThat(cancelled.getString("job_name")).isEqualTo("benchy.gcode");
    }

    @Test
    @DisplayName("Should store progress on the open job")
    void shouldStoreProgress() {
        // Given
        service.handle(LifecycleSignal.started(printing("benchy.gcode", 0, 100), T0), "Mini");
        long jobId = service.getOpenJob("p1").orElseThrow().id();

        // When
        CanonicalStatus status = CanonicalStatus.builder("p1").state(EPrinterState.PRINTING)
                .progressPercent(37.5).currentLayer(38).totalLayers(100).build();
        service.handle(LifecycleSignal.progress(status, T0 + 1_000), "Mini");

        // Then
        assertThat(jobs.findById(jobId).orElseThrow().progressPercent()).isEqualTo(37.5);
        Event progress = published.get(published.size() - 1);
        assertThat(progress.getEventType()).isEqualTo(EventTypes.JOB_PROGRESS);
        assertThat(progress.getLong("job_id")).isEqualTo(jobId);
    }

    @Test
    @DisplayName("Should pick up a job left open by a previous run")
    void shouldFindJobLeftOpen() {
        // Given
        jobs.openJob("p1", "overnight.gcode", null, null, T0);

        // When
        JobLifecycleService restarted = new JobLifecycleService(jobs, new JobLinker(scheduledJobs), new InMemoryEventBus());

        // Then
        assertThat(restarted.hasOpenJob("p1")).isTrue();
        assertThat(restarted.getOpenJob("p1").orElseThrow().jobName()).isEqualTo("overnight.gcode");
        assertThat(restarted.hasOpenJob("p2")).isFalse();
    }

    private static CanonicalStatus printing(String filename, double progress, int totalLayers) {
        return CanonicalStatus.builder("p1").state(EPrinterState.PRINTING).filename(filename)
                .progressPercent(progress).totalLayers(totalLayers).build();
    }
}
