package pfl.domain.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EventTypes;
import pfl.dal.db.ArchiveRepository;
import pfl.dal.db.PrintArchive;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Writes one immutable history row for every print that ended: completed, failed or cancelled
 * @since 20/01/2026
 */
@Singleton
public class ArchiveWriter implements IEventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(ArchiveWriter.class);

    private final ArchiveRepository archiveRepository;

    @Inject
    public ArchiveWriter(ArchiveRepository archiveRepository) {
        this.archiveRepository = archiveRepository;
    }

    @Override
    public void register(IEventBus eventBus) {
        eventBus.subscribe(EventTypes.JOB_COMPLETED, this::onJobEnded);
        eventBus.subscribe(EventTypes.JOB_CANCELLED, this::onJobEnded);
    }

    void onJobEnded(Event event) {
        Long endedAt = event.getLong("ended_at");
        long end = endedAt != null ? endedAt : event.getCreatedAt();
        Long startedAt = event.getLong("started_at");
        Long duration = event.getLong("duration_seconds");

        PrintArchive archive = new PrintArchive(
                null,
                event.getLong("job_id"),
                event.getString("printer_id"),
                event.getString("job_name"),
                event.getString("status"),
                startedAt != null ? startedAt : end,
                end,
                duration != null ? duration : 0,
                event.getString("error_code"),
                event.getLong("scheduled_job_id"),
                System.currentTimeMillis());
        long id = archiveRepository.insert(archive);
        logger.debug("Archived {} print '{}' of {} as #{}", archive.status(), archive.printName(), archive.printerId(), id);
    }
}
