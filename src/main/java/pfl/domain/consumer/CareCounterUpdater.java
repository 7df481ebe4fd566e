package pfl.domain.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EventTypes;
import pfl.dal.db.PrinterRepository;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Adds successful prints to the printer's lifetime and since-maintenance counters
 * @since 20/01/2026
 */
@Singleton
public class CareCounterUpdater implements IEventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(CareCounterUpdater.class);

    private final PrinterRepository printerRepository;

    @Inject
    public CareCounterUpdater(PrinterRepository printerRepository) {
        this.printerRepository = printerRepository;
    }

    @Override
    public void register(IEventBus eventBus) {
        eventBus.subscribe(EventTypes.JOB_COMPLETED, this::onJobCompleted);
    }

    void onJobCompleted(Event event) {
        if (!event.getBoolean("success", false)) {
            return;
        }
        String printerId = event.getString("printer_id");
        Long duration = event.getLong("duration_seconds");
        double hours = duration != null ? duration / 3600.0 : 0.0;
        printerRepository.addCompletedPrint(printerId, hours);
        logger.debug("[{}] Care counters advanced by {} h", printerId, String.format("%.2f", hours));
    }
}
