package pfl.domain.alert;

import com.google.common.util.concurrent.Striped;
import com.google.gson.Gson;
import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils;
import org.joda.time.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EChannel;
import pfl.common.EventTypes;
import pfl.dal.AlertConfig;
import pfl.dal.db.AlertPreference;
import pfl.dal.db.AlertPreferenceRepository;
import pfl.dal.db.AlertRecord;
import pfl.dal.db.AlertRepository;
import pfl.dal.db.RepositoryException;
import pfl.dal.db.UserAccount;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;

/**
 * Turns an {@link AlertRequest} into stored in-app records and out-of-band deliveries.
 * <ol>
 *     <li>resolve recipients per channel from user preferences</li>
 *     <li>drop the alert if the same (type, printer, title) was stored within the dedup window</li>
 *     <li>store the in-app records in one transaction</li>
 *     <li>during quiet hours stop here, the records are flagged for the digest</li>
 *     <li>queue one delivery per channel target on the delivery pool</li>
 * </ol>
 * The clock is Joda's {@link DateTimeUtils}, so tests can pin it.
 *
 * @since 19/01/2026
 */
@Singleton
public class AlertDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(AlertDispatcher.class);
    public static final String DELIVERY_POOL = "alertDelivery";
    private static final String SOURCE = "alerts";

    private final AlertRepository alertRepository;
    private final AlertPreferenceRepository preferenceRepository;
    private final Set<INotificationChannel> channels;
    private final AlertConfig alertConfig;
    private final QuietHours quietHours;
    private final IEventBus eventBus;
    private final ExecutorService deliveryPool;
    private final Gson gson = new Gson();
    // duplicate check and insert of one (type, printer, title) key must not interleave
    private final Striped<Lock> dedupLocks = Striped.lock(64);

    @Inject
    public AlertDispatcher(AlertRepository alertRepository, AlertPreferenceRepository preferenceRepository,
                           Set<INotificationChannel> channels, AlertConfig alertConfig, IEventBus eventBus,
                           @Named(DELIVERY_POOL) ExecutorService deliveryPool) {
        this.alertRepository = alertRepository;
        this.preferenceRepository = preferenceRepository;
        this.channels = channels;
        this.alertConfig = alertConfig;
        this.quietHours = QuietHours.from(alertConfig);
        this.eventBus = eventBus;
        this.deliveryPool = deliveryPool;
    }

    /**
     * @return stored in-app records, empty when the alert was a duplicate
     * @throws RepositoryException when the records cannot be stored; nothing is delivered then
     */
    public List<AlertRecord> dispatch(AlertRequest alert) {
        long now = DateTimeUtils.currentTimeMillis();

        Map<EChannel, List<Recipient>> recipients = resolveRecipients(alert.alertType());

        boolean quiet = quietHours.isActive(new DateTime(now));
        List<AlertRecord> stored;
        Lock lock = dedupLocks.get(dedupKey(alert));
        lock.lock();
        try {
            if (alertRepository.existsSince(alert.alertType(), alert.printerId(), alert.title(), now - alertConfig.dedupWindowMs())) {
                logger.debug("Duplicate alert suppressed: {} '{}' ({})", alert.alertType(), alert.title(), alert.printerId());
                return Collections.emptyList();
            }
            stored = alertRepository.insertAll(inAppRecords(alert, recipients.get(EChannel.IN_APP), quiet, now));
        } finally {
            lock.unlock();
        }
        logger.info("Alert {} [{}] '{}' stored for {} recipient(s){}", alert.alertType(), alert.severity(), alert.title(),
                stored.size(), quiet ? ", external delivery held by quiet hours" : "");

        publishDispatched(alert, stored, quiet, now);

        if (!quiet) {
            queueDeliveries(alert, recipients);
        }
        return stored;
    }

    private static String dedupKey(AlertRequest alert) {
        return alert.alertType() + '|' + alert.printerId() + '|' + alert.title();
    }

    /**
     * Users with a preference row for the type follow it. Active users without a row get in-app.
     */
    Map<EChannel, List<Recipient>> resolveRecipients(String alertType) {
        Map<EChannel, List<Recipient>> byChannel = new EnumMap<>(EChannel.class);
        for (EChannel channel : EChannel.values()) {
            byChannel.put(channel, new ArrayList<>());
        }
        try {
            Map<Long, AlertPreference> preferences = new HashMap<>();
            for (AlertPreference preference : preferenceRepository.findForType(alertType)) {
                preferences.put(preference.userId(), preference);
            }
            for (UserAccount user : preferenceRepository.findActiveUsers()) {
                AlertPreference preference = preferences.get(user.id());
                if (preference == null || preference.inApp()) {
                    byChannel.get(EChannel.IN_APP).add(Recipient.user(user.id(), user.username(), null));
                }
                if (preference != null && preference.email() && user.email() != null && !user.email().isBlank()) {
                    byChannel.get(EChannel.EMAIL).add(Recipient.user(user.id(), user.username(), user.email()));
                }
                if (preference != null && preference.push()) {
                    byChannel.get(EChannel.PUSH).add(Recipient.user(user.id(), user.username(), null));
                }
            }
        } catch (RepositoryException e) {
            logger.warn("Cannot load alert preferences for '{}', falling back to in-app for everyone: {}", alertType, e.getMessage());
            byChannel.get(EChannel.IN_APP).clear();
        }
        return byChannel;
    }

    private List<AlertRecord> inAppRecords(AlertRequest alert, List<Recipient> inApp, boolean quiet, long now) {
        String metadata = alert.metadata().isEmpty() ? null : gson.toJson(alert.metadata());
        List<AlertRecord> records = new ArrayList<>();
        if (inApp.isEmpty()) {
            records.add(record(alert, null, metadata, quiet, now));
        }
        for (Recipient recipient : inApp) {
            records.add(record(alert, recipient.userId(), metadata, quiet, now));
        }
        return records;
    }

    private static AlertRecord record(AlertRequest alert, Long userId, String metadata, boolean quiet, long now) {
        return new AlertRecord(null, userId, alert.alertType(), alert.severity(), alert.title(), alert.message(),
                alert.printerId(), alert.jobId(), metadata, quiet, false, now);
    }

    private void publishDispatched(AlertRequest alert, List<AlertRecord> stored, boolean quiet, long now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("alert_type", alert.alertType());
        data.put("severity", alert.severity().dbValue());
        data.put("title", alert.title());
        data.put("message", alert.message());
        data.put("printer_id", alert.printerId());
        data.put("job_id", alert.jobId());
        data.put("recipients", stored.size());
        data.put("quiet_suppressed", quiet);
        eventBus.publish(new Event(EventTypes.ALERT_DISPATCHED, SOURCE, data, now));
    }

    private void queueDeliveries(AlertRequest alert, Map<EChannel, List<Recipient>> recipients) {
        for (INotificationChannel channel : channels) {
            if (channel.getChannel() == EChannel.IN_APP) {
                continue;
            }
            List<Recipient> targets;
            try {
                targets = channel.resolveTargets(alert, recipients.getOrDefault(channel.getChannel(), Collections.emptyList()));
            } catch (RuntimeException e) {
                logger.warn("{} channel cannot resolve targets for '{}': {}", channel.getChannel(), alert.title(), e.getMessage());
                continue;
            }
            for (Recipient target : targets) {
                try {
                    deliveryPool.execute(() -> deliver(channel, alert, target));
                } catch (RejectedExecutionException e) {
                    logger.warn("{} delivery to {} not queued, delivery pool is shut down", channel.getChannel(), target);
                }
            }
        }
    }

    private void deliver(INotificationChannel channel, AlertRequest alert, Recipient target) {
        try {
            channel.deliver(alert, target);
            logger.debug("{} delivery of '{}' to {} done", channel.getChannel(), alert.title(), target);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("{} delivery of '{}' to {} interrupted", channel.getChannel(), alert.title(), target);
        } catch (Exception e) {
            logger.warn("{} delivery of '{}' to {} failed: {}", channel.getChannel(), alert.title(), target, e.getMessage());
        }
    }

    /**
     * Alerts held back during the current or last quiet period
     */
    public List<AlertRecord> getQuietDigest() {
        if (!quietHours.isEnabled()) {
            return Collections.emptyList();
        }
        Interval period = quietHours.mostRecentPeriod(new DateTime(DateTimeUtils.currentTimeMillis()));
        // end bound is exclusive, include an alert stored in the very last millisecond
        return alertRepository.findQuietSuppressed(period.getStartMillis(), period.getEndMillis() + 1);
    }

    public QuietHours getQuietHours() {
        return quietHours;
    }
}
