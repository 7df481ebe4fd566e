package pfl.domain.consumer;

import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EventTypes;
import pfl.dal.RelayConfig;
import pfl.dal.db.EventRelayRepository;
import pfl.dal.db.RepositoryException;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies every bus event into the relay table so other processes can poll it by id.
 * Rows older than the TTL are pruned, at most once per prune interval.
 * @since 20/01/2026
 */
@Singleton
public class EventRelayWriter implements IEventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(EventRelayWriter.class);

    private final EventRelayRepository relayRepository;
    private final RelayConfig relayConfig;
    private final Gson gson = new Gson();
    private long lastPruneAt;

    @Inject
    public EventRelayWriter(EventRelayRepository relayRepository, RelayConfig relayConfig) {
        this.relayRepository = relayRepository;
        this.relayConfig = relayConfig;
    }

    @Override
    public void register(IEventBus eventBus) {
        eventBus.subscribe(EventTypes.WILDCARD, this::onEvent);
    }

    void onEvent(Event event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", event.getEventType());
        payload.put("source", event.getSourceModule());
        payload.put("data", event.getData());
        payload.put("created_at", event.getCreatedAt());
        relayRepository.append(event.getEventType(), gson.toJson(payload), event.getCreatedAt());
        pruneIfDue(System.currentTimeMillis());
    }

    synchronized void pruneIfDue(long now) {
        if (now - lastPruneAt < relayConfig.pruneIntervalMs()) {
            return;
        }
        lastPruneAt = now;
        try {
            int removed = relayRepository.deleteOlderThan(now - relayConfig.ttlMs());
            if (removed > 0) {
                logger.debug("Pruned {} relay row(s)", removed);
            }
        } catch (RepositoryException e) {
            logger.warn("Relay prune failed: {}", e.getMessage());
        }
    }
}
