package pfl.domain.event;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EventTypes;

import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide event bus. Handlers are kept per type in registration order; publishing works on a
 * snapshot so handlers may subscribe, unsubscribe or publish again while being called.
 * @since 12/01/2026
 */
public class InMemoryEventBus implements IEventBus {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventBus.class);

    // LinkedHashMultimap keeps insertion order and ignores duplicate (type, handler) pairs
    private final SetMultimap<String, IEventHandler> handlers = LinkedHashMultimap.create();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void subscribe(String eventType, IEventHandler handler) {
        if (eventType == null || handler == null) {
            throw new IllegalArgumentException("Event type and handler are required");
        }
        lock.writeLock().lock();
        try {
            if (handlers.put(eventType, handler)) {
                logger.debug("Subscribed handler {} to '{}'", handler, eventType);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void unsubscribe(String eventType, IEventHandler handler) {
        lock.writeLock().lock();
        try {
            if (handlers.remove(eventType, handler)) {
                logger.debug("Unsubscribed handler {} from '{}'", handler, eventType);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void publish(Event event) {
        List<IEventHandler> exact;
        List<IEventHandler> wildcard;
        lock.readLock().lock();
        try {
            exact = ImmutableList.copyOf(handlers.get(event.getEventType()));
            wildcard = EventTypes.WILDCARD.equals(event.getEventType())
                    ? ImmutableList.of()
                    : ImmutableList.copyOf(handlers.get(EventTypes.WILDCARD));
        } finally {
            lock.readLock().unlock();
        }

        logger.trace("Publishing {} to {} exact and {} wildcard handlers", event.getEventType(), exact.size(), wildcard.size());

        for (IEventHandler handler : exact) {
            invoke(handler, event);
        }
        for (IEventHandler handler : wildcard) {
            invoke(handler, event);
        }
    }

    private void invoke(IEventHandler handler, Event event) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            logger.error("Event handler {} failed for '{}'", handler, event.getEventType(), e);
        }
    }

    @Override
    public int getSubscriberCount(String eventType) {
        lock.readLock().lock();
        try {
            return handlers.get(eventType).size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
