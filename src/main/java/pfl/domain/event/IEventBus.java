package pfl.domain.event;

/**
 * In-process publish/subscribe hub
 * @since 12/01/2026
 */
public interface IEventBus {
    /**
     * Register a handler for an event type, or for every type with {@code "*"}.
     * Registering the same handler twice for the same type has no effect.
     */
    void subscribe(String eventType, IEventHandler handler);

    /**
     * Remove a handler. No-op when the pair was never registered.
     */
    void unsubscribe(String eventType, IEventHandler handler);

    /**
     * Deliver the event synchronously to exact-type handlers first, then to wildcard handlers.
     * Handler failures are logged and never reach the caller.
     */
    void publish(Event event);

    int getSubscriberCount(String eventType);
}
