package pfl.domain.event;

/**
 * Subscriber callback. Runs on the publisher's thread, so it must return quickly.
 * @since 12/01/2026
 */
@FunctionalInterface
public interface IEventHandler {
    void handle(Event event) throws Exception;
}
