package pfl.domain.event;

/**
 * Long-lived subscriber wired at startup. Each consumer is registered once.
 * @since 22/01/2026
 */
public interface IEventConsumer {
    void register(IEventBus eventBus);
}
