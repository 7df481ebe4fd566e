package pfl.domain.alert;

import pfl.common.EChannel;

import java.util.List;

/**
 * External delivery path of alerts. Implementations are contributed through a Guice multibinder;
 * {@link #deliver} runs on the delivery pool, never on the event bus thread.
 * @since 19/01/2026
 */
public interface INotificationChannel {

    EChannel getChannel();

    /**
     * Targets for one alert. By default the users whose preferences ask for this channel.
     */
    default List<Recipient> resolveTargets(AlertRequest alert, List<Recipient> preferred) {
        return preferred;
    }

    /**
     * Deliver to one target. Failures are reported by throwing; they are logged per target.
     */
    void deliver(AlertRequest alert, Recipient recipient) throws Exception;
}
