package pfl.domain.consumer;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EventTypes;
import pfl.dal.RepublishConfig;
import pfl.domain.event.Event;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors state changes, job events and dispatched alerts to an external MQTT broker.
 * Publishing happens on a dedicated thread, a slow broker never holds up the bus.
 * <pre>
 * {prefix}/{printer}/status   printer.state_changed
 * {prefix}/{printer}/job      job.*
 * {prefix}/alerts             alert.dispatched
 * </pre>
 * @since 21/01/2026
 */
@Singleton
public class MqttRepublisher implements IEventConsumer {
    private static final Logger logger = LoggerFactory.getLogger(MqttRepublisher.class);
    private static final int QOS = 1;
    static final long CONNECT_RETRY_MS = 30_000;

    private final RepublishConfig config;
    private final Gson gson = new Gson();
    private final ExecutorService publisher;
    private final long connectRetryMs;
    private volatile IMqttClient client;
    // Paho reconnects on its own only after a first successful connect; until then publish() retries
    private boolean connectedOnce;             // publisher thread only
    private long lastConnectAttempt;           // publisher thread only

    @Inject
    public MqttRepublisher(RepublishConfig config) {
        this(config, null, Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("mqtt-republish-%d").setDaemon(true).build()), CONNECT_RETRY_MS);
    }

    MqttRepublisher(RepublishConfig config, IMqttClient client, ExecutorService publisher, long connectRetryMs) {
        this.config = config;
        this.client = client;
        this.publisher = publisher;
        this.connectRetryMs = connectRetryMs;
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    /**
     * Connect and subscribe to the bus. Does nothing when republishing is disabled.
     * A broker that is down at startup is retried from {@code publish} at most every {@value #CONNECT_RETRY_MS}ms.
     */
    @Override
    public void register(IEventBus eventBus) {
        if (!config.enabled()) {
            logger.info("MQTT republish disabled");
            return;
        }
        publisher.execute(this::connect);

        eventBus.subscribe(EventTypes.PRINTER_STATE_CHANGED, this::onStateChanged);
        eventBus.subscribe(EventTypes.JOB_STARTED, this::onJobEvent);
        eventBus.subscribe(EventTypes.JOB_PROGRESS, this::onJobEvent);
        eventBus.subscribe(EventTypes.JOB_PAUSED, this::onJobEvent);
        eventBus.subscribe(EventTypes.JOB_COMPLETED, this::onJobEvent);
        eventBus.subscribe(EventTypes.JOB_CANCELLED, this::onJobEvent);
        eventBus.subscribe(EventTypes.ALERT_DISPATCHED, this::onAlert);
        logger.info("MQTT republish to {} under '{}'", config.getServerUri(), config.topicPrefix());
    }

    private void connect() {
        lastConnectAttempt = System.currentTimeMillis();
        try {
            if (client == null) {
                client = new MqttClient(config.getServerUri(), newClientId(), new MemoryPersistence());
            }
            if (client.isConnected()) {
                connectedOnce = true;
                return;
            }
            MqttConnectOptions options = new MqttConnectOptions();
            options.setAutomaticReconnect(true);
            options.setCleanSession(true);
            if (config.username() != null && !config.username().isBlank()) {
                options.setUserName(config.username());
                options.setPassword(config.password() == null ? new char[0] : config.password().toCharArray());
            }
            client.connect(options);
            connectedOnce = true;
            logger.info("Connected to republish broker {}", config.getServerUri());
        } catch (MqttException e) {
            logger.warn("Cannot connect to republish broker {}: {}", config.getServerUri(), e.getMessage());
        }
    }

    void onStateChanged(Event event) {
        enqueue(topic(event.getString("printer_id"), "status"), event);
    }

    void onJobEvent(Event event) {
        enqueue(topic(event.getString("printer_id"), "job"), event);
    }

    void onAlert(Event event) {
        enqueue(config.topicPrefix() + "/alerts", event);
    }

    static String newClientId() {
        return "printfleet-republisher-" + UUID.randomUUID().toString().substring(0, 8);
    }

    String topic(String printerId, String leaf) {
        return config.topicPrefix() + "/" + printerId + "/" + leaf;
    }

    private void enqueue(String topic, Event event) {
        Map<String, Object> payload = new LinkedHashMap<>(event.getData());
        payload.put("event_type", event.getEventType());
        payload.put("timestamp", event.getCreatedAt());
        byte[] body = gson.toJson(payload).getBytes(StandardCharsets.UTF_8);
        try {
            publisher.execute(() -> publish(topic, body));
        } catch (RejectedExecutionException e) {
            logger.debug("Republisher closed, {} not sent", topic);
        }
    }

    private void publish(String topic, byte[] body) {
        if (!connectedOnce && System.currentTimeMillis() - lastConnectAttempt >= connectRetryMs) {
            connect();
        }
        IMqttClient current = client;
        if (current == null || !current.isConnected()) {
            logger.debug("Republish broker not connected, dropping {}", topic);
            return;
        }
        try {
            current.publish(topic, body, QOS, false);
        } catch (MqttException e) {
            logger.warn("Republish to {} failed: {}", topic, e.getMessage());
        }
    }

    public void close() {
        publisher.shutdown();
        try {
            if (!publisher.awaitTermination(5, TimeUnit.SECONDS)) {
                publisher.shutdownNow();
            }
        } catch (InterruptedException e) {
            publisher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        IMqttClient current = client;
        if (current == null) {
            return;
        }
        try {
            if (current.isConnected()) {
                current.disconnect();
            }
            current.close();
        } catch (MqttException e) {
            logger.warn("Error closing republish client: {}", e.getMessage());
        }
    }
}
