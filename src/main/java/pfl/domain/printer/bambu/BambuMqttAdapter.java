package pfl.domain.printer.bambu;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EHeater;
import pfl.common.EProtocolKind;
import pfl.dal.PrinterConfig;
import pfl.domain.printer.AbstractPrinterAdapter;
import pfl.domain.printer.IStatusListener;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Locale;
import java.util.UUID;

/**
 * Bambu Lab printers over the LAN MQTT broker running on the printer itself.
 * <p>
 * The printer pushes partial reports on {@code device/{serial}/report}; they are merged into a
 * {@link BambuReport}. The broker uses a self-signed certificate, so the TLS peer is not verified.
 * A silent broker is not reported as a disconnect by the client, the supervisor catches that
 * through {@link #getLastMessageAt()}.
 *
 * @since 16/01/2026
 */
public class BambuMqttAdapter extends AbstractPrinterAdapter implements MqttCallback {
    private static final Logger logger = LoggerFactory.getLogger(BambuMqttAdapter.class);
    private static final String USERNAME = "bblp";
    private static final int QOS = 0;
    private static final int CONNECT_TIMEOUT_S = 10;
    private static final long DISCONNECT_TIMEOUT_MS = 2_000;

    static final String PUSH_ALL = "{\"pushing\":{\"sequence_id\":\"0\",\"command\":\"pushall\"}}";

    private final BambuReport report = new BambuReport();
    private MqttClient client;

    public BambuMqttAdapter(PrinterConfig config, IStatusListener statusListener) {
        super(config, statusListener);
    }

    @Override
    public EProtocolKind getProtocolKind() {
        return EProtocolKind.BAMBU;
    }

    String reportTopic() {
        return "device/" + config.serial() + "/report";
    }

    String requestTopic() {
        return "device/" + config.serial() + "/request";
    }

    @Override
    public synchronized boolean connect() {
        if (client != null && client.isConnected()) {
            return true;
        }
        closeClient();

        String brokerUrl = "ssl://" + config.host() + ":" + config.port();
        String clientId = "printfleet-" + config.id() + "-" + UUID.randomUUID().toString().substring(0, 8);
        try {
            MqttClient newClient = new MqttClient(brokerUrl, clientId, new MemoryPersistence());
            newClient.setCallback(this);
            newClient.connect(connectOptions());
            newClient.subscribe(reportTopic(), QOS);
            client = newClient;
            markConnected(true);
            logger.info("[{}] Subscribed to {} on {}", getPrinterId(), reportTopic(), brokerUrl);
        } catch (MqttException e) {
            recordTransportError("MQTT connect to " + brokerUrl + " failed (reason " + e.getReasonCode() + ")", e);
            closeClient();
            markConnected(false);
            return false;
        } catch (GeneralSecurityException e) {
            recordTransportError("Cannot set up TLS for " + brokerUrl, e);
            markConnected(false);
            return false;
        }

        requestRefresh();
        return true;
    }

    private MqttConnectOptions connectOptions() throws GeneralSecurityException {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setUserName(USERNAME);
        options.setPassword(config.accessCode().toCharArray());
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setConnectionTimeout(CONNECT_TIMEOUT_S);
        options.setKeepAliveInterval(30);
        options.setSocketFactory(trustAllSocketFactory());
        options.setHttpsHostnameVerificationEnabled(false);
        return options;
    }

    /**
     * The printer presents a certificate signed by a vendor CA that is not in any trust store
     */
    private static SSLSocketFactory trustAllSocketFactory() throws GeneralSecurityException {
        TrustManager[] trustAll = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};
        SSLContext context = SSLContext.getInstance("TLSv1.2");
        context.init(null, trustAll, new SecureRandom());
        return context.getSocketFactory();
    }

    @Override
    public synchronized void disconnect() {
        closeClient();
        markConnected(false);
    }

    private void closeClient() {
        MqttClient current = client;
        client = null;
        if (current == null) {
            return;
        }
        try {
            if (current.isConnected()) {
                current.disconnect(DISCONNECT_TIMEOUT_MS);
            }
        } catch (MqttException e) {
            logger.debug("[{}] MQTT disconnect failed, forcing: {}", getPrinterId(), e.getMessage());
            try {
                current.disconnectForcibly(DISCONNECT_TIMEOUT_MS);
            } catch (MqttException forced) {
                logger.warn("[{}] Forced MQTT disconnect failed: {}", getPrinterId(), forced.getMessage());
            }
        }
        try {
            current.close();
        } catch (MqttException e) {
            logger.warn("[{}] Cannot close MQTT client: {}", getPrinterId(), e.getMessage());
        }
    }

    @Override
    public void requestRefresh() {
        publishRequest(PUSH_ALL);
    }

    @Override
    public boolean pause() {
        return publishRequest(printCommand("pause", null));
    }

    @Override
    public boolean resume() {
        return publishRequest(printCommand("resume", null));
    }

    @Override
    public boolean cancel() {
        return publishRequest(printCommand("stop", null));
    }

    @Override
    public boolean setTemperature(EHeater heater, double target) {
        String gcode = String.format(Locale.ROOT, "%s S%.0f\n", heater == EHeater.BED ? "M140" : "M104", target);
        return publishRequest(printCommand("gcode_line", gcode));
    }

    static String printCommand(String command, String param) {
        JsonObject print = new JsonObject();
        print.addProperty("sequence_id", "0");
        print.addProperty("command", command);
        if (param != null) {
            print.addProperty("param", param);
        }
        JsonObject root = new JsonObject();
        root.add("print", print);
        return root.toString();
    }

    private boolean publishRequest(String payload) {
        MqttClient current;
        synchronized (this) {
            current = client;
        }
        if (current == null || !current.isConnected()) {
            logger.warn("[{}] Cannot send request, MQTT not connected", getPrinterId());
            return false;
        }
        try {
            current.publish(requestTopic(), payload.getBytes(StandardCharsets.UTF_8), QOS, false);
            logger.debug("[{}] Request sent: {}", getPrinterId(), payload);
            return true;
        } catch (MqttException e) {
            recordTransportError("MQTT publish failed", e);
            return false;
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        recordTransportError("MQTT connection lost", cause);
        markConnected(false);
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        handleReport(new String(message.getPayload(), StandardCharsets.UTF_8));
    }

    /**
     * Merge one report payload and publish the resulting snapshot. Malformed payloads are dropped.
     */
    void handleReport(String payload) {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(payload);
            if (!element.isJsonObject()) {
                logger.warn("[{}] Ignoring non-object report: {}", getPrinterId(), payload);
                return;
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            logger.warn("[{}] Malformed report dropped: {}", getPrinterId(), e.getMessage());
            return;
        }

        synchronized (report) {
            if (!report.merge(json)) {
                return;
            }
            publishStatus(report.toStatus(getPrinterId()));
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // QoS 0, nothing to track
    }
}
