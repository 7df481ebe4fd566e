package pfl.domain.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EChannel;
import pfl.common.EWebhookType;
import pfl.dal.AlertConfig;
import pfl.dal.db.WebhookRepository;
import pfl.dal.db.WebhookTarget;

import javax.inject.Inject;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP POST to the enabled webhooks whose type filter accepts the alert
 * @since 20/01/2026
 */
public class WebhookChannel implements INotificationChannel {
    private static final Logger logger = LoggerFactory.getLogger(WebhookChannel.class);

    private final WebhookRepository webhookRepository;
    private final HttpClient httpClient;
    private final Duration timeout;

    @Inject
    public WebhookChannel(WebhookRepository webhookRepository, HttpClient httpClient, AlertConfig alertConfig) {
        this.webhookRepository = webhookRepository;
        this.httpClient = httpClient;
        this.timeout = Duration.ofMillis(alertConfig.webhookTimeoutMs());
    }

    @Override
    public EChannel getChannel() {
        return EChannel.WEBHOOK;
    }

    @Override
    public List<Recipient> resolveTargets(AlertRequest alert, List<Recipient> preferred) {
        List<Recipient> targets = new ArrayList<>();
        for (WebhookTarget webhook : webhookRepository.findEnabled()) {
            if (webhook.accepts(alert.alertType())) {
                targets.add(new Recipient(null, webhook.name(), webhook.url(), webhook.type().name()));
            }
        }
        return targets;
    }

    @Override
    public void deliver(AlertRequest alert, Recipient recipient) throws IOException, InterruptedException {
        EWebhookType type = EWebhookType.fromDbValue(recipient.provider());
        HttpRequest.Builder builder = HttpRequest.newBuilder(WebhookPayloadFactory.uri(type, recipient.address()))
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(
                        WebhookPayloadFactory.body(type, recipient.address(), alert), StandardCharsets.UTF_8));
        for (Map.Entry<String, String> header : WebhookPayloadFactory.headers(type, alert).entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Webhook '" + recipient.name() + "' answered HTTP " + response.statusCode());
        }
        logger.info("Webhook '{}' ({}) notified: {}", recipient.name(), type, alert.title());
    }
}
