package pfl.domain.alert;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import pfl.common.ESeverity;
import pfl.common.EWebhookType;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider specific request shapes for webhook delivery
 * @since 20/01/2026
 */
public final class WebhookPayloadFactory {
    static final String FOOTER = "PrintFleet";
    static final String TELEGRAM_API = "https://api.telegram.org/bot";

    private WebhookPayloadFactory() {
    }

    public static int color(ESeverity severity) {
        return switch (severity) {
            case CRITICAL, ERROR -> 0xef4444;
            case WARNING -> 0xf59e0b;
            case INFO -> 0x3b82f6;
        };
    }

    public static String emoji(ESeverity severity) {
        return switch (severity) {
            case CRITICAL, ERROR -> "🔴";
            case WARNING -> "🟡";
            case INFO -> "🔵";
        };
    }

    /**
     * Telegram webhooks store {@code bot-token|chat-id} instead of a url
     */
    public static URI uri(EWebhookType type, String url) {
        if (type == EWebhookType.TELEGRAM) {
            return URI.create(TELEGRAM_API + telegramParts(url)[0] + "/sendMessage");
        }
        return URI.create(url);
    }

    public static Map<String, String> headers(EWebhookType type, AlertRequest alert) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (type == EWebhookType.NTFY) {
            headers.put("Content-Type", "text/plain; charset=utf-8");
            headers.put("Title", alert.title());
            headers.put("Priority", switch (alert.severity()) {
                case CRITICAL -> "urgent";
                case WARNING, ERROR -> "high";
                case INFO -> "default";
            });
            headers.put("Tags", "printer");
        } else {
            headers.put("Content-Type", "application/json");
        }
        return headers;
    }

    public static String body(EWebhookType type, String url, AlertRequest alert) {
        String message = alert.message() == null ? "" : alert.message();
        return switch (type) {
            case DISCORD -> discord(alert, message);
            case SLACK -> slack(alert, message);
            case NTFY -> message.isBlank() ? alert.title() : message;
            case TELEGRAM -> telegram(url, alert, message);
            case GENERIC -> generic(alert, message);
        };
    }

    private static String discord(AlertRequest alert, String message) {
        JsonObject footer = new JsonObject();
        footer.addProperty("text", FOOTER);
        JsonObject embed = new JsonObject();
        embed.addProperty("title", emoji(alert.severity()) + " " + alert.title());
        embed.addProperty("description", message);
        embed.addProperty("color", color(alert.severity()));
        embed.add("footer", footer);
        JsonArray embeds = new JsonArray();
        embeds.add(embed);
        JsonObject root = new JsonObject();
        root.add("embeds", embeds);
        return root.toString();
    }

    private static String slack(AlertRequest alert, String message) {
        JsonArray blocks = new JsonArray();
        blocks.add(block("header", "plain_text", emoji(alert.severity()) + " " + alert.title()));
        blocks.add(block("section", "mrkdwn", message));
        JsonObject root = new JsonObject();
        root.add("blocks", blocks);
        return root.toString();
    }

    private static JsonObject block(String blockType, String textType, String text) {
        JsonObject textObject = new JsonObject();
        textObject.addProperty("type", textType);
        textObject.addProperty("text", text);
        JsonObject block = new JsonObject();
        block.addProperty("type", blockType);
        block.add("text", textObject);
        return block;
    }

    private static String telegram(String url, AlertRequest alert, String message) {
        JsonObject root = new JsonObject();
        root.addProperty("chat_id", telegramParts(url)[1]);
        root.addProperty("text", emoji(alert.severity()) + " *" + alert.title() + "*\n" + message);
        root.addProperty("parse_mode", "Markdown");
        return root.toString();
    }

    private static String generic(AlertRequest alert, String message) {
        JsonObject root = new JsonObject();
        root.addProperty("event", alert.alertType());
        root.addProperty("title", alert.title());
        root.addProperty("message", message);
        root.addProperty("severity", alert.severity().dbValue());
        return root.toString();
    }

    private static String[] telegramParts(String url) {
        String[] parts = url == null ? new String[0] : url.split("\\|", 2);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Telegram webhook needs 'bot-token|chat-id'");
        }
        return new String[]{parts[0].trim(), parts[1].trim()};
    }
}
