package pfl.dal.db;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.common.EWebhookType;

import javax.inject.Inject;
import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * @since 16/01/2026
 */
public class WebhookRepository extends AbstractJdbcRepository {
    private static final Logger logger = LoggerFactory.getLogger(WebhookRepository.class);

    @Inject
    public WebhookRepository(DataSource dataSource) {
        super(dataSource);
    }

    public List<WebhookTarget> findEnabled() {
        return withConnection("load webhooks", connection -> {
            List<WebhookTarget> targets = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT id, name, url, webhook_type, alert_types FROM webhooks WHERE enabled = TRUE ORDER BY id");
                 ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    targets.add(new WebhookTarget(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("url"),
                            EWebhookType.fromDbValue(rs.getString("webhook_type")),
                            parseAlertTypes(rs.getString("alert_types"))));
                }
            }
            return targets;
        });
    }

    public long insert(String name, String url, EWebhookType type, String alertTypes) {
        return withConnection("insert webhook", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO webhooks (name, url, webhook_type, alert_types, enabled) VALUES (?, ?, ?, ?, TRUE)",
                    new String[]{"id"})) {
                statement.setString(1, name);
                statement.setString(2, url);
                statement.setString(3, type.name().toLowerCase(Locale.ROOT));
                statement.setString(4, alertTypes);
                statement.executeUpdate();
                return generatedId(statement);
            }
        });
    }

    /**
     * The filter is stored either as a JSON array or as a comma separated list
     */
    static Set<String> parseAlertTypes(String raw) {
        if (raw == null || raw.isBlank()) {
            return ImmutableSet.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                JsonArray array = JsonParser.parseString(trimmed).getAsJsonArray();
                ImmutableSet.Builder<String> types = ImmutableSet.builder();
                for (JsonElement element : array) {
                    if (element.isJsonPrimitive()) {
                        types.add(element.getAsString().trim());
                    }
                }
                return types.build();
            } catch (JsonParseException | IllegalStateException e) {
                logger.warn("Unreadable webhook alert type filter '{}', accepting all alerts", raw);
                return ImmutableSet.of();
            }
        }
        return ImmutableSet.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(trimmed));
    }
}
