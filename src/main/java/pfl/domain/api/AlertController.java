package pfl.domain.api;

import io.javalin.http.Context;
import pfl.dal.db.AlertRecord;
import pfl.dal.db.AlertRepository;
import pfl.domain.alert.AlertDispatcher;

import java.util.List;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;

/**
 * In-app alert list and the quiet-hours digest
 * @since 22/01/2026
 */
public class AlertController {
    static final int DEFAULT_LIMIT = 50;

    private final AlertRepository alertRepository;
    private final AlertDispatcher alertDispatcher;

    public AlertController(AlertRepository alertRepository, AlertDispatcher alertDispatcher) {
        this.alertRepository = alertRepository;
        this.alertDispatcher = alertDispatcher;
    }

    public void registerRoutes() {
        path("/api/alerts", () -> {
            get("", this::getAlerts);
            get("/digest", this::getDigest);
        });
    }

    void getAlerts(Context ctx) {
        Long userId;
        try {
            String param = ctx.queryParam("userId");
            userId = param == null || param.isBlank() ? null : Long.valueOf(param.trim());
        } catch (NumberFormatException e) {
            ctx.status(400).json(ApiResponse.error("userId must be a number"));
            return;
        }
        List<AlertRecord> alerts = alertRepository.findForUser(userId, DEFAULT_LIMIT);
        ctx.json(ApiResponse.success(alerts));
    }

    void getDigest(Context ctx) {
        List<AlertRecord> held = alertDispatcher.getQuietDigest();
        ctx.json(ApiResponse.success(held.size() + " alert(s) held during quiet hours", held));
    }
}
