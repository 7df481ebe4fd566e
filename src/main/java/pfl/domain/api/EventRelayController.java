package pfl.domain.api;

import io.javalin.http.Context;
import pfl.dal.db.EventRelayRepository;
import pfl.dal.db.RelayEntry;

import java.util.List;

import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;

/**
 * Poll endpoint over the event relay table. Clients pass the last id they saw.
 * @since 22/01/2026
 */
public class EventRelayController {
    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private final EventRelayRepository relayRepository;

    public EventRelayController(EventRelayRepository relayRepository) {
        this.relayRepository = relayRepository;
    }

    public void registerRoutes() {
        path("/api", () -> get("/events", this::getEvents));
    }

    void getEvents(Context ctx) {
        long since;
        int limit;
        try {
            since = parse(ctx.queryParam("since"), 0L);
            limit = (int) Math.min(MAX_LIMIT, Math.max(1, parse(ctx.queryParam("limit"), DEFAULT_LIMIT)));
        } catch (NumberFormatException e) {
            ctx.status(400).json(ApiResponse.error("since and limit must be numbers"));
            return;
        }
        List<RelayEntry> entries = relayRepository.readSince(since, limit);
        ctx.json(ApiResponse.success(entries));
    }

    private static long parse(String value, long defaultValue) {
        return value == null || value.isBlank() ? defaultValue : Long.parseLong(value.trim());
    }
}
