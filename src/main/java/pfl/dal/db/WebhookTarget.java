package pfl.dal.db;

import pfl.common.EWebhookType;

import java.util.Set;

/**
 * Configured webhook. An empty type filter, or one containing {@code all}, accepts every alert.
 * @since 16/01/2026
 */
public record WebhookTarget(long id, String name, String url, EWebhookType type, Set<String> alertTypes) {

    public boolean accepts(String alertType) {
        return alertTypes.isEmpty() || alertTypes.contains("all") || alertTypes.contains(alertType);
    }
}
