package pfl.common;

import java.util.Locale;

/**
 * Webhook providers. Each one gets its own payload shape.
 * @since 16/01/2026
 */
public enum EWebhookType {
    DISCORD,
    SLACK,
    NTFY,
    TELEGRAM,
    GENERIC;

    public static EWebhookType fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return GENERIC;
        }
        try {
            return EWebhookType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERIC;
        }
    }
}
