package pfl.domain.alert;

import pfl.common.ESeverity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What should be announced. Identity for deduplication is (type, printer, title).
 * @since 19/01/2026
 */
public record AlertRequest(
        String alertType,
        ESeverity severity,
        String title,
        String message,
        String printerId,
        Long jobId,
        Map<String, Object> metadata) {

    public AlertRequest {
        if (alertType == null || alertType.isBlank()) {
            throw new IllegalArgumentException("Alert type cannot be empty");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Alert title cannot be empty");
        }
        severity = severity == null ? ESeverity.WARNING : severity;
        metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static AlertRequest of(String alertType, ESeverity severity, String title, String message, String printerId) {
        return new AlertRequest(alertType, severity, title, message, printerId, null, null);
    }
}
