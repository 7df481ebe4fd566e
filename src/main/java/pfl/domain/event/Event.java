package pfl.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message carried by the in-process event bus
 * @since 12/01/2026
 */
public class Event {
    private final String eventType;
    private final String sourceModule;
    private final Map<String, Object> data;
    private final long createdAt;

    public Event(String eventType, String sourceModule, Map<String, Object> data) {
        this(eventType, sourceModule, data, System.currentTimeMillis());
    }

    public Event(String eventType, String sourceModule, Map<String, Object> data, long createdAt) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be empty");
        }
        this.eventType = eventType;
        this.sourceModule = sourceModule;
        this.data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.createdAt = createdAt;
    }

    public String getEventType() {
        return eventType;
    }

    public String getSourceModule() {
        return sourceModule;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public String getString(String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }

    public Long getLong(String key) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "Event [type=" + eventType + ", source=" + sourceModule + ", createdAt=" + createdAt + ", data=" + data + "]";
    }
}
