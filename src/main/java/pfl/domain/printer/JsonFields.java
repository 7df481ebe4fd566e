package pfl.domain.printer;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Null-safe accessors over Gson trees. Printers send numbers as strings, omit fields and send
 * explicit nulls; every accessor falls back to the given default instead of throwing.
 * @since 13/01/2026
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static JsonObject object(JsonObject parent, String key) {
        if (parent == null) {
            return null;
        }
        JsonElement element = parent.get(key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    public static JsonArray array(JsonObject parent, String key) {
        if (parent == null) {
            return null;
        }
        JsonElement element = parent.get(key);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : null;
    }

    public static boolean has(JsonObject parent, String key) {
        return parent != null && parent.has(key) && !parent.get(key).isJsonNull();
    }

    public static String string(JsonObject parent, String key, String defaultValue) {
        JsonPrimitive primitive = primitive(parent, key);
        return primitive == null ? defaultValue : primitive.getAsString();
    }

    public static int integer(JsonObject parent, String key, int defaultValue) {
        JsonPrimitive primitive = primitive(parent, key);
        if (primitive == null) {
            return defaultValue;
        }
        try {
            if (primitive.isNumber()) {
                return primitive.getAsNumber().intValue();
            }
            return (int) Double.parseDouble(primitive.getAsString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long longValue(JsonObject parent, String key, long defaultValue) {
        JsonPrimitive primitive = primitive(parent, key);
        if (primitive == null) {
            return defaultValue;
        }
        try {
            if (primitive.isNumber()) {
                return primitive.getAsNumber().longValue();
            }
            return Long.parseLong(primitive.getAsString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static double decimal(JsonObject parent, String key, double defaultValue) {
        JsonPrimitive primitive = primitive(parent, key);
        if (primitive == null) {
            return defaultValue;
        }
        try {
            if (primitive.isNumber()) {
                return primitive.getAsNumber().doubleValue();
            }
            return Double.parseDouble(primitive.getAsString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean bool(JsonObject parent, String key, boolean defaultValue) {
        JsonPrimitive primitive = primitive(parent, key);
        if (primitive == null) {
            return defaultValue;
        }
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsInt() != 0;
        }
        return Boolean.parseBoolean(primitive.getAsString().trim());
    }

    private static JsonPrimitive primitive(JsonObject parent, String key) {
        if (parent == null) {
            return null;
        }
        JsonElement element = parent.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsJsonPrimitive();
    }
}
