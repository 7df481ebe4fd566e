package pfl.domain.printer;

import com.google.common.io.Resources;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Captured printer payloads under {@code src/test/resources/fixtures}
 * @since 13/01/2026
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String text(String name) {
        try {
            return Resources.toString(Resources.getResource("fixtures/" + name), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read fixture " + name, e);
        }
    }

    public static JsonObject json(String name) {
        return JsonParser.parseString(text(name)).getAsJsonObject();
    }
}
