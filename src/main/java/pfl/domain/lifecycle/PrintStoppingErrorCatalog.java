package pfl.domain.lifecycle;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Device error codes known to end an active print before the device state field says so.
 * The list is data: {@code code=description} lines in {@code print-stopping-errors.properties},
 * replaceable by an external file.
 * @since 14/01/2026
 */
public class PrintStoppingErrorCatalog {
    private static final Logger logger = LoggerFactory.getLogger(PrintStoppingErrorCatalog.class);
    public static final String BUNDLED_RESOURCE = "print-stopping-errors.properties";

    private final Map<String, String> codes;

    public PrintStoppingErrorCatalog(Map<String, String> codes) {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        codes.forEach((code, description) -> builder.put(normalize(code), description == null ? "" : description.trim()));
        this.codes = builder.buildKeepingLast();
    }

    /**
     * @param externalFile replacement list, null or blank for the bundled one
     */
    public static PrintStoppingErrorCatalog load(String externalFile) {
        Properties properties = new Properties();
        if (externalFile != null && !externalFile.isBlank()) {
            Path path = Paths.get(externalFile.trim());
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                properties.load(reader);
                logger.info("Loaded {} print-stopping error codes from {}", properties.size(), path.toAbsolutePath());
                return fromProperties(properties);
            } catch (IOException e) {
                logger.warn("Cannot read print-stopping error list '{}', using bundled list: {}", path, e.getMessage());
                properties.clear();
            }
        }

        try (InputStream input = PrintStoppingErrorCatalog.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (input == null) {
                logger.warn("Bundled print-stopping error list not found, stopping-error override disabled");
                return new PrintStoppingErrorCatalog(Map.of());
            }
            properties.load(new InputStreamReader(input, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.warn("Cannot read bundled print-stopping error list, stopping-error override disabled: {}", e.getMessage());
            return new PrintStoppingErrorCatalog(Map.of());
        }
        logger.info("Loaded {} print-stopping error codes", properties.size());
        return fromProperties(properties);
    }

    private static PrintStoppingErrorCatalog fromProperties(Properties properties) {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (String code : properties.stringPropertyNames()) {
            builder.put(code, properties.getProperty(code));
        }
        return new PrintStoppingErrorCatalog(builder.buildKeepingLast());
    }

    public boolean isPrintStopping(String errorCode) {
        return errorCode != null && codes.containsKey(normalize(errorCode));
    }

    /**
     * @return description of a listed code, null for codes not on the list
     */
    public String describe(String errorCode) {
        if (errorCode == null) {
            return null;
        }
        String description = codes.get(normalize(errorCode));
        return description == null || description.isEmpty() ? null : description;
    }

    public int size() {
        return codes.size();
    }

    private static String normalize(String code) {
        return code.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
