package pfl.common;

import java.util.Locale;

/**
 * Alert severity
 * @since 14/01/2026
 */
public enum ESeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ESeverity fromDbValue(String value) {
        if (value == null) {
            return WARNING;
        }
        try {
            return ESeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return WARNING;
        }
    }
}
