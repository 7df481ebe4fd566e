package pfl.common;

import java.util.Locale;

/**
 * Persisted status of a print job record
 * @since 13/01/2026
 */
public enum EJobStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static EJobStatus fromDbValue(String value) {
        return EJobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
