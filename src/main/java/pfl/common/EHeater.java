package pfl.common;

/**
 * Heaters addressable through the set-temperature command
 * @since 15/01/2026
 */
public enum EHeater {
    BED,
    NOZZLE
}
