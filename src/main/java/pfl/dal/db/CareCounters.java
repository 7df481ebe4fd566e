package pfl.dal.db;

/**
 * Usage totals of one printer, reset partially by maintenance
 * @since 16/01/2026
 */
public record CareCounters(String printerId, double totalPrintHours, int totalPrintCount,
                           double hoursSinceMaintenance, int printsSinceMaintenance) {
}
