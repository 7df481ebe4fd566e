package pfl.dal.db;

/**
 * Channel opt-ins of one user for one alert type
 * @since 16/01/2026
 */
public record AlertPreference(long userId, String alertType, boolean inApp, boolean email, boolean push) {
}
