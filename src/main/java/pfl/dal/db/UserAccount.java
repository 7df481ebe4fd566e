package pfl.dal.db;

/**
 * @since 16/01/2026
 */
public record UserAccount(long id, String username, String email) {
}
