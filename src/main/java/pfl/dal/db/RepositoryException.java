package pfl.dal.db;

/**
 * Unchecked wrapper for JDBC failures
 * @since 15/01/2026
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(String message) {
        super(message);
    }
}
