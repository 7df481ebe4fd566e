package pfl.domain.api;

/**
 * Body of an HTTP 500 for an exception no handler caught
 * @author Martin Sustik <sustik@herman.cz>
 * @since 26/09/2025
 */
public class ErrorResponse {
    private final String error;
    private final String message;
    private final long timestamp;

    public ErrorResponse(String error, String message) {
        this.error = error;
        this.message = message;
        this.timestamp = System.currentTimeMillis();
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
