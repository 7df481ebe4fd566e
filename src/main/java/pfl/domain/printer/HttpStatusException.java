package pfl.domain.printer;

import java.io.IOException;

/**
 * Non-success HTTP answer from a printer
 * @since 13/01/2026
 */
public class HttpStatusException extends IOException {
    private final int statusCode;

    public HttpStatusException(String path, int statusCode) {
        super("HTTP " + statusCode + " from " + path);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
