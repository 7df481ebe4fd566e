package pfl.domain;

/**
 * Outcome of bringing up one service at startup
 * @author Martin Sustik <sustik@herman.cz>
 * @since 10/10/2025
 */
public class ServiceInitializationResult {
    private final String serviceName;
    private final boolean success;
    private final String detail;
    private final String errorMessage;
    private final Exception exception;
    private final long initializationTimeMs;

    private ServiceInitializationResult(String serviceName, boolean success, String detail,
                                        String errorMessage, Exception exception, long initializationTimeMs) {
        this.serviceName = serviceName;
        this.success = success;
        this.detail = detail;
        this.errorMessage = errorMessage;
        this.exception = exception;
        this.initializationTimeMs = initializationTimeMs;
    }

    public static ServiceInitializationResult success(String serviceName, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, true, null, null, null, initTimeMs);
    }

    /**
     * Successful start with a short note for the startup summary, e.g. "3 printers"
     */
    public static ServiceInitializationResult success(String serviceName, String detail, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, true, detail, null, null, initTimeMs);
    }

    public static ServiceInitializationResult failure(String serviceName, Exception exception, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, false, null, exception.getMessage(), exception, initTimeMs);
    }

    public static ServiceInitializationResult failure(String serviceName, String errorMessage, long initTimeMs) {
        return new ServiceInitializationResult(serviceName, false, null, errorMessage, null, initTimeMs);
    }

    public String getServiceName() {
        return serviceName;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getDetail() {
        return detail;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Exception getException() {
        return exception;
    }

    public long getInitializationTimeMs() {
        return initializationTimeMs;
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("%s: SUCCESS (initialized in %dms)%s",
                    serviceName, initializationTimeMs, detail == null ? "" : " - " + detail);
        }
        return String.format("%s: FAILED (attempted for %dms) - %s",
                serviceName, initializationTimeMs, errorMessage);
    }
}
