package com.skanga.dbgate.error;

/**
 * Thrown when a statement runs past its read or write deadline.
 * Kept distinct from {@link QueryExecutionException} so callers can decide to retry.
 */
public class QueryTimeoutException extends GatewayException {
    private final int timeoutSeconds;

    public QueryTimeoutException(String message, int timeoutSeconds, Throwable cause) {
        super(message, cause);
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
