package com.skanga.dbgate.error;

/**
 * Thrown when no pooled connection became free within the acquire timeout.
 */
public class PoolExhaustedException extends GatewayException {
    private final long waitedMs;

    public PoolExhaustedException(String message, long waitedMs, Throwable cause) {
        super(message, cause);
        this.waitedMs = waitedMs;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
