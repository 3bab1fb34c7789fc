package com.skanga.dbgate.error;

/**
 * Base type for every failure the gateway reports to its caller.
 * Messages are safe to show to a client: they never carry credentials
 * and driver text inside them has already been sanitized.
 */
public class GatewayException extends Exception {
    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
