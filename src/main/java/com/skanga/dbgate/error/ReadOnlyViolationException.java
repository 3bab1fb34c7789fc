package com.skanga.dbgate.error;

/**
 * Thrown when a write statement is submitted while the gateway runs read-only.
 * Raised before any connection is leased.
 */
public class ReadOnlyViolationException extends GatewayException {
    public ReadOnlyViolationException(String message) {
        super(message);
    }
}
