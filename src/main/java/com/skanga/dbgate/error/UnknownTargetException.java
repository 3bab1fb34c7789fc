package com.skanga.dbgate.error;

/**
 * Thrown when a database name does not match any configured target.
 */
public class UnknownTargetException extends GatewayException {
    private final String targetName;

    public UnknownTargetException(String message, String targetName) {
        super(message);
        this.targetName = targetName;
    }

    public String getTargetName() {
        return targetName;
    }
}
