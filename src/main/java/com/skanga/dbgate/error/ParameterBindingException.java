package com.skanga.dbgate.error;

public class ParameterBindingException extends GatewayException {
    public ParameterBindingException(String message) {
        super(message);
    }

    public ParameterBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
