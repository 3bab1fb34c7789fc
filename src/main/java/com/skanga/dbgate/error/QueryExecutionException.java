package com.skanga.dbgate.error;

/**
 * Driver-reported failure. The message holds the sanitized, length-capped driver text;
 * the original {@link java.sql.SQLException} is kept as the cause for server-side logging only.
 */
public class QueryExecutionException extends GatewayException {
    private final String sqlState;
    private final int vendorCode;

    public QueryExecutionException(String message, String sqlState, int vendorCode, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
        this.vendorCode = vendorCode;
    }

    public QueryExecutionException(String message, Throwable cause) {
        this(message, null, 0, cause);
    }

    public String getSqlState() {
        return sqlState;
    }

    public int getVendorCode() {
        return vendorCode;
    }
}
