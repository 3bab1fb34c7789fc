package com.skanga.dbgate.policy;

/**
 * Classification of a SQL statement for the read-only gate and for timeout selection.
 */
public enum StatementType {
    READ,
    WRITE
}
