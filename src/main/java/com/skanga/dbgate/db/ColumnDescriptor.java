package com.skanga.dbgate.db;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata of one table column, shaped after MySQL's {@code SHOW COLUMNS} output.
 *
 * @param type         type name with length or precision, e.g. {@code VARCHAR(100)}
 * @param nullable     whether the column accepts NULL
 * @param defaultValue default expression, null when there is none
 * @param key          {@code PRI}, {@code UNI}, {@code MUL} or empty
 * @param extra        {@code auto_increment} or empty
 * @param foreignKey   referenced column, only filled in by relation lookups
 */
public record ColumnDescriptor(String type,
                               boolean nullable,
                               @JsonProperty("default") String defaultValue,
                               String key,
                               String extra,
                               @JsonInclude(JsonInclude.Include.NON_NULL)
                               @JsonProperty("foreign_key") ForeignKeyRef foreignKey) {
}
