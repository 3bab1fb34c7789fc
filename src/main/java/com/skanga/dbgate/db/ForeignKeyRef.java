package com.skanga.dbgate.db;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Column referenced by a foreign key.
 */
public record ForeignKeyRef(@JsonProperty("referenced_table") String referencedTable,
                            @JsonProperty("referenced_column") String referencedColumn) {
}
