package com.skanga.dbgate.target;

import com.skanga.dbgate.config.ResourceManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Database flavours the gateway knows how to connect to and introspect.
 * MariaDB and MySQL expose databases as JDBC catalogs; the others expose them as schemas.
 */
public enum Dialect {
    MARIADB("mariadb", "org.mariadb.jdbc.Driver", "jdbc:mariadb://%s:%d/", true,
            Set.of("information_schema", "mysql", "performance_schema", "sys")),
    MYSQL("mysql", "com.mysql.cj.jdbc.Driver", "jdbc:mysql://%s:%d/", true,
            Set.of("information_schema", "mysql", "performance_schema", "sys")),
    POSTGRESQL("postgresql", "org.postgresql.Driver", "jdbc:postgresql://%s:%d/", false,
            Set.of("information_schema", "pg_catalog", "pg_toast")),
    H2("h2", "org.h2.Driver", "jdbc:h2:tcp://%s:%d/", false,
            Set.of("information_schema"));

    private final String typeName;
    private final String driverClass;
    private final String urlPrefix;
    private final boolean usesCatalogs;
    private final Set<String> systemDatabases;

    Dialect(String typeName, String driverClass, String urlPrefix, boolean usesCatalogs, Set<String> systemDatabases) {
        this.typeName = typeName;
        this.driverClass = driverClass;
        this.urlPrefix = urlPrefix;
        this.usesCatalogs = usesCatalogs;
        this.systemDatabases = systemDatabases;
    }

    /**
     * Looks up a dialect by its DB_TYPE name (case-insensitive).
     *
     * @throws IllegalArgumentException for unsupported types
     */
    public static Dialect fromType(String dbType) {
        String normalizedType = dbType == null ? "" : dbType.trim().toLowerCase(Locale.ROOT);
        for (Dialect dialect : values()) {
            if (dialect.typeName.equals(normalizedType)) {
                return dialect;
            }
        }
        String supportedTypes = Arrays.stream(values()).map(Dialect::typeName).collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                ResourceManager.getErrorMessage("config.dialect.unknown", dbType, supportedTypes));
    }

    public String typeName() {
        return typeName;
    }

    public String driverClass() {
        return driverClass;
    }

    public boolean usesCatalogs() {
        return usesCatalogs;
    }

    /**
     * Server-level URL without a database, so that every database on one server can share a pool.
     */
    public String serverUrl(String host, int port) {
        return String.format(urlPrefix, host, port);
    }

    public String validationQuery() {
        return "SELECT 1";
    }

    public boolean isSystemDatabase(String databaseName) {
        return databaseName != null && systemDatabases.contains(databaseName.toLowerCase(Locale.ROOT));
    }

    /**
     * The database a connection currently points at: its catalog or its schema, depending on the dialect.
     * May be null when a catalog server connection has no database selected.
     */
    public String currentDatabase(Connection dbConn) throws SQLException {
        return usesCatalogs ? dbConn.getCatalog() : dbConn.getSchema();
    }

    /**
     * Points a leased connection at the given database.
     */
    public void selectDatabase(Connection dbConn, String databaseName) throws SQLException {
        if (databaseName == null || databaseName.isBlank()) {
            return;
        }
        if (usesCatalogs) {
            dbConn.setCatalog(databaseName);
        } else {
            dbConn.setSchema(databaseName);
        }
    }
}
