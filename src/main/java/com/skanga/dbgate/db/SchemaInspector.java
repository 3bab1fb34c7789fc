package com.skanga.dbgate.db;

import com.skanga.dbgate.SecurityUtils;
import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.error.GatewayException;
import com.skanga.dbgate.error.QueryExecutionException;
import com.skanga.dbgate.error.UnknownTargetException;
import com.skanga.dbgate.pool.ConnectionPoolManager;
import com.skanga.dbgate.pool.PooledConnection;
import com.skanga.dbgate.target.Dialect;
import com.skanga.dbgate.target.Target;
import com.skanga.dbgate.target.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Catalog lookups through {@link DatabaseMetaData}, so the same code serves every dialect.
 * Unknown databases and tables yield empty results rather than errors.
 */
public class SchemaInspector {
    private static final Logger logger = LoggerFactory.getLogger(SchemaInspector.class);
    private static final Set<String> TABLE_TYPES = Set.of("TABLE", "BASE TABLE", "VIEW");

    private final TargetRegistry targetRegistry;
    private final ConnectionPoolManager poolManager;

    public SchemaInspector(TargetRegistry targetRegistry, ConnectionPoolManager poolManager) {
        this.targetRegistry = targetRegistry;
        this.poolManager = poolManager;
    }

    /**
     * Lists user databases on every configured server, without system catalogs.
     *
     * @return sorted, de-duplicated database names
     * @throws GatewayException if a server cannot be reached
     */
    public List<String> listDatabases() throws GatewayException {
        Set<String> databaseNames = new TreeSet<>();
        for (Target target : targetRegistry.serverTargets()) {
            try (PooledConnection pooledConnection = poolManager.acquireServerConnection(target)) {
                DatabaseMetaData metaData = pooledConnection.connection().getMetaData();
                boolean catalogs = target.dialect().usesCatalogs();
                try (ResultSet resultSet = catalogs ? metaData.getCatalogs() : metaData.getSchemas()) {
                    while (resultSet.next()) {
                        String databaseName = resultSet.getString(catalogs ? "TABLE_CAT" : "TABLE_SCHEM");
                        if (databaseName != null && !databaseName.isBlank()
                                && !target.dialect().isSystemDatabase(databaseName)) {
                            databaseNames.add(databaseName);
                        }
                    }
                }
            } catch (SQLException e) {
                throw lookupFailure(target, e);
            }
        }
        logger.debug("Found {} databases", databaseNames.size());
        return new ArrayList<>(databaseNames);
    }

    /**
     * Lists tables and views of a database.
     *
     * @param databaseName database name, blank for the default target's database
     * @return sorted table names, empty when the database is unknown
     */
    public List<String> listTables(String databaseName) throws GatewayException {
        Target target = resolveOrNull(databaseName);
        if (target == null) {
            return List.of();
        }
        try (PooledConnection pooledConnection = poolManager.acquireServerConnection(target)) {
            Connection dbConn = pooledConnection.connection();
            CatalogScope catalogScope = scopeOf(target, dbConn);
            Set<String> tableNames = new TreeSet<>();
            try (ResultSet resultSet = dbConn.getMetaData()
                    .getTables(catalogScope.catalog(), catalogScope.schema(), "%", null)) {
                while (resultSet.next()) {
                    String tableType = resultSet.getString("TABLE_TYPE");
                    if (tableType != null && TABLE_TYPES.contains(tableType.toUpperCase(Locale.ROOT))) {
                        tableNames.add(resultSet.getString("TABLE_NAME"));
                    }
                }
            }
            return new ArrayList<>(tableNames);
        } catch (SQLException e) {
            throw lookupFailure(target, e);
        }
    }

    /**
     * Describes the columns of a table in their declared order.
     *
     * @return column name to descriptor, empty when the database or table is unknown
     */
    public Map<String, ColumnDescriptor> getSchema(String databaseName, String tableName) throws GatewayException {
        return describe(databaseName, tableName, false);
    }

    /**
     * Like {@link #getSchema(String, String)}, with {@code foreign_key} set on referencing columns.
     *
     * @return a map with a single {@code columns} entry holding the descriptors
     */
    public Map<String, Map<String, ColumnDescriptor>> getSchemaWithRelations(String databaseName, String tableName)
            throws GatewayException {
        Map<String, Map<String, ColumnDescriptor>> tableRelations = new LinkedHashMap<>();
        tableRelations.put("columns", describe(databaseName, tableName, true));
        return tableRelations;
    }

    private Map<String, ColumnDescriptor> describe(String databaseName, String tableName, boolean withRelations)
            throws GatewayException {
        Target target = resolveOrNull(databaseName);
        if (target == null || tableName == null || tableName.isBlank()) {
            return new LinkedHashMap<>();
        }
        try (PooledConnection pooledConnection = poolManager.acquireServerConnection(target)) {
            Connection dbConn = pooledConnection.connection();
            DatabaseMetaData metaData = dbConn.getMetaData();
            CatalogScope catalogScope = scopeOf(target, dbConn);

            for (String candidateName : identifierCandidates(target.dialect(), tableName)) {
                Map<String, ColumnDescriptor> tableColumns =
                        describeTableColumns(metaData, catalogScope, candidateName, withRelations);
                if (!tableColumns.isEmpty()) {
                    return tableColumns;
                }
            }
            logger.debug("Table {} not found in {}", tableName, target.name());
            return new LinkedHashMap<>();
        } catch (SQLException e) {
            throw lookupFailure(target, e);
        }
    }

    private Map<String, ColumnDescriptor> describeTableColumns(DatabaseMetaData metaData, CatalogScope catalogScope,
                                                               String tableName, boolean withRelations)
            throws SQLException {
        Map<String, ColumnDescriptor> tableColumns = new LinkedHashMap<>();
        List<RawColumn> rawColumns = new ArrayList<>();
        try (ResultSet resultSet = metaData.getColumns(catalogScope.catalog(), catalogScope.schema(), tableName, null)) {
            while (resultSet.next()) {
                // exact match only: '_' in a table name is a pattern wildcard
                if (!tableName.equals(resultSet.getString("TABLE_NAME"))) {
                    continue;
                }
                rawColumns.add(new RawColumn(
                        resultSet.getString("COLUMN_NAME"),
                        formatDataType(resultSet.getString("TYPE_NAME"), resultSet.getInt("COLUMN_SIZE"),
                                resultSet.getInt("DECIMAL_DIGITS")),
                        !"NO".equalsIgnoreCase(resultSet.getString("IS_NULLABLE")),
                        resultSet.getString("COLUMN_DEF"),
                        "YES".equalsIgnoreCase(resultSet.getString("IS_AUTOINCREMENT")),
                        resultSet.getInt("ORDINAL_POSITION")));
            }
        }
        if (rawColumns.isEmpty()) {
            return tableColumns;
        }
        rawColumns.sort(Comparator.comparingInt(RawColumn::position));

        Map<String, String> columnKeys = describeColumnKeys(metaData, catalogScope, tableName);
        Map<String, ForeignKeyRef> foreignKeys = withRelations
                ? describeTableForeignKeys(metaData, catalogScope, tableName) : Map.of();

        for (RawColumn rawColumn : rawColumns) {
            tableColumns.put(rawColumn.name(), new ColumnDescriptor(
                    rawColumn.type(),
                    rawColumn.nullable(),
                    rawColumn.defaultValue(),
                    columnKeys.getOrDefault(rawColumn.name(), ""),
                    rawColumn.autoIncrement() ? "auto_increment" : "",
                    foreignKeys.get(rawColumn.name())));
        }
        return tableColumns;
    }

    /**
     * Derives MySQL style key markers: PRI for primary key columns, UNI for single column unique indexes,
     * MUL for the leading column of any other index.
     */
    private Map<String, String> describeColumnKeys(DatabaseMetaData metaData, CatalogScope catalogScope,
                                                   String tableName) throws SQLException {
        Set<String> primaryKeyColumns = new HashSet<>();
        try (ResultSet resultSet = metaData.getPrimaryKeys(catalogScope.catalog(), catalogScope.schema(), tableName)) {
            while (resultSet.next()) {
                primaryKeyColumns.add(resultSet.getString("COLUMN_NAME"));
            }
        }

        Map<String, List<String>> indexColumns = new HashMap<>();
        Map<String, Boolean> uniqueIndexes = new HashMap<>();
        try (ResultSet resultSet = metaData.getIndexInfo(catalogScope.catalog(), catalogScope.schema(), tableName,
                false, true)) {
            while (resultSet.next()) {
                String indexName = resultSet.getString("INDEX_NAME");
                String columnName = resultSet.getString("COLUMN_NAME");
                if (indexName != null && columnName != null) {
                    indexColumns.computeIfAbsent(indexName, k -> new ArrayList<>()).add(columnName);
                    uniqueIndexes.put(indexName, !resultSet.getBoolean("NON_UNIQUE"));
                }
            }
        }

        Map<String, String> columnKeys = new HashMap<>();
        for (Map.Entry<String, List<String>> indexEntry : indexColumns.entrySet()) {
            List<String> indexedColumns = indexEntry.getValue();
            String leadingColumn = indexedColumns.get(0);
            boolean singleUnique = uniqueIndexes.getOrDefault(indexEntry.getKey(), false) && indexedColumns.size() == 1;
            String keyMarker = singleUnique ? "UNI" : "MUL";
            if (!"UNI".equals(columnKeys.get(leadingColumn))) {
                columnKeys.put(leadingColumn, keyMarker);
            }
        }
        for (String primaryKeyColumn : primaryKeyColumns) {
            columnKeys.put(primaryKeyColumn, "PRI");
        }
        return columnKeys;
    }

    private Map<String, ForeignKeyRef> describeTableForeignKeys(DatabaseMetaData metaData, CatalogScope catalogScope,
                                                                String tableName) throws SQLException {
        Map<String, ForeignKeyRef> foreignKeys = new HashMap<>();
        try (ResultSet resultSet = metaData.getImportedKeys(catalogScope.catalog(), catalogScope.schema(), tableName)) {
            while (resultSet.next()) {
                foreignKeys.putIfAbsent(resultSet.getString("FKCOLUMN_NAME"),
                        new ForeignKeyRef(resultSet.getString("PKTABLE_NAME"), resultSet.getString("PKCOLUMN_NAME")));
            }
        }
        return foreignKeys;
    }

    /**
     * Formats data type with size and precision information.
     */
    static String formatDataType(String typeName, int size, int decimalDigits) {
        if (typeName == null) return "UNKNOWN";

        String upperType = typeName.toUpperCase(Locale.ROOT);
        if (size > 0) {
            if (upperType.contains("DECIMAL") || upperType.contains("NUMERIC")) {
                // Types with precision and scale (e.g., DECIMAL(10,2))
                return String.format("%s(%d,%d)", typeName, size, Math.max(0, decimalDigits));
            } else if (upperType.contains("CHAR") || upperType.contains("BINARY")) {
                // Character and binary types
                return String.format("%s(%d)", typeName, size);
            }
        }

        return typeName;
    }

    private Target resolveOrNull(String databaseName) {
        try {
            return targetRegistry.resolve(databaseName);
        } catch (UnknownTargetException e) {
            logger.debug("Schema lookup for unknown database {}", e.getTargetName());
            return null;
        }
    }

    private static CatalogScope scopeOf(Target target, Connection dbConn) throws SQLException {
        String databaseName = target.database();
        if (target.dialect().usesCatalogs()) {
            return new CatalogScope(databaseName.isBlank() ? dbConn.getCatalog() : databaseName, null);
        }
        String schemaName = databaseName.isBlank() ? dbConn.getSchema() : normalizeIdentifier(target.dialect(), databaseName);
        return new CatalogScope(null, schemaName);
    }

    /**
     * Normalizes identifiers based on database-specific case sensitivity rules.
     */
    private static String normalizeIdentifier(Dialect dialect, String identifier) {
        return switch (dialect) {
            // PostgreSQL stores unquoted identifiers in lowercase
            case POSTGRESQL -> identifier.toLowerCase(Locale.ROOT);
            // MySQL case sensitivity depends on OS, but metadata usually matches input case
            case MARIADB, MYSQL, H2 -> identifier;
        };
    }

    /**
     * Table name spellings to try: as given first, then the dialect's folded case.
     */
    private static List<String> identifierCandidates(Dialect dialect, String tableName) {
        Set<String> candidateNames = new LinkedHashSet<>();
        candidateNames.add(tableName);
        candidateNames.add(normalizeIdentifier(dialect, tableName));
        candidateNames.add(tableName.toLowerCase(Locale.ROOT));
        candidateNames.add(tableName.toUpperCase(Locale.ROOT));
        return new ArrayList<>(candidateNames);
    }

    private QueryExecutionException lookupFailure(Target target, SQLException e) {
        String safeMessage = SecurityUtils.sanitizeMessage(e.getMessage(), targetRegistry.secrets());
        logger.error("Catalog lookup failed for {}: {}", target.name(), safeMessage);
        return new QueryExecutionException(ResourceManager.getErrorMessage("schema.lookup.failed", target.name(),
                safeMessage), e.getSQLState(), e.getErrorCode(), e);
    }

    private record CatalogScope(String catalog, String schema) {
    }

    private record RawColumn(String name, String type, boolean nullable, String defaultValue,
                             boolean autoIncrement, int position) {
    }
}
