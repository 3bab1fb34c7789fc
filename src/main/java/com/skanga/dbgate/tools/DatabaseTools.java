package com.skanga.dbgate.tools;

import com.skanga.dbgate.SecurityUtils;
import com.skanga.dbgate.config.ConfigLoader;
import com.skanga.dbgate.config.GatewayConfig;
import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.db.ColumnDescriptor;
import com.skanga.dbgate.db.QueryExecutor;
import com.skanga.dbgate.db.QueryResult;
import com.skanga.dbgate.db.SchemaInspector;
import com.skanga.dbgate.error.GatewayException;
import com.skanga.dbgate.policy.PolicyGuard;
import com.skanga.dbgate.pool.ConnectionPoolManager;
import com.skanga.dbgate.target.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * The operations exposed to tool callers, wired over one registry, one set of pools and one policy.
 * Arguments are validated here; everything below assumes well-formed input.
 */
public class DatabaseTools implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseTools.class);
    static final int MAX_IDENTIFIER_LENGTH = 128;
    static final int MAX_SQL_LENGTH = 100_000;

    private final GatewayConfig gatewayConfig;
    private final TargetRegistry targetRegistry;
    private final ConnectionPoolManager poolManager;
    private final QueryExecutor queryExecutor;
    private final SchemaInspector schemaInspector;

    public DatabaseTools(GatewayConfig gatewayConfig) {
        this(gatewayConfig, TargetRegistry.fromConfig(gatewayConfig.targetLists()));
    }

    DatabaseTools(GatewayConfig gatewayConfig, TargetRegistry targetRegistry) {
        this(gatewayConfig, targetRegistry, new ConnectionPoolManager(gatewayConfig, targetRegistry));
    }

    DatabaseTools(GatewayConfig gatewayConfig, TargetRegistry targetRegistry, ConnectionPoolManager poolManager) {
        this(gatewayConfig, targetRegistry, poolManager,
                new QueryExecutor(gatewayConfig, targetRegistry, poolManager, new PolicyGuard(gatewayConfig.readOnly())),
                new SchemaInspector(targetRegistry, poolManager));
    }

    DatabaseTools(GatewayConfig gatewayConfig, TargetRegistry targetRegistry, ConnectionPoolManager poolManager,
                  QueryExecutor queryExecutor, SchemaInspector schemaInspector) {
        this.gatewayConfig = gatewayConfig;
        this.targetRegistry = targetRegistry;
        this.poolManager = poolManager;
        this.queryExecutor = queryExecutor;
        this.schemaInspector = schemaInspector;
    }

    /**
     * Builds the tools from the process environment and the optional env file.
     *
     * @throws IOException if the env file exists but cannot be read
     */
    public static DatabaseTools fromEnvironment() throws IOException {
        return new DatabaseTools(ConfigLoader.load());
    }

    /**
     * Opens the connection pools ahead of the first call. Targets that cannot be reached are logged and
     * retried on first use.
     */
    public void initializePool() {
        logger.info("Initializing connection pools for {} database(s)", targetRegistry.names().size());
        poolManager.initialize();
    }

    /**
     * Closes every pool. Safe to call more than once.
     */
    public void closePool() {
        poolManager.shutdown();
    }

    @Override
    public void close() {
        closePool();
    }

    public List<String> listDatabases() throws GatewayException {
        logSecurityEvent("LIST_DATABASES", "Servers: " + targetRegistry.serverTargets().size());
        return schemaInspector.listDatabases();
    }

    public List<String> listTables(String databaseName) throws GatewayException {
        requireIdentifier("database_name", databaseName);
        logSecurityEvent("LIST_TABLES", "Database: " + databaseName);
        return schemaInspector.listTables(databaseName);
    }

    public Map<String, ColumnDescriptor> getTableSchema(String databaseName, String tableName) throws GatewayException {
        requireIdentifier("database_name", databaseName);
        requireIdentifier("table_name", tableName);
        logSecurityEvent("TABLE_DESCRIPTION", String.format("Table: %s, Database: %s", tableName, databaseName));
        return schemaInspector.getSchema(databaseName, tableName);
    }

    public Map<String, Map<String, ColumnDescriptor>> getTableSchemaWithRelations(String databaseName, String tableName)
            throws GatewayException {
        requireIdentifier("database_name", databaseName);
        requireIdentifier("table_name", tableName);
        logSecurityEvent("TABLE_RELATIONS", String.format("Table: %s, Database: %s", tableName, databaseName));
        return schemaInspector.getSchemaWithRelations(databaseName, tableName);
    }

    /**
     * Executes one SQL statement.
     *
     * @param sqlQuery     statement text
     * @param databaseName target database, blank for the default one
     * @param paramList    positional parameters, may be null
     * @return the query result
     * @throws GatewayException         if the statement is rejected or fails
     * @throws IllegalArgumentException if the arguments are malformed
     */
    public QueryResult executeSql(String sqlQuery, String databaseName, List<Object> paramList) throws GatewayException {
        if (sqlQuery == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.missing", "sql_query"));
        }
        if (sqlQuery.trim().isEmpty()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.empty", "sql_query"));
        }
        // length check to prevent extremely long queries
        if (sqlQuery.length() > MAX_SQL_LENGTH) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.too.long", "sql_query", MAX_SQL_LENGTH));
        }
        if (databaseName != null && databaseName.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.too.long", "database_name", MAX_IDENTIFIER_LENGTH));
        }

        logger.info("Executing SQL on {}: {}{}", databaseName == null || databaseName.isBlank() ? "default" : databaseName,
                SecurityUtils.abbreviateSql(sqlQuery),
                paramList != null ? " (with " + paramList.size() + " parameters)" : "");
        logSecurityEvent("SQL_EXECUTION", String.format("Query length: %d, Read-only: %s, Parameterized: %s",
                sqlQuery.length(), gatewayConfig.readOnly(), paramList != null && !paramList.isEmpty()));

        return queryExecutor.execute(sqlQuery, databaseName, paramList);
    }

    private static void requireIdentifier(String argumentName, String argumentValue) {
        if (argumentValue == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.missing", argumentName));
        }
        if (argumentValue.trim().isEmpty()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.argument.empty", argumentName));
        }
        if (argumentValue.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("tool.argument.too.long", argumentName, MAX_IDENTIFIER_LENGTH));
        }
    }

    /**
     * Logs security-relevant events for audit purposes.
     *
     * @param securityEvent the security event type
     * @param eventDetails  additional details about the event
     */
    private void logSecurityEvent(String securityEvent, String eventDetails) {
        // Use a specific logger for security events that could be configured
        // to write to a separate audit log file
        Logger securityLogger = LoggerFactory.getLogger("SECURITY." + DatabaseTools.class.getName());
        securityLogger.warn("SECURITY_EVENT: {} - {}", securityEvent, eventDetails);
    }
}
