package com.skanga.dbgate.db;

import com.skanga.dbgate.SecurityUtils;
import com.skanga.dbgate.config.GatewayConfig;
import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.error.GatewayException;
import com.skanga.dbgate.error.QueryExecutionException;
import com.skanga.dbgate.error.QueryTimeoutException;
import com.skanga.dbgate.policy.PolicyGuard;
import com.skanga.dbgate.policy.StatementType;
import com.skanga.dbgate.pool.ConnectionPoolManager;
import com.skanga.dbgate.pool.PooledConnection;
import com.skanga.dbgate.target.Target;
import com.skanga.dbgate.target.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketTimeoutException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one statement against a resolved target: policy checks, lease, bind, execute, read, commit.
 * Every failure after the lease rolls back and discards the connection.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);
    private static final Set<String> TIMEOUT_SQL_STATES = Set.of("57014", "HYT00", "HYT01");

    private final GatewayConfig gatewayConfig;
    private final TargetRegistry targetRegistry;
    private final ConnectionPoolManager poolManager;
    private final PolicyGuard policyGuard;

    public QueryExecutor(GatewayConfig gatewayConfig, TargetRegistry targetRegistry,
                         ConnectionPoolManager poolManager, PolicyGuard policyGuard) {
        this.gatewayConfig = gatewayConfig;
        this.targetRegistry = targetRegistry;
        this.poolManager = poolManager;
        this.policyGuard = policyGuard;
    }

    /**
     * Executes a SQL statement with optional positional parameters.
     * Name resolution, the read-only gate and the parameter count check all run before a connection is
     * leased, so a rejected statement never touches the database.
     *
     * @param sqlQuery   statement text with {@code ?} or {@code %s} placeholders
     * @param targetName database name, blank for the default target
     * @param paramList  positional parameters, may be null
     * @return rows for queries, or a single {@code affected_rows} row for updates
     * @throws GatewayException         on policy, pool, timeout or driver failures
     * @throws IllegalArgumentException if the statement is empty
     */
    public QueryResult execute(String sqlQuery, String targetName, List<Object> paramList) throws GatewayException {
        long startTime = System.currentTimeMillis();

        Target target = targetRegistry.resolve(targetName);
        StatementType statementType = policyGuard.checkAllowed(sqlQuery);
        String preparedSql = policyGuard.prepareSql(sqlQuery);
        policyGuard.checkParameterCount(sqlQuery, paramList);

        int timeoutSeconds = statementType == StatementType.READ
                ? gatewayConfig.readTimeoutSeconds() : gatewayConfig.writeTimeoutSeconds();
        logger.debug("Executing {} query on {}: {}", statementType, target.name(), SecurityUtils.abbreviateSql(sqlQuery));

        try (PooledConnection pooledConnection = poolManager.acquire(target)) {
            Connection dbConn = pooledConnection.connection();
            try {
                QueryResult queryResult = runStatement(dbConn, preparedSql, paramList, statementType, timeoutSeconds, startTime);
                if (statementType == StatementType.WRITE) {
                    dbConn.commit();
                }
                logger.debug("Query completed in {}ms, returned {} rows{}", queryResult.executionTimeMs(),
                        queryResult.rowCount(), queryResult.truncated() ? " (truncated)" : "");
                return queryResult;
            } catch (SQLException | GatewayException e) {
                pooledConnection.discard();
                rollback(dbConn, target);
                throw mapFailure(e, target, statementType, timeoutSeconds, sqlQuery, startTime);
            }
        }
    }

    private QueryResult runStatement(Connection dbConn, String preparedSql, List<Object> paramList,
                                     StatementType statementType, int timeoutSeconds, long startTime)
            throws SQLException, GatewayException {
        int maxResults = gatewayConfig.maxResults();
        try (PreparedStatement prepStmt = dbConn.prepareStatement(preparedSql)) {
            // one extra row tells us whether the result was cut off
            prepStmt.setMaxRows(maxResults < Integer.MAX_VALUE ? maxResults + 1 : maxResults);
            prepStmt.setQueryTimeout(timeoutSeconds);
            policyGuard.bind(prepStmt, paramList);

            boolean isResultSet = prepStmt.execute();
            logger.debug("Query executed successfully, isResultSet: {}", isResultSet);

            if (!isResultSet) {
                // For INSERT, UPDATE, DELETE statements
                int affectedRows = prepStmt.getUpdateCount();
                Map<String, Object> countRow = new LinkedHashMap<>();
                countRow.put("affected_rows", affectedRows);
                return new QueryResult(List.of("affected_rows"), List.of(countRow), affectedRows, false,
                        System.currentTimeMillis() - startTime);
            }

            try (ResultSet resultSet = prepStmt.getResultSet()) {
                ResultSetMetaData metaData = resultSet.getMetaData();
                int columnCount = metaData.getColumnCount();
                List<String> resultColumns = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    resultColumns.add(metaData.getColumnLabel(i));
                }

                long deadline = startTime + timeoutSeconds * 1000L;
                List<Map<String, Object>> resultRows = new ArrayList<>();
                while (resultRows.size() <= maxResults && resultSet.next()) {
                    Map<String, Object> currRow = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        currRow.put(resultColumns.get(i - 1), ValueNormalizer.readValue(resultSet, i));
                    }
                    resultRows.add(currRow);

                    // Check for timeout every 1000 rows
                    if (resultRows.size() % 1000 == 0 && System.currentTimeMillis() > deadline) {
                        logger.warn("Query execution time exceeded timeout, stopping at {} rows", resultRows.size());
                        throw new QueryTimeoutException(timeoutMessage(statementType, timeoutSeconds),
                                timeoutSeconds, null);
                    }
                }

                boolean truncated = resultRows.size() > maxResults;
                List<Map<String, Object>> cappedRows = policyGuard.cap(resultRows, maxResults);
                return new QueryResult(resultColumns, cappedRows, cappedRows.size(), truncated,
                        System.currentTimeMillis() - startTime);
            }
        }
    }

    private GatewayException mapFailure(Exception e, Target target, StatementType statementType, int timeoutSeconds,
                                        String sqlQuery, long startTime) {
        long executionTime = System.currentTimeMillis() - startTime;
        if (e instanceof GatewayException) {
            logger.error("Query failed on {} after {}ms: {}", target.name(), executionTime, e.getMessage());
            return (GatewayException) e;
        }

        SQLException sqlException = (SQLException) e;
        if (isTimeout(sqlException)) {
            logger.warn("Query on {} timed out after {}ms: {}", target.name(), executionTime,
                    SecurityUtils.abbreviateSql(sqlQuery));
            return new QueryTimeoutException(timeoutMessage(statementType, timeoutSeconds), timeoutSeconds, sqlException);
        }

        String safeMessage = SecurityUtils.sanitizeMessage(sqlException.getMessage(), targetRegistry.secrets());
        logger.error("Query execution failed on {} after {}ms: {} - Error: {}", target.name(), executionTime,
                SecurityUtils.abbreviateSql(sqlQuery), safeMessage);
        logger.debug("Driver exception", sqlException);
        if (isConnectionError(sqlException)) {
            logger.warn("Connection error detected, connection discarded: {}", safeMessage);
        }
        return new QueryExecutionException(ResourceManager.getErrorMessage("sql.execution.failed", safeMessage),
                sqlException.getSQLState(), sqlException.getErrorCode(), sqlException);
    }

    private static String timeoutMessage(StatementType statementType, int timeoutSeconds) {
        return ResourceManager.getErrorMessage("sql.timeout",
                statementType == StatementType.READ ? "read" : "write", String.valueOf(timeoutSeconds));
    }

    private void rollback(Connection dbConn, Target target) {
        try {
            dbConn.rollback();
        } catch (SQLException rollbackException) {
            logger.warn("Rollback failed on {}: {}", target.name(), rollbackException.getMessage());
        }
    }

    static boolean isTimeout(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return true;
        }
        if (e.getSQLState() != null && TIMEOUT_SQL_STATES.contains(e.getSQLState())) {
            return true;
        }
        for (Throwable cause = e.getCause(); cause != null && cause != cause.getCause(); cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException || cause instanceof SQLTimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if the given SQLException indicates a connection-related problem.
     *
     * @param e The SQLException to examine
     * @return true if this appears to be a connection error
     */
    static boolean isConnectionError(SQLException e) {
        String sqlState = e.getSQLState();
        // Connection exception SQL states (08xxx)
        if (sqlState != null && sqlState.startsWith("08")) {
            return true;
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase();
        return message.contains("broken pipe") || message.contains("connection is closed")
                || message.contains("communications link failure");
    }
}
