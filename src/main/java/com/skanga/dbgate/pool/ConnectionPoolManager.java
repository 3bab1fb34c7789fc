package com.skanga.dbgate.pool;

import com.skanga.dbgate.SecurityUtils;
import com.skanga.dbgate.config.GatewayConfig;
import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.error.GatewayException;
import com.skanga.dbgate.error.PoolExhaustedException;
import com.skanga.dbgate.error.QueryExecutionException;
import com.skanga.dbgate.target.Target;
import com.skanga.dbgate.target.TargetRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Owns one HikariCP pool per distinct server and credential pair.
 * Pools are created on first use; targets that differ only in their database share a pool, and the
 * database is selected on each lease.
 * We use <a href="https://www.baeldung.com/hikaricp">HikariCP connection pooling</a>
 */
public class ConnectionPoolManager {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPoolManager.class);
    private static final Pattern CHARSET_NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final AtomicInteger poolCounter = new AtomicInteger();

    private final GatewayConfig gatewayConfig;
    private final TargetRegistry targetRegistry;
    private final Map<Target.ServerKey, HikariDataSource> dataSources = new ConcurrentHashMap<>();
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    public ConnectionPoolManager(GatewayConfig gatewayConfig, TargetRegistry targetRegistry) {
        this.gatewayConfig = gatewayConfig;
        this.targetRegistry = targetRegistry;
    }

    /**
     * Leases a connection pointed at the target's database.
     *
     * @param target target to connect to
     * @return the lease, to be closed by the caller
     * @throws PoolExhaustedException  if no connection became free within the acquire timeout
     * @throws QueryExecutionException if the server cannot be reached or rejects the database
     * @throws IllegalStateException   after {@link #shutdown()}
     */
    public PooledConnection acquire(Target target) throws GatewayException {
        PooledConnection pooledConnection = lease(target);
        try {
            target.dialect().selectDatabase(pooledConnection.connection(), target.database());
        } catch (SQLException e) {
            pooledConnection.discard();
            pooledConnection.close();
            logger.debug("Could not select database {} on {}", target.database(), target.serverKey(), e);
            throw new QueryExecutionException(
                    ResourceManager.getErrorMessage("pool.acquire.failed", target.name(),
                            SecurityUtils.sanitizeMessage(e.getMessage(), targetRegistry.secrets())),
                    e.getSQLState(), e.getErrorCode(), e);
        }
        return pooledConnection;
    }

    /**
     * Leases a connection on the target's server without switching database.
     * For catalog lookups that name the database explicitly, so a missing database does not fail the lease.
     */
    public PooledConnection acquireServerConnection(Target target) throws GatewayException {
        return lease(target);
    }

    /**
     * Eagerly opens and validates one connection for every configured target.
     * A server that cannot be reached is logged and its pool discarded, so it is retried on next use.
     * A target whose database is missing or fails validation is logged, but the server pool stays up
     * for the other targets on it.
     */
    public void initialize() {
        Set<Target.ServerKey> reachableServers = new HashSet<>();
        for (Target target : targetRegistry.targets()) {
            try (PooledConnection pooledConnection = lease(target)) {
                reachableServers.add(target.serverKey());
                try (Statement stmt = pooledConnection.connection().createStatement()) {
                    target.dialect().selectDatabase(pooledConnection.connection(), target.database());
                    stmt.execute(target.dialect().validationQuery());
                    logger.info("Database connection pool initialized for {}", target.describe());
                } catch (SQLException e) {
                    logger.error(ResourceManager.getErrorMessage("pool.init.failed", target.name(),
                            SecurityUtils.sanitizeMessage(e.getMessage(), targetRegistry.secrets())));
                    logger.debug("Database check failure for {}", target.name(), e);
                }
            } catch (GatewayException e) {
                logger.error(ResourceManager.getErrorMessage("pool.init.failed", target.name(), e.getMessage()));
                logger.debug("Pool warm-up failure for {}", target.name(), e);
                if (!reachableServers.contains(target.serverKey())) {
                    closeDataSource(target.serverKey(), dataSources.remove(target.serverKey()));
                }
            }
        }
    }

    /**
     * Waits up to the shutdown timeout for leased connections to come back, then closes every pool.
     * Safe to call more than once.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(gatewayConfig.shutdownTimeoutSeconds());
        for (Map.Entry<Target.ServerKey, HikariDataSource> poolEntry : dataSources.entrySet()) {
            waitForActiveConnections(poolEntry.getKey(), poolEntry.getValue(), deadline);
        }
        for (Target.ServerKey serverKey : List.copyOf(dataSources.keySet())) {
            closeDataSource(serverKey, dataSources.remove(serverKey));
        }
        logger.info("All database connection pools closed");
    }

    public boolean isShutdown() {
        return shutDown.get();
    }

    public int activeConnections(Target target) {
        HikariPoolMXBean poolBean = poolBean(target);
        return poolBean == null ? 0 : poolBean.getActiveConnections();
    }

    public int totalConnections(Target target) {
        HikariPoolMXBean poolBean = poolBean(target);
        return poolBean == null ? 0 : poolBean.getTotalConnections();
    }

    private PooledConnection lease(Target target) throws GatewayException {
        if (shutDown.get()) {
            throw new IllegalStateException(ResourceManager.getErrorMessage("pool.shutdown"));
        }
        HikariDataSource dataSource;
        try {
            dataSource = dataSources.computeIfAbsent(target.serverKey(), serverKey -> createDataSource(target));
        } catch (RuntimeException e) {
            logger.error("Failed to create connection pool for {}: {}", target.serverKey(), e.getMessage());
            throw new QueryExecutionException(ResourceManager.getErrorMessage("pool.acquire.failed", target.name(),
                    SecurityUtils.sanitizeMessage(e.getMessage(), targetRegistry.secrets())), e);
        }
        if (shutDown.get()) {
            // shutdown() ran while this pool was being created
            closeDataSource(target.serverKey(), dataSources.remove(target.serverKey()));
            throw new IllegalStateException(ResourceManager.getErrorMessage("pool.shutdown"));
        }

        long startTime = System.currentTimeMillis();
        try {
            Connection dbConn = dataSource.getConnection();
            logger.trace("Leased connection for {} after {}ms", target.name(), System.currentTimeMillis() - startTime);
            String leasedDatabase;
            try {
                leasedDatabase = target.dialect().currentDatabase(dbConn);
            } catch (SQLException e) {
                dataSource.evictConnection(dbConn);
                throw acquireFailure(target, e);
            }
            return new PooledConnection(dbConn, target, dataSource, leasedDatabase);
        } catch (SQLTransientConnectionException e) {
            long waitedMs = System.currentTimeMillis() - startTime;
            // Hikari reports both a busy pool and an unreachable server as a request timeout;
            // only the latter carries the driver failure as its cause
            if (e.getCause() == null) {
                logger.warn("Connection pool for {} exhausted after {}ms", target.name(), waitedMs);
                throw new PoolExhaustedException(ResourceManager.getErrorMessage("pool.exhausted",
                        target.name(), String.valueOf(waitedMs), gatewayConfig.maxPoolSize()), waitedMs, e);
            }
            throw acquireFailure(target, e);
        } catch (SQLException e) {
            throw acquireFailure(target, e);
        }
    }

    private QueryExecutionException acquireFailure(Target target, SQLException e) {
        Throwable rootCause = e.getCause() != null ? e.getCause() : e;
        logger.error("Failed to get connection for {}: {}", target.describe(), rootCause.getMessage());
        logger.debug("Connection failure detail", e);
        return new QueryExecutionException(ResourceManager.getErrorMessage("pool.acquire.failed", target.name(),
                SecurityUtils.sanitizeMessage(rootCause.getMessage(), targetRegistry.secrets())),
                e.getSQLState(), e.getErrorCode(), e);
    }

    HikariDataSource createDataSource(Target target) {
        int acquireTimeoutMs = gatewayConfig.acquireTimeoutSeconds() * 1000;

        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(target.jdbcUrl());
        poolConfig.setUsername(target.user());
        poolConfig.setPassword(target.password());
        poolConfig.setDriverClassName(target.dialect().driverClass());
        poolConfig.setMaximumPoolSize(gatewayConfig.maxPoolSize());
        poolConfig.setMinimumIdle(Math.max(1, gatewayConfig.maxPoolSize() / 4)); // Keep 25% as minimum idle
        poolConfig.setConnectionTimeout(acquireTimeoutMs);
        poolConfig.setIdleTimeout(gatewayConfig.idleTimeoutMs());
        poolConfig.setMaxLifetime(gatewayConfig.maxLifetimeMs());
        poolConfig.setAutoCommit(false);
        poolConfig.setReadOnly(gatewayConfig.readOnly());

        poolConfig.setConnectionTestQuery(target.dialect().validationQuery());
        poolConfig.setValidationTimeout(Math.min(5000, acquireTimeoutMs));
        // Do not fail construction when the server is down; the first lease reports it
        poolConfig.setInitializationFailTimeout(-1);
        poolConfig.setPoolName("DBGatePool-" + poolCounter.incrementAndGet());

        configureDatabaseSpecificSettings(poolConfig, target);

        logger.info("Initializing connection pool {} for {} - Max: {}, Idle: {}, Acquire timeout: {}ms",
                poolConfig.getPoolName(), target.serverKey(), poolConfig.getMaximumPoolSize(),
                poolConfig.getMinimumIdle(), acquireTimeoutMs);
        return new HikariDataSource(poolConfig);
    }

    /**
     * Configures database-specific connection properties: driver timeouts, statement caching and charset.
     *
     * @param poolConfig The HikariCP configuration to modify
     * @param target     the target the pool serves
     */
    private void configureDatabaseSpecificSettings(HikariConfig poolConfig, Target target) {
        int connectTimeoutMs = gatewayConfig.connectTimeoutSeconds() * 1000;
        int socketTimeoutMs = (Math.max(gatewayConfig.readTimeoutSeconds(), gatewayConfig.writeTimeoutSeconds())
                + gatewayConfig.connectTimeoutSeconds()) * 1000;
        String charset = target.charset();
        if (!charset.isEmpty() && !CHARSET_NAME.matcher(charset).matches()) {
            throw new IllegalArgumentException("Invalid character set name: " + charset);
        }

        switch (target.dialect()) {
            case MARIADB -> {
                poolConfig.addDataSourceProperty("connectTimeout", String.valueOf(connectTimeoutMs));
                poolConfig.addDataSourceProperty("socketTimeout", String.valueOf(socketTimeoutMs));
                poolConfig.addDataSourceProperty("cachePrepStmts", "true");
                poolConfig.addDataSourceProperty("prepStmtCacheSize", "250");
                if (!charset.isEmpty()) {
                    poolConfig.setConnectionInitSql("SET NAMES " + charset);
                }
            }
            case MYSQL -> {
                poolConfig.addDataSourceProperty("connectTimeout", String.valueOf(connectTimeoutMs));
                poolConfig.addDataSourceProperty("socketTimeout", String.valueOf(socketTimeoutMs));
                poolConfig.addDataSourceProperty("cachePrepStmts", "true");
                poolConfig.addDataSourceProperty("prepStmtCacheSize", "250");
                poolConfig.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
                poolConfig.addDataSourceProperty("useServerPrepStmts", "true");
                poolConfig.addDataSourceProperty("useLocalSessionState", "true");
                if (!charset.isEmpty()) {
                    poolConfig.setConnectionInitSql("SET NAMES " + charset);
                }
            }
            case POSTGRESQL -> {
                // PostgreSQL timeouts are in seconds
                poolConfig.addDataSourceProperty("connectTimeout", String.valueOf(gatewayConfig.connectTimeoutSeconds()));
                poolConfig.addDataSourceProperty("socketTimeout", String.valueOf(socketTimeoutMs / 1000));
                poolConfig.addDataSourceProperty("prepareThreshold", "5");
                poolConfig.addDataSourceProperty("ApplicationName", "DBGate");
                if (!charset.isEmpty()) {
                    poolConfig.setConnectionInitSql("SET client_encoding TO '" + charset + "'");
                }
            }
            case H2 -> {
                // H2 settings travel in the URL
                if (!charset.isEmpty()) {
                    logger.debug("Ignoring charset {} for H2 target {}", charset, target.name());
                }
            }
        }
    }

    private void waitForActiveConnections(Target.ServerKey serverKey, HikariDataSource dataSource, long deadline) {
        HikariPoolMXBean poolBean = dataSource.getHikariPoolMXBean();
        if (poolBean == null) {
            return;
        }
        while (poolBean.getActiveConnections() > 0 && System.nanoTime() < deadline) {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while draining connections for {}", serverKey);
                return;
            }
        }
        int stillActive = poolBean.getActiveConnections();
        if (stillActive > 0) {
            logger.warn("Closing pool for {} with {} connection(s) still in use", serverKey, stillActive);
        }
    }

    private void closeDataSource(Target.ServerKey serverKey, HikariDataSource dataSource) {
        if (dataSource != null && !dataSource.isClosed()) {
            try {
                dataSource.close();
                logger.info("Database connection pool closed for {}", serverKey);
            } catch (RuntimeException e) {
                logger.warn("Error closing database connection pool for {}: {}", serverKey, e.getMessage(), e);
            }
        }
    }

    private HikariPoolMXBean poolBean(Target target) {
        HikariDataSource dataSource = dataSources.get(target.serverKey());
        return dataSource == null || dataSource.isClosed() ? null : dataSource.getHikariPoolMXBean();
    }
}
