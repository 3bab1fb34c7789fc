package com.skanga.dbgate.config;

/**
 * Immutable gateway settings, created once at startup by {@link ConfigLoader}.
 *
 * @param targetLists            raw target definitions
 * @param connectTimeoutSeconds  driver connect timeout (DB_CONNECT_TIMEOUT)
 * @param readTimeoutSeconds     statement timeout for read statements (DB_READ_TIMEOUT)
 * @param writeTimeoutSeconds    statement timeout for write statements (DB_WRITE_TIMEOUT)
 * @param acquireTimeoutSeconds  how long a caller waits for a free pooled connection (DB_ACQUIRE_TIMEOUT)
 * @param shutdownTimeoutSeconds how long shutdown waits for leased connections (DB_SHUTDOWN_TIMEOUT)
 * @param idleTimeoutMs          pool idle timeout (DB_IDLE_TIMEOUT_MS)
 * @param maxLifetimeMs          pool max connection lifetime (DB_MAX_LIFETIME_MS)
 * @param readOnly               reject write statements (MCP_READ_ONLY)
 * @param maxPoolSize            connections per pool (MCP_MAX_POOL_SIZE)
 * @param maxResults             row cap per query (MCP_MAX_RESULTS)
 */
public record GatewayConfig(TargetLists targetLists,
                            int connectTimeoutSeconds,
                            int readTimeoutSeconds,
                            int writeTimeoutSeconds,
                            int acquireTimeoutSeconds,
                            int shutdownTimeoutSeconds,
                            long idleTimeoutMs,
                            long maxLifetimeMs,
                            boolean readOnly,
                            int maxPoolSize,
                            int maxResults) {
    public static final int DEFAULT_CONNECT_TIMEOUT = 10;
    public static final int DEFAULT_READ_TIMEOUT = 30;
    public static final int DEFAULT_WRITE_TIMEOUT = 30;
    public static final int DEFAULT_ACQUIRE_TIMEOUT = 30;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT = 10;
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 600_000L;
    public static final long DEFAULT_MAX_LIFETIME_MS = 1_800_000L;
    public static final int DEFAULT_MAX_POOL_SIZE = 10;
    public static final int DEFAULT_MAX_RESULTS = 10_000;

    public GatewayConfig {
        if (targetLists == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.targets.empty"));
        }
        requirePositive("DB_CONNECT_TIMEOUT", connectTimeoutSeconds);
        requirePositive("DB_READ_TIMEOUT", readTimeoutSeconds);
        requirePositive("DB_WRITE_TIMEOUT", writeTimeoutSeconds);
        requirePositive("DB_ACQUIRE_TIMEOUT", acquireTimeoutSeconds);
        requirePositive("DB_SHUTDOWN_TIMEOUT", shutdownTimeoutSeconds);
        requirePositive("DB_IDLE_TIMEOUT_MS", idleTimeoutMs);
        requirePositive("DB_MAX_LIFETIME_MS", maxLifetimeMs);
        requirePositive("MCP_MAX_POOL_SIZE", maxPoolSize);
        requirePositive("MCP_MAX_RESULTS", maxResults);
    }

    /**
     * Settings with every option at its default, for the given targets.
     */
    public static GatewayConfig withDefaults(TargetLists targetLists) {
        return new GatewayConfig(targetLists, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, DEFAULT_WRITE_TIMEOUT,
                DEFAULT_ACQUIRE_TIMEOUT, DEFAULT_SHUTDOWN_TIMEOUT, DEFAULT_IDLE_TIMEOUT_MS, DEFAULT_MAX_LIFETIME_MS,
                true, DEFAULT_MAX_POOL_SIZE, DEFAULT_MAX_RESULTS);
    }

    public GatewayConfig withReadOnly(boolean newReadOnly) {
        return new GatewayConfig(targetLists, connectTimeoutSeconds, readTimeoutSeconds, writeTimeoutSeconds,
                acquireTimeoutSeconds, shutdownTimeoutSeconds, idleTimeoutMs, maxLifetimeMs,
                newReadOnly, maxPoolSize, maxResults);
    }

    public GatewayConfig withLimits(int newMaxPoolSize, int newMaxResults) {
        return new GatewayConfig(targetLists, connectTimeoutSeconds, readTimeoutSeconds, writeTimeoutSeconds,
                acquireTimeoutSeconds, shutdownTimeoutSeconds, idleTimeoutMs, maxLifetimeMs,
                readOnly, newMaxPoolSize, newMaxResults);
    }

    public GatewayConfig withTimeouts(int newConnectTimeout, int newReadTimeout, int newWriteTimeout,
                                      int newAcquireTimeout) {
        return new GatewayConfig(targetLists, newConnectTimeout, newReadTimeout, newWriteTimeout,
                newAcquireTimeout, shutdownTimeoutSeconds, idleTimeoutMs, maxLifetimeMs,
                readOnly, maxPoolSize, maxResults);
    }

    private static void requirePositive(String paramName, long paramValue) {
        if (paramValue <= 0) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.value.not.positive", paramName, paramValue));
        }
    }
}
