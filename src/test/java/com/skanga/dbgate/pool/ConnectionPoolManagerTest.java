package com.skanga.dbgate.pool;

import com.skanga.dbgate.TestUtils;
import com.skanga.dbgate.config.GatewayConfig;
import com.skanga.dbgate.error.GatewayException;
import com.skanga.dbgate.error.PoolExhaustedException;
import com.skanga.dbgate.error.QueryExecutionException;
import com.skanga.dbgate.target.Dialect;
import com.skanga.dbgate.target.Target;
import com.skanga.dbgate.target.TargetRegistry;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionPoolManagerTest {
    private String jdbcUrl;
    private Target geoTarget;
    private ConnectionPoolManager poolManager;

    @BeforeEach
    void setUp() throws Exception {
        jdbcUrl = TestUtils.createTestH2Url();
        TestUtils.setupGeographyDatabase(jdbcUrl);
        geoTarget = new Target("geo", "", 0, TestUtils.H2_USER, TestUtils.H2_PASSWORD, "geo", "", Dialect.H2, jdbcUrl);
    }

    @AfterEach
    void tearDown() {
        if (poolManager != null) {
            poolManager.shutdown();
        }
    }

    private ConnectionPoolManager manager(GatewayConfig gatewayConfig, Target... targets) {
        poolManager = new ConnectionPoolManager(gatewayConfig, new TargetRegistry(List.of(targets)));
        return poolManager;
    }

    private GatewayConfig config() {
        return TestUtils.createTestConfig(jdbcUrl, true);
    }

    @Test
    void testAcquireSelectsDatabase() throws Exception {
        ConnectionPoolManager manager = manager(config(), geoTarget);

        try (PooledConnection pooledConnection = manager.acquire(geoTarget);
             Statement stmt = pooledConnection.connection().createStatement();
             ResultSet resultSet = stmt.executeQuery("SELECT COUNT(*) FROM countries")) {
            assertEquals("geo", pooledConnection.connection().getSchema());
            assertTrue(resultSet.next());
            assertEquals(3, resultSet.getInt(1));
            assertEquals(1, manager.activeConnections(geoTarget));
        }
        assertEquals(0, manager.activeConnections(geoTarget));
    }

    @Test
    void testTargetsOnOneServerSharePool() throws Exception {
        Target publicTarget = geoTarget.withDatabase("public");
        ConnectionPoolManager manager = manager(config(), geoTarget);

        try (PooledConnection geoLease = manager.acquire(geoTarget);
             PooledConnection publicLease = manager.acquire(publicTarget)) {
            assertEquals("geo", geoLease.connection().getSchema());
            assertEquals("public", publicLease.connection().getSchema());
            assertEquals(2, manager.activeConnections(geoTarget));
        }
    }

    @Test
    void testUnknownDatabaseFailsLease() throws Exception {
        ConnectionPoolManager manager = manager(config(), geoTarget);

        assertThrows(QueryExecutionException.class, () -> manager.acquire(geoTarget.withDatabase("no_such_schema")));
        assertEquals(0, manager.activeConnections(geoTarget));

        try (PooledConnection serverLease = manager.acquireServerConnection(geoTarget.withDatabase("no_such_schema"))) {
            assertFalse(serverLease.connection().isClosed());
        }
    }

    @Test
    @Timeout(30)
    void testExhaustedPoolFailsFast() throws Exception {
        ConnectionPoolManager manager = manager(config().withLimits(1, 100).withTimeouts(10, 30, 30, 1), geoTarget);

        try (PooledConnection held = manager.acquire(geoTarget)) {
            PoolExhaustedException thrown = assertThrows(PoolExhaustedException.class, () -> manager.acquire(geoTarget));
            assertThat(thrown.getWaitedMs()).isGreaterThanOrEqualTo(900L);
            assertThat(thrown.getMessage()).contains("geo").contains("pool size 1");
            assertFalse(held.isDiscarded());
        }

        try (PooledConnection afterRelease = manager.acquire(geoTarget)) {
            assertFalse(afterRelease.connection().isClosed());
        }
    }

    @Test
    void testDiscardedConnectionIsEvicted() throws Exception {
        ConnectionPoolManager manager = manager(config(), geoTarget);

        PooledConnection pooledConnection = manager.acquire(geoTarget);
        pooledConnection.discard();
        pooledConnection.close();
        pooledConnection.close();

        assertTrue(pooledConnection.isDiscarded());
        assertEquals(0, manager.activeConnections(geoTarget));
        try (PooledConnection replacement = manager.acquire(geoTarget)) {
            assertEquals("geo", replacement.connection().getSchema());
        }
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        ConnectionPoolManager manager = manager(config(), geoTarget);

        PooledConnection pooledConnection = manager.acquire(geoTarget);
        pooledConnection.close();
        pooledConnection.close();

        assertEquals(0, manager.activeConnections(geoTarget));
        assertThat(manager.totalConnections(geoTarget)).isGreaterThanOrEqualTo(1);
    }

    @Test
    void testShutdownIsIdempotentAndFinal() throws Exception {
        ConnectionPoolManager manager = manager(config(), geoTarget);
        manager.acquire(geoTarget).close();

        manager.shutdown();
        manager.shutdown();

        assertTrue(manager.isShutdown());
        assertEquals(0, manager.totalConnections(geoTarget));
        assertThrows(IllegalStateException.class, () -> manager.acquire(geoTarget));
    }

    @Test
    @Timeout(60)
    void testInitializeSurvivesUnreachableTarget() throws Exception {
        Target unreachable = new Target("nowhere", "", 0, TestUtils.H2_USER, TestUtils.H2_PASSWORD, "", "",
                Dialect.H2, "jdbc:h2:tcp://127.0.0.1:1/nowhere");
        ConnectionPoolManager manager = manager(config().withTimeouts(1, 30, 30, 1), geoTarget, unreachable);

        manager.initialize();

        assertThat(manager.totalConnections(geoTarget)).isGreaterThanOrEqualTo(1);
        assertEquals(0, manager.totalConnections(unreachable));
        try (PooledConnection pooledConnection = manager.acquire(geoTarget)) {
            assertEquals("geo", pooledConnection.connection().getSchema());
        }
        assertThrows(GatewayException.class, () -> manager.acquire(unreachable));
    }

    @Test
    void testLeaseStartsOnServerDefaultDatabase() throws Exception {
        Target defaultTarget = geoTarget.withDatabase("");
        ConnectionPoolManager manager = manager(config().withLimits(1, 100), defaultTarget);

        try (PooledConnection first = manager.acquire(defaultTarget)) {
            assertEquals("public", first.connection().getSchema());
        }
        try (PooledConnection geoLease = manager.acquire(geoTarget)) {
            assertEquals("geo", geoLease.connection().getSchema());
        }
        try (PooledConnection again = manager.acquire(defaultTarget)) {
            assertEquals("public", again.connection().getSchema());
        }
        try (PooledConnection serverLease = manager.acquireServerConnection(defaultTarget)) {
            assertEquals("public", serverLease.connection().getSchema());
        }
    }

    @Test
    void testSchemaSwitchInsideLeaseIsUndone() throws Exception {
        Target defaultTarget = geoTarget.withDatabase("");
        ConnectionPoolManager manager = manager(config().withLimits(1, 100), defaultTarget);

        try (PooledConnection pooledConnection = manager.acquire(defaultTarget);
             Statement stmt = pooledConnection.connection().createStatement()) {
            stmt.execute("SET SCHEMA geo");
            assertEquals("geo", pooledConnection.connection().getSchema());
        }
        try (PooledConnection again = manager.acquire(defaultTarget)) {
            assertEquals("public", again.connection().getSchema());
        }
    }

    @Test
    void testMissingDatabaseKeepsSharedPool() throws Exception {
        Target missingTarget = new Target("missing", "", 0, TestUtils.H2_USER, TestUtils.H2_PASSWORD,
                "no_such_schema", "", Dialect.H2, jdbcUrl);
        ConnectionPoolManager manager = manager(config(), missingTarget, geoTarget);

        try (PooledConnection held = manager.acquire(geoTarget)) {
            manager.initialize();

            assertEquals(1, manager.activeConnections(geoTarget));
            assertFalse(held.connection().isClosed());
            try (Statement stmt = held.connection().createStatement();
                 ResultSet resultSet = stmt.executeQuery("SELECT COUNT(*) FROM countries")) {
                assertTrue(resultSet.next());
                assertEquals(3, resultSet.getInt(1));
            }
        }
        assertThrows(QueryExecutionException.class, () -> manager.acquire(missingTarget));
        try (PooledConnection geoLease = manager.acquire(geoTarget)) {
            assertEquals("geo", geoLease.connection().getSchema());
        }
    }

    @Test
    void testPoolCreatedDuringShutdownIsClosed() {
        List<HikariDataSource> createdPools = new CopyOnWriteArrayList<>();
        poolManager = new ConnectionPoolManager(config(), new TargetRegistry(List.of(geoTarget))) {
            @Override
            HikariDataSource createDataSource(Target target) {
                HikariDataSource dataSource = super.createDataSource(target);
                createdPools.add(dataSource);
                shutdown();
                return dataSource;
            }
        };

        assertThrows(IllegalStateException.class, () -> poolManager.acquire(geoTarget));
        assertEquals(1, createdPools.size());
        assertTrue(createdPools.get(0).isClosed());
        assertEquals(0, poolManager.totalConnections(geoTarget));
    }
}
