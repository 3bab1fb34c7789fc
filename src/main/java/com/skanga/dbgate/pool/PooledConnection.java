package com.skanga.dbgate.pool;

import com.skanga.dbgate.target.Target;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A leased connection. Use it in a try-with-resources block: closing returns the connection to its pool,
 * or evicts it when {@link #discard()} was called first. Closing more than once has no effect.
 * <p>
 * The connection goes back pointed at the database it had when it was leased, so the next borrower
 * never inherits a database selected by this one.
 */
public final class PooledConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PooledConnection.class);

    private final Connection connection;
    private final Target target;
    private final HikariDataSource dataSource;
    private final String leasedDatabase;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean discarded;

    PooledConnection(Connection connection, Target target, HikariDataSource dataSource, String leasedDatabase) {
        this.connection = connection;
        this.target = target;
        this.dataSource = dataSource;
        this.leasedDatabase = leasedDatabase;
    }

    public Connection connection() {
        return connection;
    }

    /**
     * Marks the connection as unusable, so that closing the lease evicts it instead of returning it.
     */
    public void discard() {
        discarded = true;
    }

    public boolean isDiscarded() {
        return discarded;
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        if (discarded) {
            logger.debug("Evicting discarded connection for {}", target.name());
            dataSource.evictConnection(connection);
            return;
        }
        try {
            if (!restoreDatabase()) {
                logger.debug("Evicting connection for {}: cannot return to its original database", target.name());
                dataSource.evictConnection(connection);
                return;
            }
            connection.close();
        } catch (SQLException e) {
            logger.warn("Error returning connection for {} to the pool: {}", target.name(), e.getMessage());
            dataSource.evictConnection(connection);
        }
    }

    /**
     * Switches back to the database seen at lease time.
     *
     * @return false when there is no database to switch back to
     */
    private boolean restoreDatabase() throws SQLException {
        String currentDatabase = target.dialect().currentDatabase(connection);
        if (Objects.equals(currentDatabase, leasedDatabase)) {
            return true;
        }
        if (leasedDatabase == null || leasedDatabase.isBlank()) {
            // a server connection cannot deselect its database
            return false;
        }
        // schema switches are transactional on some servers, so make the restore stick
        boolean autoCommit = connection.getAutoCommit();
        if (!autoCommit) {
            connection.rollback();
        }
        target.dialect().selectDatabase(connection, leasedDatabase);
        if (!autoCommit) {
            connection.commit();
        }
        logger.trace("Restored {} to database {}", target.name(), leasedDatabase);
        return true;
    }
}
