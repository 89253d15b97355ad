/* (C)2026 */
package com.ammann.history.store;

import com.ammann.history.exception.StoreAccessException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.duckdb.DuckDBConnection;
import org.jboss.logging.Logger;

/**
 * Owns the in-memory DuckDB database used to read the Parquet store.
 *
 * <p>One database instance is opened lazily; every caller gets its own duplicated
 * connection and must close it. Duplicated connections share the instance and its
 * loaded extensions but run independently.
 */
@ApplicationScoped
public class DuckDbConnectionProvider {

    private static final Logger LOG = Logger.getLogger(DuckDbConnectionProvider.class);
    private static final String IN_MEMORY_URL = "jdbc:duckdb:";

    private DuckDBConnection root;

    /**
     * Opens a new connection on the shared database.
     *
     * @return a connection owned by the caller
     * @throws SQLException when the database cannot be opened or duplicated
     */
    public synchronized Connection openConnection() throws SQLException {
        if (root == null || root.isClosed()) {
            root = DriverManager.getConnection(IN_MEMORY_URL).unwrap(DuckDBConnection.class);
            LOG.info("DuckDB database opened for Parquet queries");
        }
        return root.duplicate();
    }

    /**
     * Verifies the engine answers a trivial query.
     */
    public boolean isAvailable() {
        try (Connection connection = openConnection();
                var statement = connection.createStatement();
                var resultSet = statement.executeQuery("SELECT 1")) {
            return resultSet.next();
        } catch (SQLException e) {
            throw new StoreAccessException("DuckDB is not available: " + e.getMessage(), e);
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (root == null) {
            return;
        }
        try {
            root.close();
            LOG.info("DuckDB database closed");
        } catch (SQLException e) {
            LOG.warnf("Failed to close DuckDB database: %s", e.getMessage());
        } finally {
            root = null;
        }
    }
}
