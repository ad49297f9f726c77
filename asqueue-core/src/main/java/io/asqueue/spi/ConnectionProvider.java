package io.asqueue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for queue operations that run outside a caller's transaction
 * (delivery worker reads and truncation, backlog counting).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see io.asqueue.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
