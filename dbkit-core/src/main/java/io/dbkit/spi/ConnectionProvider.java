package io.dbkit.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the schema manager, the bulk loader and the session factory.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see io.dbkit.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
