package io.dbkit.jdbc.engine;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.dbkit.jdbc.spi.Dialect;
import io.dbkit.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A live HikariCP pool bound to one database, plus the dialect used to talk to it.
 *
 * <p>Built by {@link EngineFactory}; shared by every session. Connection acquisition failures are
 * translated: a wait that ran out while the pool was saturated becomes
 * {@link PoolExhaustedException}, one caused by the store refusing connections becomes
 * {@link ConnectivityException}.
 */
public final class Engine implements ConnectionProvider, AutoCloseable {
  private final HikariDataSource dataSource;
  private final Dialect dialect;
  private final ConnectionIdentifier identifier;
  private final int maxConnections;
  private final Logger logger;

  Engine(HikariDataSource dataSource, Dialect dialect, ConnectionIdentifier identifier,
      Logger logger) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.identifier = Objects.requireNonNull(identifier, "identifier");
    this.logger = Objects.requireNonNull(logger, "logger");
    this.maxConnections = dataSource.getMaximumPoolSize();
  }

  @Override
  public Connection getConnection() throws SQLException {
    try {
      return dataSource.getConnection();
    } catch (SQLTransientConnectionException e) {
      if (e.getCause() == null) {
        String message = "No connection available from " + identifier + " within "
            + dataSource.getConnectionTimeout() + " ms (max " + maxConnections + " connections)";
        logger.severe(message);
        throw new PoolExhaustedException(message, maxConnections, e);
      }
      logger.log(Level.SEVERE, "Cannot connect to " + identifier, e);
      throw new ConnectivityException("Cannot connect to " + identifier + ": "
          + e.getCause().getMessage(), e);
    }
  }

  public DataSource dataSource() {
    return dataSource;
  }

  public Dialect dialect() {
    return dialect;
  }

  public ConnectionIdentifier identifier() {
    return identifier;
  }

  public int maxConnections() {
    return maxConnections;
  }

  /** Connections currently checked out; 0 once the pool is closed. */
  public int activeConnections() {
    HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
    return pool == null ? 0 : pool.getActiveConnections();
  }

  public int totalConnections() {
    HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
    return pool == null ? 0 : pool.getTotalConnections();
  }

  public boolean isClosed() {
    return dataSource.isClosed();
  }

  /** Closes every pooled connection. */
  @Override
  public void close() {
    dataSource.close();
  }

  @Override
  public String toString() {
    return "Engine{" + identifier + ", maxConnections=" + maxConnections + "}";
  }
}
