package io.dbkit.jdbc.session;

import io.dbkit.jdbc.engine.ConnectivityException;
import io.dbkit.spi.ConnectionProvider;
import io.dbkit.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens {@link TransactionScope}s on connections from a {@link ConnectionProvider}.
 *
 * <p>With an {@link io.dbkit.jdbc.engine.Engine} as provider, the first scope triggers the
 * engine build, and a saturated pool surfaces as
 * {@link io.dbkit.jdbc.engine.PoolExhaustedException} after the pool timeout.
 */
public final class SessionFactory {
  private final ConnectionProvider connectionProvider;
  private final Duration defaultStatementTimeout;
  private final Logger logger;
  private final MetricsExporter metrics;

  /**
   * @param defaultStatementTimeout timeout applied to every statement, or {@code null} for none
   */
  public SessionFactory(ConnectionProvider connectionProvider, Duration defaultStatementTimeout,
      Logger logger, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.defaultStatementTimeout = defaultStatementTimeout;
    this.logger = Objects.requireNonNull(logger, "logger");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /** Opens a scope with the default statement timeout. */
  public TransactionScope begin() {
    return begin(defaultStatementTimeout);
  }

  /**
   * Opens a scope whose statements each time out after {@code statementTimeout}.
   *
   * @param statementTimeout per-statement limit, or {@code null} for none
   */
  public TransactionScope begin(Duration statementTimeout) {
    if (statementTimeout != null && (statementTimeout.isNegative() || statementTimeout.isZero())) {
      throw new IllegalArgumentException("statementTimeout must be positive");
    }
    Connection connection;
    try {
      connection = connectionProvider.getConnection();
    } catch (SQLException e) {
      metrics.incrementAcquireFailure();
      logger.log(Level.SEVERE, "Failed to obtain a connection", e);
      throw new ConnectivityException("Failed to obtain a connection: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      metrics.incrementAcquireFailure();
      throw e;
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      TransactionException failure = new TransactionException("Failed to begin transaction", e);
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        failure.addSuppressed(closeFailure);
      }
      logger.log(Level.SEVERE, "Failed to begin transaction", failure);
      throw failure;
    }
    return new TransactionScope(connection, statementTimeout, logger, metrics);
  }
}
