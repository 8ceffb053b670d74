package io.dbkit.jdbc.session;

import io.dbkit.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scoped acquisition of a {@link Session}: commit or roll back exactly once, then release the
 * connection exactly once.
 *
 * <pre>{@code
 * try (TransactionScope scope = db.sessionScope()) {
 *     scope.session().update("UPDATE fips SET county = ? WHERE fips_code = ?", "Kent", 10001L);
 *     scope.commit();
 * }
 * }</pre>
 *
 * <p>Rules:
 * <ul>
 *   <li>Repeating the transition already taken is a no-op; taking the other one throws
 *       {@link IllegalStateException}.</li>
 *   <li>A failed commit rolls back; the rollback failure, if any, is suppressed on the
 *       {@link TransactionException}.</li>
 *   <li>{@link #close()} rolls back when neither transition happened, then releases the
 *       connection. It runs on every path and is idempotent.</li>
 * </ul>
 * Failures of commit, rollback and release are logged here, once, and thrown as
 * {@link TransactionException}; under try-with-resources the rollback and release failures
 * arrive suppressed on the body's own exception.
 */
public final class TransactionScope implements AutoCloseable {
  private final Connection connection;
  private final Session session;
  private final Logger logger;
  private final MetricsExporter metrics;
  private final long startedNanos = System.nanoTime();
  private ScopeState state = ScopeState.ACTIVE;
  private ScopeState outcome;

  TransactionScope(Connection connection, Duration statementTimeout, Logger logger,
      MetricsExporter metrics) {
    this.connection = connection;
    this.logger = logger;
    this.metrics = metrics;
    this.session = new Session(connection, statementTimeout, this);
  }

  public Session session() {
    return session;
  }

  public ScopeState state() {
    return state;
  }

  /**
   * Makes every write of this scope durable.
   *
   * @throws TransactionException  if the commit fails (the scope is then rolled back)
   * @throws IllegalStateException if the scope was already rolled back
   */
  public void commit() {
    if (outcome == ScopeState.COMMITTED) {
      return;
    }
    if (outcome == ScopeState.ROLLED_BACK) {
      throw new IllegalStateException("Cannot commit: scope was already rolled back");
    }
    try {
      connection.commit();
      finish(ScopeState.COMMITTED);
    } catch (SQLException e) {
      TransactionException failure = new TransactionException("Commit failed", e);
      try {
        connection.rollback();
      } catch (SQLException rollbackFailure) {
        failure.addSuppressed(rollbackFailure);
      }
      finish(ScopeState.ROLLED_BACK);
      logger.log(Level.SEVERE, "Commit failed, transaction rolled back", failure);
      throw failure;
    }
  }

  /**
   * Discards every write of this scope.
   *
   * @throws TransactionException  if the rollback fails
   * @throws IllegalStateException if the scope was already committed
   */
  public void rollback() {
    if (outcome == ScopeState.ROLLED_BACK) {
      return;
    }
    if (outcome == ScopeState.COMMITTED) {
      throw new IllegalStateException("Cannot roll back: scope was already committed");
    }
    try {
      connection.rollback();
    } catch (SQLException e) {
      TransactionException failure = new TransactionException("Rollback failed", e);
      logger.log(Level.SEVERE, "Rollback failed", failure);
      throw failure;
    } finally {
      finish(ScopeState.ROLLED_BACK);
    }
  }

  /**
   * Rolls back if neither commit nor rollback happened, then returns the connection to the pool.
   */
  @Override
  public void close() {
    if (state == ScopeState.CLOSED) {
      return;
    }
    TransactionException failure = null;
    if (outcome == null) {
      try {
        rollback();
      } catch (TransactionException e) {
        failure = e;
      }
    }
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to release connection", e);
      if (failure == null) {
        failure = new TransactionException("Failed to release connection", e);
      } else {
        failure.addSuppressed(e);
      }
    } finally {
      state = ScopeState.CLOSED;
      metrics.recordScopeDurationMs(
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos));
    }
    if (failure != null) {
      throw failure;
    }
  }

  private void finish(ScopeState terminal) {
    outcome = terminal;
    state = terminal;
    if (terminal == ScopeState.COMMITTED) {
      metrics.incrementScopeCommitted();
    } else {
      metrics.incrementScopeRolledBack();
    }
  }
}
