package io.dbkit.jdbc.engine;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.dbkit.config.ConnectionConfig;
import io.dbkit.config.ConnectionConfigValidator;
import io.dbkit.config.InvalidConnectionParameterException;
import io.dbkit.config.MissingConnectionParameterException;
import io.dbkit.jdbc.dialect.Dialects;
import io.dbkit.jdbc.spi.Dialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the {@link Engine} for one {@link ConnectionConfig} on first use and memoizes it.
 *
 * <h2>Build</h2>
 * <ol>
 *   <li>re-validate the configuration;</li>
 *   <li>compose the {@link ConnectionIdentifier} through the configured dialect;</li>
 *   <li>create the Hikari pool: {@code poolSize} idle connections, at most
 *       {@code poolSize + maxOverflow} in total, connections retired after
 *       {@code recycleInterval}, callers waiting at most {@code poolTimeout};</li>
 *   <li>run the dialect's liveness query on one pooled connection.</li>
 * </ol>
 * Steps 1 to 3 fail with {@link EngineCreationException}; step 4 with
 * {@link ConnectivityException}, after closing the half-built pool.
 *
 * <h2>Lifecycle</h2>
 * <p>Building happens under a single lock, so concurrent first callers observe one build. After
 * {@link #dispose()}, the next {@link #engine()} builds a fresh pool from the same configuration.
 * Disposing while sessions are active is the caller's responsibility to avoid.
 */
public final class EngineFactory {
  private final ConnectionConfig config;
  private final Logger logger;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile Engine engine;

  public EngineFactory(ConnectionConfig config, Logger logger) {
    this.config = Objects.requireNonNull(config, "config");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Returns the memoized engine, building it if necessary.
   *
   * @throws EngineCreationException if the pool cannot be constructed
   * @throws ConnectivityException   if the liveness query fails
   */
  public Engine engine() {
    Engine current = engine;
    if (current != null) {
      return current;
    }
    lock.lock();
    try {
      if (engine == null) {
        engine = build();
      }
      return engine;
    } finally {
      lock.unlock();
    }
  }

  public boolean isBuilt() {
    return engine != null;
  }

  public ConnectionConfig config() {
    return config;
  }

  /**
   * Closes the pool if one was built. Failures are logged, never thrown. Safe to call
   * repeatedly or before any build.
   */
  public void dispose() {
    lock.lock();
    try {
      Engine current = engine;
      engine = null;
      if (current == null) {
        return;
      }
      try {
        current.close();
        logger.info("Database engine disposed: " + current.identifier());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to dispose database engine " + current.identifier(), e);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Resolves the dialect named by {@link ConnectionConfig#driver()}.
   *
   * @throws EngineCreationException if no such dialect is registered or it cannot compose a
   *     URL for {@code config}
   */
  public static Dialect dialectFor(ConnectionConfig config) {
    try {
      return Dialects.forConfig(config);
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new EngineCreationException("Unsupported database driver '" + config.driver() + "': "
          + e.getMessage(), e);
    }
  }

  /**
   * Validates {@code candidate}, logging a rejection once with the offending keys.
   */
  public static ConnectionConfig validated(Map<String, ?> candidate, Logger logger) {
    try {
      return ConnectionConfigValidator.validate(candidate);
    } catch (MissingConnectionParameterException e) {
      logger.severe("Missing database configuration parameters: " + e.missingKeys());
      throw e;
    } catch (InvalidConnectionParameterException e) {
      logger.severe("Invalid database configuration parameter '" + e.key() + "': "
          + e.getMessage());
      throw e;
    }
  }

  private Engine build() {
    validated(config.toMap(), logger);
    Dialect dialect = dialectFor(config);
    ConnectionIdentifier identifier = ConnectionIdentifier.of(config, dialect);

    HikariDataSource dataSource;
    try {
      dataSource = new HikariDataSource(hikariConfig(identifier));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to create database engine for " + identifier, e);
      throw new EngineCreationException("Failed to create database engine for " + identifier
          + ": " + e.getMessage(), e);
    }

    try (Connection conn = dataSource.getConnection();
         Statement st = conn.createStatement()) {
      st.execute(dialect.livenessQuery());
    } catch (SQLException e) {
      dataSource.close();
      Throwable reason = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.SEVERE, "Liveness check failed for " + identifier, e);
      throw new ConnectivityException("Liveness check failed for " + identifier
          + ": " + reason.getMessage(), e);
    }
    Engine built = new Engine(dataSource, dialect, identifier, logger);
    logger.info("Database engine created: " + identifier + " (pool " + config.poolSize()
        + "+" + config.maxOverflow() + ")");
    return built;
  }

  private HikariConfig hikariConfig(ConnectionIdentifier identifier) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("dbkit-" + config.name());
    hikari.setJdbcUrl(identifier.jdbcUrl());
    hikari.setUsername(config.user());
    hikari.setPassword(config.password());
    hikari.setMinimumIdle(config.poolSize());
    hikari.setMaximumPoolSize(config.maxConnections());
    hikari.setMaxLifetime(config.recycleInterval().toMillis());
    hikari.setConnectionTimeout(config.poolTimeout().toMillis());
    hikari.setAutoCommit(false);
    // Lazy start: the liveness query reports connectivity, not the pool constructor.
    hikari.setInitializationFailTimeout(-1);
    return hikari;
  }
}
