package io.dbkit.jdbc;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;
import io.dbkit.config.ConfigResolver;
import io.dbkit.config.ConnectionConfig;
import io.dbkit.dataset.TabularDataset;
import io.dbkit.jdbc.engine.Engine;
import io.dbkit.jdbc.engine.EngineFactory;
import io.dbkit.jdbc.load.BulkLoader;
import io.dbkit.jdbc.schema.SchemaManager;
import io.dbkit.jdbc.session.SessionFactory;
import io.dbkit.jdbc.session.SessionWork;
import io.dbkit.jdbc.session.TransactionScope;
import io.dbkit.jdbc.spi.Dialect;
import io.dbkit.schema.SchemaDescriptor;
import io.dbkit.spi.ConnectionProvider;
import io.dbkit.spi.MetricsExporter;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point: one configuration, one lazily built pool, and the operations that run on it.
 *
 * <pre>{@code
 * Logger log = AppLogger.create("database", Path.of("logs/db.log"));
 * try (DatabaseManager db = new DatabaseManager(config, log)) {
 *     db.createTables(List.of(teams, seeds));
 *     db.insert(teamRows, teams);
 *     long count = db.inTransaction(session ->
 *         session.queryFirst("SELECT COUNT(*) FROM ncaa_m_teams", rs -> rs.getLong(1)).orElse(0L));
 * }
 * }</pre>
 *
 * <p>Nothing touches the database until the first operation; that operation builds the engine.
 * The manager is thread-safe; each thread gets its own sessions. {@link #dispose()} must not run
 * concurrently with active scopes. After disposal, the next operation builds a new pool.
 */
public final class DatabaseManager implements AutoCloseable {
  private final ConnectionConfig config;
  private final Logger logger;
  private final Dialect dialect;
  private final EngineFactory engineFactory;
  private final SessionFactory sessions;
  private final SchemaManager schemaManager;
  private final BulkLoader bulkLoader;

  public DatabaseManager(ConnectionConfig config, Logger logger) {
    this(config, logger, MetricsExporter.NOOP);
  }

  public DatabaseManager(ConnectionConfig config, Logger logger, MetricsExporter metrics) {
    this(config, logger, metrics, BulkLoader.DEFAULT_CHUNK_SIZE);
  }

  /**
   * @param batchSize rows per JDBC batch for {@link #insert}
   * @throws io.dbkit.jdbc.engine.EngineCreationException if the configured driver is unknown
   */
  public DatabaseManager(ConnectionConfig config, Logger logger, MetricsExporter metrics,
      int batchSize) {
    this.config = Objects.requireNonNull(config, "config");
    this.logger = Objects.requireNonNull(logger, "logger");
    MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
    this.dialect = EngineFactory.dialectFor(config);
    this.engineFactory = new EngineFactory(config, logger);
    ConnectionProvider connections = () -> engineFactory.engine().getConnection();
    Duration statementTimeout = config.statementTimeout().orElse(null);
    this.sessions = new SessionFactory(connections, statementTimeout, logger, exporter);
    this.schemaManager = new SchemaManager(connections, dialect, logger, exporter);
    this.bulkLoader = new BulkLoader(sessions, dialect, logger, exporter, batchSize);
  }

  /**
   * Reads the {@code database} section of a YAML file.
   */
  public static DatabaseManager fromYaml(Path configFile, Logger logger) {
    Map<String, Object> section = ConfigResolver.defaults().databaseSection(configFile);
    return new DatabaseManager(EngineFactory.validated(section, logger), logger);
  }

  /**
   * Locates {@code config/<configName>} upward from {@code start} and reads its
   * {@code database} section.
   */
  public static DatabaseManager fromConfigResolver(ConfigResolver resolver, Path start,
      String configName, Logger logger) {
    Path file = resolver.findNearestConfig(start, configName);
    logger.info("Using database config " + file);
    return new DatabaseManager(EngineFactory.validated(resolver.databaseSection(file), logger),
        logger);
  }

  public ConnectionConfig config() {
    return config;
  }

  public Dialect dialect() {
    return dialect;
  }

  /**
   * The memoized engine, built on first call.
   *
   * @throws io.dbkit.jdbc.engine.EngineCreationException if the pool cannot be created
   * @throws io.dbkit.jdbc.engine.ConnectivityException   if the liveness query fails
   */
  public Engine engine() {
    return engineFactory.engine();
  }

  public boolean isEngineBuilt() {
    return engineFactory.isBuilt();
  }

  /**
   * Builds the engine if needed and runs the liveness query, reporting the outcome as a value.
   */
  public ConnectionStatus validateConnection() {
    try {
      Engine engine = engine();
      try (Connection conn = engine.getConnection();
           Statement st = conn.createStatement()) {
        st.execute(dialect.livenessQuery());
      }
      return new ConnectionStatus.Available(engine.identifier());
    } catch (DbKitException e) {
      return new ConnectionStatus.Unavailable(e.kind(), e.getMessage());
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Liveness query failed", e);
      return new ConnectionStatus.Unavailable(ErrorKind.CONNECTIVITY, e.getMessage());
    }
  }

  /**
   * Opens a transaction scope; use with try-with-resources and call
   * {@link TransactionScope#commit()} at the end of the block.
   */
  public TransactionScope sessionScope() {
    return sessions.begin();
  }

  /**
   * Opens a transaction scope whose statements each time out after {@code statementTimeout}.
   */
  public TransactionScope sessionScope(Duration statementTimeout) {
    return sessions.begin(statementTimeout);
  }

  /**
   * Runs {@code work} in a new scope: commits when it returns, rolls back when it throws.
   *
   * <p>A failure of the work is logged once and rethrown as is; a rollback failure is attached
   * to it as suppressed. A checked {@link SQLException} from the work is wrapped in
   * {@link SqlExecutionException}.
   */
  public <T> T inTransaction(SessionWork<T> work) {
    return inTransaction(null, work);
  }

  public <T> T inTransaction(Duration statementTimeout, SessionWork<T> work) {
    Objects.requireNonNull(work, "work");
    try (TransactionScope scope = statementTimeout == null
        ? sessions.begin() : sessions.begin(statementTimeout)) {
      T result;
      try {
        result = work.apply(scope.session());
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Session rollback because of exception", e);
        throw new SqlExecutionException("Transaction work failed", e);
      } catch (RuntimeException | Error e) {
        logger.log(Level.SEVERE, "Session rollback because of exception", e);
        throw e;
      }
      scope.commit();
      return result;
    }
  }

  /**
   * Creates the tables that do not exist yet, parent tables first.
   *
   * @return table names in creation order
   * @throws io.dbkit.jdbc.schema.SchemaCreationException naming the first failing table
   */
  public List<String> createTables(Collection<? extends SchemaDescriptor> descriptors) {
    return schemaManager.createTables(descriptors);
  }

  public List<String> createTables(Collection<? extends SchemaDescriptor> descriptors,
      Duration statementTimeout) {
    return schemaManager.createTables(descriptors, statementTimeout);
  }

  public boolean tableExists(String tableName) {
    return schemaManager.tableExists(tableName);
  }

  /**
   * Inserts every row of {@code dataset} into the descriptor's table, all or nothing.
   *
   * @return rows written
   * @throws io.dbkit.jdbc.load.BulkInsertException if any row fails
   */
  public int insert(TabularDataset dataset, SchemaDescriptor descriptor) {
    return bulkLoader.insert(dataset, descriptor);
  }

  public int insert(TabularDataset dataset, SchemaDescriptor descriptor,
      Duration statementTimeout) {
    return bulkLoader.insert(dataset, descriptor, statementTimeout);
  }

  /**
   * Closes the pool. Errors are logged, not thrown. The next operation rebuilds the engine.
   */
  public void dispose() {
    engineFactory.dispose();
  }

  @Override
  public void close() {
    dispose();
  }
}
