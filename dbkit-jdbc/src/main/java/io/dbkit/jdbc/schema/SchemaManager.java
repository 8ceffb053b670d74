package io.dbkit.jdbc.schema;

import io.dbkit.jdbc.JdbcTemplate;
import io.dbkit.jdbc.SqlExecutionException;
import io.dbkit.jdbc.engine.ConnectivityException;
import io.dbkit.jdbc.spi.Dialect;
import io.dbkit.schema.SchemaDescriptor;
import io.dbkit.schema.SchemaOrdering;
import io.dbkit.spi.ConnectionProvider;
import io.dbkit.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates tables from descriptors, parent tables first, skipping tables that already exist.
 *
 * <p>All DDL runs in auto-commit mode on one connection. The first failing table aborts the
 * call with {@link SchemaCreationException}; tables created before it are kept. Running the
 * same call twice is harmless.
 */
public final class SchemaManager {
  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final Logger logger;
  private final MetricsExporter metrics;

  public SchemaManager(ConnectionProvider connectionProvider, Dialect dialect, Logger logger,
      MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.logger = Objects.requireNonNull(logger, "logger");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public List<String> createTables(Collection<? extends SchemaDescriptor> descriptors) {
    return createTables(descriptors, null);
  }

  /**
   * @param timeout per-statement timeout, or {@code null} for none
   * @return the table names in the order they were processed
   * @throws SchemaCreationException naming the first table that could not be created
   */
  public List<String> createTables(Collection<? extends SchemaDescriptor> descriptors,
      Duration timeout) {
    Objects.requireNonNull(descriptors, "descriptors");
    List<? extends SchemaDescriptor> ordered = SchemaOrdering.parentFirst(descriptors);
    if (ordered.isEmpty()) {
      return List.of();
    }
    List<String> created = new ArrayList<>(ordered.size());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      for (SchemaDescriptor descriptor : ordered) {
        String table = descriptor.tableName();
        try {
          JdbcTemplate.execute(conn, timeout, dialect.createTableSql(descriptor));
        } catch (SqlExecutionException | IllegalArgumentException e) {
          logger.log(Level.SEVERE, "Failed to create table " + table, e);
          throw new SchemaCreationException(table, e);
        }
        created.add(table);
        logger.fine(() -> "Ensured table " + table);
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain a connection for schema creation", e);
      throw new ConnectivityException("Failed to obtain a connection for schema creation: "
          + e.getMessage(), e);
    }
    metrics.recordTablesCreated(created.size());
    logger.info("Tables ensured: " + created);
    return created;
  }

  /**
   * Checks whether {@code tableName} exists, honouring how the database stores unquoted
   * identifiers (upper case in H2, lower case in PostgreSQL).
   */
  public boolean tableExists(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    try (Connection conn = connectionProvider.getConnection()) {
      DatabaseMetaData meta = conn.getMetaData();
      String name = tableName;
      if (meta.storesUpperCaseIdentifiers()) {
        name = tableName.toUpperCase(Locale.ROOT);
      } else if (meta.storesLowerCaseIdentifiers()) {
        name = tableName.toLowerCase(Locale.ROOT);
      }
      String pattern = escapeLikePattern(name, meta.getSearchStringEscape());
      try (ResultSet rs = meta.getTables(conn.getCatalog(), null, pattern,
          new String[] {"TABLE"})) {
        return rs.next();
      }
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to look up table " + tableName, e);
    }
  }

  // getTables takes a LIKE pattern; '_' and '%' in a table name must match literally.
  static String escapeLikePattern(String name, String escape) {
    if (escape == null || escape.isEmpty()) {
      return name;
    }
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '_' || c == '%' || escape.indexOf(c) >= 0) {
        sb.append(escape);
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
