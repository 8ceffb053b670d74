package io.dbkit.jdbc.spi;

import io.dbkit.schema.ColumnType;
import io.dbkit.schema.SchemaDescriptor;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations compose JDBC URLs and render the DDL and DML used by the schema manager
 * and the bulk loader. Register custom dialects via
 * {@code META-INF/services/io.dbkit.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: PostgreSQL, MySQL, H2.
 *
 * @see io.dbkit.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2"). Matches the
   * {@code driver} key of the connection config.
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Composes the JDBC URL for a database.
   */
  String jdbcUrl(String host, int port, String database);

  /**
   * Trivial round-trip query used to verify connectivity.
   */
  default String livenessQuery() {
    return "SELECT 1";
  }

  /**
   * SQL type for a semantic column type.
   */
  String columnType(ColumnType type);

  /**
   * {@code CREATE TABLE IF NOT EXISTS} statement for a descriptor, including primary and
   * foreign key constraints.
   */
  String createTableSql(SchemaDescriptor descriptor);

  /**
   * Parameterised {@code INSERT} covering every column of the descriptor, in column order.
   */
  String insertSql(SchemaDescriptor descriptor);
}
