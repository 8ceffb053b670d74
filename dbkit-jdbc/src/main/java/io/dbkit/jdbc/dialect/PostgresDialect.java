package io.dbkit.jdbc.dialect;

import io.dbkit.schema.ColumnType;

import java.util.List;

/**
 * PostgreSQL dialect. The default when a config names no driver.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String jdbcUrl(String host, int port, String database) {
    return "jdbc:postgresql://" + host + ":" + port + "/" + database;
  }

  @Override
  public String columnType(ColumnType type) {
    return switch (type) {
      case STRING -> "VARCHAR";
      case DECIMAL -> "NUMERIC";
      default -> super.columnType(type);
    };
  }
}
