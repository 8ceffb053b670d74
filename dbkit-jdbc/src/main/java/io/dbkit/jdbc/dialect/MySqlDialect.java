package io.dbkit.jdbc.dialect;

import io.dbkit.schema.ColumnType;

import java.util.List;

/**
 * MySQL dialect (also handles TiDB URLs).
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public String jdbcUrl(String host, int port, String database) {
    return "jdbc:mysql://" + host + ":" + port + "/" + database;
  }

  @Override
  public String columnType(ColumnType type) {
    return switch (type) {
      case FLOAT -> "DOUBLE";
      case DECIMAL -> "DECIMAL(38, 10)";
      // TIMESTAMP is range-limited and session-zone converted in MySQL.
      case TIMESTAMP -> "DATETIME(6)";
      default -> super.columnType(type);
    };
  }
}
