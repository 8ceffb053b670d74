package io.dbkit.jdbc.dialect;

import io.dbkit.schema.ColumnType;

import java.util.List;

/**
 * H2 dialect. Primarily for testing.
 *
 * <p>Host and port are ignored: the URL names a private in-memory database that lives until
 * the JVM exits, so a disposed engine can be rebuilt against the same data.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String jdbcUrl(String host, int port, String database) {
    return "jdbc:h2:mem:" + database + ";DB_CLOSE_DELAY=-1";
  }

  @Override
  public String columnType(ColumnType type) {
    // H2's TEXT is a CLOB; keep values readable as plain strings.
    if (type == ColumnType.TEXT || type == ColumnType.STRING) {
      return "CHARACTER VARYING";
    }
    return super.columnType(type);
  }
}
