package io.dbkit.schema;

import java.util.Objects;

/**
 * Table and column name validation. Names are interpolated into DDL and DML, so only plain
 * unquoted identifiers are accepted.
 */
public final class Identifiers {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private Identifiers() {}

  public static String validate(String name, String what) {
    Objects.requireNonNull(name, what);
    if (!name.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid " + what + ": " + name);
    }
    return name;
  }

  public static String table(String tableName) {
    return validate(tableName, "table name");
  }

  public static String column(String columnName) {
    return validate(columnName, "column name");
  }
}
