package io.dbkit.schema;

import java.util.Objects;

/**
 * One column of a table descriptor. Primary-key columns are never nullable.
 */
public record ColumnDefinition(String name, ColumnType type, boolean nullable, boolean primaryKey) {

  public ColumnDefinition {
    Identifiers.column(name);
    Objects.requireNonNull(type, "type");
    if (primaryKey && nullable) {
      throw new IllegalArgumentException("Primary key column '" + name + "' cannot be nullable");
    }
  }

  /** A nullable, non-key column. */
  public static ColumnDefinition of(String name, ColumnType type) {
    return new ColumnDefinition(name, type, true, false);
  }

  public static ColumnDefinition notNull(String name, ColumnType type) {
    return new ColumnDefinition(name, type, false, false);
  }

  public static ColumnDefinition primaryKey(String name, ColumnType type) {
    return new ColumnDefinition(name, type, false, true);
  }
}
