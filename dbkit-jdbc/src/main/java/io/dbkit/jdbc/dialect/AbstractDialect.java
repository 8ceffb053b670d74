package io.dbkit.jdbc.dialect;

import io.dbkit.jdbc.spi.Dialect;
import io.dbkit.schema.ColumnDefinition;
import io.dbkit.schema.ColumnType;
import io.dbkit.schema.ForeignKey;
import io.dbkit.schema.Identifiers;
import io.dbkit.schema.SchemaDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses supply the URL format and override {@link #columnType(ColumnType)} where the
 * database spells a type differently.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String columnType(ColumnType type) {
    return switch (type) {
      case STRING -> "VARCHAR(255)";
      case TEXT -> "TEXT";
      case INTEGER -> "INTEGER";
      case BIGINT -> "BIGINT";
      case FLOAT -> "DOUBLE PRECISION";
      case DECIMAL -> "NUMERIC(38, 10)";
      case BOOLEAN -> "BOOLEAN";
      case DATE -> "DATE";
      case TIMESTAMP -> "TIMESTAMP";
    };
  }

  @Override
  public String createTableSql(SchemaDescriptor descriptor) {
    String table = Identifiers.table(descriptor.tableName());
    List<String> parts = new ArrayList<>();
    for (ColumnDefinition column : descriptor.columns()) {
      parts.add(column.name() + " " + columnType(column.type()) + (column.nullable() ? "" : " NOT NULL"));
    }
    List<String> primaryKey = descriptor.primaryKey();
    if (!primaryKey.isEmpty()) {
      parts.add("PRIMARY KEY (" + String.join(", ", primaryKey) + ")");
    }
    for (ForeignKey fk : descriptor.foreignKeys()) {
      parts.add("FOREIGN KEY (" + fk.column() + ") REFERENCES "
          + fk.referencedTable() + " (" + fk.referencedColumn() + ")");
    }
    return "CREATE TABLE IF NOT EXISTS " + table + " (" + String.join(", ", parts) + ")";
  }

  @Override
  public String insertSql(SchemaDescriptor descriptor) {
    String table = Identifiers.table(descriptor.tableName());
    List<String> columns = descriptor.columns().stream().map(ColumnDefinition::name).toList();
    return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
        + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
  }

  @Override
  public String toString() {
    return name();
  }
}
