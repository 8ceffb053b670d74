package io.dbkit.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable {@link SchemaDescriptor} assembled with a builder.
 *
 * <pre>{@code
 * SchemaDescriptor seeds = TableDescriptor.builder("ncaa_m_tourney_seeds")
 *     .primaryKey("id", ColumnType.BIGINT)
 *     .column("season", ColumnType.TEXT)
 *     .column("seed", ColumnType.TEXT)
 *     .column("team_id", ColumnType.BIGINT)
 *     .foreignKey("team_id", "ncaa_m_teams.id")
 *     .build();
 * }</pre>
 */
public final class TableDescriptor implements SchemaDescriptor {
  private final String tableName;
  private final List<ColumnDefinition> columns;
  private final List<ForeignKey> foreignKeys;

  private TableDescriptor(Builder builder) {
    this.tableName = builder.tableName;
    this.columns = List.copyOf(builder.columns);
    this.foreignKeys = List.copyOf(builder.foreignKeys);
  }

  public static Builder builder(String tableName) {
    return new Builder(tableName);
  }

  @Override
  public String tableName() {
    return tableName;
  }

  @Override
  public List<ColumnDefinition> columns() {
    return columns;
  }

  @Override
  public List<ForeignKey> foreignKeys() {
    return foreignKeys;
  }

  @Override
  public String toString() {
    return "TableDescriptor{" + tableName + ", columns=" + columns.size()
        + ", foreignKeys=" + foreignKeys.size() + "}";
  }

  public static final class Builder {
    private final String tableName;
    private final List<ColumnDefinition> columns = new ArrayList<>();
    private final List<ForeignKey> foreignKeys = new ArrayList<>();

    private Builder(String tableName) {
      this.tableName = Identifiers.table(tableName);
    }

    public Builder column(ColumnDefinition column) {
      columns.add(Objects.requireNonNull(column, "column"));
      return this;
    }

    /** Adds a nullable column. */
    public Builder column(String name, ColumnType type) {
      return column(ColumnDefinition.of(name, type));
    }

    public Builder notNullColumn(String name, ColumnType type) {
      return column(ColumnDefinition.notNull(name, type));
    }

    /** Adds a primary-key column; call repeatedly for a composite key. */
    public Builder primaryKey(String name, ColumnType type) {
      return column(ColumnDefinition.primaryKey(name, type));
    }

    public Builder foreignKey(ForeignKey foreignKey) {
      foreignKeys.add(Objects.requireNonNull(foreignKey, "foreignKey"));
      return this;
    }

    /**
     * @param column column of this table
     * @param target referenced {@code table.column}
     */
    public Builder foreignKey(String column, String target) {
      return foreignKey(ForeignKey.of(column, target));
    }

    /**
     * @throws IllegalArgumentException if there are no columns, a column name repeats, or a
     *                                  foreign key names a column this table does not declare
     */
    public TableDescriptor build() {
      if (columns.isEmpty()) {
        throw new IllegalArgumentException("Table " + tableName + " has no columns");
      }
      Set<String> names = new HashSet<>();
      for (ColumnDefinition column : columns) {
        if (!names.add(column.name())) {
          throw new IllegalArgumentException(
              "Duplicate column '" + column.name() + "' in table " + tableName);
        }
      }
      for (ForeignKey fk : foreignKeys) {
        if (!names.contains(fk.column())) {
          throw new IllegalArgumentException("Foreign key column '" + fk.column()
              + "' is not a column of table " + tableName);
        }
      }
      return new TableDescriptor(this);
    }
  }
}
