package io.dbkit.dataset;

import io.dbkit.schema.Identifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable rows sharing one column list, as produced by an upstream cleaning step.
 *
 * <p>Every row holds an entry per column (in column order); values may be {@code null}.
 * Iteration follows insertion order.
 *
 * <pre>{@code
 * TabularDataset teams = TabularDataset.builder("id", "team_name")
 *     .row(1101L, "Abilene Chr")
 *     .row(Map.of("id", 1102L, "team_name", "Air Force"))
 *     .build();
 * }</pre>
 */
public final class TabularDataset implements Iterable<Map<String, Object>> {
  private final List<String> columns;
  private final List<Map<String, Object>> rows;

  private TabularDataset(List<String> columns, List<Map<String, Object>> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  public static Builder builder(String... columns) {
    return builder(List.of(columns));
  }

  public static Builder builder(List<String> columns) {
    return new Builder(columns);
  }

  /**
   * Builds a dataset from maps; the column list is the union of row keys in first-seen order.
   */
  public static TabularDataset ofRows(List<? extends Map<String, ?>> rows) {
    Set<String> columns = new LinkedHashSet<>();
    for (Map<String, ?> row : rows) {
      columns.addAll(row.keySet());
    }
    Builder builder = builder(new ArrayList<>(columns));
    for (Map<String, ?> row : rows) {
      builder.row(row);
    }
    return builder.build();
  }

  public List<String> columns() {
    return columns;
  }

  public List<Map<String, Object>> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override
  public Iterator<Map<String, Object>> iterator() {
    return rows.iterator();
  }

  @Override
  public String toString() {
    return "TabularDataset{columns=" + columns + ", rows=" + rows.size() + "}";
  }

  public static final class Builder {
    private final List<String> columns;
    private final List<Map<String, Object>> rows = new ArrayList<>();

    private Builder(List<String> columns) {
      Objects.requireNonNull(columns, "columns");
      Set<String> unique = new LinkedHashSet<>();
      for (String column : columns) {
        if (!unique.add(Identifiers.column(column))) {
          throw new IllegalArgumentException("Duplicate column: " + column);
        }
      }
      this.columns = List.copyOf(unique);
    }

    /**
     * Adds a row given positionally, one value per column.
     */
    public Builder row(Object... values) {
      if (values.length != columns.size()) {
        throw new IllegalArgumentException("Row " + rows.size() + " has " + values.length
            + " values, expected " + columns.size());
      }
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < values.length; i++) {
        row.put(columns.get(i), values[i]);
      }
      rows.add(Collections.unmodifiableMap(row));
      return this;
    }

    /**
     * Adds a row given by column name. Keys must be columns of this dataset; absent columns
     * read as {@code null}.
     */
    public Builder row(Map<String, ?> values) {
      Objects.requireNonNull(values, "values");
      for (String key : values.keySet()) {
        if (!columns.contains(key)) {
          throw new IllegalArgumentException("Row " + rows.size() + " has unknown column: " + key);
        }
      }
      Map<String, Object> row = new LinkedHashMap<>();
      for (String column : columns) {
        row.put(column, values.get(column));
      }
      rows.add(Collections.unmodifiableMap(row));
      return this;
    }

    public TabularDataset build() {
      return new TabularDataset(columns, Collections.unmodifiableList(new ArrayList<>(rows)));
    }
  }
}
