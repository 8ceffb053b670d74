package io.dbkit.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative description of one table: its name, ordered columns and foreign keys, plus the
 * conversion of a dataset row into a record bound to those columns.
 *
 * <p>{@link TableDescriptor} is the stock implementation. Custom implementations only need the
 * first two methods; {@link #toRecord(Map)} coerces each value through its {@link ColumnType}.
 */
public interface SchemaDescriptor {

    String tableName();

    /**
     * Columns in declaration order. This order is used for DDL and for INSERT parameters.
     */
    List<ColumnDefinition> columns();

    default List<ForeignKey> foreignKeys() {
        return List.of();
    }

    /**
     * Primary-key column names, in declaration order. Empty when the table has no key.
     */
    default List<String> primaryKey() {
        return columns().stream()
            .filter(ColumnDefinition::primaryKey)
            .map(ColumnDefinition::name)
            .toList();
    }

    default Optional<ColumnDefinition> column(String name) {
        return columns().stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /**
     * Maps a dataset row to a record with one entry per column, in column order. Keys that are
     * not columns of this table are ignored; absent keys become {@code null}.
     *
     * @throws IllegalArgumentException if a value cannot be coerced to its column type, or a
     *                                  non-nullable column would be {@code null}
     */
    default Map<String, Object> toRecord(Map<String, ?> row) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (ColumnDefinition column : columns()) {
            Object value = column.type().coerce(row.get(column.name()), column.name());
            if (value == null && !column.nullable()) {
                throw new IllegalArgumentException(
                    "Column '" + column.name() + "' of " + tableName() + " is not nullable");
            }
            record.put(column.name(), value);
        }
        return record;
    }
}
