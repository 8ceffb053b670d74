package io.dbkit.schema;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableDescriptorTest {
  private static final TableDescriptor CAR_PRICES = TableDescriptor.builder("car_price_dataset")
      .primaryKey("brand", ColumnType.STRING)
      .primaryKey("model", ColumnType.STRING)
      .column("year", ColumnType.BIGINT)
      .column("engine_size", ColumnType.FLOAT)
      .column("price", ColumnType.BIGINT)
      .build();

  @Test
  void compositePrimaryKeyInDeclarationOrder() {
    assertEquals(List.of("brand", "model"), CAR_PRICES.primaryKey());
  }

  @Test
  void toRecordFollowsColumnOrderAndCoerces() {
    Map<String, Object> row = new HashMap<>();
    row.put("price", 23000);
    row.put("brand", "Kia");
    row.put("model", "Rio");
    row.put("year", 2019);
    row.put("unrelated", "ignored");

    Map<String, Object> record = CAR_PRICES.toRecord(row);

    assertEquals(List.of("brand", "model", "year", "engine_size", "price"),
        List.copyOf(record.keySet()));
    assertEquals(2019L, record.get("year"));
    assertEquals(23000L, record.get("price"));
    assertNull(record.get("engine_size"));
  }

  @Test
  void nullPrimaryKeyIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> CAR_PRICES.toRecord(Map.of("model", "Rio")));
  }

  @Test
  void foreignKeyParsesTableDotColumn() {
    TableDescriptor seeds = TableDescriptor.builder("ncaa_m_tourney_seeds")
        .primaryKey("id", ColumnType.BIGINT)
        .column("team_id", ColumnType.BIGINT)
        .foreignKey("team_id", "ncaa_m_teams.id")
        .build();

    assertEquals(List.of(new ForeignKey("team_id", "ncaa_m_teams", "id")), seeds.foreignKeys());
  }

  @Test
  void foreignKeyOnUndeclaredColumnIsRejected() {
    var builder = TableDescriptor.builder("child")
        .primaryKey("id", ColumnType.BIGINT)
        .foreignKey("parent_id", "parent.id");

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void duplicateColumnIsRejected() {
    var builder = TableDescriptor.builder("t")
        .column("a", ColumnType.TEXT)
        .column("a", ColumnType.BIGINT);

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  void tableWithoutColumnsIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> TableDescriptor.builder("t").build());
  }

  @Test
  void unsafeIdentifiersAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> TableDescriptor.builder("drop table;"));
    assertThrows(IllegalArgumentException.class, () -> ColumnDefinition.of("1col", ColumnType.TEXT));
    assertThrows(IllegalArgumentException.class, () -> ForeignKey.of("a", "noDot"));
  }

  @Test
  void nullablePrimaryKeyIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new ColumnDefinition("id", ColumnType.BIGINT, true, true));
  }

  @Test
  void columnLookup() {
    assertEquals(ColumnType.FLOAT, CAR_PRICES.column("engine_size").orElseThrow().type());
    assertFalse(CAR_PRICES.column("missing").isPresent());
  }
}
