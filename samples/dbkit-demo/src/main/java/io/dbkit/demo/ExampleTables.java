package io.dbkit.demo;

import io.dbkit.schema.ColumnType;
import io.dbkit.schema.TableDescriptor;

import java.util.List;

/**
 * Table layouts for the demo datasets.
 */
final class ExampleTables {

  static final TableDescriptor CAR_PRICES = TableDescriptor.builder("car_price_dataset")
      .primaryKey("brand", ColumnType.STRING)
      .primaryKey("model", ColumnType.STRING)
      .primaryKey("model_year", ColumnType.INTEGER)
      .column("engine_size", ColumnType.FLOAT)
      .column("fuel_type", ColumnType.STRING)
      .column("transmission", ColumnType.STRING)
      .column("mileage", ColumnType.BIGINT)
      .column("doors", ColumnType.INTEGER)
      .column("owner_count", ColumnType.INTEGER)
      .column("price", ColumnType.DECIMAL)
      .build();

  static final TableDescriptor TEAMS = TableDescriptor.builder("ncaa_m_teams")
      .primaryKey("team_id", ColumnType.BIGINT)
      .notNullColumn("team_name", ColumnType.TEXT)
      .column("first_d1_season", ColumnType.INTEGER)
      .column("last_d1_season", ColumnType.INTEGER)
      .build();

  static final TableDescriptor SEEDS = TableDescriptor.builder("ncaa_m_tourney_seeds")
      .primaryKey("season", ColumnType.INTEGER)
      .primaryKey("seed", ColumnType.STRING)
      .column("team_id", ColumnType.BIGINT)
      .foreignKey("team_id", "ncaa_m_teams.team_id")
      .build();

  static final TableDescriptor FIPS = TableDescriptor.builder("fips")
      .primaryKey("fips_code", ColumnType.BIGINT)
      .notNullColumn("state", ColumnType.STRING)
      .column("county", ColumnType.STRING)
      .column("updated_on", ColumnType.DATE)
      .build();

  /** Children listed before parents on purpose; creation reorders them. */
  static final List<TableDescriptor> ALL = List.of(SEEDS, CAR_PRICES, TEAMS, FIPS);

  private ExampleTables() {
  }
}
