package io.dbkit.demo;

import io.dbkit.DbKitException;
import io.dbkit.config.ConfigNotFoundException;
import io.dbkit.config.ConfigResolver;
import io.dbkit.config.LoggingConfig;
import io.dbkit.dataset.TabularDataset;
import io.dbkit.jdbc.ConnectionStatus;
import io.dbkit.jdbc.DatabaseManager;
import io.dbkit.jdbc.engine.EngineFactory;
import io.dbkit.jdbc.load.BulkInsertException;
import io.dbkit.jdbc.session.TransactionScope;
import io.dbkit.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.logging.Logger;

/**
 * Standalone demo: resolve the YAML config, create tables, bulk load a few datasets into an
 * in-memory H2 database and query them back.
 *
 * Run with: mvn -pl samples/dbkit-demo exec:java -Dexec.mainClass=io.dbkit.demo.DbKitDemo
 */
public final class DbKitDemo {
  private static final String CONFIG_NAME = "database.yaml";

  public static void main(String[] args) throws IOException {
    // 1. Locate config/database.yaml above the start directory, or fall back to the bundled one
    ConfigResolver resolver = ConfigResolver.defaults();
    Path start = args.length > 0 ? Path.of(args[0]) : Path.of("");
    Path configFile;
    try {
      configFile = resolver.findNearestConfig(start, CONFIG_NAME);
    } catch (ConfigNotFoundException e) {
      configFile = extractBundledConfig();
      System.out.println("No " + CONFIG_NAME + " found (" + e.getMessage() + "), using "
          + configFile);
    }
    Path projectRoot = configFile.getParent().getParent();

    // 2. Logger writing to file and console
    LoggingConfig logging = resolver.loggingConfig(configFile);
    Logger log = AppLogger.fromConfig(logging, projectRoot);
    log.info("Using config " + configFile);

    try (DatabaseManager db = new DatabaseManager(
        EngineFactory.validated(resolver.databaseSection(configFile), log), log)) {
      // 3. Check the store before doing anything else
      ConnectionStatus status = db.validateConnection();
      if (status instanceof ConnectionStatus.Unavailable unavailable) {
        log.severe("Database unavailable (" + unavailable.kind() + "): " + unavailable.message());
        return;
      }

      // 4. Tables, parents first
      List<String> created = db.createTables(ExampleTables.ALL);
      System.out.println("Tables: " + created);

      // 5. Bulk loads
      db.insert(teams(), ExampleTables.TEAMS);
      db.insert(seeds(), ExampleTables.SEEDS);
      db.insert(cars(), ExampleTables.CAR_PRICES);
      db.insert(fips(), ExampleTables.FIPS);

      // 6. A load that breaks a foreign key is rolled back as a whole
      TabularDataset badSeeds = TabularDataset.builder("season", "seed", "team_id")
          .row(2025, "X01", 1101L)
          .row(2025, "X02", 9999L)
          .build();
      try {
        db.insert(badSeeds, ExampleTables.SEEDS);
      } catch (BulkInsertException e) {
        System.out.println("Rejected " + e.rowCount() + " rows for " + e.tableName()
            + " (recoverable: " + e.isRecoverable() + ")");
      }

      // 7. Queries
      long seedCount = db.inTransaction(session -> session.queryFirst(
          "SELECT COUNT(*) FROM ncaa_m_tourney_seeds", rs -> rs.getLong(1)).orElse(0L));
      System.out.println("Seeds stored: " + seedCount);

      List<String> seeded = db.inTransaction(session -> session.query(
          "SELECT s.seed, t.team_name FROM ncaa_m_tourney_seeds s "
              + "JOIN ncaa_m_teams t ON t.team_id = s.team_id ORDER BY s.seed",
          rs -> rs.getString(1) + " " + rs.getString(2)));
      seeded.forEach(line -> System.out.println("  " + line));

      // 8. Explicit scope with a per-statement timeout
      try (TransactionScope scope = db.sessionScope(Duration.ofSeconds(5))) {
        int updated = scope.session().update(
            "UPDATE fips SET county = ? WHERE fips_code = ?", "Kent County", 10001L);
        scope.commit();
        System.out.println("Updated " + updated + " fips row");
      }
    } catch (DbKitException e) {
      System.err.println("Demo failed (" + e.kind() + "): " + e.getMessage());
      throw e;
    }
    System.out.println("\nDemo complete. Log written to " + projectRoot.resolve(logging.path()));
  }

  private static TabularDataset teams() {
    return TabularDataset.builder("team_id", "team_name", "first_d1_season", "last_d1_season")
        .row(1101L, "Abilene Chr", 2014, 2025)
        .row(1102L, "Air Force", 1985, 2025)
        .row(1103L, "Akron", 1985, 2025)
        .row(1104L, "Alabama", 1985, 2025)
        .build();
  }

  private static TabularDataset seeds() {
    return TabularDataset.builder("season", "seed", "team_id")
        .row(2024, "W01", 1104L)
        .row(2024, "W16", 1101L)
        .row(2024, "X08", 1103L)
        .build();
  }

  private static TabularDataset cars() {
    return TabularDataset.builder("brand", "model", "model_year", "engine_size", "fuel_type",
            "transmission", "mileage", "doors", "owner_count", "price")
        .row("Kia", "Rio", 2020, 4.2, "Diesel", "Manual", 289944L, 3, 5, new BigDecimal("8501"))
        .row("Chevrolet", "Malibu", 2012, 2.0, "Hybrid", "Automatic", 5356L, 2, 3, "12092")
        .row("Mercedes", "GLA", 2020, 4.2, "Diesel", "Automatic", 231440L, 4, 2, "11171")
        .build();
  }

  private static TabularDataset fips() {
    return TabularDataset.builder("fips_code", "state", "county", "updated_on")
        .row(1001L, "AL", "Autauga", LocalDate.of(2023, 1, 1))
        .row(10001L, "DE", "Kent", "2023-01-01")
        .row(56045L, "WY", null, null)
        .build();
  }

  private static Path extractBundledConfig() throws IOException {
    Path root = Files.createTempDirectory("dbkit-demo");
    Path target = root.resolve(ConfigResolver.CONFIG_DIR).resolve(CONFIG_NAME);
    Files.createDirectories(target.getParent());
    try (InputStream in = DbKitDemo.class.getResourceAsStream("/config/" + CONFIG_NAME)) {
      if (in == null) {
        throw new IOException("Bundled config/" + CONFIG_NAME + " is missing from the classpath");
      }
      Files.copy(in, target);
    }
    return target;
  }

  private DbKitDemo() {
  }
}
