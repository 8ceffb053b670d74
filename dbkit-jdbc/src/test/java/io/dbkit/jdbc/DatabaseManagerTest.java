package io.dbkit.jdbc;

import io.dbkit.ErrorKind;
import io.dbkit.config.ConfigNotFoundException;
import io.dbkit.config.ConfigResolver;
import io.dbkit.config.ConnectionConfig;
import io.dbkit.config.InvalidConnectionParameterException;
import io.dbkit.config.MissingConnectionParameterException;
import io.dbkit.dataset.TabularDataset;
import io.dbkit.jdbc.engine.EngineCreationException;
import io.dbkit.jdbc.load.BulkInsertException;
import io.dbkit.jdbc.session.TransactionScope;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseManagerTest {
  private final List<DatabaseManager> managers = new ArrayList<>();

  @AfterEach
  void tearDown() {
    managers.forEach(DatabaseManager::dispose);
  }

  private DatabaseManager manager(ConnectionConfig config) {
    DatabaseManager db = new DatabaseManager(config, TestDatabases.LOGGER);
    managers.add(db);
    return db;
  }

  @Test
  void nothingConnectsUntilFirstUse() {
    DatabaseManager db = manager(TestDatabases.h2());

    assertFalse(db.isEngineBuilt());
    assertEquals("h2", db.dialect().name());

    db.createTables(List.of(TestDatabases.TEAMS));
    assertTrue(db.isEngineBuilt());
  }

  @Test
  void unknownDriverFailsAtConstruction() {
    ConnectionConfig config = TestDatabases.h2Builder().driver("sqlite").build();

    var ex = assertThrows(EngineCreationException.class,
        () -> new DatabaseManager(config, TestDatabases.LOGGER));
    assertEquals(ErrorKind.ENGINE_CREATION, ex.kind());
  }

  @Test
  void inTransactionCommitsAndReturnsTheResult() {
    DatabaseManager db = manager(TestDatabases.h2());
    db.createTables(List.of(TestDatabases.TEAMS));

    int inserted = db.inTransaction(session -> session.update(
        "INSERT INTO ncaa_m_teams (id, team_name) VALUES (?, ?)", 1101L, "Abilene Chr"));
    String name = db.inTransaction(session -> session.queryFirst(
        "SELECT team_name FROM ncaa_m_teams WHERE id = ?", rs -> rs.getString(1), 1101L)
        .orElseThrow());

    assertEquals(1, inserted);
    assertEquals("Abilene Chr", name);
  }

  @Test
  void inTransactionRethrowsTheSameFailureAndRollsBack() {
    DatabaseManager db = manager(TestDatabases.h2());
    db.createTables(List.of(TestDatabases.TEAMS));
    IllegalStateException failure = new IllegalStateException("abort");

    var thrown = assertThrows(IllegalStateException.class, () -> db.inTransaction(session -> {
      session.update("INSERT INTO ncaa_m_teams (id, team_name) VALUES (?, ?)", 1L, "x");
      throw failure;
    }));

    assertSame(failure, thrown);
    assertEquals(0L, countTeams(db));
  }

  @Test
  void checkedSqlFailureIsWrapped() {
    DatabaseManager db = manager(TestDatabases.h2());

    var ex = assertThrows(SqlExecutionException.class, () -> db.inTransaction(session -> {
      throw new SQLException("bad", "42000");
    }));

    assertEquals("42000", ex.sqlState());
    assertEquals(ErrorKind.SQL_EXECUTION, ex.kind());
  }

  @Test
  void loadingTenValidAndOneInvalidRowPersistsNothing() {
    DatabaseManager db = manager(TestDatabases.h2());
    db.createTables(List.of(TestDatabases.TEAMS));
    List<Map<String, Object>> rows = new ArrayList<>(TestDatabases.teamRows(10));
    rows.add(Map.of("id", 9999L, "team_name", "Bad", "first_d1_season", "nineteen"));

    assertThrows(BulkInsertException.class,
        () -> db.insert(TabularDataset.ofRows(rows), TestDatabases.TEAMS));

    assertEquals(0L, countTeams(db));
  }

  @Test
  void scopesReturnTheirConnections() {
    DatabaseManager db = manager(TestDatabases.h2());
    db.createTables(List.of(TestDatabases.TEAMS));

    for (int i = 0; i < 5; i++) {
      try (TransactionScope scope = db.sessionScope(Duration.ofSeconds(5))) {
        scope.session().update("INSERT INTO ncaa_m_teams (id) VALUES (?)", (long) i);
        if (i % 2 == 0) {
          scope.commit();
        }
      }
    }

    assertEquals(3L, countTeams(db));
    assertEquals(0, db.engine().activeConnections());
  }

  @Test
  void validateConnectionReportsAvailable() {
    DatabaseManager db = manager(TestDatabases.h2());

    ConnectionStatus status = db.validateConnection();

    assertTrue(status.isAvailable());
    ConnectionStatus.Available available = assertInstanceOf(ConnectionStatus.Available.class, status);
    assertEquals("h2", available.identifier().dialect());
  }

  @Test
  void validateConnectionReportsUnreachableStoreAsValue() {
    DatabaseManager db = manager(TestDatabases.unreachablePostgres());

    ConnectionStatus status = db.validateConnection();

    ConnectionStatus.Unavailable unavailable =
        assertInstanceOf(ConnectionStatus.Unavailable.class, status);
    assertEquals(ErrorKind.CONNECTIVITY, unavailable.kind());
    assertTrue(unavailable.kind().recoverable());
    assertFalse(db.isEngineBuilt());
  }

  @Test
  void disposeThenReuseRebuildsTheEngine() {
    DatabaseManager db = manager(TestDatabases.h2());
    db.createTables(List.of(TestDatabases.TEAMS));
    db.insert(TabularDataset.ofRows(TestDatabases.teamRows(3)), TestDatabases.TEAMS);

    db.close();
    assertFalse(db.isEngineBuilt());

    assertEquals(3L, countTeams(db));
    assertTrue(db.isEngineBuilt());
  }

  @Test
  void fromYamlReadsTheDatabaseSection(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("database.yaml");
    Files.writeString(file, """
        database:
          driver: h2
          host: localhost
          port: 9092
          name: yaml_configured
          user: sa
          password: sa
          pool_size: 1
          max_overflow: 0
        """);

    DatabaseManager db = DatabaseManager.fromYaml(file, TestDatabases.LOGGER);
    managers.add(db);

    assertEquals("yaml_configured", db.config().name());
    assertEquals(1, db.config().maxConnections());
    assertTrue(db.validateConnection().isAvailable());
  }

  @Test
  void fromYamlRejectsIncompleteSection(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("database.yaml");
    Files.writeString(file, """
        database:
          host: localhost
          port: 5432
        """);

    TestDatabases.CapturedLog log = TestDatabases.captureLog();

    var ex = assertThrows(MissingConnectionParameterException.class,
        () -> DatabaseManager.fromYaml(file, log.logger()));
    assertEquals(List.of("name", "user", "password"), ex.missingKeys());
    List<LogRecord> severe = log.at(Level.SEVERE);
    assertEquals(1, severe.size());
    assertTrue(severe.get(0).getMessage().contains("[name, user, password]"));
  }

  @Test
  void fromYamlLogsInvalidParameterOnceWithItsKey(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("database.yaml");
    Files.writeString(file, """
        database:
          host: localhost
          port: 5432
          name: shop
          user: u
          password: p
          recycle_interval: 5
        """);
    TestDatabases.CapturedLog log = TestDatabases.captureLog();

    assertThrows(InvalidConnectionParameterException.class,
        () -> DatabaseManager.fromYaml(file, log.logger()));
    List<LogRecord> severe = log.at(Level.SEVERE);
    assertEquals(1, severe.size());
    assertTrue(severe.get(0).getMessage().contains("recycle_interval"));
  }

  @Test
  void fromConfigResolverWalksUpToConfigDirectory(@TempDir Path dir) throws IOException {
    Files.createDirectories(dir.resolve("config"));
    Files.writeString(dir.resolve("README.md"), "# project");
    Files.writeString(dir.resolve("config/database.yaml"), """
        database:
          driver: h2
          host: localhost
          port: 9092
          name: resolved
          user: sa
          password: sa
        """);
    Path nested = Files.createDirectories(dir.resolve("jobs/nightly"));

    DatabaseManager db = DatabaseManager.fromConfigResolver(ConfigResolver.defaults(), nested,
        "database.yaml", TestDatabases.LOGGER);
    managers.add(db);

    assertEquals("resolved", db.config().name());
    assertThrows(ConfigNotFoundException.class, () -> DatabaseManager.fromConfigResolver(
        ConfigResolver.defaults(), nested, "missing.yaml", TestDatabases.LOGGER));
  }

  private static long countTeams(DatabaseManager db) {
    return db.inTransaction(session -> session.queryFirst(
        "SELECT COUNT(*) FROM ncaa_m_teams", rs -> rs.getLong(1)).orElse(0L));
  }
}
