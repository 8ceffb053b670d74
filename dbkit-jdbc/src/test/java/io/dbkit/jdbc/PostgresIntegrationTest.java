package io.dbkit.jdbc;

import io.dbkit.config.ConnectionConfig;
import io.dbkit.dataset.TabularDataset;
import io.dbkit.jdbc.load.BulkInsertException;
import io.dbkit.jdbc.session.TransactionScope;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("dbkit_test");

  private DatabaseManager db;

  @BeforeEach
  void setUp() {
    ConnectionConfig config = ConnectionConfig.builder()
        .host(postgres.getHost())
        .port(postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT))
        .name(postgres.getDatabaseName())
        .user(postgres.getUsername())
        .password(postgres.getPassword())
        .poolSize(2)
        .maxOverflow(1)
        .build();
    db = new DatabaseManager(config, TestDatabases.LOGGER);
    db.inTransaction(session -> {
      session.execute("DROP TABLE IF EXISTS ncaa_m_tourney_seeds");
      session.execute("DROP TABLE IF EXISTS ncaa_m_teams");
      return null;
    });
  }

  @AfterEach
  void tearDown() {
    db.dispose();
  }

  @Test
  void createLoadAndQuery() {
    List<String> order = db.createTables(List.of(TestDatabases.SEEDS, TestDatabases.TEAMS));
    assertEquals(List.of("ncaa_m_teams", "ncaa_m_tourney_seeds"), order);
    assertTrue(db.tableExists("ncaa_m_teams"));

    assertEquals(25, db.insert(TabularDataset.ofRows(TestDatabases.teamRows(25)),
        TestDatabases.TEAMS));

    long count = db.inTransaction(session -> session.queryFirst(
        "SELECT COUNT(*) FROM ncaa_m_teams", rs -> rs.getLong(1)).orElse(0L));
    assertEquals(25L, count);
  }

  @Test
  void foreignKeyViolationRollsBackWholeLoad() {
    db.createTables(List.of(TestDatabases.TEAMS, TestDatabases.SEEDS));
    db.insert(TabularDataset.ofRows(TestDatabases.teamRows(1)), TestDatabases.TEAMS);
    TabularDataset seeds = TabularDataset.builder("id", "season", "seed", "team_id")
        .row(1L, "2024", "W01", 1101L)
        .row(2L, "2024", "W02", 4242L)
        .build();

    assertThrows(BulkInsertException.class, () -> db.insert(seeds, TestDatabases.SEEDS));

    long count = db.inTransaction(session -> session.queryFirst(
        "SELECT COUNT(*) FROM ncaa_m_tourney_seeds", rs -> rs.getLong(1)).orElse(0L));
    assertEquals(0L, count);
  }

  @Test
  void statementTimeoutCancelsLongQueries() {
    try (TransactionScope scope = db.sessionScope(Duration.ofSeconds(1))) {
      assertThrows(SqlExecutionException.class,
          () -> scope.session().execute("SELECT pg_sleep(5)"));
    }
    assertTrue(db.validateConnection().isAvailable());
  }
}
