package io.dbkit.jdbc.engine;

import io.dbkit.config.ConnectionConfig;
import io.dbkit.jdbc.DatabaseManager;
import io.dbkit.jdbc.TestDatabases;
import io.dbkit.jdbc.session.TransactionScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PoolBackpressureTest {
  private DatabaseManager db;

  @AfterEach
  void tearDown() {
    if (db != null) {
      db.dispose();
    }
  }

  private DatabaseManager manager(int poolSize, int maxOverflow) {
    ConnectionConfig config = TestDatabases.h2Builder()
        .poolSize(poolSize)
        .maxOverflow(maxOverflow)
        .poolTimeout(Duration.ofMillis(500))
        .build();
    db = new DatabaseManager(config, TestDatabases.LOGGER);
    return db;
  }

  @Test
  void acquiringBeyondTheBoundFailsInsteadOfHanging() {
    DatabaseManager db = manager(1, 1);

    assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
      try (TransactionScope first = db.sessionScope();
           TransactionScope second = db.sessionScope()) {
        var ex = assertThrows(PoolExhaustedException.class, db::sessionScope);
        assertEquals(2, ex.maxConnections());
        assertTrue(ex.isRecoverable());
        assertEquals(2, db.engine().activeConnections());
      }
    });
    assertEquals(0, db.engine().activeConnections());
  }

  @Test
  void waitingCallersProceedOnceConnectionsAreReleased() throws Exception {
    DatabaseManager db = manager(1, 1);
    db.engine();
    int workers = 6;
    ExecutorService executor = Executors.newFixedThreadPool(workers);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger completed = new AtomicInteger();
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          try (TransactionScope scope = db.sessionScope()) {
            scope.session().query("SELECT 1", rs -> rs.getInt(1));
            scope.commit();
          }
          completed.incrementAndGet();
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(workers, completed.get());
    assertTrue(db.engine().totalConnections() <= 2);
    assertEquals(0, db.engine().activeConnections());
  }
}
