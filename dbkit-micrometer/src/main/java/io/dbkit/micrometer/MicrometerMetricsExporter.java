package io.dbkit.micrometer;

import io.dbkit.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dbkit.scope.committed}: transaction scopes committed</li>
 *   <li>{@code dbkit.scope.rolled_back}: transaction scopes rolled back</li>
 *   <li>{@code dbkit.rows.inserted}: rows written by bulk inserts, tagged with {@code table}</li>
 *   <li>{@code dbkit.tables.created}: descriptors processed by schema creation</li>
 *   <li>{@code dbkit.connection.acquire.failures}: failed connection acquisitions</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code dbkit.scope.duration}: how long transaction scopes stayed open</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter scopeCommitted;
  private final Counter scopeRolledBack;
  private final Counter tablesCreated;
  private final Counter acquireFailures;
  private final Timer scopeDuration;
  private final Map<String, Counter> rowsInserted = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dbkit"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "dbkit");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-database use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "warehouse.db"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.scopeCommitted = Counter.builder(namePrefix + ".scope.committed")
        .description("Transaction scopes committed")
        .register(registry);
    this.scopeRolledBack = Counter.builder(namePrefix + ".scope.rolled_back")
        .description("Transaction scopes rolled back")
        .register(registry);
    this.tablesCreated = Counter.builder(namePrefix + ".tables.created")
        .description("Table descriptors processed by schema creation")
        .register(registry);
    this.acquireFailures = Counter.builder(namePrefix + ".connection.acquire.failures")
        .description("Connection acquisitions that failed")
        .register(registry);
    this.scopeDuration = Timer.builder(namePrefix + ".scope.duration")
        .description("Time transaction scopes stayed open")
        .register(registry);
  }

  @Override
  public void incrementScopeCommitted() {
    if (closed) return;
    scopeCommitted.increment();
  }

  @Override
  public void incrementScopeRolledBack() {
    if (closed) return;
    scopeRolledBack.increment();
  }

  @Override
  public void recordRowsInserted(String table, int rows) {
    if (closed) return;
    rowsInserted.computeIfAbsent(table, t -> Counter.builder(namePrefix + ".rows.inserted")
        .description("Rows written by bulk inserts")
        .tag("table", t)
        .register(registry))
        .increment(rows);
  }

  @Override
  public void recordTablesCreated(int tables) {
    if (closed) return;
    tablesCreated.increment(tables);
  }

  @Override
  public void recordScopeDurationMs(long durationMs) {
    if (closed) return;
    scopeDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void incrementAcquireFailure() {
    if (closed) return;
    acquireFailures.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the owning {@code DatabaseManager} is disposed for good, so the registry
   * does not keep reporting stale meters.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(scopeCommitted, scopeRolledBack, tablesCreated,
        acquireFailures, scopeDuration));
    meters.addAll(rowsInserted.values());
    rowsInserted.clear();
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
