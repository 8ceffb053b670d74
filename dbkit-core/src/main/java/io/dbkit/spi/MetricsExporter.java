package io.dbkit.spi;

/**
 * Observability hook for exporting session, schema and loading counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. The {@code dbkit-micrometer}
 * module bridges into Micrometer.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of transaction scopes that committed.
     */
    void incrementScopeCommitted();

    /**
     * Increments the count of transaction scopes that rolled back, explicitly or on close.
     */
    void incrementScopeRolledBack();

    /**
     * Records rows written by one successful bulk insert.
     *
     * @param table target table
     * @param rows  number of rows committed
     */
    void recordRowsInserted(String table, int rows);

    /**
     * Records one successful {@code createTables} call.
     *
     * @param tables number of descriptors processed
     */
    void recordTablesCreated(int tables);

    /**
     * Records how long a transaction scope was open, from begin to close.
     *
     * @param durationMs scope lifetime in milliseconds (always non-negative)
     */
    default void recordScopeDurationMs(long durationMs) {
    }

    /**
     * Increments the count of failed connection acquisitions (pool exhausted or store unreachable).
     */
    default void incrementAcquireFailure() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementScopeCommitted() {
        }

        @Override
        public void incrementScopeRolledBack() {
        }

        @Override
        public void recordRowsInserted(String table, int rows) {
        }

        @Override
        public void recordTablesCreated(int tables) {
        }
    }
}
