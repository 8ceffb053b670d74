package io.dbkit.jdbc.load;

import io.dbkit.dataset.TabularDataset;
import io.dbkit.jdbc.engine.ConnectivityException;
import io.dbkit.jdbc.engine.EngineCreationException;
import io.dbkit.jdbc.engine.PoolExhaustedException;
import io.dbkit.jdbc.session.SessionFactory;
import io.dbkit.jdbc.session.TransactionException;
import io.dbkit.jdbc.session.TransactionScope;
import io.dbkit.jdbc.spi.Dialect;
import io.dbkit.schema.ColumnDefinition;
import io.dbkit.schema.ColumnType;
import io.dbkit.schema.SchemaDescriptor;
import io.dbkit.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a {@link TabularDataset} into the table of a {@link SchemaDescriptor} inside one
 * transaction scope, all or nothing.
 *
 * <p>Rows are converted with {@link SchemaDescriptor#toRecord(Map)} before any connection is
 * taken and bound in {@link SchemaDescriptor#columns()} order, then sent as JDBC batches of {@code chunkSize} rows in dataset order. Any failure rolls
 * the whole dataset back and is reported as {@link BulkInsertException}. Failures to obtain a
 * connection propagate with their own type.
 */
public final class BulkLoader {
  public static final int DEFAULT_CHUNK_SIZE = 1000;

  private final SessionFactory sessions;
  private final Dialect dialect;
  private final Logger logger;
  private final MetricsExporter metrics;
  private final int chunkSize;

  public BulkLoader(SessionFactory sessions, Dialect dialect, Logger logger,
      MetricsExporter metrics, int chunkSize) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.logger = Objects.requireNonNull(logger, "logger");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0");
    }
    this.chunkSize = chunkSize;
  }

  public int insert(TabularDataset dataset, SchemaDescriptor descriptor) {
    return insert(dataset, descriptor, null);
  }

  /**
   * @param timeout per-statement timeout, or {@code null} for the session default
   * @return number of rows written
   * @throws BulkInsertException if any row fails; nothing is persisted
   */
  public int insert(TabularDataset dataset, SchemaDescriptor descriptor, Duration timeout) {
    Objects.requireNonNull(dataset, "dataset");
    Objects.requireNonNull(descriptor, "descriptor");
    String table = descriptor.tableName();
    int rowCount = dataset.size();
    if (rowCount == 0) {
      logger.fine(() -> "Nothing to insert into " + table);
      return 0;
    }

    List<ColumnDefinition> columns = descriptor.columns();
    List<List<Object>> records = new ArrayList<>(rowCount);
    int rowIndex = 0;
    try {
      for (Map<String, Object> row : dataset) {
        Map<String, Object> record = descriptor.toRecord(row);
        List<Object> params = new ArrayList<>(columns.size());
        for (ColumnDefinition column : columns) {
          params.add(record.get(column.name()));
        }
        records.add(params);
        rowIndex++;
      }
    } catch (IllegalArgumentException e) {
      logger.log(Level.SEVERE, "Row " + rowIndex + " of " + rowCount + " does not fit table "
          + table, e);
      throw new BulkInsertException(table, rowCount, e);
    }

    int[] sqlTypes = columns.stream()
        .map(ColumnDefinition::type)
        .mapToInt(ColumnType::sqlType)
        .toArray();
    String sql = dialect.insertSql(descriptor);

    int written;
    try (TransactionScope scope = timeout == null ? sessions.begin() : sessions.begin(timeout)) {
      written = scope.session().batchUpdate(sql, sqlTypes, records, chunkSize);
      scope.commit();
    } catch (PoolExhaustedException | ConnectivityException | EngineCreationException e) {
      throw e;
    } catch (TransactionException e) {
      // already logged by the scope
      throw new BulkInsertException(table, rowCount, e);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Bulk insert of " + rowCount + " rows into " + table
          + " failed, rolled back", e);
      throw new BulkInsertException(table, rowCount, e);
    }
    metrics.recordRowsInserted(table, rowCount);
    logger.info("Inserted " + rowCount + " rows into " + table);
    if (written != rowCount) {
      logger.fine("Driver reported " + written + " affected rows for " + rowCount + " inserts");
    }
    return rowCount;
  }
}
