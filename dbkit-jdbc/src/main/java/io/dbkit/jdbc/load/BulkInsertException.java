package io.dbkit.jdbc.load;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * A bulk insert failed and was rolled back; no row of the batch is visible.
 */
public class BulkInsertException extends DbKitException {
  private final String tableName;
  private final int rowCount;

  public BulkInsertException(String tableName, int rowCount, Throwable cause) {
    super(ErrorKind.BULK_INSERT, "Bulk insert of " + rowCount + " rows into " + tableName
        + " failed: " + cause.getMessage(), cause);
    this.tableName = tableName;
    this.rowCount = rowCount;
  }

  public String tableName() {
    return tableName;
  }

  /** Number of rows that were attempted. */
  public int rowCount() {
    return rowCount;
  }
}
