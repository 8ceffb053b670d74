package io.dbkit.jdbc.schema;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * Creating a table failed. Tables created earlier in the same call remain.
 */
public class SchemaCreationException extends DbKitException {
  private final String tableName;

  public SchemaCreationException(String tableName, Throwable cause) {
    super(ErrorKind.SCHEMA_CREATION, "Failed to create table " + tableName + ": "
        + cause.getMessage(), cause);
    this.tableName = tableName;
  }

  public String tableName() {
    return tableName;
  }
}
