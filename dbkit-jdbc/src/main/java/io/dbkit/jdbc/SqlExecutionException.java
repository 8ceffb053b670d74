package io.dbkit.jdbc;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

import java.sql.SQLException;

/**
 * Thrown when a JDBC statement fails.
 */
public class SqlExecutionException extends DbKitException {

  public SqlExecutionException(String message, SQLException cause) {
    super(ErrorKind.SQL_EXECUTION, message + ": " + cause.getMessage(), cause);
  }

  /** SQLSTATE reported by the driver, or {@code null}. */
  public String sqlState() {
    return ((SQLException) getCause()).getSQLState();
  }
}
