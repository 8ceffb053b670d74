package io.dbkit.jdbc.engine;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * The store could not be reached, or the liveness query failed.
 */
public class ConnectivityException extends DbKitException {

  public ConnectivityException(String message, Throwable cause) {
    super(ErrorKind.CONNECTIVITY, message, cause);
  }
}
