package io.dbkit.jdbc.engine;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * The connection pool could not be constructed (unknown dialect, missing JDBC driver, rejected
 * pool settings).
 */
public class EngineCreationException extends DbKitException {

  public EngineCreationException(String message, Throwable cause) {
    super(ErrorKind.ENGINE_CREATION, message, cause);
  }
}
