package io.dbkit.config;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * A connection key is present but its value is unusable (non-numeric port, negative pool size).
 */
public class InvalidConnectionParameterException extends DbKitException {
  private final String key;

  public InvalidConnectionParameterException(String key, String message) {
    super(ErrorKind.INVALID_CONFIGURATION, "Invalid database parameter '" + key + "': " + message);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
