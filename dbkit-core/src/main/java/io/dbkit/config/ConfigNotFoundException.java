package io.dbkit.config;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * No configuration file could be located, or the located file could not be read.
 */
public class ConfigNotFoundException extends DbKitException {

  public ConfigNotFoundException(String message) {
    super(ErrorKind.CONFIG_NOT_FOUND, message);
  }

  public ConfigNotFoundException(String message, Throwable cause) {
    super(ErrorKind.CONFIG_NOT_FOUND, message, cause);
  }
}
