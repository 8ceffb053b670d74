package io.dbkit.config;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * The configuration file exists but is not well-formed, or a section has the wrong shape.
 */
public class ConfigParseException extends DbKitException {

  public ConfigParseException(String message) {
    super(ErrorKind.CONFIG_PARSE, message);
  }

  public ConfigParseException(String message, Throwable cause) {
    super(ErrorKind.CONFIG_PARSE, message, cause);
  }
}
