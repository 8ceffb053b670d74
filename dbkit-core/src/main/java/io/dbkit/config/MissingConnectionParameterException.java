package io.dbkit.config;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

import java.util.List;

/**
 * One or more required connection keys are absent or blank. Lists every missing key,
 * in the order {@code host, port, name, user, password}.
 */
public class MissingConnectionParameterException extends DbKitException {
  private final List<String> missingKeys;

  public MissingConnectionParameterException(List<String> missingKeys) {
    super(ErrorKind.MISSING_PARAMETER,
        "Missing required database parameters: " + String.join(", ", missingKeys));
    this.missingKeys = List.copyOf(missingKeys);
  }

  public List<String> missingKeys() {
    return missingKeys;
  }
}
