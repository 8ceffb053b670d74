package io.dbkit;

/**
 * Classifies every failure raised by dbkit.
 *
 * <p>A kind is {@linkplain #recoverable() recoverable} when the caller can reasonably fix the
 * condition and try again (edit the config file, wait for the database, free a connection).
 * Non-recoverable kinds indicate an internal fault or a defect in the caller's descriptors.
 */
public enum ErrorKind {
  CONFIG_NOT_FOUND(true),
  CONFIG_PARSE(true),
  MISSING_PARAMETER(true),
  INVALID_CONFIGURATION(true),
  ENGINE_CREATION(false),
  CONNECTIVITY(true),
  POOL_EXHAUSTED(true),
  SCHEMA_CREATION(false),
  BULK_INSERT(false),
  TRANSACTION(false),
  SQL_EXECUTION(false);

  private final boolean recoverable;

  ErrorKind(boolean recoverable) {
    this.recoverable = recoverable;
  }

  public boolean recoverable() {
    return recoverable;
  }
}
