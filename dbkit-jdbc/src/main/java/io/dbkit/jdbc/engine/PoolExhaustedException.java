package io.dbkit.jdbc.engine;

import io.dbkit.DbKitException;
import io.dbkit.ErrorKind;

/**
 * Every connection was in use for the whole pool timeout.
 */
public class PoolExhaustedException extends DbKitException {
  private final int maxConnections;

  public PoolExhaustedException(String message, int maxConnections, Throwable cause) {
    super(ErrorKind.POOL_EXHAUSTED, message, cause);
    this.maxConnections = maxConnections;
  }

  /** The pool bound that was reached: pool size plus overflow. */
  public int maxConnections() {
    return maxConnections;
  }
}
