package io.dbkit;

import java.util.Objects;

/**
 * Base class of every exception raised by dbkit.
 *
 * <p>Callers that want to branch on the failure without matching concrete types can use
 * {@link #kind()} and {@link #isRecoverable()}.
 */
public class DbKitException extends RuntimeException {
  private final ErrorKind kind;

  public DbKitException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public DbKitException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean isRecoverable() {
    return kind.recoverable();
  }
}
