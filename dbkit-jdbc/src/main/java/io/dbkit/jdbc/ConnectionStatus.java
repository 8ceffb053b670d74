package io.dbkit.jdbc;

import io.dbkit.ErrorKind;
import io.dbkit.jdbc.engine.ConnectionIdentifier;

import java.util.Objects;

/**
 * Result of {@link DatabaseManager#validateConnection()}. Connectivity problems are an expected
 * condition, so they are reported as a value rather than thrown.
 */
public sealed interface ConnectionStatus
    permits ConnectionStatus.Available, ConnectionStatus.Unavailable {

  boolean isAvailable();

  /**
   * The liveness query succeeded.
   */
  record Available(ConnectionIdentifier identifier) implements ConnectionStatus {
    public Available {
      Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public boolean isAvailable() {
      return true;
    }
  }

  /**
   * The store could not be used.
   *
   * @param kind    what went wrong; {@link ErrorKind#recoverable()} tells whether retrying later
   *                can help
   * @param message diagnostic message
   */
  record Unavailable(ErrorKind kind, String message) implements ConnectionStatus {
    public Unavailable {
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public boolean isAvailable() {
      return false;
    }
  }
}
