package io.dbkit.jdbc.session;

/**
 * Lifecycle of a {@link TransactionScope}: {@code ACTIVE -> (COMMITTED | ROLLED_BACK) -> CLOSED}.
 */
public enum ScopeState {
  ACTIVE,
  COMMITTED,
  ROLLED_BACK,
  CLOSED
}
