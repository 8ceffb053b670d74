package io.dbkit.jdbc.session;

import io.dbkit.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One unit of work on one pooled connection with auto-commit off.
 *
 * <p>A session belongs to exactly one {@link TransactionScope} and is usable only while that
 * scope is {@link ScopeState#ACTIVE}. Sessions are not thread-safe and must not be shared
 * across concurrent units of work.
 */
public final class Session {
  private final Connection connection;
  private final Duration statementTimeout;
  private final TransactionScope scope;

  Session(Connection connection, Duration statementTimeout, TransactionScope scope) {
    this.connection = connection;
    this.statementTimeout = statementTimeout;
    this.scope = scope;
  }

  public int update(String sql, Object... params) {
    return JdbcTemplate.update(activeConnection(), statementTimeout, sql, params);
  }

  public <T> List<T> query(String sql, JdbcTemplate.RowMapper<T> mapper, Object... params) {
    return JdbcTemplate.query(activeConnection(), statementTimeout, sql, mapper, params);
  }

  /** Returns the first row of the result, if any. */
  public <T> Optional<T> queryFirst(String sql, JdbcTemplate.RowMapper<T> mapper, Object... params) {
    List<T> rows = query(sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  public void execute(String sql) {
    JdbcTemplate.execute(activeConnection(), statementTimeout, sql);
  }

  /**
   * Sends one parameterised statement per row in JDBC batches.
   *
   * @return total rows affected
   * @see JdbcTemplate#batchUpdate
   */
  public int batchUpdate(String sql, int[] sqlTypes, List<? extends List<?>> rows, int chunkSize) {
    return JdbcTemplate.batchUpdate(activeConnection(), statementTimeout, sql, sqlTypes, rows,
        chunkSize);
  }

  /**
   * The underlying connection, for work the helpers above do not cover. Do not commit, roll
   * back or close it; the owning scope does that.
   */
  public Connection connection() {
    return activeConnection();
  }

  public Optional<Duration> statementTimeout() {
    return Optional.ofNullable(statementTimeout);
  }

  private Connection activeConnection() {
    ScopeState state = scope.state();
    if (state != ScopeState.ACTIVE) {
      throw new IllegalStateException("Session is no longer usable, scope is " + state);
    }
    return connection;
  }
}
