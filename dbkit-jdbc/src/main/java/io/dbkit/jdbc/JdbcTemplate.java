package io.dbkit.jdbc;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper shared by sessions, the schema manager and the bulk loader.
 *
 * <p>Every method optionally takes a statement timeout; {@code null} means no limit. Failures
 * surface as {@link SqlExecutionException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE/INSERT/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    return update(conn, null, sql, params);
  }

  public static int update(Connection conn, Duration timeout, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      applyTimeout(ps, timeout);
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    return query(conn, null, sql, mapper, params);
  }

  public static <T> List<T> query(Connection conn, Duration timeout, String sql, RowMapper<T> mapper,
      Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      applyTimeout(ps, timeout);
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to execute query", e);
    }
  }

  /** Execute a statement without parameters, typically DDL. */
  public static void execute(Connection conn, Duration timeout, String sql) {
    try (Statement st = conn.createStatement()) {
      applyTimeout(st, timeout);
      st.execute(sql);
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to execute statement", e);
    }
  }

  /**
   * Execute one parameterised statement for every row, sending JDBC batches of at most
   * {@code chunkSize} rows.
   *
   * @param sqlTypes {@link java.sql.Types} per parameter, used to bind {@code null}
   * @return total rows affected; a driver reporting {@link Statement#SUCCESS_NO_INFO} counts as one
   */
  public static int batchUpdate(Connection conn, Duration timeout, String sql, int[] sqlTypes,
      List<? extends List<?>> rows, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0");
    }
    int total = 0;
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      applyTimeout(ps, timeout);
      int pending = 0;
      for (List<?> row : rows) {
        bindTyped(ps, sqlTypes, row);
        ps.addBatch();
        if (++pending == chunkSize) {
          total += sum(ps.executeBatch());
          pending = 0;
        }
      }
      if (pending > 0) {
        total += sum(ps.executeBatch());
      }
      return total;
    } catch (SQLException e) {
      throw new SqlExecutionException("Failed to execute batch", e);
    }
  }

  private static int sum(int[] counts) {
    int total = 0;
    for (int count : counts) {
      total += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
    }
    return total;
  }

  private static void applyTimeout(Statement st, Duration timeout) throws SQLException {
    if (timeout != null) {
      // JDBC timeouts are whole seconds; 0 would mean "no limit".
      st.setQueryTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
    }
  }

  private static void bindTyped(PreparedStatement ps, int[] sqlTypes, List<?> values)
      throws SQLException {
    if (values.size() != sqlTypes.length) {
      throw new IllegalArgumentException(
          "Expected " + sqlTypes.length + " parameters, got " + values.size());
    }
    for (int i = 0; i < sqlTypes.length; i++) {
      Object value = values.get(i);
      if (value == null) {
        ps.setNull(i + 1, sqlTypes[i]);
      } else {
        bind(ps, i + 1, value);
      }
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else {
        bind(ps, i + 1, param);
      }
    }
  }

  private static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param instanceof String s) {
      ps.setString(index, s);
    } else if (param instanceof Integer n) {
      ps.setInt(index, n);
    } else if (param instanceof Long n) {
      ps.setLong(index, n);
    } else if (param instanceof Double d) {
      ps.setDouble(index, d);
    } else if (param instanceof BigDecimal bd) {
      ps.setBigDecimal(index, bd);
    } else if (param instanceof Boolean b) {
      ps.setBoolean(index, b);
    } else if (param instanceof Timestamp ts) {
      ps.setTimestamp(index, ts);
    } else {
      ps.setObject(index, param);
    }
  }

  private JdbcTemplate() {}
}
