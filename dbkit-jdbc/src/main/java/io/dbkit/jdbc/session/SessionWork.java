package io.dbkit.jdbc.session;

import java.sql.SQLException;

/**
 * A unit of work run inside a transaction scope.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SessionWork<T> {
  T apply(Session session) throws SQLException;
}
