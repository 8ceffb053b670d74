package io.dbkit.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Semantic column types. Each dialect maps them onto its own SQL types; each type knows how to
 * coerce an incoming dataset value into the Java type bound to JDBC.
 *
 * <table>
 *   <caption>Bound Java types</caption>
 *   <tr><th>type</th><th>bound as</th></tr>
 *   <tr><td>STRING, TEXT</td><td>{@link String}</td></tr>
 *   <tr><td>INTEGER</td><td>{@link Integer}</td></tr>
 *   <tr><td>BIGINT</td><td>{@link Long}</td></tr>
 *   <tr><td>FLOAT</td><td>{@link Double}</td></tr>
 *   <tr><td>DECIMAL</td><td>{@link BigDecimal}</td></tr>
 *   <tr><td>BOOLEAN</td><td>{@link Boolean}</td></tr>
 *   <tr><td>DATE</td><td>{@link LocalDate}</td></tr>
 *   <tr><td>TIMESTAMP</td><td>{@link LocalDateTime} (UTC for instants)</td></tr>
 * </table>
 */
public enum ColumnType {
  STRING(java.sql.Types.VARCHAR),
  TEXT(java.sql.Types.VARCHAR),
  INTEGER(java.sql.Types.INTEGER),
  BIGINT(java.sql.Types.BIGINT),
  FLOAT(java.sql.Types.DOUBLE),
  DECIMAL(java.sql.Types.NUMERIC),
  BOOLEAN(java.sql.Types.BOOLEAN),
  DATE(java.sql.Types.DATE),
  TIMESTAMP(java.sql.Types.TIMESTAMP);

  private final int sqlType;

  ColumnType(int sqlType) {
    this.sqlType = sqlType;
  }

  /** The {@link java.sql.Types} constant used when binding {@code null}. */
  public int sqlType() {
    return sqlType;
  }

  /**
   * Converts {@code value} to the Java type bound for this column type. {@code null} passes
   * through.
   *
   * @param value  raw dataset value
   * @param column column name, used in the error message
   * @throws IllegalArgumentException if the value cannot be represented without loss
   */
  public Object coerce(Object value, String column) {
    if (value == null) {
      return null;
    }
    try {
      Object coerced = switch (this) {
        case STRING, TEXT -> toText(value);
        case INTEGER -> toInteger(value);
        case BIGINT -> toBigint(value);
        case FLOAT -> toFloat(value);
        case DECIMAL -> toDecimal(value);
        case BOOLEAN -> toBoolean(value);
        case DATE -> toDate(value);
        case TIMESTAMP -> toTimestamp(value);
      };
      if (coerced != null) {
        return coerced;
      }
    } catch (ArithmeticException | NumberFormatException | DateTimeParseException e) {
      throw mismatch(value, column, e);
    }
    throw mismatch(value, column, null);
  }

  private IllegalArgumentException mismatch(Object value, String column, Exception cause) {
    return new IllegalArgumentException("Type mismatch for column '" + column + "': cannot convert "
        + value.getClass().getSimpleName() + " '" + value + "' to " + this, cause);
  }

  private static String toText(Object value) {
    if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean
        || value instanceof Character || value instanceof Enum<?>) {
      return value.toString();
    }
    return null;
  }

  private static Integer toInteger(Object value) {
    if (value instanceof CharSequence cs) {
      return Integer.valueOf(cs.toString().trim());
    }
    BigDecimal decimal = integralDecimal(value);
    return decimal == null ? null : decimal.intValueExact();
  }

  private static Long toBigint(Object value) {
    if (value instanceof CharSequence cs) {
      return Long.valueOf(cs.toString().trim());
    }
    BigDecimal decimal = integralDecimal(value);
    return decimal == null ? null : decimal.longValueExact();
  }

  private static Double toFloat(Object value) {
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof CharSequence cs) {
      return Double.valueOf(cs.toString().trim());
    }
    return null;
  }

  private static BigDecimal toDecimal(Object value) {
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    if (value instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(((Number) value).doubleValue());
    }
    if (value instanceof Number n) {
      return BigDecimal.valueOf(n.longValue());
    }
    if (value instanceof CharSequence cs) {
      return new BigDecimal(cs.toString().trim());
    }
    return null;
  }

  private static Boolean toBoolean(Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof CharSequence cs) {
      String s = cs.toString().trim().toLowerCase(Locale.ROOT);
      if (s.equals("true")) {
        return Boolean.TRUE;
      }
      if (s.equals("false")) {
        return Boolean.FALSE;
      }
    }
    return null;
  }

  private static LocalDate toDate(Object value) {
    if (value instanceof LocalDate d) {
      return d;
    }
    if (value instanceof java.sql.Date d) {
      return d.toLocalDate();
    }
    if (value instanceof LocalDateTime dt) {
      return dt.toLocalDate();
    }
    if (value instanceof CharSequence cs) {
      return LocalDate.parse(cs.toString().trim());
    }
    return null;
  }

  private static LocalDateTime toTimestamp(Object value) {
    if (value instanceof LocalDateTime dt) {
      return dt;
    }
    if (value instanceof Timestamp ts) {
      return ts.toLocalDateTime();
    }
    if (value instanceof Instant i) {
      return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    }
    if (value instanceof OffsetDateTime odt) {
      return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    if (value instanceof ZonedDateTime zdt) {
      return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    if (value instanceof LocalDate d) {
      return d.atStartOfDay();
    }
    if (value instanceof CharSequence cs) {
      return LocalDateTime.parse(cs.toString().trim());
    }
    return null;
  }

  // Integral numbers only; 3.0 is accepted, 3.5 is not.
  private static BigDecimal integralDecimal(Object value) {
    BigDecimal decimal;
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    } else if (value instanceof BigInteger bi) {
      decimal = new BigDecimal(bi);
    } else if (value instanceof BigDecimal bd) {
      decimal = bd;
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new ArithmeticException("not a finite number");
      }
      decimal = BigDecimal.valueOf(d);
    } else {
      return null;
    }
    return decimal.setScale(0, java.math.RoundingMode.UNNECESSARY);
  }
}
