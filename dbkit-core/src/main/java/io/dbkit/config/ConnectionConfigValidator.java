package io.dbkit.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static io.dbkit.config.ConnectionConfig.DRIVER;
import static io.dbkit.config.ConnectionConfig.HOST;
import static io.dbkit.config.ConnectionConfig.MAX_OVERFLOW;
import static io.dbkit.config.ConnectionConfig.NAME;
import static io.dbkit.config.ConnectionConfig.PASSWORD;
import static io.dbkit.config.ConnectionConfig.POOL_SIZE;
import static io.dbkit.config.ConnectionConfig.POOL_TIMEOUT;
import static io.dbkit.config.ConnectionConfig.PORT;
import static io.dbkit.config.ConnectionConfig.RECYCLE_INTERVAL;
import static io.dbkit.config.ConnectionConfig.REQUIRED_KEYS;
import static io.dbkit.config.ConnectionConfig.STATEMENT_TIMEOUT;
import static io.dbkit.config.ConnectionConfig.USER;

/**
 * Turns a raw key/value mapping (typically the {@code database} section of a YAML file) into a
 * {@link ConnectionConfig}.
 *
 * <p>Missing-key detection runs before any value parsing, so a candidate with both missing
 * and malformed keys reports the missing ones. {@code null}, empty and blank strings count
 * as missing, but present strings are kept exactly as given. Durations accept a
 * {@link Duration} or a number of seconds (fractional values allowed for {@code pool_timeout});
 * {@code recycle_interval} and {@code pool_timeout} below the pool's floors
 * ({@link ConnectionConfig#MIN_RECYCLE_INTERVAL}, {@link ConnectionConfig#MIN_POOL_TIMEOUT})
 * are rejected rather than silently replaced.
 */
public final class ConnectionConfigValidator {

  private ConnectionConfigValidator() {}

  /**
   * Validates {@code candidate}.
   *
   * @throws MissingConnectionParameterException naming every missing required key
   * @throws InvalidConnectionParameterException if a present value is unusable
   */
  public static ConnectionConfig validate(Map<String, ?> candidate) {
    Objects.requireNonNull(candidate, "candidate");
    List<String> missing = missingKeys(candidate);
    if (!missing.isEmpty()) {
      throw new MissingConnectionParameterException(missing);
    }

    String host = string(candidate, HOST);
    int port = integer(candidate, PORT, 1);
    if (port > 65535) {
      throw new InvalidConnectionParameterException(PORT, "must be at most 65535, got " + port);
    }
    String name = string(candidate, NAME);
    String user = string(candidate, USER);
    String password = string(candidate, PASSWORD);

    String driver = isBlank(candidate.get(DRIVER))
        ? ConnectionConfig.DEFAULT_DRIVER
        : string(candidate, DRIVER).trim().toLowerCase(Locale.ROOT);
    int poolSize = candidate.get(POOL_SIZE) == null
        ? ConnectionConfig.DEFAULT_POOL_SIZE
        : integer(candidate, POOL_SIZE, 1);
    int maxOverflow = candidate.get(MAX_OVERFLOW) == null
        ? ConnectionConfig.DEFAULT_MAX_OVERFLOW
        : integer(candidate, MAX_OVERFLOW, 0);
    Duration recycle = candidate.get(RECYCLE_INTERVAL) == null
        ? ConnectionConfig.DEFAULT_RECYCLE_INTERVAL
        : duration(candidate, RECYCLE_INTERVAL, ConnectionConfig.MIN_RECYCLE_INTERVAL);
    Duration poolTimeout = candidate.get(POOL_TIMEOUT) == null
        ? ConnectionConfig.DEFAULT_POOL_TIMEOUT
        : duration(candidate, POOL_TIMEOUT, ConnectionConfig.MIN_POOL_TIMEOUT);
    Duration statementTimeout = candidate.get(STATEMENT_TIMEOUT) == null
        ? null
        : duration(candidate, STATEMENT_TIMEOUT, null);

    return new ConnectionConfig(host, port, name, user, password, driver, poolSize, maxOverflow,
        recycle, poolTimeout, statementTimeout);
  }

  /**
   * Non-throwing variant of {@link #validate(Map)}.
   */
  public static ValidationResult check(Map<String, ?> candidate) {
    try {
      return new ValidationResult.Valid(validate(candidate));
    } catch (MissingConnectionParameterException | InvalidConnectionParameterException e) {
      return new ValidationResult.Invalid(e);
    }
  }

  /**
   * Returns the required keys absent from {@code candidate}, in canonical order.
   */
  public static List<String> missingKeys(Map<String, ?> candidate) {
    List<String> missing = new ArrayList<>();
    for (String key : REQUIRED_KEYS) {
      if (isBlank(candidate.get(key))) {
        missing.add(key);
      }
    }
    return missing;
  }

  private static boolean isBlank(Object value) {
    return value == null || (value instanceof CharSequence cs && cs.toString().isBlank());
  }

  private static String string(Map<String, ?> candidate, String key) {
    Object value = candidate.get(key);
    if (value instanceof CharSequence || value instanceof Number) {
      return value.toString();
    }
    throw new InvalidConnectionParameterException(key,
        "expected a string, got " + value.getClass().getSimpleName());
  }

  private static int integer(Map<String, ?> candidate, String key, int min) {
    Object value = candidate.get(key);
    long parsed;
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      parsed = ((Number) value).longValue();
    } else if (value instanceof CharSequence cs) {
      try {
        parsed = Long.parseLong(cs.toString().trim());
      } catch (NumberFormatException e) {
        throw new InvalidConnectionParameterException(key, "not an integer: '" + cs + "'");
      }
    } else {
      throw new InvalidConnectionParameterException(key, "not an integer: " + value);
    }
    if (parsed < min || parsed > Integer.MAX_VALUE) {
      throw new InvalidConnectionParameterException(key,
          "must be " + (min == 0 ? "non-negative" : "at least " + min) + ", got " + parsed);
    }
    return (int) parsed;
  }

  private static Duration duration(Map<String, ?> candidate, String key, Duration floor) {
    Object value = candidate.get(key);
    Duration parsed;
    if (value instanceof Duration d) {
      parsed = d;
    } else if (value instanceof Number || value instanceof CharSequence) {
      try {
        BigDecimal seconds = new BigDecimal(value.toString().trim());
        parsed = Duration.ofMillis(seconds.movePointRight(3).longValueExact());
      } catch (NumberFormatException | ArithmeticException e) {
        throw new InvalidConnectionParameterException(key, "not a number of seconds: '" + value + "'");
      }
    } else {
      throw new InvalidConnectionParameterException(key, "not a duration: " + value);
    }
    if (parsed.isNegative() || parsed.isZero()) {
      throw new InvalidConnectionParameterException(key, "must be positive, got " + parsed);
    }
    if (floor != null && parsed.compareTo(floor) < 0) {
      throw new InvalidConnectionParameterException(key,
          "must be at least " + floor.toMillis() + " ms, got " + parsed.toMillis() + " ms");
    }
    return parsed;
  }
}
