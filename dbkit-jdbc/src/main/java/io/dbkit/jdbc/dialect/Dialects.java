package io.dbkit.jdbc.dialect;

import io.dbkit.config.ConnectionConfig;
import io.dbkit.jdbc.spi.Dialect;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The dialects available to the engine, discovered once through {@link ServiceLoader}
 * ({@code META-INF/services/io.dbkit.jdbc.spi.Dialect}) and keyed by the {@code driver} value
 * of a {@link ConnectionConfig}.
 *
 * <p>{@link #forConfig(ConnectionConfig)} is what the engine factory uses: it picks the dialect
 * the config names and checks that the URL it composes is one the same dialect claims, so a
 * plugged-in dialect with an inconsistent prefix list fails before a pool is created.
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private static final Map<String, Dialect> BY_DRIVER = DIALECTS.stream()
      .collect(Collectors.toUnmodifiableMap(d -> d.name().toLowerCase(Locale.ROOT),
          Function.identity()));

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Looks up a dialect by driver name, case-insensitively.
   *
   * @throws IllegalArgumentException naming the registered drivers if none matches
   */
  public static Dialect get(String driver) {
    Dialect dialect = BY_DRIVER.get(driver.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + driver
          + ". Available: " + BY_DRIVER.keySet());
    }
    return dialect;
  }

  /**
   * The registered dialect whose prefixes claim {@code jdbcUrl}, if any.
   */
  public static Optional<Dialect> owning(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      return Optional.empty();
    }
    for (Dialect dialect : DIALECTS) {
      if (claims(dialect, jdbcUrl)) {
        return Optional.of(dialect);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the dialect for {@code config.driver()} and verifies the URL it composes.
   *
   * @throws IllegalArgumentException if the driver is unknown
   * @throws IllegalStateException if the dialect composes a URL outside its own prefixes
   */
  public static Dialect forConfig(ConnectionConfig config) {
    return verified(get(config.driver()), config);
  }

  static Dialect verified(Dialect dialect, ConnectionConfig config) {
    String url = dialect.jdbcUrl(config.host(), config.port(), config.name());
    if (!claims(dialect, url)) {
      throw new IllegalStateException("Dialect '" + dialect.name() + "' composed " + url
          + " outside its prefixes " + dialect.jdbcUrlPrefixes());
    }
    return dialect;
  }

  private static boolean claims(Dialect dialect, String jdbcUrl) {
    for (String prefix : dialect.jdbcUrlPrefixes()) {
      if (jdbcUrl.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
