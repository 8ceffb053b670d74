package io.dbkit.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, immutable connection settings for one relational store.
 *
 * <p>Instances come only from {@link ConnectionConfigValidator#validate(Map)} or from
 * {@link #builder()}, which routes through the same validator. The required keys are
 * {@code host, port, name, user, password}; everything else has a default.
 *
 * @see ConnectionConfigValidator
 */
public final class ConnectionConfig {
  public static final String HOST = "host";
  public static final String PORT = "port";
  public static final String NAME = "name";
  public static final String USER = "user";
  public static final String PASSWORD = "password";
  public static final String DRIVER = "driver";
  public static final String POOL_SIZE = "pool_size";
  public static final String MAX_OVERFLOW = "max_overflow";
  public static final String RECYCLE_INTERVAL = "recycle_interval";
  public static final String POOL_TIMEOUT = "pool_timeout";
  public static final String STATEMENT_TIMEOUT = "statement_timeout";

  /** Required keys in the order they are reported when missing. */
  public static final List<String> REQUIRED_KEYS = List.of(HOST, PORT, NAME, USER, PASSWORD);

  public static final String DEFAULT_DRIVER = "postgresql";
  public static final int DEFAULT_POOL_SIZE = 10;
  public static final int DEFAULT_MAX_OVERFLOW = 2;
  public static final Duration DEFAULT_RECYCLE_INTERVAL = Duration.ofSeconds(300);
  public static final Duration DEFAULT_POOL_TIMEOUT = Duration.ofSeconds(30);

  /** Shortest connection lifetime the pool honours; shorter values are rejected. */
  public static final Duration MIN_RECYCLE_INTERVAL = Duration.ofSeconds(30);
  /** Shortest acquisition wait the pool honours; shorter values are rejected. */
  public static final Duration MIN_POOL_TIMEOUT = Duration.ofMillis(250);

  private final String host;
  private final int port;
  private final String name;
  private final String user;
  private final String password;
  private final String driver;
  private final int poolSize;
  private final int maxOverflow;
  private final Duration recycleInterval;
  private final Duration poolTimeout;
  private final Duration statementTimeout;

  ConnectionConfig(String host, int port, String name, String user, String password,
      String driver, int poolSize, int maxOverflow, Duration recycleInterval,
      Duration poolTimeout, Duration statementTimeout) {
    this.host = host;
    this.port = port;
    this.name = name;
    this.user = user;
    this.password = password;
    this.driver = driver;
    this.poolSize = poolSize;
    this.maxOverflow = maxOverflow;
    this.recycleInterval = recycleInterval;
    this.poolTimeout = poolTimeout;
    this.statementTimeout = statementTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  /** Database name. */
  public String name() {
    return name;
  }

  public String user() {
    return user;
  }

  public String password() {
    return password;
  }

  /** Dialect name, e.g. {@code postgresql}, {@code mysql} or {@code h2}. */
  public String driver() {
    return driver;
  }

  public int poolSize() {
    return poolSize;
  }

  public int maxOverflow() {
    return maxOverflow;
  }

  /** Upper bound on concurrently live connections: {@code poolSize + maxOverflow}. */
  public int maxConnections() {
    return poolSize + maxOverflow;
  }

  public Duration recycleInterval() {
    return recycleInterval;
  }

  public Duration poolTimeout() {
    return poolTimeout;
  }

  public Optional<Duration> statementTimeout() {
    return Optional.ofNullable(statementTimeout);
  }

  /**
   * Returns the settings as a key/value map using the YAML key names, suitable for
   * feeding back into the validator.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(HOST, host);
    map.put(PORT, port);
    map.put(NAME, name);
    map.put(USER, user);
    map.put(PASSWORD, password);
    map.put(DRIVER, driver);
    map.put(POOL_SIZE, poolSize);
    map.put(MAX_OVERFLOW, maxOverflow);
    map.put(RECYCLE_INTERVAL, recycleInterval);
    map.put(POOL_TIMEOUT, poolTimeout);
    if (statementTimeout != null) {
      map.put(STATEMENT_TIMEOUT, statementTimeout);
    }
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConnectionConfig that)) {
      return false;
    }
    return port == that.port
        && poolSize == that.poolSize
        && maxOverflow == that.maxOverflow
        && host.equals(that.host)
        && name.equals(that.name)
        && user.equals(that.user)
        && password.equals(that.password)
        && driver.equals(that.driver)
        && recycleInterval.equals(that.recycleInterval)
        && poolTimeout.equals(that.poolTimeout)
        && Objects.equals(statementTimeout, that.statementTimeout);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, name, user, driver, poolSize, maxOverflow);
  }

  @Override
  public String toString() {
    return "ConnectionConfig{driver=" + driver + ", host=" + host + ", port=" + port
        + ", name=" + name + ", user=" + user + ", password=****"
        + ", poolSize=" + poolSize + ", maxOverflow=" + maxOverflow
        + ", recycleInterval=" + recycleInterval + ", poolTimeout=" + poolTimeout
        + ", statementTimeout=" + statementTimeout + "}";
  }

  /**
   * Fluent builder. {@link #build()} validates through {@link ConnectionConfigValidator}, so a
   * builder that omits required values fails exactly like a config file that omits them.
   */
  public static final class Builder {
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder host(String host) {
      values.put(HOST, host);
      return this;
    }

    public Builder port(int port) {
      values.put(PORT, port);
      return this;
    }

    public Builder name(String name) {
      values.put(NAME, name);
      return this;
    }

    public Builder user(String user) {
      values.put(USER, user);
      return this;
    }

    public Builder password(String password) {
      values.put(PASSWORD, password);
      return this;
    }

    public Builder driver(String driver) {
      values.put(DRIVER, driver);
      return this;
    }

    public Builder poolSize(int poolSize) {
      values.put(POOL_SIZE, poolSize);
      return this;
    }

    public Builder maxOverflow(int maxOverflow) {
      values.put(MAX_OVERFLOW, maxOverflow);
      return this;
    }

    public Builder recycleInterval(Duration recycleInterval) {
      values.put(RECYCLE_INTERVAL, recycleInterval);
      return this;
    }

    public Builder poolTimeout(Duration poolTimeout) {
      values.put(POOL_TIMEOUT, poolTimeout);
      return this;
    }

    public Builder statementTimeout(Duration statementTimeout) {
      values.put(STATEMENT_TIMEOUT, statementTimeout);
      return this;
    }

    public ConnectionConfig build() {
      return ConnectionConfigValidator.validate(values);
    }
  }
}
