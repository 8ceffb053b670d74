package io.dbkit.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for dbkit.
 *
 * <pre>
 * dbkit:
 *   logger-name: warehouse
 *   log-file: logs/warehouse.log
 *   database:
 *     host: db.local
 *     port: 5432
 *     name: warehouse
 *     user: loader
 *     password: secret
 *     pool-size: 5
 * </pre>
 *
 * @see DbKitAutoConfiguration
 */
@ConfigurationProperties(prefix = "dbkit")
public class DbKitProperties {

    /**
     * Name of the {@link java.util.logging.Logger} handed to the database manager.
     */
    private String loggerName = "dbkit";

    /**
     * Optional log file. When set, the logger writes to this file and to the console.
     */
    private Path logFile;

    private final Database database = new Database();
    private final Metrics metrics = new Metrics();

    public String getLoggerName() {
        return loggerName;
    }

    public void setLoggerName(String loggerName) {
        this.loggerName = loggerName;
    }

    public Path getLogFile() {
        return logFile;
    }

    public void setLogFile(Path logFile) {
        this.logFile = logFile;
    }

    public Database getDatabase() {
        return database;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Connection parameters. Unset required values are reported together when the manager is
     * created.
     */
    public static class Database {
        private String host;
        private Integer port;
        private String name;
        private String user;
        private String password;
        private String driver = "postgresql";
        private int poolSize = 10;
        private int maxOverflow = 2;
        private Duration recycleInterval = Duration.ofSeconds(300);
        private Duration poolTimeout = Duration.ofSeconds(30);
        private Duration statementTimeout;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Integer getPort() {
            return port;
        }

        public void setPort(Integer port) {
            this.port = port;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDriver() {
            return driver;
        }

        public void setDriver(String driver) {
            this.driver = driver;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getMaxOverflow() {
            return maxOverflow;
        }

        public void setMaxOverflow(int maxOverflow) {
            this.maxOverflow = maxOverflow;
        }

        public Duration getRecycleInterval() {
            return recycleInterval;
        }

        public void setRecycleInterval(Duration recycleInterval) {
            this.recycleInterval = recycleInterval;
        }

        public Duration getPoolTimeout() {
            return poolTimeout;
        }

        public void setPoolTimeout(Duration poolTimeout) {
            this.poolTimeout = poolTimeout;
        }

        public Duration getStatementTimeout() {
            return statementTimeout;
        }

        public void setStatementTimeout(Duration statementTimeout) {
            this.statementTimeout = statementTimeout;
        }
    }

    public static class Metrics {
        /**
         * Whether to register the Micrometer exporter.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "dbkit";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
