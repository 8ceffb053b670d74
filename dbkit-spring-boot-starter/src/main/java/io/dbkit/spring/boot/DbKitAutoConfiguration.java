package io.dbkit.spring.boot;

import io.dbkit.config.ConnectionConfig;
import io.dbkit.jdbc.DatabaseManager;
import io.dbkit.logging.AppLogger;
import io.dbkit.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.logging.Logger;

/**
 * Auto-configuration for a {@link DatabaseManager} built from {@link DbKitProperties}.
 *
 * <p>Active once {@code dbkit.database.name} is set. The pool is not opened until the manager
 * is first used, and is closed with the application context.
 *
 * @see DbKitProperties
 * @see DbKitMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DatabaseManager.class)
@ConditionalOnProperty(prefix = "dbkit.database", name = "name")
@EnableConfigurationProperties(DbKitProperties.class)
public class DbKitAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ConnectionConfig dbkitConnectionConfig(DbKitProperties props) {
    DbKitProperties.Database db = props.getDatabase();
    ConnectionConfig.Builder builder = ConnectionConfig.builder()
        .host(db.getHost())
        .name(db.getName())
        .user(db.getUser())
        .password(db.getPassword())
        .driver(db.getDriver())
        .poolSize(db.getPoolSize())
        .maxOverflow(db.getMaxOverflow())
        .recycleInterval(db.getRecycleInterval())
        .poolTimeout(db.getPoolTimeout());
    if (db.getPort() != null) {
      builder.port(db.getPort());
    }
    if (db.getStatementTimeout() != null) {
      builder.statementTimeout(db.getStatementTimeout());
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DatabaseManager databaseManager(ConnectionConfig config, DbKitProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    Logger logger = props.getLogFile() != null
        ? AppLogger.create(props.getLoggerName(), props.getLogFile())
        : Logger.getLogger(props.getLoggerName());
    return new DatabaseManager(config, logger, metricsProvider.getIfAvailable());
  }
}
