package io.dbkit.spring.boot;

import io.dbkit.config.ConnectionConfig;
import io.dbkit.config.MissingConnectionParameterException;
import io.dbkit.jdbc.DatabaseManager;
import io.dbkit.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DbKitAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DbKitAutoConfiguration.class));

    private static String[] h2Properties() {
        return new String[] {
                "dbkit.database.driver=h2",
                "dbkit.database.host=localhost",
                "dbkit.database.port=9092",
                "dbkit.database.name=starter_" + UUID.randomUUID().toString().replace("-", ""),
                "dbkit.database.user=sa",
                "dbkit.database.password=sa",
                "dbkit.database.pool-size=2",
                "dbkit.database.max-overflow=1",
                "dbkit.database.statement-timeout=15s"
        };
    }

    @Test
    void backsOffWithoutDatabaseName() {
        runner.run(ctx -> assertFalse(ctx.containsBean("databaseManager")));
    }

    @Test
    void createsLazyManagerFromProperties() {
        runner.withPropertyValues(h2Properties()).run(ctx -> {
            DatabaseManager db = ctx.getBean(DatabaseManager.class);
            assertNotNull(db);
            assertFalse(db.isEngineBuilt());

            ConnectionConfig config = ctx.getBean(ConnectionConfig.class);
            assertEquals("h2", config.driver());
            assertEquals(3, config.maxConnections());
            assertEquals(Duration.ofSeconds(15), config.statementTimeout().orElseThrow());

            assertTrue(db.validateConnection().isAvailable());
            assertTrue(db.isEngineBuilt());
        });
    }

    @Test
    void reportsEveryMissingParameter() {
        runner.withPropertyValues("dbkit.database.name=shop", "dbkit.database.host=localhost")
                .run(ctx -> {
                    assertNotNull(ctx.getStartupFailure());
                    Throwable root = ctx.getStartupFailure();
                    while (root.getCause() != null) {
                        root = root.getCause();
                    }
                    var missing = assertInstanceOf(MissingConnectionParameterException.class, root);
                    assertEquals(java.util.List.of("port", "user", "password"), missing.missingKeys());
                });
    }

    @Test
    void usesCustomMetricsExporter() {
        runner.withPropertyValues(h2Properties())
                .withUserConfiguration(CountingExporterConfig.class)
                .run(ctx -> {
                    DatabaseManager db = ctx.getBean(DatabaseManager.class);
                    db.inTransaction(session -> session.update("CREATE TABLE t (id INT)"));
                    assertEquals(1, ctx.getBean(CountingExporter.class).committed.get());
                });
    }

    @Test
    void backsOffWhenManagerAlreadyDefined() {
        runner.withPropertyValues(h2Properties())
                .withUserConfiguration(CustomManagerConfig.class)
                .run(ctx -> assertEquals("custom",
                        ctx.getBean(DatabaseManager.class).config().name()));
    }

    @Test
    void poolIsClosedWithTheContext() {
        DatabaseManager[] holder = new DatabaseManager[1];
        runner.withPropertyValues(h2Properties()).run(ctx -> {
            holder[0] = ctx.getBean(DatabaseManager.class);
            holder[0].validateConnection();
        });
        assertFalse(holder[0].isEngineBuilt());
    }

    static class CountingExporter implements MetricsExporter {
        final AtomicInteger committed = new AtomicInteger();

        @Override
        public void incrementScopeCommitted() {
            committed.incrementAndGet();
        }

        @Override
        public void incrementScopeRolledBack() {
        }

        @Override
        public void recordRowsInserted(String table, int rows) {
        }

        @Override
        public void recordTablesCreated(int tables) {
        }
    }

    @Configuration
    static class CountingExporterConfig {
        @Bean
        CountingExporter countingExporter() {
            return new CountingExporter();
        }
    }

    @Configuration
    static class CustomManagerConfig {
        @Bean
        DatabaseManager customManager() {
            ConnectionConfig config = ConnectionConfig.builder()
                    .driver("h2").host("localhost").port(9092).name("custom")
                    .user("sa").password("sa").build();
            return new DatabaseManager(config, java.util.logging.Logger.getLogger("custom"));
        }
    }
}
