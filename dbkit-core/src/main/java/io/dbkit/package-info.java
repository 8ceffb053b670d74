/**
 * Root API of dbkit, a small JDBC connection and transactional session manager.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>dbkit-core</b> - connection config and its validator, YAML config resolution,
 *       table descriptors, tabular datasets, logger factory, SPIs (SnakeYAML only)</li>
 *   <li><b>dbkit-jdbc</b> - HikariCP engine, sessions and transaction scopes, dialects,
 *       schema manager, bulk loader and the {@code DatabaseManager} facade</li>
 *   <li><b>dbkit-micrometer</b> - metrics bridge</li>
 *   <li><b>dbkit-spring-boot-starter</b> - auto-configuration from {@code dbkit.database.*}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Logger log = AppLogger.fromConfig(resolver.loggingConfig(configFile), projectRoot);
 *
 * try (DatabaseManager db = DatabaseManager.fromYaml(configFile, log)) {
 *     db.createTables(List.of(teams, seeds));
 *     int written = db.insert(dataset, teams);
 *
 *     try (TransactionScope scope = db.sessionScope()) {
 *         scope.session().update("DELETE FROM ncaa_m_tourney_seeds WHERE season < ?", 2000);
 *         scope.commit();
 *     }
 * }
 * }</pre>
 *
 * <p>All failures extend {@link io.dbkit.DbKitException} and carry an {@link io.dbkit.ErrorKind}.
 */
package io.dbkit;
