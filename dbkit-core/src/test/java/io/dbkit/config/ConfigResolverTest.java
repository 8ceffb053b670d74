package io.dbkit.config;

import io.dbkit.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigResolverTest {
  private static final String DATABASE_YAML = """
      database:
        host: localhost
        port: 5432
        name: kaggle
        user: analyst
        password: secret
        pool_size: 5
        pool_timeout: 2.5
      logging:
        path: logs/app.log
        name: database
        console_level: DEBUG
      """;

  @TempDir
  Path tmp;

  private final ConfigResolver resolver = ConfigResolver.defaults();

  private static Path write(Path file, String content) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content);
  }

  @Test
  void findsConfigInStartDirectory() throws IOException {
    Path config = write(tmp.resolve("config/database.yaml"), DATABASE_YAML);

    assertEquals(config, resolver.findNearestConfig(tmp, "database.yaml"));
  }

  @Test
  void findsConfigInAncestorDirectory() throws IOException {
    Path config = write(tmp.resolve("config/database.yaml"), DATABASE_YAML);
    Path start = Files.createDirectories(tmp.resolve("notebooks/eda"));

    assertEquals(config, resolver.findNearestConfig(start, "database.yaml"));
  }

  @Test
  void nearestConfigWins() throws IOException {
    write(tmp.resolve("config/database.yaml"), DATABASE_YAML);
    Path nearer = write(tmp.resolve("sub/config/database.yaml"), DATABASE_YAML);

    assertEquals(nearer, resolver.findNearestConfig(tmp.resolve("sub"), "database.yaml"));
  }

  @Test
  void searchStopsAtProjectRootMarker() throws IOException {
    write(tmp.resolve("config/database.yaml"), DATABASE_YAML);
    Path project = Files.createDirectories(tmp.resolve("project"));
    Files.writeString(project.resolve("README.md"), "# project");
    Path start = Files.createDirectories(project.resolve("src"));

    var ex = assertThrows(ConfigNotFoundException.class,
        () -> resolver.findNearestConfig(start, "database.yaml"));
    assertEquals(ErrorKind.CONFIG_NOT_FOUND, ex.kind());
  }

  @Test
  void searchIsBoundedByDepth() throws IOException {
    write(tmp.resolve("config/database.yaml"), DATABASE_YAML);
    Path deep = Files.createDirectories(tmp.resolve("a/b/c/d/e/f"));

    assertThrows(ConfigNotFoundException.class,
        () -> new ConfigResolver("README.md", 2).findNearestConfig(deep, "database.yaml"));
  }

  @Test
  void findsProjectRootByMarker() throws IOException {
    Files.writeString(tmp.resolve("README.md"), "# root");
    Path start = Files.createDirectories(tmp.resolve("a/b"));

    assertEquals(tmp, resolver.findProjectRoot(start));
  }

  @Test
  void missingProjectRootIsConfigNotFound() throws IOException {
    Path start = Files.createDirectories(tmp.resolve("a"));

    assertThrows(ConfigNotFoundException.class,
        () -> new ConfigResolver("NO_SUCH_MARKER", 2).findProjectRoot(start));
  }

  @Test
  void loadsConnectionConfig() throws IOException {
    Path config = write(tmp.resolve("config/database.yaml"), DATABASE_YAML);

    ConnectionConfig connection = resolver.connectionConfig(config);

    assertEquals("localhost", connection.host());
    assertEquals(5432, connection.port());
    assertEquals("kaggle", connection.name());
    assertEquals(5, connection.poolSize());
    assertEquals(Duration.ofMillis(2500), connection.poolTimeout());
  }

  @Test
  void loadsLoggingConfig() throws IOException {
    Path config = write(tmp.resolve("config/database.yaml"), DATABASE_YAML);

    LoggingConfig logging = resolver.loggingConfig(config);

    assertEquals("logs/app.log", logging.path());
    assertEquals("database", logging.name());
    assertEquals(Level.INFO, logging.fileLevel());
    assertEquals(Level.FINE, logging.consoleLevel());
    assertNull(logging.format());
  }

  @Test
  void missingFileIsConfigNotFound() {
    assertThrows(ConfigNotFoundException.class, () -> resolver.load(tmp.resolve("nope.yaml")));
  }

  @Test
  void malformedYamlIsConfigParse() throws IOException {
    Path config = write(tmp.resolve("bad.yaml"), "database: [unclosed\n  host: x");

    var ex = assertThrows(ConfigParseException.class, () -> resolver.load(config));
    assertEquals(ErrorKind.CONFIG_PARSE, ex.kind());
  }

  @Test
  void nonMappingRootIsConfigParse() throws IOException {
    Path config = write(tmp.resolve("list.yaml"), "- a\n- b\n");

    assertThrows(ConfigParseException.class, () -> resolver.load(config));
  }

  @Test
  void emptyFileLoadsAsEmptyMap() throws IOException {
    Path config = write(tmp.resolve("empty.yaml"), "");

    assertEquals(Map.of(), resolver.load(config));
  }

  @Test
  void missingDatabaseSectionIsConfigParse() throws IOException {
    Path config = write(tmp.resolve("config/database.yaml"), "logging:\n  path: a\n  name: b\n");

    assertThrows(ConfigParseException.class, () -> resolver.connectionConfig(config));
  }

  @Test
  void missingRequiredKeysInFileAreReported() throws IOException {
    Path config = write(tmp.resolve("config/database.yaml"), "database:\n  host: h\n  port: 1\n");

    var ex = assertThrows(MissingConnectionParameterException.class,
        () -> resolver.connectionConfig(config));
    assertEquals(java.util.List.of("name", "user", "password"), ex.missingKeys());
  }

  @Test
  void unknownLogLevelIsConfigParse() throws IOException {
    Path config = write(tmp.resolve("config/database.yaml"),
        "logging:\n  path: a.log\n  name: b\n  file_level: LOUD\n");

    assertThrows(ConfigParseException.class, () -> resolver.loggingConfig(config));
  }
}
