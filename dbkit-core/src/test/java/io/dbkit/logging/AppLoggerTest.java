package io.dbkit.logging;

import io.dbkit.config.ConfigParseException;
import io.dbkit.config.LoggingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppLoggerTest {
  @TempDir
  Path tmp;

  private final List<Logger> created = new ArrayList<>();

  @AfterEach
  void closeHandlers() {
    for (Logger logger : created) {
      for (Handler handler : logger.getHandlers()) {
        handler.close();
        logger.removeHandler(handler);
      }
    }
  }

  private Logger create(String name, Path file, Level fileLevel, Level consoleLevel) {
    Logger logger = AppLogger.create(name, file, fileLevel, consoleLevel, null);
    created.add(logger);
    return logger;
  }

  @Test
  void createsFileAndConsoleSinks() {
    Logger logger = create("app-" + UUID.randomUUID(), tmp.resolve("logs/app.log"),
        Level.INFO, Level.WARNING);

    Handler[] handlers = logger.getHandlers();
    assertEquals(2, handlers.length);
    assertInstanceOf(FileHandler.class, handlers[0]);
    assertEquals(Level.INFO, handlers[0].getLevel());
    assertInstanceOf(ConsoleHandler.class, handlers[1]);
    assertEquals(Level.WARNING, handlers[1].getLevel());
    assertFalse(logger.getUseParentHandlers());
  }

  @Test
  void createsLogDirectory() {
    create("dir-" + UUID.randomUUID(), tmp.resolve("nested/deeper/app.log"), Level.INFO, Level.INFO);

    assertTrue(Files.isDirectory(tmp.resolve("nested/deeper")));
  }

  @Test
  void repeatedCreationDoesNotDuplicateHandlers() {
    String name = "dedupe-" + UUID.randomUUID();
    Logger first = create(name, tmp.resolve("a.log"), Level.INFO, Level.INFO);
    Logger second = create(name, tmp.resolve("b.log"), Level.FINE, Level.FINE);

    assertSame(first, second);
    assertEquals(2, second.getHandlers().length);
  }

  @Test
  void fileSinkUsesTimeNameLevelMessageFormat() throws IOException {
    String name = "format-" + UUID.randomUUID();
    Path file = tmp.resolve("format.log");
    Logger logger = create(name, file, Level.INFO, Level.OFF);

    logger.info("engine created");
    logger.fine("not written");
    for (Handler handler : logger.getHandlers()) {
      handler.flush();
    }

    String content = Files.readString(file);
    assertTrue(content.matches("(?s)\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} - " + name
        + " - INFO - engine created\\R"), content);
  }

  @Test
  void fromConfigResolvesRelativePathAgainstProjectRoot() {
    String name = "cfg-" + UUID.randomUUID();
    LoggingConfig config = new LoggingConfig("logs/db.log", name);

    created.add(AppLogger.fromConfig(config, tmp));

    assertTrue(Files.exists(tmp.resolve("logs/db.log")));
  }

  @Test
  void formatterRendersThrowable() {
    PatternFormatter formatter = new PatternFormatter();
    LogRecord record = new LogRecord(Level.SEVERE, "boom");
    record.setLoggerName("db");
    record.setThrown(new IllegalStateException("cause"));

    String line = formatter.format(record);

    assertTrue(line.contains(" - db - ERROR - boom"));
    assertTrue(line.contains("java.lang.IllegalStateException: cause"));
  }

  @Test
  void levelNamesParse() {
    assertEquals(Level.FINE, LogLevels.parse("debug"));
    assertEquals(Level.WARNING, LogLevels.parse("WARN"));
    assertEquals(Level.SEVERE, LogLevels.parse("critical"));
    assertThrows(ConfigParseException.class, () -> LogLevels.parse("verbose"));
  }
}
