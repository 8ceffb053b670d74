package io.dbkit.logging;

import io.dbkit.config.LoggingConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a {@link Logger} that writes to a log file and to the console, each with its own
 * threshold.
 *
 * <p>The logger is meant to be created once at start-up and handed to
 * {@code DatabaseManager} (and anything else that logs). Creation is idempotent: asking
 * for a logger name that already has handlers returns it untouched, so repeated set-up
 * calls do not duplicate output.
 */
public final class AppLogger {

  private AppLogger() {}

  public static Logger create(String name, Path logFile) {
    return create(name, logFile, Level.INFO, Level.INFO, PatternFormatter.DEFAULT_PATTERN);
  }

  /**
   * @param name         logger name
   * @param logFile      file to append to; parent directories are created
   * @param fileLevel    threshold for the file sink
   * @param consoleLevel threshold for the console sink
   * @param pattern      format pattern, see {@link PatternFormatter}
   * @throws UncheckedIOException if the log file cannot be opened
   */
  public static Logger create(String name, Path logFile, Level fileLevel, Level consoleLevel,
      String pattern) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(logFile, "logFile");
    Logger logger = Logger.getLogger(name);
    synchronized (logger) {
      if (logger.getHandlers().length > 0) {
        return logger;
      }
      Formatter formatter = new PatternFormatter(pattern == null ? PatternFormatter.DEFAULT_PATTERN : pattern);
      FileHandler fileHandler;
      try {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        fileHandler = new FileHandler(logFile.toString(), true);
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot open log file " + logFile, e);
      }
      fileHandler.setLevel(fileLevel);
      fileHandler.setFormatter(formatter);

      ConsoleHandler consoleHandler = new ConsoleHandler();
      consoleHandler.setLevel(consoleLevel);
      consoleHandler.setFormatter(formatter);

      logger.addHandler(fileHandler);
      logger.addHandler(consoleHandler);
      logger.setLevel(lowest(fileLevel, consoleLevel));
      logger.setUseParentHandlers(false);
      return logger;
    }
  }

  /**
   * Builds the logger described by a {@code logging} config section. A relative
   * {@link LoggingConfig#path()} is resolved against {@code projectRoot}.
   */
  public static Logger fromConfig(LoggingConfig config, Path projectRoot) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(projectRoot, "projectRoot");
    Path path = Path.of(config.path());
    Path logFile = path.isAbsolute() ? path : projectRoot.resolve(path);
    return create(config.name(), logFile, config.fileLevel(), config.consoleLevel(), config.format());
  }

  private static Level lowest(Level a, Level b) {
    return a.intValue() <= b.intValue() ? a : b;
  }
}
