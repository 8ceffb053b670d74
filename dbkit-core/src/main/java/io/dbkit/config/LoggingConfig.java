package io.dbkit.config;

import io.dbkit.logging.LogLevels;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;

/**
 * The {@code logging} section of a configuration file.
 *
 * @param path         log file path, relative to the project root unless absolute
 * @param name         logger name
 * @param fileLevel    minimum level written to the file
 * @param consoleLevel minimum level written to the console
 * @param format       {@link java.util.Formatter} pattern, or {@code null} for the default
 */
public record LoggingConfig(String path, String name, Level fileLevel, Level consoleLevel,
    String format) {

  public static final String PATH = "path";
  public static final String NAME = "name";
  public static final String FILE_LEVEL = "file_level";
  public static final String CONSOLE_LEVEL = "console_level";
  public static final String FORMAT = "format";

  public LoggingConfig {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(fileLevel, "fileLevel");
    Objects.requireNonNull(consoleLevel, "consoleLevel");
  }

  public LoggingConfig(String path, String name) {
    this(path, name, Level.INFO, Level.INFO, null);
  }

  /**
   * Reads a {@code logging} section.
   *
   * @throws ConfigParseException if {@code path} or {@code name} is missing or a level is unknown
   */
  public static LoggingConfig fromMap(Map<String, ?> section) {
    Objects.requireNonNull(section, "section");
    String path = required(section, PATH);
    String name = required(section, NAME);
    Level fileLevel = optionalLevel(section, FILE_LEVEL);
    Level consoleLevel = optionalLevel(section, CONSOLE_LEVEL);
    Object format = section.get(FORMAT);
    return new LoggingConfig(path, name, fileLevel, consoleLevel,
        format == null ? null : format.toString());
  }

  private static String required(Map<String, ?> section, String key) {
    Object value = section.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new ConfigParseException("logging section is missing '" + key + "'");
    }
    return value.toString();
  }

  private static Level optionalLevel(Map<String, ?> section, String key) {
    Object value = section.get(key);
    return value == null ? Level.INFO : LogLevels.parse(value.toString());
  }
}
