package io.dbkit.logging;

import io.dbkit.config.ConfigParseException;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;

/**
 * Maps level names found in config files onto {@link Level}.
 *
 * <p>Accepts the conventional names ({@code DEBUG, INFO, WARN, WARNING, ERROR, CRITICAL}) as
 * well as the JUL ones ({@code FINE, SEVERE, ALL, OFF}), case-insensitively.
 */
public final class LogLevels {

  private LogLevels() {}

  public static Level parse(String name) {
    Objects.requireNonNull(name, "name");
    return switch (name.trim().toUpperCase(Locale.ROOT)) {
      case "ALL" -> Level.ALL;
      case "TRACE", "FINEST" -> Level.FINEST;
      case "FINER" -> Level.FINER;
      case "DEBUG", "FINE" -> Level.FINE;
      case "CONFIG" -> Level.CONFIG;
      case "INFO" -> Level.INFO;
      case "WARN", "WARNING" -> Level.WARNING;
      case "ERROR", "CRITICAL", "FATAL", "SEVERE" -> Level.SEVERE;
      case "OFF" -> Level.OFF;
      default -> throw new ConfigParseException("Unknown log level: '" + name + "'");
    };
  }

  /**
   * Returns the conventional display name for {@code level}: {@code DEBUG} for FINE, {@code ERROR}
   * for SEVERE, the JUL name otherwise.
   */
  public static String displayName(Level level) {
    if (level == Level.FINE) {
      return "DEBUG";
    }
    if (level == Level.SEVERE) {
      return "ERROR";
    }
    return level.getName();
  }
}
