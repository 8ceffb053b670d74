package io.dbkit.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * {@link Formatter} driven by a {@link String#format} pattern, with the same argument order as
 * {@link java.util.logging.SimpleFormatter}:
 * <ol>
 *   <li>timestamp ({@link ZonedDateTime})</li>
 *   <li>source (class and method, or logger name)</li>
 *   <li>logger name</li>
 *   <li>level ({@code DEBUG}, {@code INFO}, {@code WARNING}, {@code ERROR})</li>
 *   <li>formatted message</li>
 *   <li>stack trace, prefixed by a line separator, or empty</li>
 * </ol>
 */
public final class PatternFormatter extends Formatter {
  public static final String DEFAULT_PATTERN = "%1$tF %1$tT - %3$s - %4$s - %5$s%6$s%n";

  private final String pattern;

  public PatternFormatter() {
    this(DEFAULT_PATTERN);
  }

  public PatternFormatter(String pattern) {
    this.pattern = Objects.requireNonNull(pattern, "pattern");
  }

  public String pattern() {
    return pattern;
  }

  @Override
  public String format(LogRecord record) {
    ZonedDateTime time = ZonedDateTime.ofInstant(record.getInstant(), ZoneId.systemDefault());
    String source = record.getSourceClassName() != null
        ? record.getSourceClassName()
            + (record.getSourceMethodName() != null ? " " + record.getSourceMethodName() : "")
        : record.getLoggerName();
    String thrown = "";
    if (record.getThrown() != null) {
      StringWriter sw = new StringWriter();
      try (PrintWriter pw = new PrintWriter(sw)) {
        pw.println();
        record.getThrown().printStackTrace(pw);
      }
      thrown = sw.toString();
    }
    return String.format(pattern, time, source, record.getLoggerName(),
        LogLevels.displayName(record.getLevel()), formatMessage(record), thrown);
  }
}
