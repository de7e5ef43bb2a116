package io.elmah.logback.domain;

/**
 * Message severities accepted by the elmah.io API. The wire value is the constant name.
 *
 * @since 1.0.0
 */
public enum Severity {
  Verbose,
  Debug,
  Information,
  Warning,
  Error,
  Fatal;

  /**
   * Maps a logging level to its API severity.
   *
   * @param level logging level; {@code null} maps to {@link #Information}
   * @return matching severity
   */
  public static Severity fromLevel(LogLevel level) {
    if (level == null) {
      return Information;
    }
    return switch (level) {
      case TRACE -> Verbose;
      case DEBUG -> Debug;
      case WARN -> Warning;
      case ERROR -> Error;
      case FATAL -> Fatal;
      default -> Information;
    };
  }
}
