package io.elmah.logback.domain;

/**
 * Logging levels understood by the message mapper.
 * <p>Logback stops at {@code ERROR}; {@link #FATAL} is derived from a {@code FATAL} marker on an
 * error event.</p>
 *
 * @since 1.0.0
 */
public enum LogLevel {
  TRACE,
  DEBUG,
  INFO,
  WARN,
  ERROR,
  FATAL
}
