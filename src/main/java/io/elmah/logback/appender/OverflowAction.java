package io.elmah.logback.appender;

/**
 * What {@link AsyncBatchingAppenderBase} does with an event that arrives while the queue is full.
 *
 * @since 1.0.0
 */
public enum OverflowAction {
  /** Drop the new event and count it under {@code elmahio.events.dropped}. */
  DISCARD,
  /** Block the logging thread until the worker frees space. */
  BLOCK,
  /** Accept the event beyond the configured limit. */
  GROW
}
