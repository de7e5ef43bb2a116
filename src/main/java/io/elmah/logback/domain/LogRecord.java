package io.elmah.logback.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of one log event, captured on the logging thread before it is queued.
 * <p>Everything a field lookup may read lives here, so lookups can be evaluated later on the batch
 * worker without touching thread-local state.</p>
 *
 * @param timestamp event time
 * @param level event level
 * @param loggerName logger that produced the event
 * @param threadName thread that produced the event; may be {@code null}
 * @param messageTemplate raw message pattern before argument substitution; may be {@code null}
 * @param formattedMessage message after argument substitution; may be {@code null}
 * @param renderedTitle title rendered by a configured layout; {@code null} when no layout is set
 * @param properties event properties in lookup order; values may be {@code null}
 * @param contextProperties properties of the logging context
 * @param exception attached throwable snapshot; may be {@code null}
 * @param request request active on the logging thread; may be {@code null}
 * @param markers names of the markers attached to the event
 * @since 1.0.0
 */
public record LogRecord(
    Instant timestamp,
    LogLevel level,
    String loggerName,
    String threadName,
    String messageTemplate,
    String formattedMessage,
    String renderedTitle,
    Map<String, Object> properties,
    Map<String, String> contextProperties,
    ExceptionInfo exception,
    RequestInfo request,
    Set<String> markers) {

  public LogRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    loggerName = loggerName == null ? "" : loggerName;
    properties = properties == null || properties.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    contextProperties = contextProperties == null ? Map.of() : Map.copyOf(contextProperties);
    markers = markers == null ? Set.of() : Set.copyOf(markers);
  }

  /**
   * Returns the exception snapshot when present.
   *
   * @return optional exception
   */
  public Optional<ExceptionInfo> exceptionInfo() {
    return Optional.ofNullable(exception);
  }

  /**
   * Returns the request snapshot when present.
   *
   * @return optional request
   */
  public Optional<RequestInfo> requestInfo() {
    return Optional.ofNullable(request);
  }
}
