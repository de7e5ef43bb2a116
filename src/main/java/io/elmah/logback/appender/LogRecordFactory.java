package io.elmah.logback.appender;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.LoggerContextVO;
import ch.qos.logback.classic.spi.StackTraceElementProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.Layout;
import io.elmah.logback.application.port.RequestContextProvider;
import io.elmah.logback.domain.ExceptionInfo;
import io.elmah.logback.domain.LogLevel;
import io.elmah.logback.domain.LogRecord;
import io.elmah.logback.domain.RequestInfo;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Marker;
import org.slf4j.event.KeyValuePair;

/**
 * Snapshots a Logback event into a {@link LogRecord} on the logging thread.
 * <p>Properties merge the MDC (when enabled) with the SLF4J key/value pairs; a key/value pair wins over an MDC
 * entry with the same key. An {@code ERROR} event carrying the {@code FATAL} marker becomes {@link LogLevel#FATAL}.</p>
 */
final class LogRecordFactory {
  static final String FATAL_MARKER = "FATAL";

  private final Layout<ILoggingEvent> titleLayout;
  private final boolean includeMdc;
  private final RequestContextProvider requestContext;

  LogRecordFactory(Layout<ILoggingEvent> titleLayout, boolean includeMdc, RequestContextProvider requestContext) {
    this.titleLayout = titleLayout;
    this.includeMdc = includeMdc;
    this.requestContext = requestContext;
  }

  LogRecord create(ILoggingEvent event) {
    Set<String> markers = markerNames(event.getMarkerList());
    return new LogRecord(
        event.getInstant(),
        level(event.getLevel(), markers),
        event.getLoggerName(),
        event.getThreadName(),
        event.getMessage(),
        event.getFormattedMessage(),
        titleLayout == null ? null : titleLayout.doLayout(event),
        properties(event),
        contextProperties(event.getLoggerContextVO()),
        exception(event.getThrowableProxy()),
        request(),
        markers);
  }

  private Map<String, Object> properties(ILoggingEvent event) {
    Map<String, Object> properties = new LinkedHashMap<>();
    if (includeMdc) {
      Map<String, String> mdc = event.getMDCPropertyMap();
      if (mdc != null) {
        properties.putAll(mdc);
      }
    }
    List<KeyValuePair> pairs = event.getKeyValuePairs();
    if (pairs != null) {
      for (KeyValuePair pair : pairs) {
        if (pair != null && pair.key != null) {
          properties.put(pair.key, pair.value);
        }
      }
    }
    return properties;
  }

  private RequestInfo request() {
    if (requestContext == null) {
      return null;
    }
    return requestContext.currentRequest().orElse(null);
  }

  private static Map<String, String> contextProperties(LoggerContextVO context) {
    if (context == null || context.getPropertyMap() == null) {
      return Map.of();
    }
    Map<String, String> copy = new LinkedHashMap<>();
    context.getPropertyMap().forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    return copy;
  }

  static LogLevel level(Level level, Set<String> markers) {
    if (level == null) {
      return LogLevel.INFO;
    }
    return switch (level.toInt()) {
      case Level.ERROR_INT -> markers.contains(FATAL_MARKER) ? LogLevel.FATAL : LogLevel.ERROR;
      case Level.WARN_INT -> LogLevel.WARN;
      case Level.DEBUG_INT -> LogLevel.DEBUG;
      case Level.TRACE_INT -> LogLevel.TRACE;
      default -> LogLevel.INFO;
    };
  }

  private static Set<String> markerNames(List<Marker> markers) {
    if (markers == null || markers.isEmpty()) {
      return Set.of();
    }
    Set<String> names = new LinkedHashSet<>();
    for (Marker marker : markers) {
      collect(marker, names);
    }
    return names;
  }

  private static void collect(Marker marker, Set<String> names) {
    if (marker == null || !names.add(marker.getName())) {
      return;
    }
    Iterator<Marker> references = marker.iterator();
    while (references.hasNext()) {
      collect(references.next(), names);
    }
  }

  static ExceptionInfo exception(IThrowableProxy proxy) {
    if (proxy == null) {
      return null;
    }
    IThrowableProxy base = proxy;
    while (base.getCause() != null && base.getCause() != base) {
      base = base.getCause();
    }
    return new ExceptionInfo(
        proxy.getClassName(),
        proxy.getMessage(),
        ThrowableProxyUtil.asString(proxy),
        base.getClassName(),
        firstFrameClass(base));
  }

  private static String firstFrameClass(IThrowableProxy proxy) {
    StackTraceElementProxy[] frames = proxy.getStackTraceElementProxyArray();
    if (frames == null || frames.length == 0 || frames[0] == null) {
      return null;
    }
    return frames[0].getStackTraceElement().getClassName();
  }
}
