package io.elmah.logback.domain;

import java.util.Objects;

/**
 * Snapshot of the throwable attached to a log event.
 *
 * @param className fully qualified class name of the logged throwable
 * @param message throwable message; may be {@code null}
 * @param stackTrace full rendered stack trace including causes
 * @param baseClassName class name of the innermost cause
 * @param baseSource declaring class of the innermost cause's first stack frame; may be {@code null}
 * @since 1.0.0
 */
public record ExceptionInfo(
    String className,
    String message,
    String stackTrace,
    String baseClassName,
    String baseSource) {

  public ExceptionInfo {
    Objects.requireNonNull(className, "className");
    Objects.requireNonNull(stackTrace, "stackTrace");
    baseClassName = baseClassName == null ? className : baseClassName;
  }
}
