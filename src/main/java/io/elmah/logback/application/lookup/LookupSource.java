package io.elmah.logback.application.lookup;

import io.elmah.logback.domain.LogRecord;

/**
 * One step of a {@link FieldLookup} cascade.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface LookupSource {

  /**
   * Renders this source for the given record.
   *
   * @param record captured log event
   * @return rendered text; {@code null} or blank lets the cascade continue
   */
  String render(LogRecord record);
}
