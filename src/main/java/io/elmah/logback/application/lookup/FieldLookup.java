package io.elmah.logback.application.lookup;

import io.elmah.logback.domain.LogRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiled lookup expression such as {@code property:hostname|property:HostName|machinename}.
 * <p>Sources are evaluated left to right and the first non-blank value wins. When every source is blank
 * the lookup renders an empty string.</p>
 *
 * @since 1.0.0
 */
public final class FieldLookup {
  private static final char SOURCE_SEPARATOR = '|';

  private final String expression;
  private final List<LookupSource> sources;

  private FieldLookup(String expression, List<LookupSource> sources) {
    this.expression = expression;
    this.sources = List.copyOf(sources);
  }

  /**
   * Parses an expression against a registry.
   *
   * @param expression {@code |}-separated list of {@code name[:argument]} sources
   * @param registry registry resolving source names
   * @return compiled lookup
   * @throws IllegalArgumentException when the expression is blank or references an unknown source
   */
  public static FieldLookup parse(String expression, LookupRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("Lookup expression must not be blank");
    }
    List<LookupSource> sources = new ArrayList<>();
    int start = 0;
    while (start <= expression.length()) {
      int end = expression.indexOf(SOURCE_SEPARATOR, start);
      if (end < 0) {
        end = expression.length();
      }
      String segment = expression.substring(start, end).trim();
      if (segment.isEmpty()) {
        throw new IllegalArgumentException("Empty lookup source in '" + expression + "'");
      }
      sources.add(createSource(segment, registry));
      start = end + 1;
    }
    return new FieldLookup(expression.trim(), sources);
  }

  private static LookupSource createSource(String segment, LookupRegistry registry) {
    int colon = segment.indexOf(':');
    if (colon < 0) {
      return registry.create(segment, null);
    }
    return registry.create(segment.substring(0, colon), segment.substring(colon + 1));
  }

  /**
   * Renders the first non-blank source value.
   *
   * @param record captured log event
   * @return rendered value, never {@code null}
   */
  public String render(LogRecord record) {
    for (LookupSource source : sources) {
      String value = source.render(record);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return "";
  }

  /**
   * Returns the normalized source expression.
   *
   * @return expression text
   */
  public String expression() {
    return expression;
  }

  @Override
  public String toString() {
    return "FieldLookup{" + expression + '}';
  }
}
