package io.elmah.logback.application.lookup;

import io.elmah.logback.domain.LogRecord;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved lookup for every {@link LookupField}.
 *
 * @since 1.0.0
 */
public final class FieldLookups {
  private final Map<LookupField, FieldLookup> lookups;

  private FieldLookups(Map<LookupField, FieldLookup> lookups) {
    this.lookups = Collections.unmodifiableMap(new EnumMap<>(lookups));
  }

  /**
   * Builds lookups from defaults and user overrides.
   * <p>An override is parsed as is and its errors propagate. A default is parsed from its primary expression
   * and falls back to the secondary expression when the registry lacks a source the primary needs.</p>
   *
   * @param registry registry resolving source names
   * @param overrides user supplied expressions keyed by field; may be empty
   * @return resolved lookups
   * @throws IllegalArgumentException when an override is invalid
   */
  public static FieldLookups resolve(LookupRegistry registry, Map<LookupField, String> overrides) {
    Objects.requireNonNull(registry, "registry");
    Map<LookupField, String> effectiveOverrides = overrides == null ? Map.of() : overrides;
    Map<LookupField, FieldLookup> resolved = new EnumMap<>(LookupField.class);
    for (LookupField field : LookupField.values()) {
      String override = effectiveOverrides.get(field);
      if (override != null) {
        resolved.put(field, parseOverride(field, override, registry));
      } else {
        resolved.put(field, parseDefault(field, registry));
      }
    }
    return new FieldLookups(resolved);
  }

  /**
   * Resolves the defaults against a registry without overrides.
   *
   * @param registry registry resolving source names
   * @return resolved lookups
   */
  public static FieldLookups defaults(LookupRegistry registry) {
    return resolve(registry, Map.of());
  }

  private static FieldLookup parseOverride(LookupField field, String expression, LookupRegistry registry) {
    try {
      return FieldLookup.parse(expression, registry);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid " + field + " lookup: " + ex.getMessage(), ex);
    }
  }

  private static FieldLookup parseDefault(LookupField field, LookupRegistry registry) {
    try {
      return FieldLookup.parse(field.primary(), registry);
    } catch (IllegalArgumentException ex) {
      return FieldLookup.parse(field.fallback(), registry);
    }
  }

  /**
   * Returns the lookup for a field.
   *
   * @param field message field
   * @return compiled lookup
   */
  public FieldLookup get(LookupField field) {
    return lookups.get(field);
  }

  /**
   * Renders a field for a record.
   *
   * @param field message field
   * @param record captured log event
   * @return rendered text, never {@code null}
   */
  public String render(LookupField field, LogRecord record) {
    return lookups.get(field).render(record);
  }
}
