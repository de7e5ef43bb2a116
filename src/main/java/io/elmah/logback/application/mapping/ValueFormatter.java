package io.elmah.logback.application.mapping;

import java.lang.reflect.Array;
import java.util.Iterator;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Formats structured property values as text.
 * <p>Maps render as {@code "k1"="v1", "k2"="v2"}, the same shape {@link ItemsParser} reads back, so a map
 * logged under a well-known name (for example {@code cookies}) becomes a list of items. Iterables and arrays
 * render as {@code "a", "b"}. Everything else uses {@link String#valueOf(Object)}.</p>
 *
 * @since 1.0.0
 */
public final class ValueFormatter {
  private static final String SEPARATOR = ", ";

  private ValueFormatter() {}

  /**
   * Formats a property value.
   *
   * @param value value to format; {@code null} yields an empty string
   * @return text form of the value
   */
  public static String format(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Map<?, ?> map) {
      return formatMap(map);
    }
    if (value instanceof Iterable<?> iterable) {
      return formatIterator(iterable.iterator());
    }
    if (value.getClass().isArray()) {
      return formatArray(value);
    }
    return String.valueOf(value);
  }

  private static String formatMap(Map<?, ?> map) {
    StringJoiner joiner = new StringJoiner(SEPARATOR);
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      String key = quote(String.valueOf(entry.getKey()));
      Object value = entry.getValue();
      joiner.add(value == null ? key : key + '=' + quote(format(value)));
    }
    return joiner.toString();
  }

  private static String formatIterator(Iterator<?> iterator) {
    StringJoiner joiner = new StringJoiner(SEPARATOR);
    while (iterator.hasNext()) {
      joiner.add(element(iterator.next()));
    }
    return joiner.toString();
  }

  private static String formatArray(Object array) {
    StringJoiner joiner = new StringJoiner(SEPARATOR);
    int length = Array.getLength(array);
    for (int i = 0; i < length; i++) {
      joiner.add(element(Array.get(array, i)));
    }
    return joiner.toString();
  }

  private static String element(Object value) {
    if (value instanceof CharSequence) {
      return quote(value.toString());
    }
    return format(value);
  }

  private static String quote(String value) {
    return '"' + value + '"';
  }
}
