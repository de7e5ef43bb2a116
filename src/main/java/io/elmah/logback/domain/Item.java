package io.elmah.logback.domain;

import java.util.Objects;

/**
 * Key/value pair used for cookies, form fields, query string entries, server variables and data.
 *
 * @param key item name; never {@code null}
 * @param value item value; may be {@code null}
 * @since 1.0.0
 */
public record Item(String key, String value) {
  public Item {
    Objects.requireNonNull(key, "key");
  }
}
