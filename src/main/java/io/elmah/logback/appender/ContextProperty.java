package io.elmah.logback.appender;

import io.elmah.logback.validation.Strings;

/**
 * Extra data item rendered for every event.
 * <p>Configured from {@code logback.xml} as a nested {@code <contextProperty>} element with a {@code name} and
 * a lookup expression in {@code lookup}.</p>
 *
 * @since 1.0.0
 */
public final class ContextProperty {
  private String name;
  private String lookup;

  public ContextProperty() {}

  public ContextProperty(String name, String lookup) {
    setName(name);
    setLookup(lookup);
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = Strings.requireNonBlank("contextProperty.name", name);
  }

  public String getLookup() {
    return lookup;
  }

  public void setLookup(String lookup) {
    this.lookup = Strings.requireNonBlank("contextProperty.lookup", lookup);
  }

  @Override
  public String toString() {
    return "ContextProperty{" + name + '=' + lookup + '}';
  }
}
