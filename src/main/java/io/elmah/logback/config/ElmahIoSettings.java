package io.elmah.logback.config;

import io.elmah.logback.logging.Logs;
import io.elmah.logback.validation.Net;
import io.elmah.logback.validation.Strings;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Connection settings of one appender after every source has been consulted.
 * <p><strong>Why:</strong> Secrets such as the API key rarely belong in {@code logback.xml}; they may come from a
 * YAML file, a system property or the environment instead.</p>
 * <p><strong>Precedence:</strong> appender setter &gt; YAML file &gt; system property {@code elmahio.<key>} &gt;
 * environment variable {@code ELMAHIO_<KEY>} (for example {@code ELMAHIO_API_KEY}).</p>
 *
 * @param apiKey API key; never blank
 * @param logId destination log
 * @param application application name; {@code null} when unset
 * @param proxy HTTP proxy; {@code null} for direct connections
 * @param baseUrl API endpoint; {@code null} for the public API
 * @since 1.0.0
 */
public record ElmahIoSettings(
    String apiKey,
    UUID logId,
    String application,
    InetSocketAddress proxy,
    URI baseUrl) {

  public static final String API_KEY = "apiKey";
  public static final String LOG_ID = "logId";
  public static final String APPLICATION = "application";
  public static final String PROXY = "proxy";
  public static final String BASE_URL = "baseUrl";

  /** Setting keys in the order they are reported. */
  public static final List<String> KEYS = List.of(API_KEY, LOG_ID, APPLICATION, PROXY, BASE_URL);

  public ElmahIoSettings {
    Strings.requireNonBlank(API_KEY, apiKey);
    Objects.requireNonNull(logId, LOG_ID);
  }

  /**
   * Resolves settings from the JVM system properties and environment.
   *
   * @param explicit values set on the appender; {@code null} values are ignored
   * @param yaml values loaded from the YAML file; may be empty
   * @param warn receives a message for each YAML key that is not a setting; may be {@code null}
   * @return validated settings
   * @throws IllegalArgumentException when a required value is missing or a value is malformed
   */
  public static ElmahIoSettings resolve(
      Map<String, String> explicit, Map<String, String> yaml, Consumer<String> warn) {
    return resolve(explicit, yaml, warn, System::getProperty, System::getenv);
  }

  static ElmahIoSettings resolve(
      Map<String, String> explicit,
      Map<String, String> yaml,
      Consumer<String> warn,
      UnaryOperator<String> systemProperties,
      UnaryOperator<String> environment) {
    Map<String, String> explicitCopy = explicit == null ? Map.of() : explicit;
    Map<String, String> yamlCopy = yaml == null ? Map.of() : yaml;
    if (warn != null) {
      for (String key : yamlCopy.keySet()) {
        if (!KEYS.contains(key)) {
          warn.accept("Ignoring unknown YAML setting: " + key);
        }
      }
    }

    Map<String, String> merged = new LinkedHashMap<>();
    for (String key : KEYS) {
      String value = Strings.firstNonBlank(
          explicitCopy.get(key),
          yamlCopy.get(key),
          systemProperties.apply("elmahio." + key),
          environment.apply(environmentName(key)));
      if (value != null) {
        merged.put(key, value.trim());
      }
    }

    String apiKey = merged.get(API_KEY);
    if (apiKey == null) {
      throw new IllegalArgumentException(missing(API_KEY));
    }
    String rawLogId = merged.get(LOG_ID);
    if (rawLogId == null) {
      throw new IllegalArgumentException(missing(LOG_ID));
    }
    return new ElmahIoSettings(
        apiKey,
        parseLogId(rawLogId),
        merged.get(APPLICATION),
        merged.containsKey(PROXY) ? Net.toSocketAddress(merged.get(PROXY)) : null,
        merged.containsKey(BASE_URL) ? parseBaseUrl(merged.get(BASE_URL)) : null);
  }

  /**
   * Returns the environment variable consulted for a setting.
   *
   * @param key setting key such as {@code apiKey}
   * @return upper snake case name such as {@code ELMAHIO_API_KEY}
   */
  public static String environmentName(String key) {
    StringBuilder name = new StringBuilder("ELMAHIO_");
    for (int i = 0; i < key.length(); i++) {
      char c = key.charAt(i);
      if (Character.isUpperCase(c) && i > 0) {
        name.append('_');
      }
      name.append(Character.toUpperCase(c));
    }
    return name.toString();
  }

  private static UUID parseLogId(String raw) {
    try {
      return UUID.fromString(raw);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("logId must be a UUID: " + raw, ex);
    }
  }

  private static URI parseBaseUrl(String raw) {
    URI uri;
    try {
      uri = URI.create(raw);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("baseUrl is not a valid URI: " + raw, ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("baseUrl must be an absolute http(s) URI: " + raw);
    }
    return uri;
  }

  private static String missing(String key) {
    return key + " is required; set it on the appender, in configFile, as -Delmahio." + key
        + " or as " + environmentName(key);
  }

  @Override
  public String toString() {
    return "ElmahIoSettings{apiKey=" + Logs.redact(apiKey)
        + ", logId=" + logId
        + ", application=" + application
        + ", proxy=" + proxy
        + ", baseUrl=" + baseUrl
        + '}';
  }
}
