package io.elmah.logback.application.lookup;

import io.elmah.logback.application.mapping.ItemsParser;
import io.elmah.logback.application.mapping.ValueFormatter;
import io.elmah.logback.domain.LogRecord;
import io.elmah.logback.domain.RequestInfo;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Named factories for {@link LookupSource}s.
 * <p>Built-in sources are {@code property}, {@code context}, {@code logger}, {@code machinename},
 * {@code environment-user} and {@code literal}. The {@code request} source is only registered by
 * {@link #withRequestSources()}, so expressions that reference it fail to parse when no request context is
 * available.</p>
 *
 * @since 1.0.0
 */
public final class LookupRegistry {
  private static final Set<String> REQUEST_FIELDS = Set.of(
      "host", "method", "url", "statuscode", "user", "cookies", "form", "querystring", "headers");

  private final Map<String, Function<String, LookupSource>> factories;

  private LookupRegistry(Map<String, Function<String, LookupSource>> factories) {
    this.factories = Map.copyOf(factories);
  }

  /**
   * Creates a registry holding the built-in sources without request support.
   *
   * @return registry instance
   */
  public static LookupRegistry defaults() {
    return new LookupRegistry(builtIns());
  }

  /**
   * Creates a registry holding the built-in sources and the {@code request} source.
   *
   * @return registry instance
   */
  public static LookupRegistry withRequestSources() {
    Map<String, Function<String, LookupSource>> factories = builtIns();
    factories.put("request", LookupRegistry::requestSource);
    return new LookupRegistry(factories);
  }

  /**
   * Reports whether a source name is registered.
   *
   * @param name source name, case insensitive
   * @return {@code true} when the source can be created
   */
  public boolean supports(String name) {
    return name != null && factories.containsKey(name.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Creates a source instance.
   *
   * @param name source name, case insensitive
   * @param argument text after the first {@code ':'}; {@code null} when absent
   * @return configured source
   * @throws IllegalArgumentException when the name is unknown or the argument is invalid
   */
  public LookupSource create(String name, String argument) {
    Objects.requireNonNull(name, "name");
    Function<String, LookupSource> factory = factories.get(name.trim().toLowerCase(Locale.ROOT));
    if (factory == null) {
      throw new IllegalArgumentException("Unknown lookup source '" + name + "'");
    }
    return factory.apply(argument);
  }

  private static Map<String, Function<String, LookupSource>> builtIns() {
    Map<String, Function<String, LookupSource>> factories = new LinkedHashMap<>();
    factories.put("property", LookupRegistry::propertySource);
    factories.put("context", LookupRegistry::contextSource);
    factories.put("logger", arg -> noArgument("logger", arg, LogRecord::loggerName));
    factories.put("machinename", arg -> noArgument("machinename", arg, record -> MachineName.VALUE));
    factories.put("environment-user",
        arg -> noArgument("environment-user", arg, record -> System.getProperty("user.name")));
    factories.put("literal", arg -> {
      String text = arg == null ? "" : arg;
      return record -> text;
    });
    return factories;
  }

  private static LookupSource propertySource(String name) {
    String key = requireArgument("property", name);
    return record -> {
      Object value = record.properties().get(key);
      return value == null ? null : ValueFormatter.format(value);
    };
  }

  private static LookupSource contextSource(String name) {
    String key = requireArgument("context", name);
    return record -> record.contextProperties().get(key);
  }

  private static LookupSource requestSource(String field) {
    String normalized = requireArgument("request", field).toLowerCase(Locale.ROOT);
    if (!REQUEST_FIELDS.contains(normalized)) {
      throw new IllegalArgumentException("Unknown request field '" + field + "'");
    }
    Function<RequestInfo, String> extractor = switch (normalized) {
      case "host" -> RequestInfo::host;
      case "method" -> RequestInfo::method;
      case "url" -> RequestInfo::url;
      case "statuscode" -> request -> request.statusCode() == null ? null : request.statusCode().toString();
      case "user" -> RequestInfo::user;
      case "cookies" -> request -> ItemsParser.toJson(request.cookies());
      case "form" -> request -> ItemsParser.toJson(request.form());
      case "querystring" -> request -> ItemsParser.toJson(request.queryString());
      default -> request -> ItemsParser.toJson(request.headers());
    };
    return record -> record.requestInfo().map(extractor).orElse(null);
  }

  private static String requireArgument(String source, String argument) {
    if (argument == null || argument.isBlank()) {
      throw new IllegalArgumentException("Lookup source '" + source + "' requires an argument");
    }
    return argument.trim();
  }

  private static LookupSource noArgument(String source, String argument, LookupSource delegate) {
    if (argument != null) {
      throw new IllegalArgumentException("Lookup source '" + source + "' does not take an argument");
    }
    return delegate;
  }

  private static final class MachineName {
    private static final String VALUE = detect();

    private static String detect() {
      try {
        return InetAddress.getLocalHost().getHostName();
      } catch (UnknownHostException ex) {
        String env = System.getenv("HOSTNAME");
        if (env == null || env.isBlank()) {
          env = System.getenv("COMPUTERNAME");
        }
        return env == null ? "" : env.trim();
      }
    }
  }
}
