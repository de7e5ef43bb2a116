package io.elmah.logback.application.mapping;

import io.elmah.logback.application.lookup.FieldLookup;
import io.elmah.logback.application.lookup.FieldLookups;
import io.elmah.logback.application.lookup.LookupField;
import io.elmah.logback.application.lookup.LookupRegistry;
import io.elmah.logback.domain.CreateMessage;
import io.elmah.logback.domain.ExceptionInfo;
import io.elmah.logback.domain.Item;
import io.elmah.logback.domain.LogRecord;
import io.elmah.logback.domain.Severity;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Maps captured log records to elmah.io messages.
 * <p><strong>Why:</strong> Centralizes the fallback rules for well-known fields so the appender and tests share one
 * definition of how hostname, URL, status code, type, source and item lists are derived.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Render every {@link LookupField} and normalize blank results to {@code null}.</li>
 *   <li>Derive source and type from the exception when their lookups are blank.</li>
 *   <li>Reduce absolute URLs to their path and drop unparsable URLs and status codes.</li>
 *   <li>Collect event properties and configured context properties into the data list.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use.</p>
 *
 * @since 1.0.0
 */
public final class MessageMapper {
  private final FieldLookups lookups;
  private final boolean includeEventProperties;
  private final Map<String, FieldLookup> contextProperties;

  /**
   * Creates a mapper.
   *
   * @param lookups resolved field lookups
   * @param includeEventProperties whether event properties are copied into the data list
   * @param contextProperties extra data items keyed by name, rendered per record; may be empty
   */
  public MessageMapper(
      FieldLookups lookups, boolean includeEventProperties, Map<String, FieldLookup> contextProperties) {
    this.lookups = Objects.requireNonNull(lookups, "lookups");
    this.includeEventProperties = includeEventProperties;
    this.contextProperties = contextProperties == null
        ? Map.of()
        : new LinkedHashMap<>(contextProperties);
  }

  /**
   * Creates a mapper with the default lookups, event properties included and no context properties.
   *
   * @param registry registry resolving source names
   * @return mapper instance
   */
  public static MessageMapper withDefaults(LookupRegistry registry) {
    return new MessageMapper(FieldLookups.defaults(registry), true, Map.of());
  }

  /**
   * Builds the message for one record.
   *
   * @param record captured log event
   * @return new message instance
   */
  public CreateMessage map(LogRecord record) {
    Objects.requireNonNull(record, "record");
    String title = record.renderedTitle() != null ? record.renderedTitle() : record.formattedMessage();

    CreateMessage message = new CreateMessage();
    message.setTitle(title);
    message.setTitleTemplate(record.messageTemplate() != null ? record.messageTemplate() : title);
    message.setSeverity(Severity.fromLevel(record.level()));
    message.setDateTime(record.timestamp());
    message.setDetail(record.exceptionInfo().map(ExceptionInfo::stackTrace).orElse(null));
    message.setData(data(record));
    message.setSource(source(record));
    message.setHostname(field(LookupField.HOSTNAME, record));
    message.setApplication(field(LookupField.APPLICATION, record));
    message.setUser(field(LookupField.USER, record));
    message.setMethod(field(LookupField.METHOD, record));
    message.setVersion(field(LookupField.VERSION, record));
    message.setUrl(url(record));
    message.setType(type(record));
    message.setStatusCode(statusCode(record));
    message.setServerVariables(ItemsParser.parse(lookups.render(LookupField.SERVER_VARIABLES, record)));
    message.setCookies(ItemsParser.parse(lookups.render(LookupField.COOKIES, record)));
    message.setForm(ItemsParser.parse(lookups.render(LookupField.FORM, record)));
    message.setQueryString(ItemsParser.parse(lookups.render(LookupField.QUERY_STRING, record)));
    return message;
  }

  private String field(LookupField field, LogRecord record) {
    return nullIfBlank(lookups.render(field, record));
  }

  private String source(LogRecord record) {
    String source = field(LookupField.SOURCE, record);
    if (source != null) {
      return source;
    }
    return record.exceptionInfo()
        .map(ExceptionInfo::baseSource)
        .orElse(record.loggerName());
  }

  private String type(LogRecord record) {
    String type = field(LookupField.TYPE, record);
    if (type != null) {
      return type;
    }
    return record.exceptionInfo().map(ExceptionInfo::baseClassName).orElse(null);
  }

  private String url(LogRecord record) {
    String url = field(LookupField.URL, record);
    if (url == null) {
      return null;
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException ex) {
      return null;
    }
    if (!uri.isAbsolute()) {
      return url;
    }
    String path = uri.getRawPath();
    return path == null || path.isEmpty() ? "/" : path;
  }

  private Integer statusCode(LogRecord record) {
    String statusCode = field(LookupField.STATUS_CODE, record);
    if (statusCode == null) {
      return null;
    }
    try {
      return Integer.valueOf(statusCode.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private List<Item> data(LogRecord record) {
    if (!includeEventProperties && contextProperties.isEmpty()) {
      return null;
    }
    List<Item> items = new ArrayList<>();
    if (includeEventProperties) {
      for (Map.Entry<String, Object> property : record.properties().entrySet()) {
        if (property.getValue() != null) {
          items.add(new Item(property.getKey(), ValueFormatter.format(property.getValue())));
        }
      }
    }
    for (Map.Entry<String, FieldLookup> property : contextProperties.entrySet()) {
      String value = property.getValue().render(record);
      if (!value.isBlank()) {
        items.add(new Item(property.getKey(), value));
      }
    }
    return items;
  }

  private static String nullIfBlank(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
