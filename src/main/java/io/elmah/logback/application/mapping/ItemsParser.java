package io.elmah.logback.application.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.elmah.logback.domain.Item;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts rendered item lists (cookies, form, query string, server variables) into {@link Item}s.
 * <p>Two input shapes are accepted:</p>
 * <ul>
 *   <li>a JSON array of objects, {@code [{"name":"value"},{"other":"value"}]}, as produced by the
 *       {@code request:*} lookups;</li>
 *   <li>key/value text, {@code "name"="value", "other"="value"}, as produced by {@link ValueFormatter} for
 *       maps passed as event properties.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ItemsParser {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Pattern ENTRY_SEPARATOR = Pattern.compile(Pattern.quote("\", \""));
  private static final Pattern KEY_VALUE_SEPARATOR = Pattern.compile(Pattern.quote("\"=\""));

  private ItemsParser() {}

  /**
   * Parses rendered text into items.
   *
   * @param rendered rendered lookup output; may be {@code null}
   * @return parsed items, or {@code null} when the input is blank
   */
  public static List<Item> parse(String rendered) {
    if (rendered == null || rendered.isBlank()) {
      return null;
    }
    if (rendered.startsWith("[{") && rendered.endsWith("}]")) {
      List<Item> items = parseJson(rendered);
      if (items != null) {
        return items;
      }
    }
    return parseKeyValues(rendered);
  }

  /**
   * Renders a map as a JSON array of single-property objects.
   *
   * @param values ordered values; {@code null} values render as JSON null
   * @return JSON text, or an empty string for an empty map
   */
  public static String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return "";
    }
    ArrayNode array = MAPPER.createArrayNode();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      array.addObject().put(entry.getKey(), entry.getValue());
    }
    try {
      return MAPPER.writeValueAsString(array);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to render items as JSON", ex);
    }
  }

  private static List<Item> parseJson(String rendered) {
    JsonNode root;
    try {
      root = MAPPER.readTree(rendered);
    } catch (JsonProcessingException ex) {
      return null;
    }
    if (root == null || !root.isArray()) {
      return null;
    }
    List<Item> items = new ArrayList<>();
    for (JsonNode element : root) {
      if (!(element instanceof ObjectNode object)) {
        continue;
      }
      Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        items.add(new Item(field.getKey(), text(field.getValue())));
      }
    }
    return items;
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    return node.isTextual() ? node.asText() : node.toString();
  }

  private static List<Item> parseKeyValues(String rendered) {
    List<Item> items = new ArrayList<>();
    for (String entry : ENTRY_SEPARATOR.split(rendered)) {
      if (entry.isEmpty()) {
        continue;
      }
      String[] parts = KEY_VALUE_SEPARATOR.split(entry, -1);
      String key = stripQuotes(parts[0]);
      if (key.isBlank()) {
        continue;
      }
      String value = parts.length > 1 ? stripQuotes(parts[1]) : null;
      items.add(new Item(key, value));
    }
    return items;
  }

  private static String stripQuotes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '"') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '"') {
      end--;
    }
    return value.substring(start, end);
  }
}
