package io.elmah.logback.infrastructure.http;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.elmah.logback.domain.BulkResult;
import io.elmah.logback.domain.CreateMessage;
import io.elmah.logback.domain.Item;
import java.io.IOException;
import java.io.StringWriter;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON codec for the messages API.
 * <p>Messages are written with the streaming generator using camelCase names; {@code null} fields are omitted
 * and {@code dateTime} is an ISO-8601 UTC instant. Bulk responses are read as a tree.</p>
 *
 * @since 1.0.0
 */
final class MessageJson {
  private final JsonFactory factory = new JsonFactory();
  private final ObjectMapper mapper = new ObjectMapper(factory);

  String write(CreateMessage message) throws IOException {
    Objects.requireNonNull(message, "message");
    StringWriter out = new StringWriter(512);
    try (JsonGenerator generator = factory.createGenerator(out)) {
      writeMessage(generator, message);
    }
    return out.toString();
  }

  String writeAll(List<CreateMessage> messages) throws IOException {
    Objects.requireNonNull(messages, "messages");
    StringWriter out = new StringWriter(512 * Math.max(1, messages.size()));
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartArray();
      for (CreateMessage message : messages) {
        writeMessage(generator, message);
      }
      generator.writeEndArray();
    }
    return out.toString();
  }

  List<BulkResult> readBulkResults(String body) throws IOException {
    if (body == null || body.isBlank()) {
      return List.of();
    }
    JsonNode root = mapper.readTree(body);
    if (root == null || !root.isArray()) {
      throw new IOException("Bulk response is not a JSON array");
    }
    List<BulkResult> results = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      int statusCode = node.path("statusCode").asInt(0);
      JsonNode location = node.get("location");
      results.add(new BulkResult(statusCode, location == null || location.isNull() ? null : location.asText()));
    }
    return results;
  }

  private static void writeMessage(JsonGenerator generator, CreateMessage message) throws IOException {
    generator.writeStartObject();
    writeString(generator, "title", message.getTitle());
    writeString(generator, "titleTemplate", message.getTitleTemplate());
    if (message.getSeverity() != null) {
      generator.writeStringField("severity", message.getSeverity().name());
    }
    if (message.getDateTime() != null) {
      generator.writeStringField("dateTime", DateTimeFormatter.ISO_INSTANT.format(message.getDateTime()));
    }
    writeString(generator, "detail", message.getDetail());
    writeItems(generator, "data", message.getData());
    writeString(generator, "source", message.getSource());
    writeString(generator, "hostname", message.getHostname());
    writeString(generator, "application", message.getApplication());
    writeString(generator, "user", message.getUser());
    writeString(generator, "method", message.getMethod());
    writeString(generator, "version", message.getVersion());
    writeString(generator, "url", message.getUrl());
    writeString(generator, "type", message.getType());
    if (message.getStatusCode() != null) {
      generator.writeNumberField("statusCode", message.getStatusCode());
    }
    writeItems(generator, "serverVariables", message.getServerVariables());
    writeItems(generator, "cookies", message.getCookies());
    writeItems(generator, "form", message.getForm());
    writeItems(generator, "queryString", message.getQueryString());
    generator.writeEndObject();
  }

  private static void writeString(JsonGenerator generator, String name, String value) throws IOException {
    if (value != null) {
      generator.writeStringField(name, value);
    }
  }

  private static void writeItems(JsonGenerator generator, String name, List<Item> items) throws IOException {
    if (items == null) {
      return;
    }
    generator.writeArrayFieldStart(name);
    for (Item item : items) {
      generator.writeStartObject();
      generator.writeStringField("key", item.key());
      if (item.value() == null) {
        generator.writeNullField("value");
      } else {
        generator.writeStringField("value", item.value());
      }
      generator.writeEndObject();
    }
    generator.writeEndArray();
  }
}
