package io.elmah.logback.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.elmah.logback.application.port.MessageListener;
import io.elmah.logback.domain.CreateMessage;
import io.elmah.logback.domain.Item;
import io.elmah.logback.domain.Severity;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class HttpMessagesClientTest {
  private static final UUID LOG_ID = UUID.fromString("6b0e0a7e-8b5d-4f0e-9e4c-2f1d7c3b9a10");
  private static final ObjectMapper JSON = new ObjectMapper();

  private HttpServer server;
  private final List<Captured> requests = new CopyOnWriteArrayList<>();
  private final Map<String, Response> responses = new ConcurrentHashMap<>();
  private final List<CreateMessage> sent = Collections.synchronizedList(new ArrayList<>());
  private final List<Failure> failures = Collections.synchronizedList(new ArrayList<>());
  private HttpMessagesClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", exchange -> {
      byte[] body = exchange.getRequestBody().readAllBytes();
      requests.add(new Captured(
          exchange.getRequestMethod(),
          exchange.getRequestURI(),
          exchange.getRequestHeaders().getFirst("User-Agent"),
          exchange.getRequestHeaders().getFirst("Content-Type"),
          new String(body, StandardCharsets.UTF_8)));
      Response response = responses.getOrDefault(exchange.getRequestURI().getPath(), new Response(201, ""));
      byte[] out = response.body().getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(response.status(), out.length == 0 ? -1 : out.length);
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(out);
      }
    });
    server.start();

    client = HttpMessagesClient.builder("key/with+chars")
        .baseUrl(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/"))
        .userAgent("Elmah.Io.Logback/test")
        .build();
    client.addListener(new MessageListener() {
      @Override
      public void onMessage(CreateMessage message) {
        sent.add(message);
      }

      @Override
      public void onMessageFail(CreateMessage message, Throwable error) {
        failures.add(new Failure(message, error));
      }
    });
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void createPostsSingleMessageAsCamelCaseJson() throws IOException {
    CreateMessage message = message("Order failed");
    message.setSeverity(Severity.Error);
    message.setDateTime(Instant.parse("2024-03-01T12:30:45.123Z"));
    message.setStatusCode(500);
    message.setData(List.of(new Item("orderId", "42"), new Item("note", null)));

    client.createAndNotify(LOG_ID, message).join();

    assertEquals(1, requests.size());
    Captured request = requests.get(0);
    assertEquals("POST", request.method());
    assertEquals("/v3/messages/" + LOG_ID, request.uri().getPath());
    assertEquals("api_key=key%2Fwith%2Bchars", request.uri().getRawQuery());
    assertEquals("Elmah.Io.Logback/test", request.userAgent());
    assertTrue(request.contentType().startsWith("application/json"));

    JsonNode json = JSON.readTree(request.body());
    assertEquals("Order failed", json.get("title").asText());
    assertEquals("Error", json.get("severity").asText());
    assertEquals("2024-03-01T12:30:45.123Z", json.get("dateTime").asText());
    assertEquals(500, json.get("statusCode").asInt());
    assertEquals("orderId", json.get("data").get(0).get("key").asText());
    assertTrue(json.get("data").get(1).get("value").isNull());
    assertNull(json.get("url"), "null fields are omitted");
    assertNull(json.get("cookies"));

    assertEquals(List.of(message), sent);
    assertTrue(failures.isEmpty());
  }

  @Test
  void errorStatusFailsMessageWithoutThrowing() {
    responses.put("/v3/messages/" + LOG_ID, new Response(401, "{\"title\":\"Unauthorized\"}"));
    CreateMessage message = message("denied");

    client.createAndNotify(LOG_ID, message).join();

    assertEquals(1, failures.size());
    Failure failure = failures.get(0);
    assertEquals(message, failure.message());
    ElmahioApiException error = assertInstanceOf(ElmahioApiException.class, failure.error());
    assertEquals(401, error.statusCode());
    assertTrue(error.getMessage().contains("Unauthorized"));
  }

  @Test
  void failureIsLoggedAtDebugWithoutApiKey() {
    responses.put("/v3/messages/" + LOG_ID, new Response(400, "invalid message"));
    Logger logger = (Logger) LoggerFactory.getLogger(HttpMessagesClient.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    Level originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);

    try {
      client.createAndNotify(LOG_ID, message("bad")).join();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    List<ILoggingEvent> events = appender.list;
    assertEquals(1, events.size());
    ILoggingEvent event = events.get(0);
    assertEquals(Level.DEBUG, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("was not stored"));
    assertTrue(event.getFormattedMessage().contains("HTTP 400"));
    assertFalse(event.getFormattedMessage().contains("key/with+chars"));
  }

  @Test
  void bulkPostsArrayAndFailsRejectedMessages() throws IOException {
    responses.put("/v3/messages/" + LOG_ID + "/_bulk", new Response(200,
        "[{\"statusCode\":201,\"location\":\"https://api.elmah.io/v3/messages/x/1\"},"
            + "{\"statusCode\":400,\"location\":null},"
            + "{\"statusCode\":201,\"location\":\"https://api.elmah.io/v3/messages/x/3\"}]"));
    CreateMessage first = message("one");
    CreateMessage second = message("two");
    CreateMessage third = message("three");

    client.createBulkAndNotify(LOG_ID, List.of(first, second, third)).join();

    assertEquals(1, requests.size());
    assertEquals("/v3/messages/" + LOG_ID + "/_bulk", requests.get(0).uri().getPath());
    JsonNode json = JSON.readTree(requests.get(0).body());
    assertTrue(json.isArray());
    assertEquals(3, json.size());
    assertEquals("two", json.get(1).get("title").asText());

    assertEquals(List.of(first, second, third), sent);
    assertEquals(1, failures.size());
    assertEquals(second, failures.get(0).message());
    assertEquals(400, ((ElmahioApiException) failures.get(0).error()).statusCode());
  }

  @Test
  void bulkResultWithoutStatusCodeFailsItsMessage() {
    responses.put("/v3/messages/" + LOG_ID + "/_bulk", new Response(200,
        "[{\"statusCode\":201},{\"location\":null}]"));
    CreateMessage first = message("one");
    CreateMessage second = message("two");

    client.createBulkAndNotify(LOG_ID, List.of(first, second)).join();

    assertEquals(1, failures.size());
    assertEquals(second, failures.get(0).message());
    assertEquals(0, ((ElmahioApiException) failures.get(0).error()).statusCode());
  }

  @Test
  void shortBulkResponseFailsMessagesWithoutResult() {
    responses.put("/v3/messages/" + LOG_ID + "/_bulk", new Response(200, "[{\"statusCode\":201}]"));
    CreateMessage first = message("one");
    CreateMessage second = message("two");
    CreateMessage third = message("three");

    client.createBulkAndNotify(LOG_ID, List.of(first, second, third)).join();

    assertEquals(List.of(second, third), failures.stream().map(Failure::message).toList());
    assertTrue(failures.get(0).error().getMessage().contains("no result for message"));
  }

  @Test
  void blankBulkResponseCountsAsStored() {
    responses.put("/v3/messages/" + LOG_ID + "/_bulk", new Response(201, ""));

    client.createBulkAndNotify(LOG_ID, List.of(message("a"), message("b"))).join();

    assertTrue(failures.isEmpty());
  }

  @Test
  void unreadableBulkResponseIsLoggedAsWarning() {
    responses.put("/v3/messages/" + LOG_ID + "/_bulk", new Response(200, "<html>proxy page</html>"));
    Logger logger = (Logger) LoggerFactory.getLogger(HttpMessagesClient.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    Level originalLevel = logger.getLevel();
    logger.setAdditive(false);
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);

    try {
      client.createBulkAndNotify(LOG_ID, List.of(message("a"), message("b"))).join();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    assertTrue(failures.isEmpty());
    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("Unreadable bulk response for 2 messages"));
  }

  @Test
  void bulkErrorStatusFailsEveryMessage() {
    responses.put("/v3/messages/" + LOG_ID + "/_bulk", new Response(503, "maintenance"));

    client.createBulkAndNotify(LOG_ID, List.of(message("a"), message("b"))).join();

    assertEquals(2, failures.size());
  }

  @Test
  void connectionFailureIsReportedToListeners() {
    server.stop(0);

    client.createAndNotify(LOG_ID, message("offline")).join();

    assertEquals(1, failures.size());
    assertInstanceOf(IOException.class, failures.get(0).error());
  }

  @Test
  void listenerMayModifyMessageBeforeSend() throws IOException {
    client.addListener(new MessageListener() {
      @Override
      public void onMessage(CreateMessage message) {
        message.setVersion("2.0.0");
      }
    });

    client.createAndNotify(LOG_ID, message("versioned")).join();

    assertEquals("2.0.0", JSON.readTree(requests.get(0).body()).get("version").asText());
  }

  @Test
  void throwingListenerDoesNotStopTheSend() {
    client.addListener(new MessageListener() {
      @Override
      public void onMessage(CreateMessage message) {
        throw new IllegalStateException("boom");
      }
    });

    client.createAndNotify(LOG_ID, message("still sent")).join();

    assertEquals(1, requests.size());
  }

  @Test
  void emptyBulkDoesNotCallApi() {
    client.createBulkAndNotify(LOG_ID, List.of()).join();

    assertTrue(requests.isEmpty());
  }

  @Test
  void endpointHandlesBaseUrlWithoutTrailingSlash() {
    HttpMessagesClient plain = HttpMessagesClient.builder("k")
        .baseUrl(URI.create("https://api.example.com"))
        .build();

    assertEquals(URI.create("https://api.example.com/v3/messages/" + LOG_ID + "/_bulk?api_key=k"),
        plain.endpoint(LOG_ID, "/_bulk"));
  }

  @Test
  void builderRejectsBlankKeyAndNonHttpBaseUrl() {
    assertThrows(IllegalArgumentException.class, () -> HttpMessagesClient.builder(" "));
    assertThrows(IllegalArgumentException.class,
        () -> HttpMessagesClient.builder("k").baseUrl(URI.create("ftp://example.com")));
  }

  private static CreateMessage message(String title) {
    CreateMessage message = new CreateMessage();
    message.setTitle(title);
    return message;
  }

  private record Captured(String method, URI uri, String userAgent, String contentType, String body) {}

  private record Response(int status, String body) {}

  private record Failure(CreateMessage message, Throwable error) {}
}
