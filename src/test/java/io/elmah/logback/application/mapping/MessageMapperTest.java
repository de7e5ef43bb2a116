package io.elmah.logback.application.mapping;

import static io.elmah.logback.testutil.TestRecords.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.elmah.logback.application.lookup.FieldLookup;
import io.elmah.logback.application.lookup.FieldLookups;
import io.elmah.logback.application.lookup.LookupField;
import io.elmah.logback.application.lookup.LookupRegistry;
import io.elmah.logback.domain.CreateMessage;
import io.elmah.logback.domain.ExceptionInfo;
import io.elmah.logback.domain.Item;
import io.elmah.logback.domain.LogLevel;
import io.elmah.logback.domain.RequestInfo;
import io.elmah.logback.domain.Severity;
import io.elmah.logback.testutil.TestRecords;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageMapperTest {
  private static final ExceptionInfo TIMEOUT = new ExceptionInfo(
      "java.lang.IllegalStateException",
      "charge failed",
      "java.lang.IllegalStateException: charge failed\n\tat com.example.Payments.charge(Payments.java:10)",
      "java.net.SocketTimeoutException",
      "com.example.http.Client");

  private final LookupRegistry registry = LookupRegistry.defaults();
  private final MessageMapper mapper = MessageMapper.withDefaults(registry);

  @Test
  void mapsCoreFieldsFromRecord() {
    CreateMessage message = mapper.map(record().level(LogLevel.WARN).build());

    assertEquals("Invoice 42 created", message.getTitle());
    assertEquals("Invoice {} created", message.getTitleTemplate());
    assertEquals(Severity.Warning, message.getSeverity());
    assertEquals(TestRecords.TIMESTAMP, message.getDateTime());
    assertEquals("com.example.billing.InvoiceService", message.getSource());
    assertNull(message.getDetail());
    assertNull(message.getType());
    assertNull(message.getUrl());
    assertNull(message.getStatusCode());
    assertNull(message.getCookies());
  }

  @Test
  void renderedTitleReplacesFormattedMessage() {
    CreateMessage message = mapper.map(record().title("[billing] Invoice 42 created").build());

    assertEquals("[billing] Invoice 42 created", message.getTitle());
    assertEquals("Invoice {} created", message.getTitleTemplate());
  }

  @Test
  void titleTemplateFallsBackToTitle() {
    CreateMessage message = mapper.map(record().message(null, "no template").build());

    assertEquals("no template", message.getTitleTemplate());
  }

  @Test
  void fatalLevelMapsToFatalSeverity() {
    assertEquals(Severity.Fatal, mapper.map(record().level(LogLevel.FATAL).build()).getSeverity());
    assertEquals(Severity.Verbose, mapper.map(record().level(LogLevel.TRACE).build()).getSeverity());
  }

  @Test
  void exceptionProvidesDetailTypeAndSource() {
    CreateMessage message = mapper.map(record().level(LogLevel.ERROR).exception(TIMEOUT).build());

    assertEquals(TIMEOUT.stackTrace(), message.getDetail());
    assertEquals("java.net.SocketTimeoutException", message.getType());
    assertEquals("com.example.billing.InvoiceService", message.getSource());
  }

  @Test
  void exceptionSourceIsUsedWhenSourceLookupIsBlank() {
    FieldLookups lookups = FieldLookups.resolve(
        registry, Map.of(LookupField.SOURCE, "property:source"));
    MessageMapper custom = new MessageMapper(lookups, true, Map.of());

    CreateMessage message = custom.map(record().exception(TIMEOUT).build());

    assertEquals("com.example.http.Client", message.getSource());
  }

  @Test
  void propertiesOverrideDerivedValues() {
    CreateMessage message = mapper.map(record()
        .exception(TIMEOUT)
        .property("type", "PaymentDeclined")
        .property("source", "Payments")
        .build());

    assertEquals("PaymentDeclined", message.getType());
    assertEquals("Payments", message.getSource());
  }

  @Test
  void wellKnownPropertiesPopulateHttpFields() {
    CreateMessage message = mapper.map(record()
        .property("hostname", "web-01")
        .property("User", "alice")
        .property("method", "POST")
        .property("version", "1.4.2")
        .property("Application", "shop")
        .property("statusCode", "502")
        .build());

    assertEquals("web-01", message.getHostname());
    assertEquals("alice", message.getUser());
    assertEquals("POST", message.getMethod());
    assertEquals("1.4.2", message.getVersion());
    assertEquals("shop", message.getApplication());
    assertEquals(502, message.getStatusCode());
  }

  @Test
  void absoluteUrlIsReducedToPath() {
    assertEquals("/orders/42", mapper.map(record().property("url", "https://shop.example.com/orders/42?x=1").build())
        .getUrl());
    assertEquals("/", mapper.map(record().property("url", "https://shop.example.com").build()).getUrl());
    assertEquals("/relative", mapper.map(record().property("url", "/relative").build()).getUrl());
  }

  @Test
  void unparsableUrlAndStatusCodeAreDropped() {
    CreateMessage message = mapper.map(record()
        .property("url", "http://bad host/")
        .property("statuscode", "teapot")
        .build());

    assertNull(message.getUrl());
    assertNull(message.getStatusCode());
  }

  @Test
  void itemListsAreParsedFromProperties() {
    Map<String, String> cookies = new LinkedHashMap<>();
    cookies.put("session", "abc");
    CreateMessage message = mapper.map(record()
        .property("cookies", cookies)
        .property("Form", "[{\"email\":\"a@example.com\"}]")
        .property("queryString", "\"q\"=\"shoes\"")
        .property("serverVariables", "[{\"User-Agent\":\"curl\"}]")
        .build());

    assertEquals(List.of(new Item("session", "abc")), message.getCookies());
    assertEquals(List.of(new Item("email", "a@example.com")), message.getForm());
    assertEquals(List.of(new Item("q", "shoes")), message.getQueryString());
    assertEquals(List.of(new Item("User-Agent", "curl")), message.getServerVariables());
  }

  @Test
  void requestSnapshotFeedsPrimaryLookups() {
    MessageMapper requestMapper = MessageMapper.withDefaults(LookupRegistry.withRequestSources());
    RequestInfo request = RequestInfo.builder()
        .host("shop.example.com")
        .method("GET")
        .url("https://shop.example.com/cart")
        .statusCode(500)
        .user("bob")
        .header("Accept", "text/html")
        .queryParameter("page", "2")
        .build();

    CreateMessage message = requestMapper.map(record().request(request).build());

    assertEquals("shop.example.com", message.getHostname());
    assertEquals("GET", message.getMethod());
    assertEquals("/cart", message.getUrl());
    assertEquals(500, message.getStatusCode());
    assertEquals("bob", message.getUser());
    assertEquals(List.of(new Item("Accept", "text/html")), message.getServerVariables());
    assertEquals(List.of(new Item("page", "2")), message.getQueryString());
  }

  @Test
  void dataContainsEventPropertiesAndContextProperties() {
    Map<String, FieldLookup> context = new LinkedHashMap<>();
    context.put("tenant", FieldLookup.parse("property:tenantId|literal:unknown", registry));
    context.put("empty", FieldLookup.parse("property:nothing", registry));
    MessageMapper custom = new MessageMapper(FieldLookups.defaults(registry), true, context);

    CreateMessage message = custom.map(record().property("orderId", 42).property("skip", null).build());

    assertEquals(List.of(new Item("orderId", "42"), new Item("tenant", "unknown")), message.getData());
  }

  @Test
  void eventPropertiesCanBeExcluded() {
    MessageMapper withoutProperties = new MessageMapper(FieldLookups.defaults(registry), false, Map.of());

    assertNull(withoutProperties.map(record().property("orderId", 42).build()).getData());
  }

  @Test
  void blankLookupResultsBecomeNull() {
    CreateMessage message = mapper.map(record().property("user", " ").property("version", "").build());

    assertTrue(message.getUser() == null || !message.getUser().isBlank());
    assertNull(message.getVersion());
  }
}
