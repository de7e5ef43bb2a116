package io.elmah.logback.application.lookup;

import static io.elmah.logback.testutil.TestRecords.record;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.elmah.logback.domain.LogRecord;
import io.elmah.logback.domain.RequestInfo;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldLookupTest {
  private final LookupRegistry registry = LookupRegistry.defaults();

  @Test
  void firstNonBlankSourceWins() {
    FieldLookup lookup = FieldLookup.parse("property:missing|property:blank|property:user|literal:fallback", registry);
    LogRecord record = record().property("blank", "  ").property("user", "alice").build();

    assertEquals("alice", lookup.render(record));
  }

  @Test
  void rendersEmptyStringWhenNothingMatches() {
    FieldLookup lookup = FieldLookup.parse("property:user|context:user", registry);

    assertEquals("", lookup.render(record().build()));
  }

  @Test
  void literalKeepsTextAfterFirstColon() {
    FieldLookup lookup = FieldLookup.parse("literal:http://example.com", registry);

    assertEquals("http://example.com", lookup.render(record().build()));
  }

  @Test
  void contextSourceReadsLoggerContextProperties() {
    FieldLookup lookup = FieldLookup.parse("context:HOSTNAME", registry);

    assertEquals("build-agent-7", lookup.render(record().context("HOSTNAME", "build-agent-7").build()));
  }

  @Test
  void loggerSourceRendersLoggerName() {
    FieldLookup lookup = FieldLookup.parse("logger", registry);

    assertEquals("com.example.Api", lookup.render(record().logger("com.example.Api").build()));
  }

  @Test
  void propertySourceFormatsCollections() {
    FieldLookup lookup = FieldLookup.parse("property:cookies", registry);
    LogRecord record = record().property("cookies", Map.of("session", "abc")).build();

    assertEquals("\"session\"=\"abc\"", lookup.render(record));
  }

  @Test
  void propertySourceFormatsLists() {
    FieldLookup lookup = FieldLookup.parse("property:tags", registry);

    assertEquals("\"a\", \"b\"", lookup.render(record().property("tags", List.of("a", "b")).build()));
  }

  @Test
  void sourceNamesAreCaseInsensitive() {
    FieldLookup lookup = FieldLookup.parse(" Property:user | LITERAL:x ", registry);

    assertEquals("x", lookup.render(record().build()));
  }

  @Test
  void blankExpressionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> FieldLookup.parse("  ", registry));
  }

  @Test
  void emptySegmentIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> FieldLookup.parse("property:user||logger", registry));
  }

  @Test
  void unknownSourceIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> FieldLookup.parse("aspnet-user-identity", registry));

    assertTrue(ex.getMessage().contains("aspnet-user-identity"));
  }

  @Test
  void propertyWithoutArgumentIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> FieldLookup.parse("property", registry));
  }

  @Test
  void loggerWithArgumentIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> FieldLookup.parse("logger:short", registry));
  }

  @Test
  void requestSourceNeedsRequestRegistry() {
    assertFalse(registry.supports("request"));
    assertThrows(IllegalArgumentException.class, () -> FieldLookup.parse("request:url", registry));
  }

  @Test
  void requestSourceReadsRequestSnapshot() {
    LookupRegistry requestRegistry = LookupRegistry.withRequestSources();
    RequestInfo request = RequestInfo.builder()
        .host("shop.example.com")
        .statusCode(404)
        .cookie("session", "abc")
        .cookie("theme", "dark")
        .build();
    LogRecord withRequest = record().request(request).build();

    assertTrue(requestRegistry.supports("REQUEST"));
    assertEquals("shop.example.com", FieldLookup.parse("request:host", requestRegistry).render(withRequest));
    assertEquals("404", FieldLookup.parse("request:statuscode", requestRegistry).render(withRequest));
    assertEquals("[{\"session\":\"abc\"},{\"theme\":\"dark\"}]",
        FieldLookup.parse("request:cookies", requestRegistry).render(withRequest));
    assertEquals("", FieldLookup.parse("request:host", requestRegistry).render(record().build()));
  }

  @Test
  void unknownRequestFieldIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> FieldLookup.parse("request:session", LookupRegistry.withRequestSources()));
  }

  @Test
  void machineNameAndEnvironmentUserRenderWithoutArguments() {
    LogRecord empty = record().build();

    assertEquals(System.getProperty("user.name"), FieldLookup.parse("environment-user", registry).render(empty));
    FieldLookup machine = FieldLookup.parse("machinename", registry);
    assertEquals(machine.render(empty), machine.render(empty));
  }
}
