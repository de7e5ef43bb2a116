package io.elmah.logback.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ElmahIoSettingsTest {
  private static final String LOG_ID = "6b0e0a7e-8b5d-4f0e-9e4c-2f1d7c3b9a10";

  private final Map<String, String> systemProperties = new HashMap<>();
  private final Map<String, String> environment = new HashMap<>();

  private ElmahIoSettings resolve(Map<String, String> explicit, Map<String, String> yaml, List<String> warnings) {
    return ElmahIoSettings.resolve(explicit, yaml, warnings::add, systemProperties::get, environment::get);
  }

  @Test
  void explicitValuesWinOverEveryOtherSource() {
    systemProperties.put("elmahio.apiKey", "from-property");
    environment.put("ELMAHIO_API_KEY", "from-env");

    ElmahIoSettings settings = resolve(
        Map.of("apiKey", "from-setter", "logId", LOG_ID),
        Map.of("apiKey", "from-yaml"),
        new ArrayList<>());

    assertEquals("from-setter", settings.apiKey());
    assertEquals(UUID.fromString(LOG_ID), settings.logId());
  }

  @Test
  void yamlWinsOverSystemPropertiesAndEnvironment() {
    systemProperties.put("elmahio.application", "from-property");
    environment.put("ELMAHIO_APPLICATION", "from-env");

    ElmahIoSettings settings = resolve(
        Map.of("apiKey", "key", "logId", LOG_ID),
        Map.of("application", "from-yaml"),
        new ArrayList<>());

    assertEquals("from-yaml", settings.application());
  }

  @Test
  void environmentIsConsultedLast() {
    systemProperties.put("elmahio.logId", LOG_ID);
    environment.put("ELMAHIO_API_KEY", "env-key");
    environment.put("ELMAHIO_BASE_URL", "http://localhost:8080/");

    ElmahIoSettings settings = resolve(new HashMap<>(), Map.of(), new ArrayList<>());

    assertEquals("env-key", settings.apiKey());
    assertEquals(URI.create("http://localhost:8080/"), settings.baseUrl());
    assertNull(settings.proxy());
  }

  @Test
  void blankExplicitValueFallsThroughToNextSource() {
    Map<String, String> explicit = new HashMap<>();
    explicit.put("apiKey", "  ");
    explicit.put("logId", LOG_ID);

    ElmahIoSettings settings = resolve(explicit, Map.of("apiKey", "yaml-key"), new ArrayList<>());

    assertEquals("yaml-key", settings.apiKey());
  }

  @Test
  void missingApiKeyNamesEverySource() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> resolve(Map.of("logId", LOG_ID), Map.of(), new ArrayList<>()));

    assertTrue(ex.getMessage().contains("-Delmahio.apiKey"));
    assertTrue(ex.getMessage().contains("ELMAHIO_API_KEY"));
  }

  @Test
  void logIdMustBeUuid() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> resolve(Map.of("apiKey", "key", "logId", "not-a-guid"), Map.of(), new ArrayList<>()));

    assertTrue(ex.getMessage().startsWith("logId must be a UUID"));
  }

  @Test
  void proxyIsParsedAsHostAndPort() {
    ElmahIoSettings settings = resolve(
        Map.of("apiKey", "key", "logId", LOG_ID, "proxy", "proxy.local:3128"), Map.of(), new ArrayList<>());

    assertEquals("proxy.local", settings.proxy().getHostString());
    assertEquals(3128, settings.proxy().getPort());
  }

  @Test
  void baseUrlMustBeHttp() {
    assertThrows(IllegalArgumentException.class,
        () -> resolve(Map.of("apiKey", "key", "logId", LOG_ID, "baseUrl", "ftp://example.com"),
            Map.of(), new ArrayList<>()));
  }

  @Test
  void unknownYamlKeysAreReported() {
    List<String> warnings = new ArrayList<>();

    resolve(Map.of("apiKey", "key", "logId", LOG_ID), Map.of("apikey", "typo"), warnings);

    assertEquals(List.of("Ignoring unknown YAML setting: apikey"), warnings);
  }

  @Test
  void toStringMasksApiKey() {
    ElmahIoSettings settings = resolve(
        Map.of("apiKey", "0123456789abcdef0123", "logId", LOG_ID), Map.of(), new ArrayList<>());

    String text = settings.toString();
    assertFalse(text.contains("0123456789abcdef0123"));
    assertTrue(text.contains("[REDACTED]...0123"));
  }

  @Test
  void environmentNameUsesUpperSnakeCase() {
    assertEquals("ELMAHIO_API_KEY", ElmahIoSettings.environmentName("apiKey"));
    assertEquals("ELMAHIO_PROXY", ElmahIoSettings.environmentName("proxy"));
  }
}
