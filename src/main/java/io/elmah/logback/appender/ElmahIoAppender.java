package io.elmah.logback.appender;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Layout;
import io.elmah.logback.application.lookup.FieldLookup;
import io.elmah.logback.application.lookup.FieldLookups;
import io.elmah.logback.application.lookup.LookupField;
import io.elmah.logback.application.lookup.LookupRegistry;
import io.elmah.logback.application.mapping.MessageMapper;
import io.elmah.logback.application.pipeline.MessageDispatcher;
import io.elmah.logback.application.port.MessageListener;
import io.elmah.logback.application.port.MessagesClient;
import io.elmah.logback.application.port.MetricsPort;
import io.elmah.logback.application.port.RequestContextProvider;
import io.elmah.logback.config.ElmahIoSettings;
import io.elmah.logback.config.YamlConfigLoader;
import io.elmah.logback.domain.CreateMessage;
import io.elmah.logback.domain.LogRecord;
import io.elmah.logback.infrastructure.http.HttpMessagesClient;
import io.elmah.logback.infrastructure.metrics.NoOpMetricsAdapter;
import io.elmah.logback.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.elmah.logback.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Logback appender that stores log events as messages in an elmah.io log.
 * <p><strong>Why:</strong> Lets applications logging through SLF4J report to elmah.io by adding one appender
 * to {@code logback.xml}.</p>
 * <pre>{@code
 * <appender name="ELMAHIO" class="io.elmah.logback.appender.ElmahIoAppender">
 *   <apiKey>${ELMAHIO_API_KEY}</apiKey>
 *   <logId>6b0e0a7e-8b5d-4f0e-9e4c-2f1d7c3b9a10</logId>
 *   <application>billing</application>
 *   <contextProperty>
 *     <name>tenant</name>
 *     <lookup>property:tenant|literal:unknown</lookup>
 *   </contextProperty>
 * </appender>
 * }</pre>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve connection settings and compile the field lookups on {@link #start()}.</li>
 *   <li>Snapshot events on the logging thread and hand batches to {@link MessageDispatcher}.</li>
 *   <li>Expose on-message, on-error and on-filter hooks.</li>
 * </ul>
 * <p><strong>Failure handling:</strong> configuration errors are reported to the Logback status manager and
 * leave the appender stopped. Messages the API did not store are reported there too, counted under
 * {@code elmahio.messages.failed} and passed to the on-error hook. {@code elmahio.messages.sent} counts only
 * the messages of requests that completed without such a failure.</p>
 * <p><strong>Recursion:</strong> events from loggers under {@code io.elmah.logback} are ignored so the HTTP client's
 * own logging never becomes a message.</p>
 *
 * @since 1.0.0
 */
public class ElmahIoAppender extends AsyncBatchingAppenderBase<ILoggingEvent, LogRecord> {
  static final String OWN_LOGGER_PREFIX = "io.elmah.logback";

  private final MessagesClient injectedClient;

  private String apiKey;
  private String logId;
  private String application;
  private String proxy;
  private String baseUrl;
  private String configFile;
  private final Map<LookupField, String> lookupOverrides = new EnumMap<>(LookupField.class);
  private final List<ContextProperty> contextProperties = new ArrayList<>();
  private Layout<ILoggingEvent> layout;
  private boolean includeEventProperties = true;
  private boolean includeMdc = true;
  private boolean metricsEnabled;

  private volatile Consumer<CreateMessage> onMessage;
  private volatile BiConsumer<CreateMessage, Throwable> onError;
  private volatile Predicate<CreateMessage> onFilter;
  private RequestContextProvider requestContextProvider;

  private volatile MetricsPort metrics = MetricsPort.NO_OP;
  private MetricsPort injectedMetrics;
  private volatile Set<CreateMessage> sending = newSendingSet();
  private OpenTelemetryMetricsAdapter openTelemetry;
  private MessagesClient client;
  private MessagesClient listenedClient;
  private MessageDispatcher dispatcher;
  private LogRecordFactory recordFactory;
  private ElmahIoSettings settings;

  /** Creates an appender that builds its HTTP client from the resolved settings. */
  public ElmahIoAppender() {
    this(null);
  }

  /**
   * Creates an appender sending through the given client.
   *
   * @param client client to use instead of {@link HttpMessagesClient}; {@code null} builds one on start
   */
  public ElmahIoAppender(MessagesClient client) {
    this.injectedClient = client;
  }

  @Override
  public void start() {
    if (isStarted()) {
      return;
    }
    try {
      configure();
    } catch (IOException | RuntimeException ex) {
      addError("elmah.io appender [" + getName() + "] not started: " + ex.getMessage(), ex);
      closeMetrics();
      return;
    }
    super.start();
    if (isStarted()) {
      addInfo("elmah.io appender [" + getName() + "] started with " + settings);
    } else {
      closeMetrics();
    }
  }

  @Override
  public void stop() {
    if (!isStarted()) {
      return;
    }
    super.stop();
    closeMetrics();
  }

  private void configure() throws IOException {
    Map<String, String> yaml = Map.of();
    if (configFile != null && !configFile.isBlank()) {
      String section = getName() == null ? "" : getName();
      yaml = YamlConfigLoader.load(Path.of(configFile.trim()), section).orElseGet(() -> {
        addWarn("configFile " + configFile + " does not exist; ignoring it");
        return Map.of();
      });
    }
    Map<String, String> explicit = new LinkedHashMap<>();
    explicit.put(ElmahIoSettings.API_KEY, apiKey);
    explicit.put(ElmahIoSettings.LOG_ID, logId);
    explicit.put(ElmahIoSettings.APPLICATION, application);
    explicit.put(ElmahIoSettings.PROXY, proxy);
    explicit.put(ElmahIoSettings.BASE_URL, baseUrl);
    settings = ElmahIoSettings.resolve(explicit, yaml, this::addWarn);

    LookupRegistry registry = requestContextProvider == null
        ? LookupRegistry.defaults()
        : LookupRegistry.withRequestSources();
    Map<LookupField, String> overrides = new EnumMap<>(LookupField.class);
    overrides.putAll(lookupOverrides);
    String fixedApplication = settings.application();
    boolean applicationSetterUsed = application != null && !application.isBlank();
    // a name from YAML, system properties or the environment does not replace an explicit applicationLookup
    if (fixedApplication != null
        && (applicationSetterUsed || !lookupOverrides.containsKey(LookupField.APPLICATION))) {
      if (fixedApplication.indexOf('|') >= 0) {
        throw new IllegalArgumentException("application must not contain '|'");
      }
      overrides.put(LookupField.APPLICATION, "literal:" + fixedApplication);
    }
    FieldLookups lookups = FieldLookups.resolve(registry, overrides);

    Map<String, FieldLookup> extra = new LinkedHashMap<>();
    for (ContextProperty property : contextProperties) {
      Strings.requireNonBlank("contextProperty.name", property.getName());
      try {
        extra.put(property.getName(), FieldLookup.parse(property.getLookup(), registry));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(
            "Invalid lookup for context property " + property.getName() + ": " + ex.getMessage(), ex);
      }
    }

    if (layout != null && !layout.isStarted()) {
      layout.setContext(getContext());
      layout.start();
    }

    if (injectedMetrics != null) {
      metrics = injectedMetrics;
    } else if (metricsEnabled) {
      openTelemetry = new OpenTelemetryMetricsAdapter();
      metrics = openTelemetry;
    } else {
      metrics = new NoOpMetricsAdapter();
    }

    client = injectedClient != null
        ? injectedClient
        : HttpMessagesClient.builder(settings.apiKey())
            .baseUrl(settings.baseUrl())
            .proxy(settings.proxy())
            .build();
    if (listenedClient != client) {
      client.addListener(new HookListener());
      listenedClient = client;
    }

    MessageMapper mapper = new MessageMapper(lookups, includeEventProperties, extra);
    dispatcher = new MessageDispatcher(mapper, client, settings.logId(), this::filtered, metrics);
    recordFactory = new LogRecordFactory(layout, includeMdc, requestContextProvider);
  }

  private void closeMetrics() {
    OpenTelemetryMetricsAdapter current = openTelemetry;
    openTelemetry = null;
    metrics = MetricsPort.NO_OP;
    if (current != null) {
      current.close();
    }
  }

  @Override
  protected LogRecord prepare(ILoggingEvent event) {
    String loggerName = event.getLoggerName();
    if (loggerName != null && loggerName.startsWith(OWN_LOGGER_PREFIX)) {
      return null;
    }
    return recordFactory.create(event);
  }

  @Override
  protected CompletableFuture<Void> writeBatch(List<LogRecord> batch) {
    Set<CreateMessage> current = newSendingSet();
    sending = current;
    return dispatcher.dispatch(batch).whenComplete((ignored, error) -> {
      if (error == null) {
        countStored(current);
      }
    });
  }

  private void countStored(Set<CreateMessage> stored) {
    synchronized (stored) {
      for (int i = 0; i < stored.size(); i++) {
        metrics.increment("elmahio.messages.sent");
      }
      stored.clear();
    }
  }

  private static Set<CreateMessage> newSendingSet() {
    return Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  @Override
  protected void onEventDropped() {
    metrics.increment("elmahio.events.dropped");
  }

  @Override
  protected void onBatchWritten(int size, long elapsedMillis) {
    metrics.observe("elmahio.batch.latencyMillis", elapsedMillis);
  }

  private boolean filtered(CreateMessage message) {
    Predicate<CreateMessage> filter = onFilter;
    return filter != null && filter.test(message);
  }

  private final class HookListener implements MessageListener {
    @Override
    public void onMessage(CreateMessage message) {
      sending.add(message);
      Consumer<CreateMessage> hook = onMessage;
      if (hook != null) {
        try {
          hook.accept(message);
        } catch (RuntimeException ex) {
          addWarn("onMessage hook failed for " + message, ex);
        }
      }
    }

    @Override
    public void onMessageFail(CreateMessage message, Throwable error) {
      sending.remove(message);
      addError("Failed to store " + message + " in elmah.io", error);
      metrics.increment("elmahio.messages.failed");
      BiConsumer<CreateMessage, Throwable> hook = onError;
      if (hook != null) {
        try {
          hook.accept(message, error);
        } catch (RuntimeException ex) {
          addWarn("onError hook failed for " + message, ex);
        }
      }
    }
  }

  public String getApiKey() {
    return apiKey;
  }

  /** API key with permission to write messages. Required unless provided by another settings source. */
  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getLogId() {
    return logId;
  }

  /** Destination log, as a UUID string. */
  public void setLogId(String logId) {
    this.logId = logId;
  }

  public String getApplication() {
    return application;
  }

  /**
   * Fixed application name; takes precedence over {@link #setApplicationLookup(String)}. A name that only comes
   * from {@code configFile}, {@code -Delmahio.application} or {@code ELMAHIO_APPLICATION} applies when no
   * application lookup is configured.
   */
  public void setApplication(String application) {
    this.application = application;
  }

  public String getProxy() {
    return proxy;
  }

  /** HTTP proxy as {@code host:port}. */
  public void setProxy(String proxy) {
    this.proxy = proxy;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getConfigFile() {
    return configFile;
  }

  /** YAML file read for the {@code common} section and the section named after this appender. */
  public void setConfigFile(String configFile) {
    this.configFile = configFile;
  }

  public Layout<ILoggingEvent> getLayout() {
    return layout;
  }

  /** Layout rendering the message title; the formatted message is used when unset. */
  public void setLayout(Layout<ILoggingEvent> layout) {
    this.layout = layout;
  }

  public boolean isIncludeEventProperties() {
    return includeEventProperties;
  }

  public void setIncludeEventProperties(boolean includeEventProperties) {
    this.includeEventProperties = includeEventProperties;
  }

  public boolean isIncludeMdc() {
    return includeMdc;
  }

  public void setIncludeMdc(boolean includeMdc) {
    this.includeMdc = includeMdc;
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  /** Publishes {@code elmahio.*} metrics through OpenTelemetry when {@code true}. */
  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }

  /**
   * Adds a data item rendered from a lookup for every message.
   *
   * @param property name and lookup expression
   */
  public void addContextProperty(ContextProperty property) {
    contextProperties.add(Objects.requireNonNull(property, "property"));
  }

  public List<ContextProperty> getContextProperties() {
    return List.copyOf(contextProperties);
  }

  public void setHostnameLookup(String expression) {
    setLookup(LookupField.HOSTNAME, expression);
  }

  public void setCookiesLookup(String expression) {
    setLookup(LookupField.COOKIES, expression);
  }

  public void setFormLookup(String expression) {
    setLookup(LookupField.FORM, expression);
  }

  public void setQueryStringLookup(String expression) {
    setLookup(LookupField.QUERY_STRING, expression);
  }

  public void setServerVariablesLookup(String expression) {
    setLookup(LookupField.SERVER_VARIABLES, expression);
  }

  public void setSourceLookup(String expression) {
    setLookup(LookupField.SOURCE, expression);
  }

  public void setApplicationLookup(String expression) {
    setLookup(LookupField.APPLICATION, expression);
  }

  public void setUserLookup(String expression) {
    setLookup(LookupField.USER, expression);
  }

  public void setMethodLookup(String expression) {
    setLookup(LookupField.METHOD, expression);
  }

  public void setVersionLookup(String expression) {
    setLookup(LookupField.VERSION, expression);
  }

  public void setUrlLookup(String expression) {
    setLookup(LookupField.URL, expression);
  }

  public void setTypeLookup(String expression) {
    setLookup(LookupField.TYPE, expression);
  }

  public void setStatusCodeLookup(String expression) {
    setLookup(LookupField.STATUS_CODE, expression);
  }

  /**
   * Returns the expression configured for a field.
   *
   * @param field message field
   * @return override, or {@code null} when the default applies
   */
  public String getLookup(LookupField field) {
    return lookupOverrides.get(field);
  }

  private void setLookup(LookupField field, String expression) {
    if (expression == null || expression.isBlank()) {
      lookupOverrides.remove(field);
    } else {
      lookupOverrides.put(field, expression.trim());
    }
  }

  /**
   * Replaces the metrics chosen by {@link #setMetricsEnabled(boolean)}. Must be set before {@link #start()}.
   *
   * @param metricsPort metrics sink, or {@code null} to go back to the default
   */
  void setMetricsPort(MetricsPort metricsPort) {
    this.injectedMetrics = metricsPort;
  }

  /**
   * Hook invoked right before each message is sent; the message may be modified.
   *
   * @param onMessage hook, or {@code null}
   */
  public void setOnMessage(Consumer<CreateMessage> onMessage) {
    this.onMessage = onMessage;
  }

  /**
   * Hook invoked for each message the API did not store.
   *
   * @param onError hook, or {@code null}
   */
  public void setOnError(BiConsumer<CreateMessage, Throwable> onError) {
    this.onError = onError;
  }

  /**
   * Hook deciding which messages are not sent; returning {@code true} drops the message.
   *
   * @param onFilter predicate, or {@code null} to send everything
   */
  public void setOnFilter(Predicate<CreateMessage> onFilter) {
    this.onFilter = onFilter;
  }

  /**
   * Supplies the current HTTP request and enables the {@code request:*} lookup sources. Must be set before
   * {@link #start()}.
   *
   * @param requestContextProvider provider, or {@code null}
   */
  public void setRequestContextProvider(RequestContextProvider requestContextProvider) {
    this.requestContextProvider = requestContextProvider;
  }
}
