package io.elmah.logback.infrastructure.http;

import io.elmah.logback.application.port.MessageListener;
import io.elmah.logback.application.port.MessagesClient;
import io.elmah.logback.domain.BulkResult;
import io.elmah.logback.domain.CreateMessage;
import io.elmah.logback.infrastructure.LibraryVersion;
import io.elmah.logback.validation.Strings;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MessagesClient} backed by the JDK {@link HttpClient}.
 * <p><strong>Why:</strong> Posts messages to {@code /v3/messages/{logId}} and {@code /v3/messages/{logId}/_bulk}
 * without pulling in a vendor SDK.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize messages with {@link MessageJson}.</li>
 *   <li>Raise {@link MessageListener#onMessage} before sending and {@link MessageListener#onMessageFail} for
 *   every message that was not stored.</li>
 *   <li>Complete returned futures normally even when the request failed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; listeners may be added while requests are in flight.</p>
 * <p><strong>Observability:</strong> Failures are logged at DEBUG under {@code io.elmah.logback}; the appender
 * ignores that logger so diagnostics never loop back into the API.</p>
 *
 * @since 1.0.0
 */
public final class HttpMessagesClient implements MessagesClient {
  private static final Logger log = LoggerFactory.getLogger(HttpMessagesClient.class);

  /** Public elmah.io API endpoint. */
  public static final URI DEFAULT_BASE_URL = URI.create("https://api.elmah.io");
  /** Connect and request timeout applied to every call. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private final HttpClient http;
  private final URI baseUrl;
  private final String apiKey;
  private final Duration timeout;
  private final String userAgent;
  private final MessageJson json = new MessageJson();
  private final List<MessageListener> listeners = new CopyOnWriteArrayList<>();

  private HttpMessagesClient(Builder builder) {
    this.apiKey = builder.apiKey;
    this.baseUrl = builder.baseUrl;
    this.timeout = builder.timeout;
    this.userAgent = builder.userAgent;
    HttpClient.Builder httpBuilder = HttpClient.newBuilder()
        .connectTimeout(builder.timeout)
        .followRedirects(HttpClient.Redirect.NORMAL);
    if (builder.proxy != null) {
      httpBuilder.proxy(ProxySelector.of(builder.proxy));
    }
    this.http = httpBuilder.build();
  }

  /**
   * Starts a builder for the given API key.
   *
   * @param apiKey elmah.io API key with messages write permission
   * @return builder
   * @throws IllegalArgumentException if {@code apiKey} is blank
   */
  public static Builder builder(String apiKey) {
    return new Builder(apiKey);
  }

  @Override
  public void addListener(MessageListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public CompletableFuture<Void> createAndNotify(UUID logId, CreateMessage message) {
    Objects.requireNonNull(logId, "logId");
    Objects.requireNonNull(message, "message");
    notifyMessage(message);

    String body;
    try {
      body = json.write(message);
    } catch (IOException ex) {
      notifyFailure(message, ex);
      return CompletableFuture.completedFuture(null);
    }

    HttpRequest request = post(endpoint(logId, ""), body);
    return send(request)
        .handle((response, error) -> {
          Throwable failure = error != null ? unwrap(error) : statusFailure(response);
          if (failure != null) {
            notifyFailure(message, failure);
          }
          return null;
        });
  }

  @Override
  public CompletableFuture<Void> createBulkAndNotify(UUID logId, List<CreateMessage> messages) {
    Objects.requireNonNull(logId, "logId");
    Objects.requireNonNull(messages, "messages");
    if (messages.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    List<CreateMessage> batch = List.copyOf(messages);
    batch.forEach(this::notifyMessage);

    String body;
    try {
      body = json.writeAll(batch);
    } catch (IOException ex) {
      batch.forEach(message -> notifyFailure(message, ex));
      return CompletableFuture.completedFuture(null);
    }

    HttpRequest request = post(endpoint(logId, "/_bulk"), body);
    return send(request)
        .handle((response, error) -> {
          Throwable failure = error != null ? unwrap(error) : statusFailure(response);
          if (failure != null) {
            batch.forEach(message -> notifyFailure(message, failure));
            return null;
          }
          reportBulkResults(batch, response.body());
          return null;
        });
  }

  private void reportBulkResults(List<CreateMessage> batch, String body) {
    if (body == null || body.isBlank()) {
      return;
    }
    List<BulkResult> results;
    try {
      results = json.readBulkResults(body);
    } catch (IOException ex) {
      // the request itself succeeded, so the messages are not reported as failed
      log.warn("Unreadable bulk response for {} messages: {}", batch.size(), ex.getMessage());
      return;
    }
    for (int i = 0; i < batch.size(); i++) {
      if (i >= results.size()) {
        notifyFailure(batch.get(i), new ElmahioApiException(0, "no result for message in bulk response"));
        continue;
      }
      BulkResult result = results.get(i);
      if (!result.accepted()) {
        notifyFailure(batch.get(i), new ElmahioApiException(result.statusCode(), "message rejected in bulk request"));
      }
    }
  }

  private CompletableFuture<HttpResponse<String>> send(HttpRequest request) {
    try {
      return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (RuntimeException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  private HttpRequest post(URI uri, String body) {
    return HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Content-Type", "application/json; charset=utf-8")
        .header("Accept", "application/json")
        .header("User-Agent", userAgent)
        .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
        .build();
  }

  URI endpoint(UUID logId, String suffix) {
    String base = baseUrl.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + "/v3/messages/" + logId + suffix
        + "?api_key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
  }

  private void notifyMessage(CreateMessage message) {
    for (MessageListener listener : listeners) {
      try {
        listener.onMessage(message);
      } catch (RuntimeException ex) {
        log.debug("onMessage listener failed", ex);
      }
    }
  }

  private void notifyFailure(CreateMessage message, Throwable error) {
    log.debug("Message {} was not stored: {}", message, error.toString());
    for (MessageListener listener : listeners) {
      try {
        listener.onMessageFail(message, error);
      } catch (RuntimeException ex) {
        log.debug("onMessageFail listener failed", ex);
      }
    }
  }

  private static Throwable statusFailure(HttpResponse<String> response) {
    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      return null;
    }
    return new ElmahioApiException(status, response.body());
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  /** Builder for {@link HttpMessagesClient}. */
  public static final class Builder {
    private final String apiKey;
    private URI baseUrl = DEFAULT_BASE_URL;
    private InetSocketAddress proxy;
    private Duration timeout = DEFAULT_TIMEOUT;
    private String userAgent = "Elmah.Io.Logback/" + LibraryVersion.get();

    private Builder(String apiKey) {
      this.apiKey = Strings.requireNonBlank("apiKey", apiKey);
    }

    /**
     * Overrides the API endpoint, mainly for tests and private deployments.
     *
     * @param baseUrl absolute http(s) URI; {@code null} keeps the default
     * @return this builder
     */
    public Builder baseUrl(URI baseUrl) {
      if (baseUrl != null) {
        String scheme = baseUrl.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
          throw new IllegalArgumentException("baseUrl must be an absolute http(s) URI: " + baseUrl);
        }
        this.baseUrl = baseUrl;
      }
      return this;
    }

    /**
     * Routes requests through an HTTP proxy.
     *
     * @param proxy proxy address; {@code null} connects directly
     * @return this builder
     */
    public Builder proxy(InetSocketAddress proxy) {
      this.proxy = proxy;
      return this;
    }

    /**
     * Sets the connect and request timeout.
     *
     * @param timeout positive duration
     * @return this builder
     */
    public Builder timeout(Duration timeout) {
      Objects.requireNonNull(timeout, "timeout");
      if (timeout.isZero() || timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must be positive");
      }
      this.timeout = timeout;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = Strings.requireNonBlank("userAgent", userAgent);
      return this;
    }

    public HttpMessagesClient build() {
      return new HttpMessagesClient(this);
    }
  }
}
