package io.elmah.logback.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the HTTP request that was active on the logging thread.
 * <p>Item maps preserve insertion order so rendered lists keep the order the request carried.</p>
 *
 * @since 1.0.0
 */
public record RequestInfo(
    String host,
    String method,
    String url,
    Integer statusCode,
    String user,
    Map<String, String> cookies,
    Map<String, String> form,
    Map<String, String> queryString,
    Map<String, String> headers) {

  public RequestInfo {
    cookies = copy(cookies);
    form = copy(form);
    queryString = copy(queryString);
    headers = copy(headers);
  }

  private static Map<String, String> copy(Map<String, String> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /**
   * Starts a builder for request snapshots.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Mutable builder used by request context providers. */
  public static final class Builder {
    private String host;
    private String method;
    private String url;
    private Integer statusCode;
    private String user;
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private final Map<String, String> form = new LinkedHashMap<>();
    private final Map<String, String> queryString = new LinkedHashMap<>();
    private final Map<String, String> headers = new LinkedHashMap<>();

    private Builder() {}

    public Builder host(String value) {
      this.host = value;
      return this;
    }

    public Builder method(String value) {
      this.method = value;
      return this;
    }

    public Builder url(String value) {
      this.url = value;
      return this;
    }

    public Builder statusCode(Integer value) {
      this.statusCode = value;
      return this;
    }

    public Builder user(String value) {
      this.user = value;
      return this;
    }

    public Builder cookie(String name, String value) {
      cookies.put(name, value);
      return this;
    }

    public Builder formField(String name, String value) {
      form.put(name, value);
      return this;
    }

    public Builder queryParameter(String name, String value) {
      queryString.put(name, value);
      return this;
    }

    public Builder header(String name, String value) {
      headers.put(name, value);
      return this;
    }

    public RequestInfo build() {
      return new RequestInfo(host, method, url, statusCode, user, cookies, form, queryString, headers);
    }
  }
}
