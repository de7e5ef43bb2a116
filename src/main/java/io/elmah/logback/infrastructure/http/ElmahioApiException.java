package io.elmah.logback.infrastructure.http;

import io.elmah.logback.logging.Logs;

/**
 * Raised when the messages API rejects a request or a message inside a bulk request.
 *
 * @since 1.0.0
 */
public final class ElmahioApiException extends RuntimeException {
  private static final long serialVersionUID = 1L;
  private static final int MAX_BODY_BYTES = 512;

  private final int statusCode;

  /**
   * Creates an exception for an HTTP status.
   *
   * @param statusCode HTTP status returned by the API
   * @param body response body; truncated in the message
   */
  public ElmahioApiException(int statusCode, String body) {
    super("elmah.io API responded with HTTP " + statusCode
        + (body == null || body.isBlank() ? "" : ": " + Logs.truncate(body, MAX_BODY_BYTES)));
    this.statusCode = statusCode;
  }

  /**
   * Returns the HTTP status reported by the API.
   *
   * @return HTTP status code
   */
  public int statusCode() {
    return statusCode;
  }
}
