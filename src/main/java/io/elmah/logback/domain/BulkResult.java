package io.elmah.logback.domain;

/**
 * Outcome of one message inside a bulk submission.
 *
 * @param statusCode HTTP status reported for the message
 * @param location URL of the stored message; {@code null} when the message was rejected
 * @since 1.0.0
 */
public record BulkResult(int statusCode, String location) {

  /**
   * Reports whether the API accepted the message.
   *
   * @return {@code true} for a status from 200 to 399; a missing status reads as {@code 0} and is not accepted
   */
  public boolean accepted() {
    return statusCode >= 200 && statusCode < 400;
  }
}
