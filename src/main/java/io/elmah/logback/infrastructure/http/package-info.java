/**
 * <strong>Purpose:</strong> HTTP adapter for the elmah.io messages API built on {@link java.net.http.HttpClient}
 * and Jackson.
 * <p><strong>Concurrency:</strong> Requests run asynchronously; listeners are stored in copy-on-write lists.</p>
 * <p><strong>Security:</strong> The API key travels as the {@code api_key} query parameter and is never logged.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.infrastructure.http;
