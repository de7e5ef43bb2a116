/**
 * <strong>Purpose:</strong> Helpers that sanitize text before it reaches Logback status messages or SLF4J logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Security:</strong> Masks the API key and caps response bodies echoed into diagnostics.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.logging;
