/**
 * Metrics adapters that bridge the appender's {@link io.elmah.logback.application.port.MetricsPort} to
 * OpenTelemetry or to a no-op implementation.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps and updated from logging threads
 * and the batch worker.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code elmahio.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported; message contents never leave the process
 * through this path.</p>
 */
package io.elmah.logback.infrastructure.metrics;
