/**
 * <strong>Purpose:</strong> Domain model for log snapshots and the messages submitted to elmah.io.
 * <p><strong>Pipeline role:</strong> Shared by the appender (producer of {@link io.elmah.logback.domain.LogRecord}),
 * the mapper and the API client (consumers of {@link io.elmah.logback.domain.CreateMessage}).</p>
 * <p><strong>Concurrency:</strong> Records are immutable. {@code CreateMessage} is confined to the batch worker.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.domain;
