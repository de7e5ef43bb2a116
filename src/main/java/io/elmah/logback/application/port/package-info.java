/**
 * <strong>Purpose:</strong> Ports separating the mapping pipeline from transport, metrics and request context.
 * <p><strong>Pipeline role:</strong> Appender -> mapper -> dispatcher -> {@link io.elmah.logback.application.port.MessagesClient}.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Implementations receive request data (cookies, headers, form values) and must not log it.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.application.port;
