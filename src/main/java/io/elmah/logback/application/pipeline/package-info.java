/**
 * Batch dispatch: map, filter, then submit through the {@link io.elmah.logback.application.port.MessagesClient} port.
 *
 * @since 1.0.0
 */
package io.elmah.logback.application.pipeline;
