/**
 * Request context adapters backing the {@code request:*} lookup sources.
 *
 * @since 1.0.0
 */
package io.elmah.logback.infrastructure.request;
