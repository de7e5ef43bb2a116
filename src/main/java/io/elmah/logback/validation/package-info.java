/**
 * <strong>Purpose:</strong> Validation helpers used while the appender resolves its configuration.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.</p>
 * <p><strong>Security:</strong> Rejects control characters so configuration values cannot inject into request lines.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.validation;
