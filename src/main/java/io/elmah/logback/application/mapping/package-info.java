/**
 * <strong>Purpose:</strong> Field mapping from captured log records to elmah.io messages.
 * <p><strong>Concurrency:</strong> Stateless or immutable helpers; safe to share across threads.</p>
 * <p><strong>Security:</strong> Item lists can carry cookies and form values; nothing here logs them.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.application.mapping;
