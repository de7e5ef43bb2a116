/**
 * Templated field lookups: {@code |}-separated cascades of sources evaluated against a captured
 * {@link io.elmah.logback.domain.LogRecord}.
 */
package io.elmah.logback.application.lookup;
