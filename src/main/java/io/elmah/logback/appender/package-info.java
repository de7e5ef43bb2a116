/**
 * <strong>Purpose:</strong> Logback integration: the {@link io.elmah.logback.appender.ElmahIoAppender} and the
 * batching base it builds on.
 * <p><strong>Concurrency:</strong> Events are captured on logging threads and written by one daemon worker per
 * appender.</p>
 * <p><strong>Diagnostics:</strong> Reported through the Logback status manager; enable
 * {@code <configuration debug="true">} to print them.</p>
 *
 * @since 1.0.0
 */
package io.elmah.logback.appender;
