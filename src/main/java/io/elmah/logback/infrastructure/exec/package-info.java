/**
 * Thread factories for the appender's batch worker.
 */
package io.elmah.logback.infrastructure.exec;
