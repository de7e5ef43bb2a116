package io.elmah.logback.infrastructure.metrics;

import io.elmah.logback.application.port.MetricsPort;

/**
 * Metrics adapter used when {@code metricsEnabled} is off.
 *
 * @since 1.0.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
