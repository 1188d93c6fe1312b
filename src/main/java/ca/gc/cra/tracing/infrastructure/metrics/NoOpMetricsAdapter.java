package ca.gc.cra.tracing.infrastructure.metrics;

import ca.gc.cra.tracing.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; wired when {@code metrics.enabled} is {@code false}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
