package ca.gc.cra.tracing.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying capture timestamps to the tracing facade.
 * <p><strong>Why:</strong> Events emitted without an explicit timestamp are stamped at capture time; tests inject
 * deterministic clocks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.tracing.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return wall-clock time; never {@code null}
   */
  Instant now();

  /**
   * Default {@link ClockPort} using the system UTC clock.
   */
  ClockPort SYSTEM = Instant::now;
}
