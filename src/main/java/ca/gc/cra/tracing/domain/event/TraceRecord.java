package ca.gc.cra.tracing.domain.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Event as captured by the background agent, with its category group already reduced to the canonical key.
 *
 * @param type event type
 * @param name event name
 * @param id optional correlation token; may be {@code null}
 * @param categoryGroup canonical comma-joined category group key
 * @param args begin/end/instant arguments; may be {@code null}
 * @param value counter value; may be {@code null} for non-count events or counter increments
 * @param timestamp capture time
 * @param threadName name of the emitting thread
 * @param session capture session sequence number that accepted the record
 * @since 0.1.0
 */
public record TraceRecord(
    TracingEventType type,
    String name,
    Long id,
    String categoryGroup,
    Map<String, Object> args,
    CounterValue value,
    Instant timestamp,
    String threadName,
    long session) {

  /**
   * Validates required fields.
   */
  public TraceRecord {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(categoryGroup, "categoryGroup");
    Objects.requireNonNull(timestamp, "timestamp");
    threadName = threadName == null ? "" : threadName;
  }
}
