package ca.gc.cra.tracing.application.port;

import ca.gc.cra.tracing.domain.event.CounterValue;
import java.time.Instant;
import java.util.Map;

/**
 * <strong>What:</strong> Outbound port receiving enabled trace events from the tracing facade.
 * <p><strong>Why:</strong> Separates the enablement and dispatch logic from the capture engine that buffers and
 * persists events.</p>
 * <p><strong>Role:</strong> Implemented by {@code AgentTraceRecorder}; tests supply recording doubles.</p>
 * <p><strong>Performance:</strong> Called on the application thread for every enabled event; implementations must
 * not block. The {@code categoryGroup} argument is the canonical, interned key computed once per distinct group.</p>
 *
 * @since 0.1.0
 */
public interface TraceRecorder {
  /**
   * Records the start of an asynchronous span.
   *
   * @param name span name
   * @param id correlation token; may be {@code null}
   * @param categoryGroup canonical comma-joined category key
   * @param args up to two named arguments; may be {@code null}
   * @param timestamp capture time
   */
  void emitBegin(String name, Long id, String categoryGroup, Map<String, Object> args, Instant timestamp);

  /**
   * Records the end of an asynchronous span.
   *
   * @param name span name
   * @param id correlation token; may be {@code null}
   * @param categoryGroup canonical comma-joined category key
   * @param args up to two named arguments; may be {@code null}
   * @param timestamp capture time
   */
  void emitEnd(String name, Long id, String categoryGroup, Map<String, Object> args, Instant timestamp);

  /**
   * Records a point-in-time event.
   *
   * @param name event name
   * @param id correlation token; may be {@code null}
   * @param categoryGroup canonical comma-joined category key
   * @param args up to two named arguments; may be {@code null}
   * @param timestamp capture time
   */
  void emitInstant(String name, Long id, String categoryGroup, Map<String, Object> args, Instant timestamp);

  /**
   * Records a counter sample.
   *
   * @param name counter name
   * @param id correlation token; may be {@code null}
   * @param categoryGroup canonical comma-joined category key
   * @param value counter value; {@code null} increments the single-value counter
   * @param timestamp capture time
   */
  void emitCount(String name, Long id, String categoryGroup, CounterValue value, Instant timestamp);
}
