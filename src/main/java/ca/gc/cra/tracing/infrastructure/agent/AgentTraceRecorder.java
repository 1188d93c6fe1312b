package ca.gc.cra.tracing.infrastructure.agent;

import ca.gc.cra.tracing.application.port.TraceRecorder;
import ca.gc.cra.tracing.domain.event.CounterValue;
import ca.gc.cra.tracing.domain.event.TracingEventType;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TraceRecorder} that turns facade calls into {@link ca.gc.cra.tracing.domain.event.TraceRecord}s queued on a
 * {@link TracingAgent}. Records outside the agent's allow-list, or arriving while it is stopped, are ignored.
 *
 * @since 0.1.0
 */
public final class AgentTraceRecorder implements TraceRecorder {
  private final TracingAgent agent;

  public AgentTraceRecorder(TracingAgent agent) {
    this.agent = Objects.requireNonNull(agent, "agent");
  }

  @Override
  public void emitBegin(String name, Long id, String categoryGroup, Map<String, Object> args, Instant timestamp) {
    agent.record(TracingEventType.BEGIN, name, id, categoryGroup, args, null, timestamp);
  }

  @Override
  public void emitEnd(String name, Long id, String categoryGroup, Map<String, Object> args, Instant timestamp) {
    agent.record(TracingEventType.END, name, id, categoryGroup, args, null, timestamp);
  }

  @Override
  public void emitInstant(String name, Long id, String categoryGroup, Map<String, Object> args, Instant timestamp) {
    agent.record(TracingEventType.INSTANT, name, id, categoryGroup, args, null, timestamp);
  }

  @Override
  public void emitCount(String name, Long id, String categoryGroup, CounterValue value, Instant timestamp) {
    agent.record(TracingEventType.COUNT, name, id, categoryGroup, null, value, timestamp);
  }
}
