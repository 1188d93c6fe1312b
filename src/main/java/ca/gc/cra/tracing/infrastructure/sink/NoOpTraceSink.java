package ca.gc.cra.tracing.infrastructure.sink;

import ca.gc.cra.tracing.application.port.TraceSink;
import ca.gc.cra.tracing.domain.event.TraceRecord;
import java.util.List;

/**
 * Sink that discards every record; wired when {@code sink.type=none}.
 *
 * @since 0.1.0
 */
public final class NoOpTraceSink implements TraceSink {
  @Override
  public void write(List<TraceRecord> records) {}
}
