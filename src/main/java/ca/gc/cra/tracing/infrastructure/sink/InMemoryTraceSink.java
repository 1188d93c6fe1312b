package ca.gc.cra.tracing.infrastructure.sink;

import ca.gc.cra.tracing.application.port.TraceSink;
import ca.gc.cra.tracing.domain.event.TraceRecord;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory sink used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryTraceSink implements TraceSink {
  private final CopyOnWriteArrayList<TraceRecord> records = new CopyOnWriteArrayList<>();
  private final AtomicInteger flushes = new AtomicInteger();
  private volatile boolean closed;

  @Override
  public void write(List<TraceRecord> batch) {
    records.addAll(Objects.requireNonNull(batch, "batch"));
  }

  @Override
  public void flush() {
    flushes.incrementAndGet();
  }

  @Override
  public void close() {
    closed = true;
  }

  /**
   * Returns a snapshot of written records.
   *
   * @return immutable list of records in write order
   */
  public List<TraceRecord> snapshot() {
    return List.copyOf(records);
  }

  public int flushCount() {
    return flushes.get();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Clears the captured records.
   */
  public void clear() {
    records.clear();
  }
}
