package ca.gc.cra.tracing.application.port;

import ca.gc.cra.tracing.domain.event.TraceRecord;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Persistence port written by the capture agent's background thread.
 * <p><strong>Why:</strong> Keeps the agent lifecycle independent of where trace records end up (file, log, memory).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist batches of {@link TraceRecord} in capture order.</li>
 *   <li>Flush buffered records when requested.</li>
 *   <li>Dispose of persistence resources cleanly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Only the agent thread calls a sink; implementations need no synchronization
 * unless they expose state to other threads.</p>
 *
 * @since 0.1.0
 */
public interface TraceSink extends AutoCloseable {
  /**
   * Persists a batch of records.
   *
   * <p>A sink that fails after persisting some records throws {@link TraceWriteException} with the count of
   * complete records so a retry does not duplicate them. A record that can never be persisted is skipped and
   * reported by the sink rather than failing the batch.</p>
   *
   * @param records records in capture order; never empty
   * @throws IOException if the write fails
   */
  void write(List<TraceRecord> records) throws IOException;

  /**
   * Flushes buffered records to durable storage.
   *
   * @throws IOException if flushing fails
   */
  default void flush() throws IOException {}

  /**
   * Closes the sink.
   *
   * @throws IOException if shutdown fails
   */
  @Override
  default void close() throws IOException {}
}
