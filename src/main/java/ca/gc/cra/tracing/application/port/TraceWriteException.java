package ca.gc.cra.tracing.application.port;

import java.io.IOException;

/**
 * Raised by a {@link TraceSink} that failed part-way through a batch.
 *
 * <p>{@link #written()} records persisted before the failure are complete and must not be written again; the
 * agent resumes the retry from that index.</p>
 *
 * @since 0.1.0
 */
public class TraceWriteException extends IOException {
  private static final long serialVersionUID = 1L;

  private final int written;

  /**
   * Creates the exception.
   *
   * @param written number of leading records of the batch fully persisted; negative values are treated as zero
   * @param cause underlying I/O failure
   */
  public TraceWriteException(int written, IOException cause) {
    super("Trace write failed after " + Math.max(0, written) + " records", cause);
    this.written = Math.max(0, written);
  }

  public int written() {
    return written;
  }
}
