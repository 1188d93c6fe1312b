package ca.gc.cra.tracing.infrastructure.agent;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives I/O failures the agent thread could not recover from with one retry.
 *
 * <p>Called on the agent thread; implementations must not block.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AgentErrorHandler {
  /**
   * Handles a failed background operation.
   *
   * @param operation {@code write}, {@code flush} or {@code close}
   * @param error failure after retry
   */
  void onError(String operation, IOException error);

  /**
   * Returns the default handler, which logs at error level.
   *
   * @return logging handler
   */
  static AgentErrorHandler logging() {
    Logger log = LoggerFactory.getLogger(TracingAgent.class);
    return (operation, error) -> log.error("Trace agent {} failed; records may be lost", operation, error);
  }
}
