package ca.gc.cra.tracing.application.port;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * <strong>What:</strong> Port controlling the background capture session.
 * <p><strong>Why:</strong> The facade keeps the capture allow-list aligned with the enablement table without knowing
 * how the agent buffers or writes events.</p>
 * <p><strong>Role:</strong> Implemented by {@code TracingAgent}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @since 0.1.0
 */
public interface TraceCapturePort {
  /**
   * Replaces the category allow-list; applied immediately when a session is active.
   *
   * @param categories categories to capture
   */
  void setCategories(Collection<String> categories);

  /**
   * Returns the current allow-list.
   *
   * @return immutable snapshot
   */
  List<String> categories();

  /** Starts (or restarts) a capture session. */
  void start();

  /**
   * Stops the active session and flushes buffered events.
   *
   * @throws IOException if the final flush fails after one retry
   */
  void stop() throws IOException;

  boolean isStarted();

  /**
   * Reports whether the port was shut down for good; a closed port rejects {@link #start()}.
   *
   * @return {@code true} once closed
   */
  default boolean isClosed() {
    return false;
  }

  /**
   * Capture port that ignores every request; used when no agent is wired.
   */
  TraceCapturePort NO_OP = new TraceCapturePort() {
    @Override public void setCategories(Collection<String> categories) {}

    @Override public List<String> categories() {
      return List.of();
    }

    @Override public void start() {}

    @Override public void stop() {}

    @Override public boolean isStarted() {
      return false;
    }
  };
}
