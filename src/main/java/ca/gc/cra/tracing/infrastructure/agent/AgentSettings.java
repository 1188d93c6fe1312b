package ca.gc.cra.tracing.infrastructure.agent;

import ca.gc.cra.tracing.validation.Numbers;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Tuning knobs of the {@link TracingAgent}.
 *
 * @param queueCapacity hand-off buffer capacity; records offered while full are dropped
 * @param batchSize maximum records written to the sink per call
 * @param flushInterval period between sink flushes while records are pending
 * @param shutdownTimeout bound on blocking flush requests and on joining the agent thread
 * @param defaultCategories allow-list used when none has been set
 * @since 0.1.0
 */
public record AgentSettings(
    int queueCapacity,
    int batchSize,
    Duration flushInterval,
    Duration shutdownTimeout,
    List<String> defaultCategories) {
  public static final int DEFAULT_QUEUE_CAPACITY = 8192;
  public static final int DEFAULT_BATCH_SIZE = 256;
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  public static final List<String> DEFAULT_CATEGORIES = List.of("app", "runtime");

  /**
   * Validates ranges and copies the default categories.
   */
  public AgentSettings {
    Numbers.requireRange("agent.queueCapacity", queueCapacity, 1, 1_048_576);
    Numbers.requireRange("agent.batchSize", batchSize, 1, queueCapacity);
    Objects.requireNonNull(flushInterval, "flushInterval");
    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    if (flushInterval.isNegative() || flushInterval.isZero()) {
      throw new IllegalArgumentException("agent.flushIntervalMillis must be positive");
    }
    if (shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
      throw new IllegalArgumentException("agent.shutdownTimeoutMillis must be positive");
    }
    defaultCategories = defaultCategories == null ? DEFAULT_CATEGORIES : List.copyOf(defaultCategories);
  }

  public static AgentSettings defaults() {
    return new AgentSettings(
        DEFAULT_QUEUE_CAPACITY, DEFAULT_BATCH_SIZE, DEFAULT_FLUSH_INTERVAL, DEFAULT_SHUTDOWN_TIMEOUT, DEFAULT_CATEGORIES);
  }
}
