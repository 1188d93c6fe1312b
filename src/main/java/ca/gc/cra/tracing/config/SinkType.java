package ca.gc.cra.tracing.config;

import java.util.Locale;

/**
 * Trace sink selected by {@code sink.type}.
 *
 * @since 0.1.0
 */
public enum SinkType {
  /** Discard captured records. */
  NONE,
  /** One SLF4J line per record. */
  LOG,
  /** JSON lines file at {@code sink.path}. */
  JSONL,
  /** In-memory buffer for tests and diagnostics. */
  MEMORY;

  /**
   * Parses a sink type, defaulting to {@link #NONE} when blank.
   *
   * @param value textual form such as {@code "jsonl"}
   * @return parsed type
   * @throws IllegalArgumentException if the value names no sink type
   */
  public static SinkType fromString(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    try {
      return SinkType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown sink.type: " + value + " (expected none, log, jsonl, memory)", ex);
    }
  }
}
