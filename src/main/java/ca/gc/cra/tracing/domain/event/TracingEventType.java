package ca.gc.cra.tracing.domain.event;

import java.util.Locale;

/**
 * Types of tracing events, each mapped to its trace-event phase character.
 *
 * @since 0.1.0
 */
public enum TracingEventType {
  /** Start of an asynchronous span, correlated with its end by name and id. */
  BEGIN('S'),
  /** End of an asynchronous span. */
  END('F'),
  /** Point-in-time marker. */
  INSTANT('I'),
  /** Counter sample. */
  COUNT('C');

  private final char phase;

  TracingEventType(char phase) {
    this.phase = phase;
  }

  /**
   * Returns the trace-event phase character ({@code S}, {@code F}, {@code I}, {@code C}).
   *
   * @return phase character
   */
  public char phase() {
    return phase;
  }

  /**
   * Returns the lower-case wire name ({@code begin}, {@code end}, {@code instant}, {@code count}).
   *
   * @return wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire name, ignoring case.
   *
   * @param name event type name
   * @return matching type
   * @throws IllegalArgumentException if {@code name} is {@code null} or not one of the four event types
   */
  public static TracingEventType fromName(String name) {
    if (name != null) {
      switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "begin":
          return BEGIN;
        case "end":
          return END;
        case "instant":
          return INSTANT;
        case "count":
          return COUNT;
        default:
          break;
      }
    }
    throw new IllegalArgumentException(
        "Tracing event must include one of the eventType values: begin, end, instant, count (was " + name + ")");
  }
}
