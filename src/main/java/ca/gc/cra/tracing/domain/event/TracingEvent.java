package ca.gc.cra.tracing.domain.event;

import ca.gc.cra.tracing.domain.category.CategoryGroup;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Immutable structured trace event supplied to the tracing facade and delivered to
 * in-process listeners.
 * <p><strong>Why:</strong> Gives emitters one validated shape for begin/end/instant/count events so the facade can
 * forward them to the recorder without re-checking payload rules on the hot path.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable; argument maps are copied into unmodifiable views.</p>
 *
 * @param eventType event type; required
 * @param name event, timer, or counter name; required and non-blank
 * @param id optional numeric correlation token pairing begin/end events; may be {@code null}
 * @param categories categories of the event; may be {@code null} when the caller passes an explicit override to
 *     {@code Tracing.emit}
 * @param value counter value for {@link TracingEventType#COUNT} events only; {@code null} means increment
 * @param args one or two named arguments for begin/end/instant events only; empty maps are stored as {@code null}
 * @param timestamp optional capture time; the facade stamps the current time when absent
 * @since 0.1.0
 */
public record TracingEvent(
    TracingEventType eventType,
    String name,
    Long id,
    CategoryGroup categories,
    CounterValue value,
    Map<String, Object> args,
    Instant timestamp) {
  /** Maximum number of named arguments the recorder accepts per event. */
  public static final int MAX_ARGS = 2;

  /**
   * Validates event invariants and defensively copies the argument map.
   */
  public TracingEvent {
    if (eventType == null) {
      throw new IllegalArgumentException(
          "Tracing event must include one of the eventType values: begin, end, instant, count");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Tracing event name must not be blank");
    }
    if (eventType == TracingEventType.COUNT) {
      if (args != null && !args.isEmpty()) {
        throw new IllegalArgumentException("args are not used for count events; use value instead");
      }
      args = null;
    } else {
      if (value != null) {
        throw new IllegalArgumentException("value is only used for count events (was " + eventType.wireName() + ")");
      }
      args = copyArgs(args);
    }
  }

  public static TracingEvent begin(String name) {
    return new TracingEvent(TracingEventType.BEGIN, name, null, null, null, null, null);
  }

  public static TracingEvent end(String name) {
    return new TracingEvent(TracingEventType.END, name, null, null, null, null, null);
  }

  public static TracingEvent instant(String name) {
    return new TracingEvent(TracingEventType.INSTANT, name, null, null, null, null, null);
  }

  /**
   * Creates a count event that increments the single-value counter.
   *
   * @param name counter name
   * @return count event without a value
   */
  public static TracingEvent count(String name) {
    return new TracingEvent(TracingEventType.COUNT, name, null, null, null, null, null);
  }

  public static TracingEvent count(String name, Number value) {
    return new TracingEvent(TracingEventType.COUNT, name, null, null, CounterValue.of(value), null, null);
  }

  public static TracingEvent count(String name, Map<String, ? extends Number> series) {
    return new TracingEvent(TracingEventType.COUNT, name, null, null, CounterValue.of(series), null, null);
  }

  public TracingEvent withId(long correlationId) {
    return new TracingEvent(eventType, name, correlationId, categories, value, args, timestamp);
  }

  public TracingEvent withCategories(CategoryGroup group) {
    return new TracingEvent(eventType, name, id, group, value, args, timestamp);
  }

  public TracingEvent withCategories(String... group) {
    return withCategories(CategoryGroup.of(group));
  }

  public TracingEvent withArgs(Map<String, ?> eventArgs) {
    return new TracingEvent(
        eventType, name, id, categories, value, eventArgs == null ? null : new LinkedHashMap<>(eventArgs), timestamp);
  }

  public TracingEvent withTimestamp(Instant at) {
    return new TracingEvent(eventType, name, id, categories, value, args, at);
  }

  /**
   * Builds an event from an untyped attribute map, as produced by a JSON or YAML decoder.
   *
   * <p>Recognized keys: {@code eventType}, {@code name}, {@code id}, {@code category}, {@code value},
   * {@code args}, {@code timestamp}. {@code timestamp} may be an {@link Instant} or epoch milliseconds.</p>
   *
   * @param attributes source attributes; must not be {@code null}
   * @return validated event
   * @throws IllegalArgumentException when the event type is absent or unrecognized, or when any field has the
   *     wrong shape
   */
  public static TracingEvent fromMap(Map<String, ?> attributes) {
    if (attributes == null) {
      throw new IllegalArgumentException("A tracing event object is required");
    }
    Object rawType = attributes.get("eventType");
    if (rawType != null && !(rawType instanceof String) && !(rawType instanceof TracingEventType)) {
      throw new IllegalArgumentException("eventType must be a string");
    }
    TracingEventType type = rawType instanceof TracingEventType t ? t : TracingEventType.fromName((String) rawType);

    Object rawName = attributes.get("name");
    if (rawName != null && !(rawName instanceof String)) {
      throw new IllegalArgumentException("name must be a string");
    }

    Object rawCategory = attributes.get("category");
    CategoryGroup group = rawCategory == null ? null : CategoryGroup.from(rawCategory);

    return new TracingEvent(
        type,
        (String) rawName,
        toId(attributes.get("id")),
        group,
        toCounterValue(attributes.get("value")),
        toArgs(attributes.get("args")),
        toTimestamp(attributes.get("timestamp")));
  }

  private static Map<String, Object> copyArgs(Map<String, Object> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    if (args.size() > MAX_ARGS) {
      throw new IllegalArgumentException(
          "Tracing events support at most " + MAX_ARGS + " args (was " + args.size() + ")");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : args.entrySet()) {
      if (entry.getKey() == null || entry.getKey().isBlank()) {
        throw new IllegalArgumentException("Tracing event arg names must not be blank");
      }
      copy.put(entry.getKey(), entry.getValue());
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Long toId(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Long l) {
      return l;
    }
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return ((Number) raw).longValue();
    }
    if (raw instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("id must be numeric (was '" + s + "')", ex);
      }
    }
    throw new IllegalArgumentException("id must be numeric");
  }

  private static CounterValue toCounterValue(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof CounterValue counter) {
      return counter;
    }
    if (raw instanceof Number number) {
      return CounterValue.of(number);
    }
    if (raw instanceof Map<?, ?> map) {
      Map<String, Number> series = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key) || !(entry.getValue() instanceof Number number)) {
          throw new IllegalArgumentException("counter value map must contain name -> number entries");
        }
        series.put(key, number);
      }
      return CounterValue.of(series);
    }
    throw new IllegalArgumentException("value must be a number or a map of two numbers");
  }

  private static Map<String, Object> toArgs(Object raw) {
    if (raw == null) {
      return null;
    }
    if (!(raw instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException("args must be a map of name -> value");
    }
    Map<String, Object> args = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("args must be a map of name -> value");
      }
      args.put(key, entry.getValue());
    }
    return args;
  }

  private static Instant toTimestamp(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Instant instant) {
      return instant;
    }
    if (raw instanceof Number millis) {
      return Instant.ofEpochMilli(millis.longValue());
    }
    throw new IllegalArgumentException("timestamp must be an Instant or epoch milliseconds");
  }
}
