package ca.gc.cra.tracing.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value carried by a {@link TracingEventType#COUNT} event: either a single number or a two-series counter.
 *
 * <p>The recorder supports multi-value counters with exactly two named series. A count event without a
 * {@code CounterValue} means "increment the single-value counter by one".</p>
 *
 * @param single value of a single-value counter; {@code null} for a multi-value counter
 * @param series the two named values of a multi-value counter in insertion order; {@code null} for a single value
 * @since 0.1.0
 */
public record CounterValue(Number single, Map<String, Number> series) {
  /** Number of series a multi-value counter must carry. */
  public static final int SERIES_COUNT = 2;

  /**
   * Validates that exactly one representation is present.
   */
  public CounterValue {
    if ((single == null) == (series == null)) {
      throw new IllegalArgumentException("counter value must be either a number or a map of two numbers");
    }
    if (series != null) {
      if (series.size() != SERIES_COUNT) {
        throw new IllegalArgumentException(
            "multi-value counters must have exactly " + SERIES_COUNT + " values (was " + series.size() + ")");
      }
      Map<String, Number> copy = new LinkedHashMap<>();
      for (Map.Entry<String, Number> entry : series.entrySet()) {
        if (entry.getKey() == null || entry.getKey().isBlank()) {
          throw new IllegalArgumentException("counter series names must not be blank");
        }
        if (entry.getValue() == null) {
          throw new IllegalArgumentException("counter series '" + entry.getKey() + "' must have a numeric value");
        }
        copy.put(entry.getKey(), entry.getValue());
      }
      series = Collections.unmodifiableMap(copy);
    }
  }

  public static CounterValue of(Number value) {
    return new CounterValue(value, null);
  }

  public static CounterValue of(Map<String, ? extends Number> series) {
    return new CounterValue(null, series == null ? null : new LinkedHashMap<>(series));
  }

  public boolean isMulti() {
    return series != null;
  }
}
