package ca.gc.cra.tracing.application.tracing;

import ca.gc.cra.tracing.application.port.MetricsPort;
import ca.gc.cra.tracing.domain.category.CategoryGroup;
import ca.gc.cra.tracing.validation.Numbers;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Interning cache from {@link CategoryGroup} to its canonical recorder key.
 * <p><strong>Why:</strong> Recorders identify category groups by one comma-joined string; building it on every emit
 * would allocate on the hot path.</p>
 * <p><strong>Role:</strong> Used by the tracing facade before forwarding events to the recorder.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Hits are lock-free; inserts are serialized so the cap
 * holds under contention.</p>
 * <p><strong>Observability:</strong> Increments {@code tracing.groupKeys.overflow} for every key computed past the
 * cap and logs one warning the first time.</p>
 *
 * @since 0.1.0
 */
public final class CategoryGroupKeys {
  /** Default number of distinct groups cached. */
  public static final int DEFAULT_MAX_ENTRIES = 4096;

  private static final Logger log = LoggerFactory.getLogger(CategoryGroupKeys.class);

  private final Map<CategoryGroup, String> keys = new ConcurrentHashMap<>();
  private final int maxEntries;
  private final MetricsPort metrics;
  private final AtomicBoolean overflowWarned = new AtomicBoolean();
  private final Object insertLock = new Object();

  public CategoryGroupKeys() {
    this(DEFAULT_MAX_ENTRIES, MetricsPort.NO_OP);
  }

  /**
   * Creates a cache bounded to {@code maxEntries} groups.
   *
   * @param maxEntries cache cap; at least 1
   * @param metrics metrics sink
   */
  public CategoryGroupKeys(int maxEntries, MetricsPort metrics) {
    this.maxEntries = (int) Numbers.requireRange("groupKeys.maxEntries", maxEntries, 1, Integer.MAX_VALUE);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the canonical key of {@code group}: categories sorted, joined with commas, interned.
   *
   * @param group non-empty category group
   * @return canonical key
   */
  public String keyFor(CategoryGroup group) {
    String key = keys.get(group);
    if (key != null) {
      return key;
    }
    key = canonicalKey(group);
    synchronized (insertLock) {
      String existing = keys.get(group);
      if (existing != null) {
        return existing;
      }
      if (keys.size() < maxEntries) {
        keys.put(group, key);
        return key;
      }
    }
    metrics.increment("tracing.groupKeys.overflow");
    if (overflowWarned.compareAndSet(false, true)) {
      log.warn("Category group key cache reached {} entries; further keys are computed per emit", maxEntries);
    }
    return key;
  }

  public int size() {
    return keys.size();
  }

  public int maxEntries() {
    return maxEntries;
  }

  /**
   * Computes the canonical key without caching.
   *
   * @param group category group
   * @return sorted, comma-joined, interned key
   */
  public static String canonicalKey(CategoryGroup group) {
    String[] sorted = group.asList().toArray(new String[0]);
    Arrays.sort(sorted);
    return String.join(",", sorted).intern();
  }
}
