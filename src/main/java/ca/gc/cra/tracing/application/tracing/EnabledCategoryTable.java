package ca.gc.cra.tracing.application.tracing;

import ca.gc.cra.tracing.domain.category.CategoryFlags;
import ca.gc.cra.tracing.domain.category.CategoryGroup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Category to bit-flag table answering "is anything interested in this category?".
 * <p><strong>Why:</strong> The emit hot path must reject disabled categories with a single lookup per category and no
 * allocation.</p>
 * <p><strong>Role:</strong> Shared state between the tracing facade, which sets {@link CategoryFlags#LISTENING}, and
 * operators enabling {@link CategoryFlags#RECORDING}. Change listeners are the enablement notification callback.</p>
 * <p><strong>Thread-safety:</strong> Reads are lock-free; mutations are serialized on the table monitor and change
 * listeners run on the mutating thread after the change is visible.</p>
 *
 * @since 0.1.0
 */
public final class EnabledCategoryTable {
  private static final Logger log = LoggerFactory.getLogger(EnabledCategoryTable.class);

  private final Map<String, Integer> flags = new ConcurrentHashMap<>();
  // insertion order for snapshots; guarded by this
  private final List<String> order = new ArrayList<>();
  private final List<CategoryTableListener> listeners = new CopyOnWriteArrayList<>();

  /**
   * Returns the flags currently set for {@code category}.
   *
   * @param category category name
   * @return bit flags, {@link CategoryFlags#NONE} when unknown
   */
  public int flags(String category) {
    if (category == null) {
      return CategoryFlags.NONE;
    }
    Integer value = flags.get(category);
    return value == null ? CategoryFlags.NONE : value;
  }

  public boolean isEnabled(String category) {
    return flags(category) != CategoryFlags.NONE;
  }

  /**
   * Tests whether any category of {@code group} has a flag set. Stops at the first enabled category.
   *
   * @param group categories to test
   * @return {@code true} when at least one category is enabled
   */
  public boolean isEnabled(CategoryGroup group) {
    if (group == null) {
      return false;
    }
    for (int i = 0; i < group.size(); i++) {
      if (flags.containsKey(group.get(i))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Sets or clears {@code mask} on every category of {@code group}.
   *
   * @param group categories to update
   * @param mask flags to set or clear
   * @param enable {@code true} to set, {@code false} to clear
   * @return {@code true} when at least one category's flags changed
   * @throws IllegalArgumentException if {@code group} is {@code null} or {@code mask} is zero
   */
  public boolean setFlags(CategoryGroup group, int mask, boolean enable) {
    if (group == null) {
      throw new IllegalArgumentException("category must be a string or collection of strings");
    }
    if (mask == CategoryFlags.NONE) {
      throw new IllegalArgumentException("mask must set at least one flag");
    }
    Map<String, Integer> snapshot;
    synchronized (this) {
      boolean changed = false;
      for (int i = 0; i < group.size(); i++) {
        changed |= apply(group.get(i), mask, enable);
      }
      if (!changed) {
        return false;
      }
      snapshot = snapshotLocked();
    }
    if (log.isDebugEnabled()) {
      log.debug("Category flags {} {} for {}", enable ? "set" : "cleared", CategoryFlags.describe(mask), group);
    }
    for (CategoryTableListener listener : listeners) {
      listener.onCategoriesChanged(snapshot);
    }
    return true;
  }

  /**
   * Lists categories having any bit of {@code mask} set, in first-enabled order.
   *
   * @param mask flags to match
   * @return immutable list
   */
  public synchronized List<String> categoriesWith(int mask) {
    List<String> result = new ArrayList<>();
    for (String category : order) {
      if ((flags(category) & mask) != 0) {
        result.add(category);
      }
    }
    return List.copyOf(result);
  }

  public List<String> enabledCategories() {
    return categoriesWith(CategoryFlags.RECORDING | CategoryFlags.LISTENING);
  }

  /**
   * Returns every enabled category with its flags.
   *
   * @return immutable insertion-ordered map
   */
  public synchronized Map<String, Integer> snapshot() {
    return snapshotLocked();
  }

  public void addListener(CategoryTableListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(CategoryTableListener listener) {
    listeners.remove(listener);
  }

  private boolean apply(String category, int mask, boolean enable) {
    int current = flags(category);
    int next = enable ? current | mask : current & ~mask;
    if (next == current) {
      return false;
    }
    if (next == CategoryFlags.NONE) {
      flags.remove(category);
      order.remove(category);
    } else {
      if (current == CategoryFlags.NONE) {
        order.add(category);
      }
      flags.put(category, next);
    }
    return true;
  }

  private Map<String, Integer> snapshotLocked() {
    Map<String, Integer> copy = new LinkedHashMap<>();
    for (String category : order) {
      copy.put(category, flags.get(category));
    }
    return Collections.unmodifiableMap(copy);
  }
}
