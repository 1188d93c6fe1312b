package ca.gc.cra.tracing.application.tracing;

import java.util.Map;

/**
 * Notified after an {@link EnabledCategoryTable} mutation actually changed at least one category's flags.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CategoryTableListener {
  /**
   * Receives the table contents after the change.
   *
   * @param snapshot immutable map of category to non-zero flags
   */
  void onCategoriesChanged(Map<String, Integer> snapshot);
}
