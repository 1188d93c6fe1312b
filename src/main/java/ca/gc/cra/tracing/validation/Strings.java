package ca.gc.cra.tracing.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by tracing categories, event names, and configuration.
 * <p><strong>Why:</strong> Ensures emit and listener calls reject malformed identifiers at the call site, before
 * they reach the enablement table or the canonical group key cache.
 * <p><strong>Role:</strong> Domain support utilities invoked by {@code CategoryGroup}, {@code TracingEvent}, and
 * configuration loaders.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied by callers or config files.</li>
 *   <li>Reject category names that would corrupt comma-joined category group keys.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans with minimal allocations (trimmed copy only when needed).</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed; caller owns the result
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   *
   * <p><strong>Concurrency:</strong> Thread-safe; method uses only locals.</p>
   * <p><strong>Performance:</strong> Single pass trim and character scan; O(n) on the input length.</p>
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a single category name.
   *
   * <p>Category names are used verbatim (no trimming) because listeners and emitters must agree on the
   * exact identifier. Commas are rejected since they delimit categories inside a canonical group key.</p>
   *
   * @param category candidate category; must be non-empty
   * @return the same category instance
   * @throws IllegalArgumentException if the category is {@code null}, empty, contains a comma, or contains control
   *     characters
   */
  public static String requireCategory(String category) {
    if (category == null) {
      throw new IllegalArgumentException("category must be a string or collection of strings");
    }
    if (category.isEmpty()) {
      throw new IllegalArgumentException("category must not be empty");
    }
    for (int i = 0; i < category.length(); i++) {
      char c = category.charAt(i);
      if (c == ',') {
        throw new IllegalArgumentException("category must not contain ',': " + category);
      }
      if (Character.isISOControl(c)) {
        throw new IllegalArgumentException("category must not contain control characters");
      }
    }
    return category;
  }

  /**
   * Returns the first argument that is neither {@code null} nor blank, trimmed.
   *
   * @param first preferred candidate (e.g. a system property)
   * @param second fallback candidate (e.g. an environment variable)
   * @param defaultValue value returned when both candidates are blank
   * @return trimmed winner or {@code defaultValue}
   */
  public static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
