package ca.gc.cra.tracing.domain.category;

import ca.gc.cra.tracing.validation.Strings;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, insertion-ordered set of tracing categories attached to one emit call or one listener
 * registration.
 *
 * <p>A group is a logical OR-set: an event emitted for {@code [a, b]} reaches listeners of {@code a} or
 * {@code b}. Equality uses set semantics so {@code [a, b]} and {@code [b, a]} are equal. Empty-string entries
 * are dropped during normalization; the empty group is legal and matches nothing.</p>
 *
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads and to use as a map key.</p>
 *
 * @since 0.1.0
 */
public final class CategoryGroup implements Iterable<String> {
  private static final CategoryGroup EMPTY = new CategoryGroup(new String[0]);

  private final String[] categories;
  private final Set<String> lookup;
  private final int hash;

  private CategoryGroup(String[] categories) {
    this.categories = categories;
    this.lookup = categories.length == 0
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(categories)));
    this.hash = lookup.hashCode();
  }

  /**
   * Returns the empty group.
   *
   * @return shared empty instance
   */
  public static CategoryGroup empty() {
    return EMPTY;
  }

  /**
   * Normalizes a single category name to a one-element group.
   *
   * @param category category name; the empty string yields the empty group
   * @return normalized group
   * @throws IllegalArgumentException if {@code category} is {@code null} or malformed
   */
  public static CategoryGroup of(String category) {
    if (category == null) {
      throw new IllegalArgumentException("category must be a string or collection of strings");
    }
    if (category.isEmpty()) {
      return EMPTY;
    }
    return new CategoryGroup(new String[] {Strings.requireCategory(category)});
  }

  /**
   * Normalizes an array of category names.
   *
   * @param categories category names; duplicates and empty strings are dropped
   * @return normalized group
   * @throws IllegalArgumentException if the array or any element is {@code null} or malformed
   */
  public static CategoryGroup of(String... categories) {
    if (categories == null) {
      throw new IllegalArgumentException("category must be a string or collection of strings");
    }
    return of(Arrays.asList(categories));
  }

  /**
   * Normalizes a collection of category names.
   *
   * @param categories collection whose elements must all be strings
   * @return normalized group
   * @throws IllegalArgumentException if the collection is {@code null} or contains a non-string element
   */
  public static CategoryGroup of(Collection<?> categories) {
    if (categories == null) {
      throw new IllegalArgumentException("category must be a string or collection of strings");
    }
    LinkedHashSet<String> unique = new LinkedHashSet<>();
    for (Object candidate : categories) {
      if (!(candidate instanceof String category)) {
        throw new IllegalArgumentException("category must be a string or collection of strings");
      }
      if (!category.isEmpty()) {
        unique.add(Strings.requireCategory(category));
      }
    }
    if (unique.isEmpty()) {
      return EMPTY;
    }
    return new CategoryGroup(unique.toArray(new String[0]));
  }

  /**
   * Normalizes an untyped category argument, as received from configuration or dynamic callers.
   *
   * @param value a {@link CategoryGroup}, {@link String}, {@code String[]}, or {@link Collection} of strings
   * @return normalized group
   * @throws IllegalArgumentException for any other argument type
   */
  public static CategoryGroup from(Object value) {
    if (value instanceof CategoryGroup group) {
      return group;
    }
    if (value instanceof String category) {
      return of(category);
    }
    if (value instanceof String[] array) {
      return of(array);
    }
    if (value instanceof Collection<?> collection) {
      return of(collection);
    }
    throw new IllegalArgumentException("category must be a string or collection of strings");
  }

  /**
   * Parses a comma-separated category list such as {@code "app,db"}. Whitespace around entries is trimmed.
   *
   * @param list comma-separated categories; {@code null} or blank yields the empty group
   * @return normalized group
   */
  public static CategoryGroup parse(String list) {
    if (list == null || list.isBlank()) {
      return EMPTY;
    }
    String[] tokens = list.split(",");
    for (int i = 0; i < tokens.length; i++) {
      tokens[i] = tokens[i].trim();
    }
    return of(tokens);
  }

  /**
   * Tests membership.
   *
   * @param category category name
   * @return {@code true} when the group contains the category
   */
  public boolean contains(String category) {
    return lookup.contains(category);
  }

  /**
   * Tests whether this group shares at least one category with another group.
   *
   * @param other other group
   * @return {@code true} on any overlap
   */
  public boolean intersects(CategoryGroup other) {
    for (String category : other.categories) {
      if (lookup.contains(category)) {
        return true;
      }
    }
    return false;
  }

  public boolean isEmpty() {
    return categories.length == 0;
  }

  public int size() {
    return categories.length;
  }

  /**
   * Returns the category at {@code index} in insertion order. Indexed access keeps the enablement hot path free
   * of iterator allocation.
   *
   * @param index zero-based position
   * @return category name
   */
  public String get(int index) {
    return categories[index];
  }

  /**
   * Returns the categories in insertion order.
   *
   * @return unmodifiable list view
   */
  public List<String> asList() {
    return List.of(categories);
  }

  /**
   * Returns the categories as an unmodifiable set.
   *
   * @return set view preserving insertion order
   */
  public Set<String> asSet() {
    return lookup;
  }

  @Override
  public Iterator<String> iterator() {
    return lookup.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CategoryGroup other)) {
      return false;
    }
    return hash == other.hash && lookup.equals(other.lookup);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return Arrays.toString(categories);
  }
}
