package ca.gc.cra.tracing.application.events;

import ca.gc.cra.tracing.domain.category.CategoryGroup;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <strong>What:</strong> Event emitter keyed by category sets instead of single event names.
 * <p><strong>Why:</strong> Trace events belong to several categories at once; a listener subscribed to more than one
 * of them must still see each event exactly once.</p>
 * <p><strong>Role:</strong> Application-layer engine composed by the tracing facade.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep one registration per listener identity, merging categories on repeated registration.</li>
 *   <li>Track per-category listener counts and report categories gaining or losing their last listener to
 *   {@link MultiplexerObserver}s.</li>
 *   <li>Dispatch payloads over a snapshot of registrations so listeners may subscribe or unsubscribe while
 *   being invoked.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Callers confine an instance to one thread.</p>
 * <p><strong>Performance:</strong> Emit performs one map lookup per category to reject unmatched groups before
 * scanning registrations.</p>
 *
 * @param <E> payload type
 * @since 0.1.0
 */
public final class CategoryMultiplexer<E> {
  /** Names whose registration never raises category notifications. */
  public static final Set<String> META_CATEGORY_NAMES =
      Set.of("newListener", "removeListener", "newListenerCategory", "removeListenerCategory");

  private final List<Registration<E>> registrations = new ArrayList<>();
  private final Map<CategoryListener<E>, Registration<E>> byListener = new IdentityHashMap<>();
  private final Map<String, Integer> categoryCounts = new LinkedHashMap<>();
  private final List<MultiplexerObserver<E>> observers = new CopyOnWriteArrayList<>();
  private ListenerErrorHandler<E> errorHandler = ListenerErrorHandler.rethrowing();

  /**
   * Registers an observer for registration-table changes.
   *
   * @param observer observer; must not be {@code null}
   */
  public void addObserver(MultiplexerObserver<E> observer) {
    observers.add(Objects.requireNonNull(observer, "observer"));
  }

  public void removeObserver(MultiplexerObserver<E> observer) {
    observers.remove(observer);
  }

  /**
   * Replaces the handler consulted when a listener throws during dispatch.
   *
   * @param handler handler; must not be {@code null}
   */
  public void setErrorHandler(ListenerErrorHandler<E> handler) {
    this.errorHandler = Objects.requireNonNull(handler, "handler");
  }

  /**
   * Subscribes {@code listener} to every category of {@code group}.
   *
   * <p>An empty group is a no-op. Observers first receive {@code categoryAdded} for each category that had no
   * listener before this call, then {@code listenerAdded} if the listener was not registered yet.</p>
   *
   * @param group categories to subscribe to
   * @param listener listener; must not be {@code null}
   * @return this multiplexer
   * @throws IllegalArgumentException if {@code group} is {@code null}
   */
  public CategoryMultiplexer<E> on(CategoryGroup group, CategoryListener<E> listener) {
    requireGroup(group);
    Objects.requireNonNull(listener, "listener");
    if (group.isEmpty()) {
      return this;
    }

    List<String> newCategories = new ArrayList<>(group.size());
    Registration<E> registration = byListener.get(listener);
    boolean newListener = registration == null;
    if (newListener) {
      registration = new Registration<>(listener);
      registrations.add(registration);
      byListener.put(listener, registration);
    }
    for (int i = 0; i < group.size(); i++) {
      String category = group.get(i);
      if (registration.categories.add(category)) {
        int count = categoryCounts.merge(category, 1, Integer::sum);
        if (count == 1 && !isMetaCategoryName(category)) {
          newCategories.add(category);
        }
      }
    }

    for (String category : newCategories) {
      for (MultiplexerObserver<E> observer : observers) {
        observer.categoryAdded(category);
      }
    }
    if (newListener) {
      for (MultiplexerObserver<E> observer : observers) {
        observer.listenerAdded(listener);
      }
    }
    return this;
  }

  public CategoryMultiplexer<E> on(String category, CategoryListener<E> listener) {
    return on(CategoryGroup.of(category), listener);
  }

  public CategoryMultiplexer<E> on(Collection<String> categories, CategoryListener<E> listener) {
    return on(CategoryGroup.of(categories), listener);
  }

  /**
   * Alias for {@link #on(CategoryGroup, CategoryListener)}.
   *
   * @param group categories to subscribe to
   * @param listener listener
   * @return this multiplexer
   */
  public CategoryMultiplexer<E> addListener(CategoryGroup group, CategoryListener<E> listener) {
    return on(group, listener);
  }

  /**
   * Unsubscribes {@code listener} from the categories of {@code group}.
   *
   * <p>When the listener has no category left its registration is deleted and observers receive
   * {@code listenerRemoved}; then {@code categoryRemoved} fires for each category this call left without listeners.
   * Removing a pair that is not registered changes nothing and notifies no one.</p>
   *
   * @param group categories to unsubscribe from
   * @param listener listener; must not be {@code null}
   * @return this multiplexer
   */
  public CategoryMultiplexer<E> removeListener(CategoryGroup group, CategoryListener<E> listener) {
    requireGroup(group);
    Objects.requireNonNull(listener, "listener");
    Registration<E> registration = byListener.get(listener);
    if (registration == null || group.isEmpty()) {
      return this;
    }

    List<String> emptied = new ArrayList<>(group.size());
    for (int i = 0; i < group.size(); i++) {
      String category = group.get(i);
      if (registration.categories.remove(category) && decrement(category)) {
        emptied.add(category);
      }
    }

    if (registration.categories.isEmpty()) {
      registrations.remove(registration);
      byListener.remove(listener);
      for (MultiplexerObserver<E> observer : observers) {
        observer.listenerRemoved(listener);
      }
    }
    fireCategoriesRemoved(emptied);
    return this;
  }

  public CategoryMultiplexer<E> removeListener(String category, CategoryListener<E> listener) {
    return removeListener(CategoryGroup.of(category), listener);
  }

  public CategoryMultiplexer<E> removeListener(Collection<String> categories, CategoryListener<E> listener) {
    return removeListener(CategoryGroup.of(categories), listener);
  }

  /**
   * Removes every registration, newest first, then reports every category that had listeners as removed.
   *
   * @return this multiplexer
   */
  public CategoryMultiplexer<E> removeAllListeners() {
    if (registrations.isEmpty()) {
      return this;
    }
    List<String> categories = new ArrayList<>(categoryCounts.keySet());
    List<Registration<E>> removed = new ArrayList<>(registrations);
    Collections.reverse(removed);

    registrations.clear();
    byListener.clear();
    categoryCounts.clear();

    for (Registration<E> registration : removed) {
      for (MultiplexerObserver<E> observer : observers) {
        observer.listenerRemoved(registration.listener);
      }
    }
    fireCategoriesRemoved(categories);
    return this;
  }

  /**
   * Removes the categories of {@code group} from every listener, newest registration first.
   *
   * @param group categories to clear
   * @return this multiplexer
   */
  public CategoryMultiplexer<E> removeAllListeners(CategoryGroup group) {
    requireGroup(group);
    if (group.isEmpty() || registrations.isEmpty()) {
      return this;
    }

    Set<String> emptied = new LinkedHashSet<>();
    List<CategoryListener<E>> removedListeners = new ArrayList<>();
    for (int i = registrations.size() - 1; i >= 0; i--) {
      Registration<E> registration = registrations.get(i);
      for (int c = 0; c < group.size(); c++) {
        String category = group.get(c);
        if (registration.categories.remove(category) && decrement(category)) {
          emptied.add(category);
        }
      }
      if (registration.categories.isEmpty()) {
        registrations.remove(i);
        byListener.remove(registration.listener);
        removedListeners.add(registration.listener);
      }
    }

    for (CategoryListener<E> listener : removedListeners) {
      for (MultiplexerObserver<E> observer : observers) {
        observer.listenerRemoved(listener);
      }
    }
    fireCategoriesRemoved(emptied);
    return this;
  }

  /**
   * Publishes {@code payload} to every listener subscribed to at least one category of {@code group}.
   *
   * @param group categories of the payload
   * @param payload payload handed to listeners
   * @return {@code true} iff at least one listener matched
   */
  public boolean emit(CategoryGroup group, E payload) {
    requireGroup(group);
    if (group.isEmpty() || !hasListenerFor(group)) {
      return false;
    }

    List<Registration<E>> snapshot = List.copyOf(registrations);
    boolean found = false;
    for (Registration<E> registration : snapshot) {
      if (!registration.matches(group)) {
        continue;
      }
      found = true;
      try {
        registration.listener.onEvent(payload);
      } catch (RuntimeException ex) {
        errorHandler.onListenerError(registration.listener, payload, ex);
      }
    }
    return found;
  }

  public boolean emit(String category, E payload) {
    return emit(CategoryGroup.of(category), payload);
  }

  public boolean emit(Collection<String> categories, E payload) {
    return emit(CategoryGroup.of(categories), payload);
  }

  /**
   * Returns every registered listener in registration order.
   *
   * @return immutable list
   */
  public List<CategoryListener<E>> listeners() {
    List<CategoryListener<E>> result = new ArrayList<>(registrations.size());
    for (Registration<E> registration : registrations) {
      result.add(registration.listener);
    }
    return List.copyOf(result);
  }

  /**
   * Returns the listeners subscribed to any category of {@code group}, each listed once.
   *
   * @param group categories to match
   * @return immutable list in registration order
   */
  public List<CategoryListener<E>> listeners(CategoryGroup group) {
    requireGroup(group);
    List<CategoryListener<E>> result = new ArrayList<>();
    for (Registration<E> registration : registrations) {
      if (registration.matches(group)) {
        result.add(registration.listener);
      }
    }
    return List.copyOf(result);
  }

  public int listenerCount() {
    return registrations.size();
  }

  /**
   * Counts the distinct listeners subscribed to any category of {@code group}.
   *
   * @param group categories to match; the empty group counts zero
   * @return listener count
   */
  public int listenerCount(CategoryGroup group) {
    requireGroup(group);
    int count = 0;
    for (Registration<E> registration : registrations) {
      if (registration.matches(group)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the union of all registered categories in first-registration order.
   *
   * @return immutable set
   */
  public Set<String> listenerCategories() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(categoryCounts.keySet()));
  }

  /**
   * Tests whether {@code category} has at least one listener.
   *
   * @param category category name
   * @return {@code true} when subscribed
   */
  public boolean hasListeners(String category) {
    return categoryCounts.containsKey(category);
  }

  /**
   * Reports whether {@code category} is one of the reserved meta names.
   *
   * @param category category name
   * @return {@code true} for reserved names
   */
  public static boolean isMetaCategoryName(String category) {
    return META_CATEGORY_NAMES.contains(category);
  }

  private boolean hasListenerFor(CategoryGroup group) {
    for (int i = 0; i < group.size(); i++) {
      if (categoryCounts.containsKey(group.get(i))) {
        return true;
      }
    }
    return false;
  }

  /** Returns {@code true} when the category has no listener left. */
  private boolean decrement(String category) {
    Integer remaining = categoryCounts.computeIfPresent(category, (key, count) -> count > 1 ? count - 1 : null);
    return remaining == null;
  }

  private void fireCategoriesRemoved(Collection<String> categories) {
    for (String category : categories) {
      if (isMetaCategoryName(category)) {
        continue;
      }
      for (MultiplexerObserver<E> observer : observers) {
        observer.categoryRemoved(category);
      }
    }
  }

  private static void requireGroup(CategoryGroup group) {
    if (group == null) {
      throw new IllegalArgumentException("category must be a string or collection of strings");
    }
  }

  private static final class Registration<E> {
    private final CategoryListener<E> listener;
    private final Set<String> categories = new LinkedHashSet<>();

    private Registration(CategoryListener<E> listener) {
      this.listener = listener;
    }

    private boolean matches(CategoryGroup group) {
      for (int i = 0; i < group.size(); i++) {
        if (categories.contains(group.get(i))) {
          return true;
        }
      }
      return false;
    }
  }
}
