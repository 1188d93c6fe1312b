package ca.gc.cra.tracing.application.events;

/**
 * Receives registration-table changes from a {@link CategoryMultiplexer}.
 *
 * <p>These notifications travel on their own channel and never through {@link CategoryMultiplexer#emit}, so
 * application listeners cannot mistake them for published payloads. Category notifications are not raised for the
 * reserved names in {@link CategoryMultiplexer#META_CATEGORY_NAMES}.</p>
 *
 * @param <E> payload type of the observed multiplexer
 * @since 0.1.0
 */
public interface MultiplexerObserver<E> {
  /**
   * A listener was registered for the first time.
   *
   * @param listener new listener
   */
  default void listenerAdded(CategoryListener<E> listener) {}

  /**
   * A listener lost its last category and was removed.
   *
   * @param listener removed listener
   */
  default void listenerRemoved(CategoryListener<E> listener) {}

  /**
   * A category went from zero to one or more listeners.
   *
   * @param category category name
   */
  default void categoryAdded(String category) {}

  /**
   * A category went from one or more listeners to zero.
   *
   * @param category category name
   */
  default void categoryRemoved(String category) {}
}
