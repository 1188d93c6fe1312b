package ca.gc.cra.tracing.application.events;

/**
 * Decides what happens when a listener throws during {@link CategoryMultiplexer#emit}.
 *
 * @param <E> payload type
 * @since 0.1.0
 */
@FunctionalInterface
public interface ListenerErrorHandler<E> {
  /**
   * Handles a listener failure. Returning normally continues dispatch to the remaining listeners.
   *
   * @param listener listener that failed
   * @param payload payload being dispatched
   * @param error failure raised by the listener
   */
  void onListenerError(CategoryListener<E> listener, E payload, RuntimeException error);

  /**
   * Returns a handler that rethrows, aborting the current dispatch.
   *
   * @param <E> payload type
   * @return rethrowing handler
   */
  static <E> ListenerErrorHandler<E> rethrowing() {
    return (listener, payload, error) -> {
      throw error;
    };
  }
}
