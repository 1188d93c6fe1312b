package ca.gc.cra.tracing.application.events;

/**
 * Callback registered on a {@link CategoryMultiplexer} for one or more categories.
 *
 * <p>Listeners are identified by reference: registering the same instance twice extends its category set.</p>
 *
 * @param <E> payload type
 * @since 0.1.0
 */
@FunctionalInterface
public interface CategoryListener<E> {
  /**
   * Receives a payload published on at least one of the listener's categories. Called at most once per publish.
   *
   * @param payload published payload
   */
  void onEvent(E payload);
}
