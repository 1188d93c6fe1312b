/**
 * <strong>Purpose:</strong> The tracing facade and the state it consults on every emit: the enabled category table
 * and the canonical group key cache.
 * <p><strong>Pipeline role:</strong> Application thread: emit, fast reject, recorder hand-off, listener dispatch.
 * <p><strong>Concurrency:</strong> The facade is confined to the application thread; table reads are lock-free.
 * <p><strong>Metrics:</strong> {@code tracing.*}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracing.application.tracing;
