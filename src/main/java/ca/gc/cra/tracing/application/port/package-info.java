/**
 * <strong>Purpose:</strong> Ports between the tracing core and its collaborators: the recorder that receives
 * enabled events, the capture session control, the trace sink, metrics, and time.
 * <p><strong>Concurrency:</strong> Each port documents which thread calls it.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracing.application.port;
