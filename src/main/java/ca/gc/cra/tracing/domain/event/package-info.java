/**
 * <strong>Purpose:</strong> Trace event value types: the validated {@link ca.gc.cra.tracing.domain.event.TracingEvent}
 * supplied by emitters and the {@link ca.gc.cra.tracing.domain.event.TraceRecord} buffered by the agent.
 * <p><strong>Concurrency:</strong> Immutable records safe to hand off between threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracing.domain.event;
