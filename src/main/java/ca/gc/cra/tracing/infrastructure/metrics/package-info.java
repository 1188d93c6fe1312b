/**
 * Metrics adapters that bridge the tracing {@code MetricsPort} to OpenTelemetry or a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; the facade and the agent thread update them
 * concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code tracing.*} and {@code agent.*} namespaces.</p>
 */
package ca.gc.cra.tracing.infrastructure.metrics;
