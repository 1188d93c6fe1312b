/**
 * Configuration records and the composition root of the tracing runtime.
 * <p><strong>Role:</strong> Bootstrap layer selecting the sink, metrics, and startup categories.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.tracing.config;
