/**
 * <strong>Purpose:</strong> Background capture agent: session lifecycle, category allow-list filtering, the bounded
 * hand-off queue, and batched writes to a {@code TraceSink}.
 * <p><strong>Concurrency:</strong> One dedicated thread ({@code trace-agent-0}) drains the queue; emitters only
 * offer.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code agent.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracing.infrastructure.agent;
