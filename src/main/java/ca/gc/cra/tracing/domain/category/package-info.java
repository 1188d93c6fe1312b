/**
 * <strong>Purpose:</strong> Category value types shared by the multiplexer, the enablement table, and the agent.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share across the application and agent threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracing.domain.category;
