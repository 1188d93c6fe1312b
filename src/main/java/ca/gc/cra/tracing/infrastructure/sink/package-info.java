/**
 * Trace sink adapters written by the capture agent: discard, in-memory, SLF4J log lines, and JSON lines files.
 * <p><strong>Concurrency:</strong> Sinks are called from the agent thread only.</p>
 */
package ca.gc.cra.tracing.infrastructure.sink;
