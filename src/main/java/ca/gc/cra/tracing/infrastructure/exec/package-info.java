/**
 * Executor construction for the tracing runtime's background threads.
 */
package ca.gc.cra.tracing.infrastructure.exec;
