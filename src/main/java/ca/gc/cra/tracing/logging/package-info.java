/**
 * <strong>Purpose:</strong> Logging helpers shared by the tracing runtime: Logback level control and bounded argument
 * rendering.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracing.logging;
