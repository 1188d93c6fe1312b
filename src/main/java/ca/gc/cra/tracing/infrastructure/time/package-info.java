/**
 * Clock adapters.
 */
package ca.gc.cra.tracing.infrastructure.time;
