/**
 * <strong>Purpose:</strong> Generic multi-category publish/subscribe engine.
 * <p>One listener may subscribe to many categories and is invoked once per publish, however many of its categories
 * match. The engine has no tracing-specific knowledge.
 * <p><strong>Concurrency:</strong> Not thread-safe; owned by the application context.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracing.application.events;
