package ca.gc.cra.tracing.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors owned by the tracing runtime.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the single-thread executor that runs the capture agent loop.
   *
   * <p>The thread is a daemon so an application that never closes the runtime can still exit; the runtime's shutdown
   * hook performs the final flush.</p>
   *
   * @param prefix thread-name prefix; threads are named {@code prefix-0}, {@code prefix-1}, ...
   * @param handler uncaught exception handler installed on the thread
   * @return configured executor service
   */
  public static ExecutorService newAgentExecutor(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "trace-agent" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
