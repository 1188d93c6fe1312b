package ca.gc.cra.tracing.infrastructure.agent;

import ca.gc.cra.tracing.application.port.MetricsPort;
import ca.gc.cra.tracing.application.port.TraceCapturePort;
import ca.gc.cra.tracing.application.port.TraceSink;
import ca.gc.cra.tracing.application.port.TraceWriteException;
import ca.gc.cra.tracing.domain.category.CategoryGroup;
import ca.gc.cra.tracing.domain.event.CounterValue;
import ca.gc.cra.tracing.domain.event.TraceRecord;
import ca.gc.cra.tracing.domain.event.TracingEventType;
import ca.gc.cra.tracing.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Background capture agent that buffers trace records for the enabled categories and writes
 * them to a {@link TraceSink}.
 * <p><strong>Why:</strong> Emitters must never wait on trace I/O; the agent owns a dedicated thread and a bounded
 * hand-off queue so the application thread only pays for an {@code offer}.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link TraceCapturePort}; fed by
 * {@link AgentTraceRecorder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run capture sessions filtered by a category allow-list; changing the list while started swaps to a new
 *   session.</li>
 *   <li>Drop records when the queue is full and count them.</li>
 *   <li>Drain the queue in batches, flush periodically, and serve blocking flush requests.</li>
 *   <li>Retry a failed write or flush once, then surface the failure. A write retry resumes after the records the
 *   sink reported as written.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All public methods are thread-safe. Lifecycle changes are serialized; offers are
 * lock-free apart from the queue.</p>
 * <p><strong>Performance:</strong> A rejected offer costs one volatile read and one cached map lookup.</p>
 * <p><strong>Observability:</strong> Emits {@code agent.enqueued}, {@code agent.dropped}, {@code agent.written},
 * {@code agent.write.retry}, {@code agent.write.error}, {@code agent.flush.latencyNanos}, {@code agent.queue.depth},
 * {@code agent.session.started}, and {@code agent.session.stopped}.</p>
 *
 * @since 0.1.0
 */
public final class TracingAgent implements TraceCapturePort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TracingAgent.class);
  private static final long POLL_TIMEOUT_MILLIS = 25L;
  private static final int DROP_LOG_THRESHOLD = 1_000;

  private final AgentSettings settings;
  private final TraceSink sink;
  private final MetricsPort metrics;
  private final AgentErrorHandler errorHandler;
  private final BlockingQueue<TraceRecord> queue;
  private final ConcurrentLinkedQueue<CompletableFuture<Void>> flushRequests = new ConcurrentLinkedQueue<>();
  private final ExecutorService executor;
  private final Object lifecycleLock = new Object();
  private final AtomicLong sessionSequence = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicInteger dropLogLimiter = new AtomicInteger();

  private volatile CaptureSession session;
  private volatile List<String> categories;
  private volatile boolean running = true;
  private volatile boolean closed;

  public TracingAgent(AgentSettings settings, TraceSink sink, MetricsPort metrics) {
    this(settings, sink, metrics, AgentErrorHandler.logging());
  }

  /**
   * Creates the agent and starts its background thread. No session is active until {@link #start()}.
   *
   * @param settings tuning knobs
   * @param sink destination of captured records; closed by {@link #close()}
   * @param metrics metrics sink
   * @param errorHandler receives background I/O failures
   */
  public TracingAgent(AgentSettings settings, TraceSink sink, MetricsPort metrics, AgentErrorHandler errorHandler) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    this.categories = settings.defaultCategories();
    this.executor = ExecutorFactories.newAgentExecutor(
        "trace-agent", (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex));
    executor.execute(this::runLoop);
  }

  /**
   * Replaces the allow-list. While started, the current session is replaced by a new one so that records of removed
   * categories are rejected from this point on.
   *
   * @param next categories to capture
   */
  @Override
  public void setCategories(Collection<String> next) {
    List<String> normalized = CategoryGroup.of(Objects.requireNonNull(next, "categories")).asList();
    synchronized (lifecycleLock) {
      categories = normalized;
      CaptureSession current = session;
      if (current != null) {
        session = new CaptureSession(sessionSequence.incrementAndGet(), normalized);
        log.debug("Trace capture session {} replaced by {} for categories {}", current.id(), session.id(), normalized);
      }
    }
  }

  /**
   * Replaces the allow-list from a comma-separated list.
   *
   * @param commaList categories separated by commas; {@code null} restores the configured defaults
   */
  public void setCategories(String commaList) {
    setCategories(commaList == null ? settings.defaultCategories() : CategoryGroup.parse(commaList).asList());
  }

  @Override
  public List<String> categories() {
    return categories;
  }

  /**
   * Starts a capture session for the current allow-list. Calling it while started restarts the session.
   *
   * @throws IllegalStateException if the agent is closed
   */
  @Override
  public void start() {
    synchronized (lifecycleLock) {
      if (closed) {
        throw new IllegalStateException("Trace agent is closed");
      }
      CaptureSession previous = session;
      session = new CaptureSession(sessionSequence.incrementAndGet(), categories);
      metrics.increment("agent.session.started");
      if (previous == null) {
        log.info("Trace capture session {} started for categories {}", session.id(), categories);
      } else {
        log.info("Trace capture session {} restarted as {} for categories {}", previous.id(), session.id(), categories);
      }
    }
  }

  /**
   * Stops the active session and blocks until every buffered record is written and flushed. A second call is a
   * no-op.
   *
   * @throws IOException if the final write or flush failed after one retry
   */
  @Override
  public void stop() throws IOException {
    CaptureSession stopped;
    synchronized (lifecycleLock) {
      stopped = session;
      if (stopped == null) {
        return;
      }
      session = null;
      metrics.increment("agent.session.stopped");
    }
    log.info("Trace capture session {} stopping", stopped.id());
    flush();
  }

  @Override
  public boolean isStarted() {
    return session != null;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  /**
   * Returns the active session's sequence number, or {@code 0} when stopped.
   *
   * @return session number
   */
  public long sessionId() {
    CaptureSession current = session;
    return current == null ? 0L : current.id();
  }

  /**
   * Blocks until records queued before this call are written and the sink is flushed.
   *
   * @throws IOException if writing or flushing failed after one retry, or the agent did not answer within the
   *     shutdown timeout
   */
  public void flush() throws IOException {
    if (closed && !running) {
      return;
    }
    CompletableFuture<Void> request = new CompletableFuture<>();
    flushRequests.add(request);
    long timeoutMillis = settings.shutdownTimeout().toMillis();
    try {
      request.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException("Trace flush failed", cause);
    } catch (TimeoutException ex) {
      flushRequests.remove(request);
      throw new IOException("Timed out after " + timeoutMillis + " ms waiting for trace flush", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for trace flush", ex);
    }
  }

  /**
   * Hands a record to the agent thread without blocking.
   *
   * @param record record to capture
   * @return {@code true} when queued; {@code false} when stopped, filtered out, or dropped because the queue is full
   */
  public boolean offer(TraceRecord record) {
    CaptureSession current = session;
    if (current == null || !current.accepts(record.categoryGroup())) {
      return false;
    }
    return enqueue(record);
  }

  /**
   * Builds and queues a record stamped with the current session and thread. Nothing is allocated when the group is
   * not captured.
   *
   * @return {@code true} when queued
   */
  boolean record(
      TracingEventType type,
      String name,
      Long id,
      String categoryGroup,
      Map<String, Object> args,
      CounterValue value,
      Instant timestamp) {
    CaptureSession current = session;
    if (current == null || !current.accepts(categoryGroup)) {
      return false;
    }
    TraceRecord record = new TraceRecord(
        type, name, id, categoryGroup, args, value, timestamp, Thread.currentThread().getName(), current.id());
    return enqueue(record);
  }

  /**
   * Returns how many records were dropped because the queue was full.
   *
   * @return drop count since creation
   */
  public long droppedEvents() {
    return dropped.get();
  }

  public int queuedEvents() {
    return queue.size();
  }

  /**
   * Stops the session (final flush), stops the agent thread, waits for it up to the shutdown timeout, and closes the
   * sink. Idempotent.
   */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    try {
      stop();
    } catch (IOException ex) {
      errorHandler.onError("flush", ex);
    }

    running = false;
    executor.shutdown();
    long timeoutMillis = settings.shutdownTimeout().toMillis();
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        log.warn("Trace agent thread did not stop within {} ms; interrupting", timeoutMillis);
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }

    try {
      sink.close();
    } catch (IOException ex) {
      errorHandler.onError("close", ex);
    }
    log.info("Trace agent closed (dropped={})", dropped.get());
  }

  private boolean enqueue(TraceRecord record) {
    if (queue.offer(record)) {
      metrics.increment("agent.enqueued");
      return true;
    }
    long total = dropped.incrementAndGet();
    metrics.increment("agent.dropped");
    int count = dropLogLimiter.incrementAndGet();
    if (count == 1 || count % DROP_LOG_THRESHOLD == 0) {
      log.warn("Trace agent queue full; dropping records (capacity={}, dropped={})", settings.queueCapacity(), total);
      if (count >= DROP_LOG_THRESHOLD * 100) {
        dropLogLimiter.set(0);
      }
    }
    return false;
  }

  private void runLoop() {
    List<TraceRecord> batch = new ArrayList<>(settings.batchSize());
    long flushIntervalNanos = settings.flushInterval().toNanos();
    long lastFlush = System.nanoTime();
    boolean pending = false;
    try {
      while (running) {
        TraceRecord first = queue.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        if (first != null) {
          batch.add(first);
          queue.drainTo(batch, settings.batchSize() - 1);
          writeInBackground(batch);
          pending = true;
        }
        if (!flushRequests.isEmpty()) {
          serveFlushRequests(batch);
          lastFlush = System.nanoTime();
          pending = false;
        } else if (pending && System.nanoTime() - lastFlush >= flushIntervalNanos) {
          flushInBackground();
          lastFlush = System.nanoTime();
          pending = false;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Trace agent thread interrupted");
    }
    // close() already flushed through stop(); only late work needs another pass
    if (!flushRequests.isEmpty() || !queue.isEmpty()) {
      serveFlushRequests(batch);
    }
  }

  private void serveFlushRequests(List<TraceRecord> batch) {
    List<CompletableFuture<Void>> requests = new ArrayList<>();
    CompletableFuture<Void> request;
    while ((request = flushRequests.poll()) != null) {
      requests.add(request);
    }
    IOException failure = null;
    try {
      drainAll(batch);
      long start = System.nanoTime();
      flushWithRetry();
      metrics.observe("agent.flush.latencyNanos", System.nanoTime() - start);
    } catch (IOException ex) {
      metrics.increment("agent.write.error");
      failure = ex;
    }
    for (CompletableFuture<Void> waiting : requests) {
      if (failure == null) {
        waiting.complete(null);
      } else {
        waiting.completeExceptionally(failure);
      }
    }
    if (failure != null && requests.isEmpty()) {
      errorHandler.onError("flush", failure);
    }
  }

  private void drainAll(List<TraceRecord> batch) throws IOException {
    IOException failure = null;
    while (queue.drainTo(batch, settings.batchSize()) > 0) {
      try {
        writeWithRetry(batch);
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        }
      } finally {
        batch.clear();
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private void writeInBackground(List<TraceRecord> batch) {
    try {
      writeWithRetry(batch);
    } catch (IOException ex) {
      metrics.increment("agent.write.error");
      errorHandler.onError("write", ex);
    } finally {
      batch.clear();
      metrics.observe("agent.queue.depth", queue.size());
    }
  }

  private void flushInBackground() {
    long start = System.nanoTime();
    try {
      flushWithRetry();
      metrics.observe("agent.flush.latencyNanos", System.nanoTime() - start);
    } catch (IOException ex) {
      metrics.increment("agent.write.error");
      errorHandler.onError("flush", ex);
    }
  }

  private void writeWithRetry(List<TraceRecord> batch) throws IOException {
    try {
      sinkWrite(batch);
    } catch (IOException first) {
      int done = first instanceof TraceWriteException partial ? Math.min(partial.written(), batch.size()) : 0;
      metrics.increment("agent.write.retry");
      log.debug("Retrying trace write of {} records after failure ({} already written)",
          batch.size() - done, done, first);
      if (done < batch.size()) {
        try {
          sinkWrite(batch.subList(done, batch.size()));
        } catch (IOException second) {
          second.addSuppressed(first);
          throw second;
        }
      }
    }
    metrics.observe("agent.written", batch.size());
  }

  private void flushWithRetry() throws IOException {
    try {
      sinkFlush();
    } catch (IOException first) {
      metrics.increment("agent.write.retry");
      log.debug("Retrying trace flush after failure", first);
      try {
        sinkFlush();
      } catch (IOException second) {
        second.addSuppressed(first);
        throw second;
      }
    }
  }

  private void sinkWrite(List<TraceRecord> batch) throws IOException {
    try {
      sink.write(batch);
    } catch (RuntimeException ex) {
      throw new IOException("Trace sink write failed", ex);
    }
  }

  private void sinkFlush() throws IOException {
    try {
      sink.flush();
    } catch (RuntimeException ex) {
      throw new IOException("Trace sink flush failed", ex);
    }
  }
}
