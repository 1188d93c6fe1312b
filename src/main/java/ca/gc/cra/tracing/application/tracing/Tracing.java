package ca.gc.cra.tracing.application.tracing;

import ca.gc.cra.tracing.application.events.CategoryListener;
import ca.gc.cra.tracing.application.events.CategoryMultiplexer;
import ca.gc.cra.tracing.application.events.MultiplexerObserver;
import ca.gc.cra.tracing.application.port.ClockPort;
import ca.gc.cra.tracing.application.port.MetricsPort;
import ca.gc.cra.tracing.application.port.TraceCapturePort;
import ca.gc.cra.tracing.application.port.TraceRecorder;
import ca.gc.cra.tracing.domain.category.CategoryFlags;
import ca.gc.cra.tracing.domain.category.CategoryGroup;
import ca.gc.cra.tracing.domain.event.TracingEvent;
import ca.gc.cra.tracing.logging.Logs;
import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * <strong>What:</strong> Process-wide tracing entry point combining category enablement, the external recorder, and
 * in-process category listeners.
 * <p><strong>Why:</strong> Application code emits trace events unconditionally; this facade makes the disabled case a
 * single table lookup and keeps the capture agent's allow-list in step with what is enabled.</p>
 * <p><strong>Role:</strong> Application service composed by {@code TracingRuntime}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject events whose categories are all disabled before doing any other work.</li>
 *   <li>Map event types to the recorder operations using the cached canonical group key.</li>
 *   <li>Republish enabled events to listeners registered through {@link #on}.</li>
 *   <li>Set {@link CategoryFlags#LISTENING} as categories gain and lose listeners.</li>
 *   <li>Push the enabled category set to the {@link TraceCapturePort} whenever it changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the application thread, except {@link #isEnabled} which may be called
 * from any thread. The enablement table tolerates operator threads.</p>
 * <p><strong>Performance:</strong> A rejected emit costs one table lookup per category and one uncontended
 * {@link LongAdder} increment; nothing reaches the metrics port.</p>
 * <p><strong>Observability:</strong> Emits {@code tracing.emit.recorded},
 * {@code tracing.emit.recorder.error}, {@code tracing.listener.error}, and {@code tracing.capture.stop.error}.</p>
 *
 * @since 0.1.0
 */
public final class Tracing {
  private static final Logger log = LoggerFactory.getLogger(Tracing.class);
  private static final int ERROR_LOG_THRESHOLD = 1_000;

  private final EnabledCategoryTable table;
  private final CategoryGroupKeys groupKeys;
  private final TraceRecorder recorder;
  private final TraceCapturePort capture;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final CategoryMultiplexer<TracingEvent> multiplexer = new CategoryMultiplexer<>();
  private final AtomicInteger recorderErrorLogLimiter = new AtomicInteger();
  private final LongAdder rejected = new LongAdder();
  private final Object captureLock = new Object();
  private List<String> pushedCategories = List.of();

  /**
   * Creates a facade.
   *
   * @param table enablement table shared with operators
   * @param groupKeys canonical key cache
   * @param recorder destination of enabled events
   * @param capture capture session kept in step with the enabled categories
   * @param metrics metrics sink
   * @param clock timestamp source for events emitted without one
   */
  public Tracing(
      EnabledCategoryTable table,
      CategoryGroupKeys groupKeys,
      TraceRecorder recorder,
      TraceCapturePort capture,
      MetricsPort metrics,
      ClockPort clock) {
    this.table = Objects.requireNonNull(table, "table");
    this.groupKeys = Objects.requireNonNull(groupKeys, "groupKeys");
    this.recorder = Objects.requireNonNull(recorder, "recorder");
    this.capture = Objects.requireNonNull(capture, "capture");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");

    multiplexer.addObserver(new ListeningFlagUpdater());
    multiplexer.setErrorHandler((listener, payload, error) -> {
      metrics.increment("tracing.listener.error");
      log.warn("Trace listener failed on event {}", payload.name(), error);
    });
    table.addListener(snapshot -> syncCapture());
    syncCapture();
  }

  public boolean isEnabled(String category) {
    return table.isEnabled(category);
  }

  public boolean isEnabled(Collection<String> categories) {
    return table.isEnabled(CategoryGroup.of(categories));
  }

  /**
   * Tests whether any category of {@code group} is recorded or listened to.
   *
   * @param group categories to test
   * @return {@code true} when an emit for {@code group} would be forwarded
   */
  public boolean isEnabled(CategoryGroup group) {
    return table.isEnabled(group);
  }

  /**
   * Lists categories currently enabled for recording.
   *
   * @return immutable list in enable order
   */
  public List<String> recordingCategories() {
    return table.categoriesWith(CategoryFlags.RECORDING);
  }

  /**
   * Returns how many emits were rejected because none of their categories was enabled.
   *
   * @return rejection count since creation
   */
  public long rejectedEvents() {
    return rejected.sum();
  }

  public boolean enableRecording(CategoryGroup group) {
    return enableRecording(group, true);
  }

  /**
   * Sets or clears recording for every category of {@code group}.
   *
   * @param group categories to update
   * @param enable {@code true} to record, {@code false} to stop recording
   * @return {@code true} when any category changed
   */
  public boolean enableRecording(CategoryGroup group, boolean enable) {
    return table.setFlags(group, CategoryFlags.RECORDING, enable);
  }

  public boolean enableRecording(String category, boolean enable) {
    return enableRecording(CategoryGroup.of(category), enable);
  }

  public boolean enableRecording(Collection<String> categories, boolean enable) {
    return enableRecording(CategoryGroup.of(categories), enable);
  }

  /**
   * Emits {@code event} on its own categories.
   *
   * @param event event to emit
   * @return {@code true} iff the event reached the recorder
   * @throws IllegalArgumentException if the event carries no categories
   */
  public boolean emit(TracingEvent event) {
    Objects.requireNonNull(event, "event");
    if (event.categories() == null) {
      throw new IllegalArgumentException("Tracing event must include a category or a category override");
    }
    return emit(event.categories(), event);
  }

  public boolean emit(String category, TracingEvent event) {
    return emit(CategoryGroup.of(category), event);
  }

  public boolean emit(Collection<String> categories, TracingEvent event) {
    return emit(CategoryGroup.of(categories), event);
  }

  /**
   * Emits {@code event} on {@code categories}, which take precedence over the event's own categories.
   *
   * <p>Returns {@code false} without further work when no category is enabled. A recorder failure is logged and
   * counted, never thrown.</p>
   *
   * @param categories effective categories
   * @param event event to emit
   * @return {@code true} iff the event reached the recorder
   */
  public boolean emit(CategoryGroup categories, TracingEvent event) {
    Objects.requireNonNull(event, "event");
    if (categories == null) {
      throw new IllegalArgumentException("category must be a string or collection of strings");
    }
    if (!table.isEnabled(categories)) {
      rejected.increment();
      return false;
    }

    Instant timestamp = event.timestamp() != null ? event.timestamp() : clock.now();
    String key = groupKeys.keyFor(categories);
    if (!forward(event, key, timestamp)) {
      return false;
    }
    metrics.increment("tracing.emit.recorded");

    TracingEvent published = event;
    if (!categories.equals(event.categories()) || event.timestamp() == null) {
      published = new TracingEvent(
          event.eventType(), event.name(), event.id(), categories, event.value(), event.args(), timestamp);
    }
    multiplexer.emit(categories, published);
    return true;
  }

  /**
   * Emits an instant event without arguments.
   *
   * @param category event category
   * @param name event name
   * @return {@code true} iff the event reached the recorder
   */
  public boolean emit(String category, String name) {
    CategoryGroup group = CategoryGroup.of(category);
    if (!table.isEnabled(group)) {
      rejected.increment();
      return false;
    }
    return emit(group, TracingEvent.instant(name));
  }

  public boolean emit(String category, String name, Map<String, ?> args) {
    CategoryGroup group = CategoryGroup.of(category);
    if (!table.isEnabled(group)) {
      rejected.increment();
      return false;
    }
    return emit(group, TracingEvent.instant(name).withArgs(args));
  }

  /**
   * Emits an instant event whose arguments are computed only when the category is enabled.
   *
   * @param category event category
   * @param name event name
   * @param args argument supplier, invoked at most once
   * @return {@code true} iff the event reached the recorder
   */
  public boolean emit(String category, String name, Supplier<? extends Map<String, ?>> args) {
    CategoryGroup group = CategoryGroup.of(category);
    if (!table.isEnabled(group)) {
      rejected.increment();
      return false;
    }
    return emit(group, TracingEvent.instant(name).withArgs(args.get()));
  }

  /**
   * Emits an instant event carrying a {@code message} argument formatted with SLF4J {@code {}} placeholders.
   *
   * @param category event category
   * @param name event name
   * @param format message pattern
   * @param params pattern arguments
   * @return {@code true} iff the event reached the recorder
   */
  public boolean emitMessage(String category, String name, String format, Object... params) {
    CategoryGroup group = CategoryGroup.of(category);
    if (!table.isEnabled(group)) {
      rejected.increment();
      return false;
    }
    String message = MessageFormatter.arrayFormat(format, params).getMessage();
    return emit(group, TracingEvent.instant(name).withArgs(Map.of("message", message)));
  }

  /**
   * Registers {@code listener} for events emitted on any category of {@code group}.
   *
   * @param group categories to listen to
   * @param listener listener
   * @return this facade
   */
  public Tracing on(CategoryGroup group, CategoryListener<TracingEvent> listener) {
    multiplexer.on(group, listener);
    return this;
  }

  public Tracing on(String category, CategoryListener<TracingEvent> listener) {
    multiplexer.on(category, listener);
    return this;
  }

  public Tracing on(Collection<String> categories, CategoryListener<TracingEvent> listener) {
    multiplexer.on(categories, listener);
    return this;
  }

  public Tracing removeListener(CategoryGroup group, CategoryListener<TracingEvent> listener) {
    multiplexer.removeListener(group, listener);
    return this;
  }

  public Tracing removeListener(String category, CategoryListener<TracingEvent> listener) {
    multiplexer.removeListener(category, listener);
    return this;
  }

  public Tracing removeListener(Collection<String> categories, CategoryListener<TracingEvent> listener) {
    multiplexer.removeListener(categories, listener);
    return this;
  }

  public Tracing removeAllListeners() {
    multiplexer.removeAllListeners();
    return this;
  }

  public Tracing removeAllListeners(CategoryGroup group) {
    multiplexer.removeAllListeners(group);
    return this;
  }

  public List<CategoryListener<TracingEvent>> listeners() {
    return multiplexer.listeners();
  }

  public List<CategoryListener<TracingEvent>> listeners(CategoryGroup group) {
    return multiplexer.listeners(group);
  }

  public int listenerCount() {
    return multiplexer.listenerCount();
  }

  public int listenerCount(CategoryGroup group) {
    return multiplexer.listenerCount(group);
  }

  /**
   * Registers a callback invoked after any category's enablement changes.
   *
   * @param listener change callback
   */
  public void addCategoryChangeListener(CategoryTableListener listener) {
    table.addListener(listener);
  }

  public void removeCategoryChangeListener(CategoryTableListener listener) {
    table.removeListener(listener);
  }

  private boolean forward(TracingEvent event, String key, Instant timestamp) {
    try {
      switch (event.eventType()) {
        case BEGIN -> recorder.emitBegin(event.name(), event.id(), key, event.args(), timestamp);
        case END -> recorder.emitEnd(event.name(), event.id(), key, event.args(), timestamp);
        case INSTANT -> recorder.emitInstant(event.name(), event.id(), key, event.args(), timestamp);
        case COUNT -> recorder.emitCount(event.name(), event.id(), key, event.value(), timestamp);
      }
      return true;
    } catch (RuntimeException ex) {
      metrics.increment("tracing.emit.recorder.error");
      int count = recorderErrorLogLimiter.incrementAndGet();
      if (count == 1 || count % ERROR_LOG_THRESHOLD == 0) {
        log.warn("Trace recorder rejected {} event {} (args={}, failures={})",
            event.eventType().wireName(), event.name(), Logs.truncate(String.valueOf(event.args()), Logs.DEFAULT_MAX_BYTES), count, ex);
      }
      return false;
    }
  }

  private void syncCapture() {
    synchronized (captureLock) {
      if (capture.isClosed()) {
        log.debug("Trace capture is closed; enablement changes are no longer captured");
        return;
      }
      List<String> enabled = table.enabledCategories();
      if (enabled.equals(pushedCategories)) {
        return;
      }
      pushedCategories = enabled;
      if (enabled.isEmpty()) {
        if (capture.isStarted()) {
          try {
            capture.stop();
          } catch (IOException ex) {
            metrics.increment("tracing.capture.stop.error");
            log.error("Failed to stop trace capture after last category was disabled", ex);
          }
        }
        return;
      }
      capture.setCategories(enabled);
      if (!capture.isStarted()) {
        capture.start();
      }
    }
  }

  private final class ListeningFlagUpdater implements MultiplexerObserver<TracingEvent> {
    @Override
    public void categoryAdded(String category) {
      table.setFlags(CategoryGroup.of(category), CategoryFlags.LISTENING, true);
    }

    @Override
    public void categoryRemoved(String category) {
      table.setFlags(CategoryGroup.of(category), CategoryFlags.LISTENING, false);
    }
  }
}
