package ca.gc.cra.tracing.config;

import ca.gc.cra.tracing.application.port.ClockPort;
import ca.gc.cra.tracing.application.port.MetricsPort;
import ca.gc.cra.tracing.application.port.TraceSink;
import ca.gc.cra.tracing.application.tracing.CategoryGroupKeys;
import ca.gc.cra.tracing.application.tracing.EnabledCategoryTable;
import ca.gc.cra.tracing.application.tracing.Tracing;
import ca.gc.cra.tracing.infrastructure.agent.AgentTraceRecorder;
import ca.gc.cra.tracing.infrastructure.agent.TracingAgent;
import ca.gc.cra.tracing.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.tracing.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tracing.infrastructure.sink.InMemoryTraceSink;
import ca.gc.cra.tracing.infrastructure.sink.JsonLinesTraceSink;
import ca.gc.cra.tracing.infrastructure.sink.LoggingTraceSink;
import ca.gc.cra.tracing.infrastructure.sink.NoOpTraceSink;
import ca.gc.cra.tracing.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.tracing.logging.LoggingConfigurator;
import ca.gc.cra.tracing.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root wiring the tracing facade to its enablement table, key cache, capture agent,
 * sink, metrics, and clock.
 * <p><strong>Why:</strong> Gives applications one object to create (or one lazily created process-wide instance) and
 * one object to close.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Translate {@link TracingConfig} into adapters: sink by {@link SinkType}, OpenTelemetry or no-op metrics.</li>
 *   <li>Enable the configured startup categories for recording, which starts the capture session.</li>
 *   <li>Stop the agent with a final flush and release metrics on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #global()} and {@link #close()} are thread-safe; the facade it exposes is
 * confined to the application thread.</p>
 *
 * @since 0.1.0
 */
public final class TracingRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TracingRuntime.class);
  private static final Object GLOBAL_LOCK = new Object();
  private static volatile TracingRuntime global;

  private final TracingConfig config;
  private final EnabledCategoryTable table;
  private final CategoryGroupKeys groupKeys;
  private final TraceSink sink;
  private final TracingAgent agent;
  private final Tracing tracing;
  private final MetricsPort metrics;
  private final AtomicBoolean closed = new AtomicBoolean();

  private TracingRuntime(TracingConfig config, TraceSink sink, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(clock, "clock");

    if (config.verboseLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    this.table = new EnabledCategoryTable();
    this.groupKeys = new CategoryGroupKeys(config.groupKeysMaxEntries(), metrics);
    this.agent = new TracingAgent(config.agent(), sink, metrics);
    this.tracing = new Tracing(table, groupKeys, new AgentTraceRecorder(agent), agent, metrics, clock);
    if (!config.categories().isEmpty()) {
      tracing.enableRecording(config.categories(), true);
    }
    log.info("Tracing runtime ready (sink={}, recording={}, metrics={})",
        config.sinkType(), config.categories(), config.metricsEnabled());
  }

  /**
   * Creates a runtime from {@code config}, building the sink and metrics adapters it names.
   *
   * @param config runtime configuration
   * @return started runtime; recording is active when {@code config.categories()} is non-empty
   */
  public static TracingRuntime create(TracingConfig config) {
    Objects.requireNonNull(config, "config");
    MetricsPort metrics = config.metricsEnabled() ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
    return new TracingRuntime(config, createSink(config), metrics, new SystemClockAdapter());
  }

  /**
   * Creates a runtime with explicit collaborators; {@code config.sinkType()} and {@code config.metricsEnabled()} are
   * ignored.
   *
   * @param config runtime configuration
   * @param sink trace sink; closed with the runtime
   * @param metrics metrics port; closed with the runtime when it is {@link AutoCloseable}
   * @param clock timestamp source
   * @return started runtime
   */
  public static TracingRuntime create(TracingConfig config, TraceSink sink, MetricsPort metrics, ClockPort clock) {
    return new TracingRuntime(config, sink, metrics, clock);
  }

  /**
   * Returns the process-wide runtime, creating it on first use.
   *
   * <p>Configuration comes from the file named by {@code tracing.config} / {@code TRACING_CONFIG} when set, otherwise
   * the defaults, then {@code tracing.categories} / {@code TRACING_CATEGORIES} override the startup categories. A JVM
   * shutdown hook closes the instance.</p>
   *
   * @return shared runtime
   * @throws IllegalStateException when the configuration file cannot be read
   */
  public static TracingRuntime global() {
    TracingRuntime current = global;
    if (current != null) {
      return current;
    }
    synchronized (GLOBAL_LOCK) {
      if (global == null) {
        TracingRuntime created = create(systemConfig());
        Runtime.getRuntime().addShutdownHook(new Thread(created::close, "trace-shutdown"));
        global = created;
      }
      return global;
    }
  }

  public Tracing tracing() {
    return tracing;
  }

  public TracingAgent agent() {
    return agent;
  }

  public EnabledCategoryTable table() {
    return table;
  }

  public CategoryGroupKeys groupKeys() {
    return groupKeys;
  }

  public TraceSink sink() {
    return sink;
  }

  public TracingConfig config() {
    return config;
  }

  /**
   * Stops capture with a final flush, joins the agent thread, closes the sink, and releases metrics. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    agent.close();
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
    log.info("Tracing runtime closed");
  }

  static TraceSink createSink(TracingConfig config) {
    return switch (config.sinkType()) {
      case NONE -> new NoOpTraceSink();
      case LOG -> new LoggingTraceSink();
      case JSONL -> new JsonLinesTraceSink(config.sinkPath());
      case MEMORY -> new InMemoryTraceSink();
    };
  }

  private static TracingConfig systemConfig() {
    String location = Strings.firstNonBlank(
        System.getProperty(TracingConfig.CONFIG_PROPERTY), System.getenv(TracingConfig.CONFIG_ENV), null);
    TracingConfig config = TracingConfig.defaults();
    if (location != null) {
      Path path = Path.of(location);
      try {
        config = TracingConfig.load(path);
      } catch (IOException ex) {
        throw new IllegalStateException("Failed to read tracing configuration from " + path, ex);
      }
    }
    return config.withOverrides(System.getProperties(), System.getenv());
  }
}
