package ca.gc.cra.tracing.config;

import ca.gc.cra.tracing.application.tracing.CategoryGroupKeys;
import ca.gc.cra.tracing.domain.category.CategoryGroup;
import ca.gc.cra.tracing.infrastructure.agent.AgentSettings;
import ca.gc.cra.tracing.validation.Numbers;
import ca.gc.cra.tracing.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * <strong>What:</strong> Immutable configuration of the tracing runtime.
 * <p><strong>Why:</strong> Collects every tunable (startup categories, agent sizing, sink selection, metrics, logging)
 * behind one validated record so the runtime wiring never parses strings.</p>
 * <p><strong>Role:</strong> Produced from YAML, {@code .properties} or plain maps; consumed by
 * {@link TracingRuntime}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param categories categories enabled for recording at startup
 * @param agent capture agent settings
 * @param sinkType trace sink selection
 * @param sinkPath file written by {@link SinkType#JSONL}
 * @param groupKeysMaxEntries cap of the category group key cache
 * @param metricsEnabled whether metrics are exported through OpenTelemetry
 * @param verboseLogging whether tracing loggers run at DEBUG
 * @since 0.1.0
 */
public record TracingConfig(
    List<String> categories,
    AgentSettings agent,
    SinkType sinkType,
    Path sinkPath,
    int groupKeysMaxEntries,
    boolean metricsEnabled,
    boolean verboseLogging) {
  /** System property holding categories to record at startup. */
  public static final String CATEGORIES_PROPERTY = "tracing.categories";
  /** Environment variable holding categories to record at startup. */
  public static final String CATEGORIES_ENV = "TRACING_CATEGORIES";
  /** System property naming a YAML or properties file read by {@link TracingRuntime#global()}. */
  public static final String CONFIG_PROPERTY = "tracing.config";
  /** Environment variable naming a YAML or properties file read by {@link TracingRuntime#global()}. */
  public static final String CONFIG_ENV = "TRACING_CONFIG";

  private static final Path DEFAULT_SINK_PATH = Path.of("trace.jsonl");
  private static final int MAX_QUEUE_CAPACITY = 1_048_576;
  private static final int MAX_FLUSH_INTERVAL_MILLIS = 3_600_000;
  private static final int MAX_SHUTDOWN_TIMEOUT_MILLIS = 600_000;

  /**
   * Validates and copies components.
   */
  public TracingConfig {
    categories = List.copyOf(Objects.requireNonNull(categories, "categories"));
    Objects.requireNonNull(agent, "agent");
    Objects.requireNonNull(sinkType, "sinkType");
    Objects.requireNonNull(sinkPath, "sinkPath");
    Numbers.requireRange("groupKeys.maxEntries", groupKeysMaxEntries, 1, Integer.MAX_VALUE);
  }

  /**
   * Returns the defaults: nothing recorded, no sink, metrics and verbose logging off.
   *
   * @return default configuration
   */
  public static TracingConfig defaults() {
    return new TracingConfig(
        List.of(),
        AgentSettings.defaults(),
        SinkType.NONE,
        DEFAULT_SINK_PATH,
        CategoryGroupKeys.DEFAULT_MAX_ENTRIES,
        false,
        false);
  }

  /**
   * Builds a configuration from flat keys; absent or blank keys keep their defaults.
   *
   * @param options flat key/value map such as the output of {@link YamlConfigLoader}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static TracingConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    TracingConfig defaults = defaults();
    AgentSettings agentDefaults = defaults.agent();

    List<String> categories = parseCategories("categories", options.get("categories"), defaults.categories());
    List<String> defaultCategories = parseCategories(
        "agent.defaultCategories", options.get("agent.defaultCategories"), agentDefaults.defaultCategories());
    int queueCapacity = parseBoundedInt(
        options, "agent.queueCapacity", agentDefaults.queueCapacity(), 1, MAX_QUEUE_CAPACITY);
    int batchSize = parseBoundedInt(options, "agent.batchSize", agentDefaults.batchSize(), 1, queueCapacity);
    int flushMillis = parseBoundedInt(
        options,
        "agent.flushIntervalMillis",
        (int) agentDefaults.flushInterval().toMillis(),
        1,
        MAX_FLUSH_INTERVAL_MILLIS);
    int shutdownMillis = parseBoundedInt(
        options,
        "agent.shutdownTimeoutMillis",
        (int) agentDefaults.shutdownTimeout().toMillis(),
        1,
        MAX_SHUTDOWN_TIMEOUT_MILLIS);
    AgentSettings agent = new AgentSettings(
        queueCapacity,
        batchSize,
        Duration.ofMillis(flushMillis),
        Duration.ofMillis(shutdownMillis),
        defaultCategories);

    SinkType sinkType = SinkType.fromString(options.get("sink.type"));
    String rawPath = options.get("sink.path");
    Path sinkPath = rawPath == null || rawPath.isBlank() ? defaults.sinkPath() : parsePath("sink.path", rawPath);
    int maxEntries = parseBoundedInt(
        options, "groupKeys.maxEntries", defaults.groupKeysMaxEntries(), 1, Integer.MAX_VALUE);

    return new TracingConfig(
        categories,
        agent,
        sinkType,
        sinkPath,
        maxEntries,
        parseBoolean(options.get("metrics.enabled"), defaults.metricsEnabled()),
        parseBoolean(options.get("logging.verbose"), defaults.verboseLogging()));
  }

  /**
   * Reads a {@code .properties} file with the same keys as {@link #fromMap(Map)}.
   *
   * @param path properties file
   * @return validated configuration
   * @throws IOException when the file cannot be read
   */
  public static TracingConfig fromProperties(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, String> options = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) {
      options.put(name, props.getProperty(name));
    }
    return fromMap(options);
  }

  /**
   * Loads a configuration file, choosing the format by extension: {@code .yml}/{@code .yaml} through
   * {@link YamlConfigLoader}, anything else as properties. A missing YAML file yields the defaults.
   *
   * @param path configuration file
   * @return validated configuration
   * @throws IOException when the file cannot be read
   */
  public static TracingConfig load(Path path) throws IOException {
    String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".yml") || name.endsWith(".yaml")) {
      return YamlConfigLoader.load(path).map(TracingConfig::fromMap).orElseGet(TracingConfig::defaults);
    }
    return fromProperties(path);
  }

  /**
   * Replaces the startup categories with the first non-blank of the system property {@code tracing.categories} and
   * the environment variable {@code TRACING_CATEGORIES}.
   *
   * @param systemProperties JVM properties
   * @param environment process environment
   * @return this configuration or a copy with the overridden categories
   */
  public TracingConfig withOverrides(Properties systemProperties, Map<String, String> environment) {
    String raw = Strings.firstNonBlank(
        systemProperties.getProperty(CATEGORIES_PROPERTY), environment.get(CATEGORIES_ENV), null);
    if (raw == null) {
      return this;
    }
    return withCategories(parseCategories(CATEGORIES_PROPERTY, raw, categories));
  }

  public TracingConfig withCategories(List<String> startupCategories) {
    return new TracingConfig(
        startupCategories, agent, sinkType, sinkPath, groupKeysMaxEntries, metricsEnabled, verboseLogging);
  }

  public TracingConfig withSink(SinkType type, Path path) {
    return new TracingConfig(categories, agent, type, path, groupKeysMaxEntries, metricsEnabled, verboseLogging);
  }

  private static List<String> parseCategories(String key, String raw, List<String> fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return CategoryGroup.parse(raw).asList();
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(key + " contains an invalid category: " + raw, ex);
    }
  }

  private static int parseBoundedInt(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return (int) Numbers.parseRange(key, raw, min, max);
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
