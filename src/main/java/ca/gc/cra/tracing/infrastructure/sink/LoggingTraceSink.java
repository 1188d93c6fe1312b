package ca.gc.cra.tracing.infrastructure.sink;

import ca.gc.cra.tracing.application.port.TraceSink;
import ca.gc.cra.tracing.domain.event.TraceRecord;
import ca.gc.cra.tracing.logging.Logs;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each trace record as one INFO line on the {@code ca.gc.cra.tracing.trace} logger; wired when
 * {@code sink.type=log}.
 *
 * <p>Argument values are truncated with {@link Logs#formatArgs} so large payloads cannot flood the log.</p>
 *
 * @since 0.1.0
 */
public final class LoggingTraceSink implements TraceSink {
  static final String LOGGER_NAME = "ca.gc.cra.tracing.trace";
  private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

  private final int maxArgBytes;

  public LoggingTraceSink() {
    this(Logs.DEFAULT_MAX_BYTES);
  }

  /**
   * Creates a sink truncating each argument value to {@code maxArgBytes}.
   *
   * @param maxArgBytes byte budget per argument value; must be positive
   */
  public LoggingTraceSink(int maxArgBytes) {
    if (maxArgBytes <= 0) {
      throw new IllegalArgumentException("maxArgBytes must be positive");
    }
    this.maxArgBytes = maxArgBytes;
  }

  @Override
  public void write(List<TraceRecord> records) {
    if (!log.isInfoEnabled()) {
      return;
    }
    for (TraceRecord record : records) {
      String line;
      try {
        line = format(record);
      } catch (RuntimeException ex) {
        log.warn("trace.event skipped: {} in {} could not be formatted", record.name(), record.categoryGroup(), ex);
        continue;
      }
      log.info("trace.event {}", line);
    }
  }

  private String format(TraceRecord record) {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("ph=" + record.type().phase());
    joiner.add("name=" + record.name());
    joiner.add("cat=" + record.categoryGroup());
    if (record.id() != null) {
      joiner.add("id=" + record.id());
    }
    joiner.add("ts=" + record.timestamp());
    joiner.add("thread=" + record.threadName());
    joiner.add("session=" + record.session());
    if (record.args() != null) {
      joiner.add("args=" + Logs.formatArgs(record.args(), maxArgBytes));
    }
    if (record.value() != null) {
      joiner.add("value=" + (record.value().isMulti() ? record.value().series() : record.value().single()));
    }
    return joiner.toString();
  }
}
