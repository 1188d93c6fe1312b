package ca.gc.cra.tracing.infrastructure.sink;

import ca.gc.cra.tracing.application.port.TraceSink;
import ca.gc.cra.tracing.application.port.TraceWriteException;
import ca.gc.cra.tracing.domain.event.CounterValue;
import ca.gc.cra.tracing.domain.event.TraceRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends trace records to a file, one JSON object per line; wired when {@code sink.type=jsonl}.
 *
 * <p>Line fields: {@code ph}, {@code name}, {@code cat}, {@code ts} (epoch microseconds), {@code tid} (thread
 * name), {@code session}, then {@code id}, {@code args} and {@code value} when present. Argument values that are not
 * JSON scalars, maps or collections are written with {@code toString()}.</p>
 * <p>Not thread-safe; only the agent thread writes.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesTraceSink implements TraceSink {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesTraceSink.class);
  private static final int SKIP_LOG_THRESHOLD = 1_000;

  private final Path file;
  private final JsonFactory jsonFactory = JsonFactory.builder()
      .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
      .disable(StreamWriteFeature.FLUSH_PASSED_TO_STREAM)
      .build();
  private BufferedWriter writer;
  private long skipped;

  /**
   * Creates a sink appending to {@code file}; the file and its parent directories are created on first write.
   *
   * @param file target file
   */
  public JsonLinesTraceSink(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  /**
   * Renders each record to a complete line before touching the file, so a record that fails to render is skipped
   * and never leaves a partial line behind.
   *
   * @throws TraceWriteException if the file write fails; carries the number of lines already written
   */
  @Override
  public void write(List<TraceRecord> records) throws IOException {
    BufferedWriter out = open();
    StringWriter line = new StringWriter(256);
    int written = 0;
    for (TraceRecord record : records) {
      line.getBuffer().setLength(0);
      if (!render(record, line)) {
        written++;
        continue;
      }
      line.append(System.lineSeparator());
      try {
        out.write(line.getBuffer().toString());
      } catch (IOException ex) {
        throw new TraceWriteException(written, ex);
      }
      written++;
    }
  }

  /**
   * Returns how many records were skipped because they could not be rendered as JSON.
   *
   * @return skip count since creation
   */
  public long skippedRecords() {
    return skipped;
  }

  @Override
  public void flush() throws IOException {
    if (writer != null) {
      writer.flush();
    }
  }

  @Override
  public void close() throws IOException {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } finally {
      writer = null;
      log.debug("Closed trace file {}", file);
    }
  }

  public Path file() {
    return file;
  }

  private BufferedWriter open() throws IOException {
    if (writer == null) {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer = Files.newBufferedWriter(
          file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
      log.info("Writing trace records to {}", file);
    }
    return writer;
  }

  private boolean render(TraceRecord record, StringWriter target) {
    try (JsonGenerator gen = jsonFactory.createGenerator(target)) {
      writeRecord(gen, record);
      return true;
    } catch (IOException | RuntimeException ex) {
      skipped++;
      if (skipped == 1 || skipped % SKIP_LOG_THRESHOLD == 0) {
        log.warn("Skipping trace record {} in {} that cannot be written as JSON (skipped={})",
            record.name(), record.categoryGroup(), skipped, ex);
      }
      return false;
    }
  }

  private static void writeRecord(JsonGenerator gen, TraceRecord record) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("ph", String.valueOf(record.type().phase()));
    gen.writeStringField("name", record.name());
    gen.writeStringField("cat", record.categoryGroup());
    long micros = Math.addExact(
        Math.multiplyExact(record.timestamp().getEpochSecond(), 1_000_000L), record.timestamp().getNano() / 1_000);
    gen.writeNumberField("ts", micros);
    gen.writeStringField("tid", record.threadName());
    gen.writeNumberField("session", record.session());
    if (record.id() != null) {
      gen.writeNumberField("id", record.id());
    }
    if (record.args() != null) {
      gen.writeFieldName("args");
      writeValue(gen, record.args());
    }
    CounterValue value = record.value();
    if (value != null) {
      gen.writeFieldName("value");
      writeValue(gen, value.isMulti() ? value.series() : value.single());
    }
    gen.writeEndObject();
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String s) {
      gen.writeString(s);
    } else if (value instanceof Boolean b) {
      gen.writeBoolean(b);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      gen.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }
}
