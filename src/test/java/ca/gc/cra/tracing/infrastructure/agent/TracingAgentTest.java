package ca.gc.cra.tracing.infrastructure.agent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracing.application.port.TraceSink;
import ca.gc.cra.tracing.application.port.TraceWriteException;
import ca.gc.cra.tracing.domain.event.TraceRecord;
import ca.gc.cra.tracing.domain.event.TracingEventType;
import ca.gc.cra.tracing.infrastructure.sink.InMemoryTraceSink;
import ca.gc.cra.tracing.infrastructure.sink.JsonLinesTraceSink;
import ca.gc.cra.tracing.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TracingAgentTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<String> errors = new CopyOnWriteArrayList<>();
  private TracingAgent agent;

  @AfterEach
  void tearDown() {
    if (agent != null) {
      agent.close();
    }
  }

  @Test
  void nothingIsCapturedBeforeStart() {
    InMemoryTraceSink sink = new InMemoryTraceSink();
    agent = newAgent(sink, settings(16, 4));

    assertFalse(agent.isStarted());
    assertEquals(0L, agent.sessionId());
    assertFalse(agent.offer(record("app", "early")));
  }

  @Test
  void startedAgentCapturesAllowedCategoriesAndFlushes() throws IOException {
    InMemoryTraceSink sink = new InMemoryTraceSink();
    agent = newAgent(sink, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();

    assertTrue(agent.offer(record("app", "a1")));
    assertTrue(agent.offer(record("app,db", "a2")));
    assertFalse(agent.offer(record("db", "d1")));
    agent.flush();

    assertEquals(List.of("a1", "a2"), sink.snapshot().stream().map(TraceRecord::name).toList());
    assertTrue(sink.flushCount() >= 1);
    assertEquals(2, metrics.count("agent.enqueued"));
  }

  @Test
  void changingCategoriesWhileStartedSwapsSession() {
    agent = newAgent(new InMemoryTraceSink(), settings(16, 4));
    agent.setCategories(List.of("one", "two"));
    agent.start();
    long firstSession = agent.sessionId();

    agent.setCategories(List.of("one"));

    assertNotEquals(firstSession, agent.sessionId());
    assertEquals(List.of("one"), agent.categories());
    assertFalse(agent.offer(record("two", "rejected")));
    assertTrue(agent.offer(record("one", "accepted")));
  }

  @Test
  void commaListSetterParsesAndNullRestoresDefaults() {
    agent = newAgent(new InMemoryTraceSink(), settings(16, 4));

    agent.setCategories(" net, ui ,net");
    assertEquals(List.of("net", "ui"), agent.categories());

    agent.setCategories((String) null);
    assertEquals(AgentSettings.DEFAULT_CATEGORIES, agent.categories());
  }

  @Test
  void recordStampsSessionAndThread() throws IOException {
    InMemoryTraceSink sink = new InMemoryTraceSink();
    agent = newAgent(sink, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();

    assertTrue(agent.record(TracingEventType.INSTANT, "tick", 3L, "app", null, null, NOW));
    assertFalse(agent.record(TracingEventType.INSTANT, "tick", 3L, "other", null, null, NOW));
    agent.flush();

    TraceRecord written = sink.snapshot().get(0);
    assertEquals(agent.sessionId(), written.session());
    assertEquals(Thread.currentThread().getName(), written.threadName());
    assertEquals(3L, written.id());
  }

  @Test
  void stopFlushesAndIsIdempotent() throws IOException {
    InMemoryTraceSink sink = new InMemoryTraceSink();
    agent = newAgent(sink, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();
    agent.offer(record("app", "last"));

    agent.stop();
    agent.stop();

    assertFalse(agent.isStarted());
    assertEquals(1, sink.snapshot().size());
    assertEquals(1, metrics.count("agent.session.stopped"));
    assertFalse(agent.offer(record("app", "after-stop")));
  }

  @Test
  void fullQueueDropsRecords() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    TraceSink blocking = new TraceSink() {
      @Override
      public void write(List<TraceRecord> records) {
        entered.countDown();
        try {
          release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
    };
    agent = newAgent(blocking, settings(2, 2));
    agent.setCategories(List.of("app"));
    agent.start();

    assertTrue(agent.offer(record("app", "in-flight")));
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    assertTrue(agent.offer(record("app", "q1")));
    assertTrue(agent.offer(record("app", "q2")));
    assertFalse(agent.offer(record("app", "dropped")));

    assertEquals(1L, agent.droppedEvents());
    assertEquals(1, metrics.count("agent.dropped"));
    assertEquals(2, agent.queuedEvents());
    release.countDown();
  }

  @Test
  void failedWriteIsRetriedOnce() throws IOException {
    FlakySink sink = new FlakySink(1, 0);
    agent = newAgent(sink, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();

    agent.offer(record("app", "retried"));
    agent.flush();

    assertEquals(1, sink.written.get());
    assertEquals(1, metrics.count("agent.write.retry"));
    assertTrue(errors.isEmpty());
  }

  @Test
  void persistentFlushFailureSurfacesFromFlush() {
    FlakySink sink = new FlakySink(0, Integer.MAX_VALUE);
    agent = newAgent(sink, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();
    agent.offer(record("app", "unflushed"));

    IOException ex = assertThrows(IOException.class, () -> agent.flush());

    assertEquals("flush failed", ex.getMessage());
    assertEquals(1, ex.getSuppressed().length);
  }

  @Test
  void backgroundWriteFailureReachesErrorHandler() throws InterruptedException {
    CountDownLatch reported = new CountDownLatch(1);
    FlakySink sink = new FlakySink(Integer.MAX_VALUE, 0);
    agent = new TracingAgent(settings(16, 4), sink, metrics, (operation, error) -> {
      errors.add(operation);
      reported.countDown();
    });
    agent.setCategories(List.of("app"));
    agent.start();

    agent.offer(record("app", "lost"));

    assertTrue(reported.await(5, TimeUnit.SECONDS));
    assertEquals("write", errors.get(0));
    assertTrue(metrics.count("agent.write.error") >= 1);
  }

  @Test
  void runtimeExceptionFromSinkIsWrapped() throws InterruptedException {
    CountDownLatch reported = new CountDownLatch(1);
    List<IOException> failures = new CopyOnWriteArrayList<>();
    TraceSink broken = records -> {
      throw new IllegalStateException("sink bug");
    };
    agent = new TracingAgent(settings(16, 4), broken, metrics, (operation, error) -> {
      failures.add(error);
      reported.countDown();
    });
    agent.setCategories(List.of("app"));
    agent.start();

    agent.offer(record("app", "x"));

    assertTrue(reported.await(5, TimeUnit.SECONDS));
    assertTrue(failures.get(0).getCause() instanceof IllegalStateException);
  }

  @Test
  void closeFlushesClosesSinkAndRejectsRestart() {
    InMemoryTraceSink sink = new InMemoryTraceSink();
    agent = newAgent(sink, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();
    agent.offer(record("app", "final"));

    agent.close();
    agent.close();

    assertEquals(1, sink.snapshot().size());
    assertTrue(sink.isClosed());
    assertFalse(agent.isStarted());
    assertThrows(IllegalStateException.class, () -> agent.start());
  }

  @Test
  void closeFlushesSinkExactlyOnce() throws IOException {
    InMemoryTraceSink sink = new InMemoryTraceSink();
    agent = newAgent(sink, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();
    agent.offer(record("app", "settled"));
    agent.flush();
    int before = sink.flushCount();

    agent.close();

    assertEquals(before + 1, sink.flushCount());
    assertEquals(1, sink.snapshot().size());
  }

  @Test
  void retryResumesAfterRecordsTheSinkAlreadyWrote() throws IOException {
    List<String> persisted = new CopyOnWriteArrayList<>();
    AtomicInteger failures = new AtomicInteger();
    TraceSink failsMidBatch = records -> {
      for (int i = 0; i < records.size(); i++) {
        TraceRecord next = records.get(i);
        if (next.name().equals("second") && failures.getAndIncrement() == 0) {
          throw new TraceWriteException(i, new IOException("disk hiccup"));
        }
        persisted.add(next.name());
      }
    };
    agent = newAgent(failsMidBatch, settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();

    agent.offer(record("app", "first"));
    agent.offer(record("app", "second"));
    agent.offer(record("app", "third"));
    agent.flush();

    assertEquals(List.of("first", "second", "third"), persisted);
    assertEquals(1, metrics.count("agent.write.retry"));
    assertTrue(errors.isEmpty());
  }

  @Test
  void unrenderableRecordIsWrittenNeitherTwiceNorPartially(@TempDir Path tempDir) throws IOException {
    Path file = tempDir.resolve("trace.jsonl");
    agent = newAgent(new JsonLinesTraceSink(file), settings(16, 4));
    agent.setCategories(List.of("app"));
    agent.start();
    Object unprintable = new Object() {
      @Override
      public String toString() {
        throw new IllegalStateException("cannot render");
      }
    };

    agent.offer(record("app", "good"));
    agent.offer(new TraceRecord(
        TracingEventType.INSTANT, "bad", null, "app", Map.of("v", unprintable), null, NOW, "test", 0L));
    agent.offer(record("app", "after"));
    agent.flush();

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).contains("\"name\":\"good\""), lines.get(0));
    assertTrue(lines.get(1).contains("\"name\":\"after\""), lines.get(1));
    assertEquals(0, metrics.count("agent.write.retry"));
  }

  @Test
  void closeReportsSinkCloseFailure() {
    TraceSink failingClose = new TraceSink() {
      @Override
      public void write(List<TraceRecord> records) {
      }

      @Override
      public void close() throws IOException {
        throw new IOException("close failed");
      }
    };
    agent = newAgent(failingClose, settings(16, 4));

    agent.close();

    assertEquals(List.of("close"), errors);
  }

  private TracingAgent newAgent(TraceSink sink, AgentSettings settings) {
    return new TracingAgent(settings, sink, metrics, (operation, error) -> errors.add(operation));
  }

  private static AgentSettings settings(int capacity, int batch) {
    return new AgentSettings(capacity, batch, Duration.ofMillis(50), Duration.ofSeconds(2), null);
  }

  private static TraceRecord record(String group, String name) {
    return new TraceRecord(TracingEventType.INSTANT, name, null, group, null, null, NOW, "test", 0L);
  }

  private static final class FlakySink implements TraceSink {
    private final AtomicInteger writeFailures;
    private final AtomicInteger flushFailures;
    private final AtomicInteger written = new AtomicInteger();

    private FlakySink(int writeFailures, int flushFailures) {
      this.writeFailures = new AtomicInteger(writeFailures);
      this.flushFailures = new AtomicInteger(flushFailures);
    }

    @Override
    public void write(List<TraceRecord> records) throws IOException {
      if (writeFailures.getAndDecrement() > 0) {
        throw new IOException("write failed");
      }
      written.addAndGet(records.size());
    }

    @Override
    public void flush() throws IOException {
      if (flushFailures.getAndDecrement() > 0) {
        throw new IOException("flush failed");
      }
    }
  }
}
