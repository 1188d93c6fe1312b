package ca.gc.cra.tracing.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracing.domain.event.CounterValue;
import ca.gc.cra.tracing.domain.event.TraceRecord;
import ca.gc.cra.tracing.domain.event.TracingEventType;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingTraceSinkTest {
  private static final Instant AT = Instant.parse("2024-05-01T12:00:00Z");

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private Level previousLevel;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(LoggingTraceSink.LOGGER_NAME);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.INFO);
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    logger.setAdditive(true);
    logger.setLevel(previousLevel);
  }

  @Test
  void logsOneLinePerRecord() {
    LoggingTraceSink sink = new LoggingTraceSink();

    sink.write(List.of(
        new TraceRecord(TracingEventType.END, "req", 4L, "app", Map.of("status", 200), null, AT, "worker-1", 2L),
        new TraceRecord(TracingEventType.COUNT, "queue", null, "app", null, CounterValue.of(7), AT, "worker-1", 2L)));

    assertEquals(2, appender.list.size());
    String first = appender.list.get(0).getFormattedMessage();
    assertEquals(
        "trace.event ph=F, name=req, cat=app, id=4, ts=2024-05-01T12:00:00Z, thread=worker-1, session=2, "
            + "args={status=200}",
        first);
    assertTrue(appender.list.get(1).getFormattedMessage().endsWith("value=7"));
  }

  @Test
  void longArgumentsAreTruncated() {
    LoggingTraceSink sink = new LoggingTraceSink(4);

    sink.write(List.of(new TraceRecord(
        TracingEventType.INSTANT, "mark", null, "app", Map.of("body", "abcdefgh"), null, AT, "t", 1L)));

    assertTrue(appender.list.get(0).getFormattedMessage().contains("body=abcd... (truncated, 4 of 8)"));
  }

  @Test
  void unformattableRecordIsSkippedAndLaterRecordsStillLogged() {
    Object unprintable = new Object() {
      @Override
      public String toString() {
        throw new IllegalStateException("cannot render");
      }
    };

    new LoggingTraceSink().write(List.of(
        new TraceRecord(TracingEventType.INSTANT, "bad", null, "app", Map.of("v", unprintable), null, AT, "t", 1L),
        new TraceRecord(TracingEventType.INSTANT, "after", null, "app", null, null, AT, "t", 1L)));

    assertEquals(2, appender.list.size());
    assertEquals(Level.WARN, appender.list.get(0).getLevel());
    assertTrue(appender.list.get(1).getFormattedMessage().contains("name=after"));
  }

  @Test
  void nothingIsLoggedWhenLoggerIsOff() {
    logger.setLevel(Level.OFF);

    new LoggingTraceSink().write(List.of(
        new TraceRecord(TracingEventType.INSTANT, "mark", null, "app", null, null, AT, "t", 1L)));

    assertTrue(appender.list.isEmpty());
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new LoggingTraceSink(0));
  }
}
