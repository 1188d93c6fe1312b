package ca.gc.cra.tracing.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("abc", Logs.truncate("abc", 3));
    assertEquals("<null>", Logs.truncate(null, 3));
  }

  @Test
  void longValuesReportOriginalLength() {
    assertEquals("ab... (truncated, 2 of 5)", Logs.truncate("abcde", 2));
  }

  @Test
  void truncationDoesNotSplitMultiByteCharacters() {
    String truncated = Logs.truncate("éé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void formatArgsKeepsInsertionOrder() {
    Map<String, Object> args = new LinkedHashMap<>();
    args.put("b", 1);
    args.put("a", null);

    assertEquals("{b=1, a=null}", Logs.formatArgs(args, 16));
    assertEquals("{}", Logs.formatArgs(Map.of(), 16));
  }

  @Test
  void verboseLoggingRaisesTracingLogger() {
    Logger logger = (Logger) LoggerFactory.getLogger("ca.gc.cra.tracing");
    Level previous = logger.getLevel();
    try {
      assertTrue(LoggingConfigurator.enableVerboseLogging());
      assertEquals(Level.DEBUG, logger.getLevel());
    } finally {
      logger.setLevel(previous);
    }
  }
}
