package ca.gc.cra.tracing.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(256, Numbers.requireRange("agent.batchSize", 256, 1, 8192));
  }

  @Test
  void requireRangeRejectsValuesBelowMinimum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("agent.batchSize", 0, 1, 8192));
  }

  @Test
  void parseRangeTrimsInput() {
    assertEquals(42, Numbers.parseRange("agent.queueCapacity", " 42 ", 1, 100));
  }

  @Test
  void parseRangeRejectsNonNumbers() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Numbers.parseRange("agent.queueCapacity", "lots", 1, 100));
    assertEquals("agent.queueCapacity must be a number (was 'lots')", ex.getMessage());
  }
}
