package org.birdguide.hotspot.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("S1 | L1", Logs.row(List.of("S1", "L1"), 64));
    assertEquals("<null>", Logs.truncate(null, 10));
    assertEquals("<null>", Logs.row(null, 10));
  }

  @Test
  void longRowsAreTruncatedToOneLine() {
    String rendered = Logs.row(List.of("S1", "first line\nsecond line", "x".repeat(100)), 32);

    assertFalse(rendered.contains("\n"));
    assertTrue(rendered.endsWith("(truncated, 32 of 130 bytes)"), rendered);
  }

  @Test
  void truncationDoesNotSplitCodePoints() {
    String rendered = Logs.truncate("ééé", 3);

    assertTrue(rendered.startsWith("é... (truncated"), rendered);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
