package ca.gc.cra.subscan.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void truncateRespectsCodePointBoundaries() {
    String truncated = Logs.truncate("aé" + "x".repeat(10), 2);

    assertTrue(truncated.startsWith("a... (truncated, 1 of"), truncated);
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void rootCauseReportsInnermostFailure() {
    Exception wrapped = new UncheckedIOException(new IOException("connection reset"));

    assertEquals("IOException: connection reset", Logs.rootCause(wrapped));
    assertEquals("IllegalStateException", Logs.rootCause(new IllegalStateException()));
  }
}
