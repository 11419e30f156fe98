package ca.gc.cra.subscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\nb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void printableAsciiEnforcesLength() {
    assertEquals("env=dev", Strings.requirePrintableAscii("attrs", "env=dev", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=dev", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 16));
  }

  @Test
  void splitCsvDropsEmptyTokens() {
    assertEquals(List.of("8.8.8.8", "1.1.1.1"), Strings.splitCsv(" 8.8.8.8 ,, 1.1.1.1,"));
    assertEquals(List.of(), Strings.splitCsv(null));
  }
}
