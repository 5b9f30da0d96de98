package ca.gc.cra.kafkarecon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("client.json", Strings.requireNonBlank("config", "  client.json "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("config", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("config", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("config", null));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("env=lab", Strings.requirePrintableAscii("attrs", "env=lab", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x".repeat(17), 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 16));
  }

  @Test
  void truncateKeepsPrefix() {
    assertEquals("ssl.cl", Strings.truncate("ssl.client.auth", 6));
    assertEquals("short", Strings.truncate("short", 20));
    assertNull(Strings.truncate(null, 5));
    assertThrows(IllegalArgumentException.class, () -> Strings.truncate("x", -1));
  }

  @Test
  void containsControlDetectsNewlines() {
    assertTrue(Strings.containsControl("a\nb"));
    assertFalse(Strings.containsControl("plain"));
  }
}
