package org.birdguide.hotspot.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("Blue Grosbeak", Strings.requireNonBlank("sampleSpecies", "  Blue Grosbeak "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("sampleSpecies", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("sampleSpecies", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("sampleSpecies", null));
  }

  @Test
  void safeTokenAcceptsLocalityIds() {
    assertEquals("L1234567", Strings.requireSafeToken("localityId", "L1234567"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireSafeToken("localityId", "L/1"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireSafeToken("localityId", ".."));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireSafeToken("localityId", "L 1"));
  }

  @Test
  void printableAsciiEnforcesLength() {
    assertEquals("service.name=guide", Strings.requirePrintableAscii("attrs", "service.name=guide", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 10));
  }
}
