package org.birdguide.hotspot.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"dataDir=./ebird", "seasons.summer=6,7"});

    assertEquals("./ebird", map.get("dataDir"));
    assertEquals("6,7", map.get("seasons.summer"));
  }

  @Test
  void splitsOnFirstEqualsAndLaterDuplicatesWin() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"otelResourceAttributes=a=b", "topN=3", "topN=5"});

    assertEquals("a=b", map.get("otelResourceAttributes"));
    assertEquals("5", map.get("topN"));
  }

  @Test
  void emptyValueIsKept() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"sampleSpecies="});

    assertTrue(map.containsKey("sampleSpecies"));
    assertEquals("", map.get("sampleSpecies"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out=a\u0001b"}));
  }
}
