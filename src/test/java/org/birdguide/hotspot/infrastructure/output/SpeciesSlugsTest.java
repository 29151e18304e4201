package org.birdguide.hotspot.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.birdguide.hotspot.domain.SpeciesKey;
import org.junit.jupiter.api.Test;

class SpeciesSlugsTest {
  @Test
  void slugFoldsPunctuationAndCase() {
    assertEquals("blue_grosbeak", SpeciesSlugs.slug("Blue Grosbeak"));
    assertEquals("cooper_s_hawk", SpeciesSlugs.slug("Cooper's Hawk"));
    assertEquals("black_and_white_warbler", SpeciesSlugs.slug("Black-and-white Warbler"));
    assertEquals("species", SpeciesSlugs.slug("???"));
  }

  @Test
  void collidingNamesGetNumericSuffixInOrder() {
    SpeciesKey first = new SpeciesKey("Gray Jay", "Perisoreus canadensis");
    SpeciesKey second = new SpeciesKey("Gray-Jay", "Perisoreus sp.");
    SpeciesKey third = new SpeciesKey("gray jay", "Perisoreus other");

    Map<SpeciesKey, String> slugs = SpeciesSlugs.assign(List.of(first, second, third));

    assertEquals("gray_jay", slugs.get(first));
    assertEquals("gray_jay_2", slugs.get(second));
    assertEquals("gray_jay_3", slugs.get(third));
  }
}
