package org.birdguide.hotspot.infrastructure.output;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.birdguide.hotspot.domain.SpeciesKey;

/**
 * File-name slugs for species documents.
 *
 * <p>A slug is the lower-case common name with every run of characters outside {@code [a-z0-9]} collapsed to
 * one underscore. Names that collide after folding get {@code _2}, {@code _3}, ... in species order.</p>
 */
public final class SpeciesSlugs {
  private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

  private SpeciesSlugs() {
    // Utility
  }

  /**
   * Slug of one common name without collision handling.
   *
   * @param commonName species common name
   * @return slug, {@code species} when nothing alphanumeric remains
   */
  public static String slug(String commonName) {
    String folded = NON_ALNUM.matcher(commonName.toLowerCase(Locale.ROOT)).replaceAll("_");
    int start = 0;
    int end = folded.length();
    while (start < end && folded.charAt(start) == '_') {
      start++;
    }
    while (end > start && folded.charAt(end - 1) == '_') {
      end--;
    }
    return start == end ? "species" : folded.substring(start, end);
  }

  /**
   * Assigns unique slugs.
   *
   * @param species species in publication order
   * @return species to slug, iteration order of {@code species}
   */
  public static Map<SpeciesKey, String> assign(Collection<SpeciesKey> species) {
    Map<SpeciesKey, String> slugs = new LinkedHashMap<>();
    Set<String> used = new HashSet<>();
    for (SpeciesKey key : species) {
      String base = slug(key.commonName());
      String candidate = base;
      int suffix = 2;
      while (!used.add(candidate)) {
        candidate = base + "_" + suffix++;
      }
      slugs.put(key, candidate);
    }
    return slugs;
  }
}
