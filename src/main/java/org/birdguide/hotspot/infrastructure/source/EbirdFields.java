package org.birdguide.hotspot.infrastructure.source;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.OptionalInt;
import org.birdguide.hotspot.domain.LocalityType;

/** Parsers for the typed columns shared by both eBird files. */
final class EbirdFields {
  private EbirdFields() {
    // Utility
  }

  static double coordinate(String column, String raw, double limit) throws RowParseException {
    double value;
    try {
      value = Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new RowParseException(column + " is not a number: '" + raw + "'", ex);
    }
    if (Double.isNaN(value) || value < -limit || value > limit) {
      throw new RowParseException(column + " out of range: " + raw);
    }
    return value;
  }

  static int month(String raw) throws RowParseException {
    try {
      return LocalDate.parse(raw).getMonthValue();
    } catch (DateTimeParseException ex) {
      throw new RowParseException(EbirdColumns.OBSERVATION_DATE + " is not an ISO date: '" + raw + "'", ex);
    }
  }

  static boolean complete(String raw) throws RowParseException {
    switch (raw.toLowerCase(Locale.ROOT)) {
      case "1":
      case "true":
        return true;
      case "0":
      case "false":
        return false;
      default:
        throw new RowParseException(EbirdColumns.ALL_SPECIES_REPORTED + " is not 0 or 1: '" + raw + "'");
    }
  }

  static LocalityType localityType(String raw) {
    return LocalityType.fromCode(raw);
  }

  /** {@code X}, blanks and non-numeric counts are presence-only reports. */
  static OptionalInt individuals(String raw) {
    if (raw.isEmpty()) {
      return OptionalInt.empty();
    }
    for (int i = 0; i < raw.length(); i++) {
      if (!Character.isDigit(raw.charAt(i))) {
        return OptionalInt.empty();
      }
    }
    try {
      return OptionalInt.of(Integer.parseInt(raw));
    } catch (NumberFormatException ex) {
      return OptionalInt.empty();
    }
  }
}
