package org.birdguide.hotspot.infrastructure.source;

import de.siegmar.fastcsv.reader.CsvRecord;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import org.birdguide.hotspot.application.port.SourceReadException;

/**
 * Header of an eBird Basic Dataset file: column names mapped to field positions.
 *
 * @since 0.1.0
 */
public final class EbirdColumns {
  public static final String COMMON_NAME = "COMMON NAME";
  public static final String SCIENTIFIC_NAME = "SCIENTIFIC NAME";
  public static final String CATEGORY = "CATEGORY";
  public static final String OBSERVATION_COUNT = "OBSERVATION COUNT";
  public static final String LOCALITY = "LOCALITY";
  public static final String LOCALITY_ID = "LOCALITY ID";
  public static final String LOCALITY_TYPE = "LOCALITY TYPE";
  public static final String LATITUDE = "LATITUDE";
  public static final String LONGITUDE = "LONGITUDE";
  public static final String OBSERVATION_DATE = "OBSERVATION DATE";
  public static final String SAMPLING_EVENT_IDENTIFIER = "SAMPLING EVENT IDENTIFIER";
  public static final String ALL_SPECIES_REPORTED = "ALL SPECIES REPORTED";

  private static final char BOM = '\uFEFF';

  private final Map<String, Integer> positions;

  private EbirdColumns(Map<String, Integer> positions) {
    this.positions = Map.copyOf(positions);
  }

  /**
   * Indexes a header row and checks that the required columns are present.
   *
   * @param source file name for diagnostics
   * @param header header fields
   * @param required columns the mapper reads
   * @return column index
   * @throws SourceReadException if a required column is absent
   */
  public static EbirdColumns fromHeader(String source, List<String> header, Collection<String> required)
      throws SourceReadException {
    Objects.requireNonNull(header, "header");
    Map<String, Integer> positions = new HashMap<>();
    for (int i = 0; i < header.size(); i++) {
      String name = header.get(i);
      if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
        name = name.substring(1);
      }
      positions.putIfAbsent(name.trim(), i);
    }
    TreeSet<String> missing = new TreeSet<>();
    for (String column : required) {
      if (!positions.containsKey(column)) {
        missing.add(column);
      }
    }
    if (!missing.isEmpty()) {
      throw new SourceReadException(source + " is missing required columns " + missing);
    }
    return new EbirdColumns(positions);
  }

  /**
   * Reads a required, non-blank field.
   *
   * @param record data row
   * @param column column name
   * @return trimmed value
   * @throws RowParseException if the row is too short or the value is blank
   */
  public String required(CsvRecord record, String column) throws RowParseException {
    String value = optional(record, column);
    if (value.isEmpty()) {
      throw new RowParseException(column + " is blank");
    }
    return value;
  }

  /**
   * Reads a field that may be blank.
   *
   * @param record data row
   * @param column column name
   * @return trimmed value, empty when blank
   * @throws RowParseException if the row is too short to contain the column
   */
  public String optional(CsvRecord record, String column) throws RowParseException {
    Integer position = positions.get(column);
    if (position == null) {
      throw new IllegalStateException("column " + column + " was not declared as required");
    }
    if (position >= record.getFieldCount()) {
      throw new RowParseException("row has " + record.getFieldCount() + " fields, " + column + " missing");
    }
    return record.getField(position).trim();
  }
}
